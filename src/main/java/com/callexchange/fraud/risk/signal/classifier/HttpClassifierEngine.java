package com.callexchange.fraud.risk.signal.classifier;

import com.callexchange.fraud.risk.features.FeatureBag;
import com.callexchange.fraud.risk.signal.ClassifierEngine;
import com.callexchange.fraud.risk.signal.Prediction;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Asks the model-serving service for a fraud probability. Calls go through a circuit breaker so a
 * struggling model service stops costing latency on the hot path; any failure surfaces as
 * {@link ClassifierUnavailableException} and the caller treats the classifier as abstaining.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraud.ml.enabled", havingValue = "true")
public class HttpClassifierEngine implements ClassifierEngine {

    static final String CIRCUIT_BREAKER = "classifier";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String serviceUrl;

    @Autowired
    public HttpClassifierEngine(CircuitBreakerRegistry circuitBreakerRegistry,
                                @Value("${fraud.ml.service.url:http://localhost:5000/predict}") String serviceUrl,
                                @Value("${fraud.ml.service.timeout-ms:200}") int timeoutMs) {
        this(createRestTemplate(timeoutMs), circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER), serviceUrl);
    }

    HttpClassifierEngine(RestTemplate restTemplate, CircuitBreaker circuitBreaker, String serviceUrl) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.serviceUrl = serviceUrl;
        log.info("Classifier client targeting {}", serviceUrl);
    }

    @Override
    public Prediction predict(FeatureBag features) {
        Map<String, Object> request = Map.of(
                "entityKind", features.kind().label(),
                "features", features.toFeatureMap());
        ClassifierResponse response;
        try {
            response = circuitBreaker.executeSupplier(
                    () -> restTemplate.postForObject(serviceUrl, request, ClassifierResponse.class));
        } catch (CallNotPermittedException e) {
            throw new ClassifierUnavailableException("classifier circuit open", e);
        } catch (RestClientException e) {
            throw new ClassifierUnavailableException("classifier call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getFraudProbability() == null) {
            throw new ClassifierUnavailableException("classifier response missing fraudProbability");
        }
        log.debug("Classifier returned probability={} confidence={} for {}",
                response.getFraudProbability(), response.getConfidence(), features.kind());
        return Prediction.builder()
                .fraudProbability(response.getFraudProbability())
                .confidence(response.getConfidence() != null ? response.getConfidence() : 0.0)
                .featureWeights(response.getFeatureWeights() != null ? response.getFeatureWeights() : Map.of())
                .explanations(response.getExplanations() != null ? response.getExplanations() : List.of())
                .build();
    }

    private static RestTemplate createRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
