package com.callexchange.fraud.risk.messaging;

import com.callexchange.fraud.risk.domain.FraudCheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Publishes blocked and review-band decisions for case management and downstream auto-block tooling.
 * Records are keyed by {@code kind:entityId} so every decision about one entity lands on one partition;
 * the {@code fraud-decision} header lets consumers route without deserializing the payload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.decisions.kafka.enabled", havingValue = "true")
public class FraudDecisionProducer {

    static final String DECISION_HEADER = "fraud-decision";
    static final String BLOCK = "BLOCK";
    static final String REVIEW = "REVIEW";

    private final KafkaTemplate<String, FraudCheckResult> fraudDecisionKafkaTemplate;

    @Value("${fraud.decisions.kafka.topic:fraud-decisions}")
    private String topic;

    public void send(FraudCheckResult result) {
        String decision = decisionOf(result);
        ProducerRecord<String, FraudCheckResult> record = new ProducerRecord<>(topic, keyOf(result), result);
        record.headers().add(DECISION_HEADER, decision.getBytes(StandardCharsets.UTF_8));
        fraudDecisionKafkaTemplate.send(record).whenComplete((sent, ex) -> {
            if (ex != null) {
                log.error("{} decision for {} {} (check {}, score {}) not published to {}; case management will not see it",
                        decision, kindLabel(result), result.getEntityId(), result.getId(), result.getRiskScore(), topic, ex);
            } else {
                log.debug("Published {} decision for {} {} partition={}", decision, kindLabel(result), result.getEntityId(),
                        sent != null ? sent.getRecordMetadata().partition() : null);
            }
        });
    }

    static String decisionOf(FraudCheckResult result) {
        return result.isApproved() ? REVIEW : BLOCK;
    }

    static String keyOf(FraudCheckResult result) {
        if (result.getEntityId() == null) {
            return result.getId();
        }
        return kindLabel(result) + ":" + result.getEntityId();
    }

    private static String kindLabel(FraudCheckResult result) {
        return result.getEntityKind() != null ? result.getEntityKind().label() : "unknown";
    }
}
