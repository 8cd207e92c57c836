package com.callexchange.fraud.risk.config;

import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for blocked and review-band fraud decisions. JSON values, entity id as key.
 */
@Configuration
@ConditionalOnProperty(name = "fraud.decisions.kafka.enabled", havingValue = "true")
public class FraudKafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Short so an unreachable broker cannot stall the decision path. */
    @Value("${fraud.decisions.kafka.max-block-ms:500}")
    private int maxBlockMs;

    @Bean
    public ProducerFactory<String, FraudCheckResult> fraudDecisionProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        JsonSerializer<FraudCheckResult> serializer = new JsonSerializer<>(decisionObjectMapper());
        serializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, FraudCheckResult> fraudDecisionKafkaTemplate(
            ProducerFactory<String, FraudCheckResult> fraudDecisionProducerFactory) {
        return new KafkaTemplate<>(fraudDecisionProducerFactory);
    }

    /** Kept out of the context so Spring MVC keeps its auto-configured ObjectMapper. */
    private static ObjectMapper decisionObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
