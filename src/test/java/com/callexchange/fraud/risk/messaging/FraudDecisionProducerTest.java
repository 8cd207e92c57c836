package com.callexchange.fraud.risk.messaging;

import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FraudDecisionProducer with a mocked KafkaTemplate.
 */
@ExtendWith(MockitoExtension.class)
class FraudDecisionProducerTest {

    @Mock
    private KafkaTemplate<String, FraudCheckResult> kafkaTemplate;

    private FraudDecisionProducer producer;

    @BeforeEach
    void setUp() {
        producer = new FraudDecisionProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", "fraud-decisions");
    }

    @SuppressWarnings("unchecked")
    private ProducerRecord<String, FraudCheckResult> sentRecord() {
        ArgumentCaptor<ProducerRecord<String, FraudCheckResult>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        return captor.getValue();
    }

    private static String decisionHeader(ProducerRecord<String, FraudCheckResult> record) {
        return new String(record.headers().lastHeader(FraudDecisionProducer.DECISION_HEADER).value(),
                StandardCharsets.UTF_8);
    }

    @Test
    void blockedCallIsKeyedByKindAndEntity() {
        FraudCheckResult result = FraudCheckResult.builder().id("check-1").entityId("call-1")
                .entityKind(EntityKind.CALL).approved(false).riskScore(1.0).build();
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.<SendResult<String, FraudCheckResult>>completedFuture(null));

        producer.send(result);

        ProducerRecord<String, FraudCheckResult> record = sentRecord();
        assertThat(record.topic()).isEqualTo("fraud-decisions");
        assertThat(record.key()).isEqualTo("call:call-1");
        assertThat(record.value()).isSameAs(result);
        assertThat(decisionHeader(record)).isEqualTo("BLOCK");
    }

    @Test
    void approvedResultIsPublishedForReview() {
        FraudCheckResult result = FraudCheckResult.builder().id("check-3").entityId("bid-1")
                .entityKind(EntityKind.BID).approved(true).requiresReview(true).riskScore(0.65).build();
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.<SendResult<String, FraudCheckResult>>completedFuture(null));

        producer.send(result);

        assertThat(decisionHeader(sentRecord())).isEqualTo("REVIEW");
    }

    @Test
    void missingEntityFallsBackToCheckIdAndBrokerFailureIsTolerated() {
        FraudCheckResult result = FraudCheckResult.builder().id("check-2").approved(false).build();
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        producer.send(result);

        assertThat(sentRecord().key()).isEqualTo("check-2");
    }
}
