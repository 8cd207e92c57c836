package com.callexchange.fraud.api;

import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudFlag;
import com.callexchange.fraud.risk.domain.FraudReport;
import com.callexchange.fraud.risk.domain.FraudRules;
import com.callexchange.fraud.risk.domain.FraudSeverity;
import com.callexchange.fraud.risk.domain.FraudSignalType;
import com.callexchange.fraud.risk.engine.FraudDecisionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for FraudController and its error mapping.
 */
@WebMvcTest(controllers = FraudController.class)
class FraudControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FraudDecisionService fraudDecisionService;

    private static FraudCheckResult blocked(String entityId, EntityKind kind) {
        return FraudCheckResult.builder()
                .id("check-1")
                .entityId(entityId)
                .entityKind(kind)
                .timestamp(Instant.parse("2026-03-10T12:00:00Z"))
                .approved(false)
                .riskScore(1.0)
                .reasons(List.of("From number blacklisted: chargeback ring"))
                .flags(List.of(FraudFlag.builder()
                        .type(FraudSignalType.BLACKLIST)
                        .severity(FraudSeverity.CRITICAL)
                        .description("Blacklisted phone")
                        .score(1.0)
                        .build()))
                .metadata(Map.of("rulesVersion", "default"))
                .build();
    }

    @Test
    void checkCallReturnsDecision() throws Exception {
        when(fraudDecisionService.checkCall(argThat(c -> "call-1".equals(c.getId()))))
                .thenReturn(blocked("call-1", EntityKind.CALL));

        mockMvc.perform(post("/api/v1/fraud/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"call-1\",\"fromNumber\":\"+14155550100\",\"toNumber\":\"+14155550111\","
                                + "\"direction\":\"INBOUND\",\"startTime\":\"2026-03-10T12:00:00Z\",\"buyerId\":\"buyer-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("call-1"))
                .andExpect(jsonPath("$.entityKind").value("CALL"))
                .andExpect(jsonPath("$.approved").value(false))
                .andExpect(jsonPath("$.riskScore").value(1.0))
                .andExpect(jsonPath("$.flags[0].type").value("BLACKLIST"))
                .andExpect(jsonPath("$.flags[0].severity").value("CRITICAL"));
    }

    @Test
    void missingCallMapsValidationCode() throws Exception {
        when(fraudDecisionService.checkCall(isNull()))
                .thenThrow(new FraudValidationException("INVALID_CALL", "call cannot be null"));

        mockMvc.perform(post("/api/v1/fraud/calls").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_CALL"))
                .andExpect(jsonPath("$.message").value("call cannot be null"));
    }

    @Test
    void checkBidPassesBidAndBuyer() throws Exception {
        when(fraudDecisionService.checkBid(any(), any())).thenReturn(blocked("bid-1", EntityKind.BID));

        mockMvc.perform(post("/api/v1/fraud/bids")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bid\":{\"id\":\"bid-1\",\"buyerId\":\"buyer-1\",\"amount\":9.99},"
                                + "\"account\":{\"id\":\"buyer-1\",\"qualityScore\":40}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityKind").value("BID"));

        verify(fraudDecisionService).checkBid(
                argThat(b -> "bid-1".equals(b.getId())),
                argThat(a -> "buyer-1".equals(a.getId()) && a.getQualityScore() == 40.0));
    }

    @Test
    void bidWithoutAccountFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/fraud/bids")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bid\":{\"id\":\"bid-1\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.account").value("account is required"));

        verifyNoInteractions(fraudDecisionService);
    }

    @Test
    void checkAccountReturnsDecision() throws Exception {
        when(fraudDecisionService.checkAccount(any())).thenReturn(blocked("acct-1", EntityKind.ACCOUNT));

        mockMvc.perform(post("/api/v1/fraud/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"acct-1\",\"email\":\"x@mailinator.com\",\"type\":\"BUYER\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityKind").value("ACCOUNT"));
    }

    @Test
    void riskScoreLookup() throws Exception {
        when(fraudDecisionService.getRiskScore("acct-1", EntityKind.ACCOUNT)).thenReturn(Optional.of(0.44));

        mockMvc.perform(get("/api/v1/fraud/risk-scores/account/acct-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("acct-1"))
                .andExpect(jsonPath("$.entityKind").value("account"))
                .andExpect(jsonPath("$.riskScore").value(0.44));
    }

    @Test
    void unknownEntityIsNotFound() throws Exception {
        when(fraudDecisionService.getRiskScore("nobody", EntityKind.CALL)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/fraud/risk-scores/call/nobody"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownEntityKindIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/fraud/risk-scores/wallet/w-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        verifyNoInteractions(fraudDecisionService);
    }

    @Test
    void reportFraudIsAccepted() throws Exception {
        when(fraudDecisionService.reportFraud(any())).thenAnswer(inv -> ((FraudReport) inv.getArgument(0)).toBuilder()
                .id("report-1")
                .status(FraudReport.Status.PENDING)
                .build());

        mockMvc.perform(post("/api/v1/fraud/reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"acct-9\",\"entityKind\":\"ACCOUNT\",\"fraudType\":\"confirmed\","
                                + "\"reportedBy\":\"analyst-7\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("report-1"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.fraudType").value("confirmed"));
    }

    @Test
    void reportStorageFailureIsInternalError() throws Exception {
        when(fraudDecisionService.reportFraud(any()))
                .thenThrow(new FraudProcessingException("failed to save fraud report", new IllegalStateException("db down")));

        mockMvc.perform(post("/api/v1/fraud/reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"acct-9\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @Test
    void getRulesReturnsLiveRules() throws Exception {
        when(fraudDecisionService.currentRules()).thenReturn(FraudRules.defaults());

        mockMvc.perform(get("/api/v1/fraud/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("default"))
                .andExpect(jsonPath("$.requireMfaScore").value(0.7))
                .andExpect(jsonPath("$.autoBlockScore").value(0.9));
    }

    @Test
    void putRulesReplacesLiveRules() throws Exception {
        mockMvc.perform(put("/api/v1/fraud/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"v2\",\"mlEnabled\":true,\"rulesEnabled\":true,"
                                + "\"requireMfaScore\":0.6,\"autoBlockScore\":0.85,"
                                + "\"velocityLimits\":{\"call_placement\":{\"action\":\"call_placement\","
                                + "\"maxCount\":50,\"window\":\"PT30M\"}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UPDATED"))
                .andExpect(jsonPath("$.version").value("v2"));

        verify(fraudDecisionService).updateRules(argThat(r -> "v2".equals(r.getVersion())
                && r.getAutoBlockScore() == 0.85
                && r.getVelocityLimits().get("call_placement").getMaxCount() == 50));
    }

    @Test
    void invalidRulesAreBadRequest() throws Exception {
        doThrow(new FraudValidationException("INVALID_RULES", "threshold scores must be within [0,1]"))
                .when(fraudDecisionService).updateRules(any());

        mockMvc.perform(put("/api/v1/fraud/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"bad\",\"autoBlockScore\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_RULES"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/fraud/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
