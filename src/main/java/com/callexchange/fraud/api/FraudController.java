package com.callexchange.fraud.api;

import com.callexchange.fraud.domain.Account;
import com.callexchange.fraud.domain.Call;
import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudReport;
import com.callexchange.fraud.risk.domain.FraudRules;
import com.callexchange.fraud.risk.engine.FraudDecisionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for fraud checks on calls, bids and accounts, risk score lookups, fraud reports and rule updates.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/fraud")
@RequiredArgsConstructor
@Tag(name = "Fraud", description = "Risk scoring and fraud decisions for the call exchange")
public class FraudController {

    private final FraudDecisionService fraudDecisionService;

    @PostMapping("/calls")
    @Operation(summary = "Check a call", description = "Scores a call before routing. Denylisted numbers are rejected immediately.")
    public ResponseEntity<FraudCheckResult> checkCall(@RequestBody(required = false) Call call) {
        return ResponseEntity.ok(fraudDecisionService.checkCall(call));
    }

    @PostMapping("/bids")
    @Operation(summary = "Check a bid", description = "Scores a bid together with the buyer account placing it")
    public ResponseEntity<FraudCheckResult> checkBid(@Valid @RequestBody BidCheckRequest request) {
        return ResponseEntity.ok(fraudDecisionService.checkBid(request.getBid(), request.getAccount()));
    }

    @PostMapping("/accounts")
    @Operation(summary = "Check an account", description = "Scores an account at signup or on change")
    public ResponseEntity<FraudCheckResult> checkAccount(@RequestBody(required = false) Account account) {
        return ResponseEntity.ok(fraudDecisionService.checkAccount(account));
    }

    @GetMapping("/risk-scores/{kind}/{entityId}")
    @Operation(summary = "Current risk score", description = "Smoothed risk score of an entity; 404 when it has no risk profile yet")
    public ResponseEntity<RiskScoreResponse> getRiskScore(@PathVariable String kind, @PathVariable String entityId) {
        EntityKind entityKind = EntityKind.fromLabel(kind);
        return fraudDecisionService.getRiskScore(entityId, entityKind)
                .map(score -> ResponseEntity.ok(RiskScoreResponse.builder()
                        .entityId(entityId)
                        .entityKind(entityKind.label())
                        .riskScore(score)
                        .build()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/reports")
    @Operation(summary = "Report fraud", description = "Records a fraud report and pushes the entity's risk score toward 1.0")
    public ResponseEntity<FraudReport> reportFraud(@RequestBody(required = false) FraudReport report) {
        FraudReport stored = fraudDecisionService.reportFraud(report);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(stored);
    }

    @GetMapping("/rules")
    @Operation(summary = "Live fraud rules")
    public ResponseEntity<FraudRules> getRules() {
        return ResponseEntity.ok(fraudDecisionService.currentRules());
    }

    @PutMapping("/rules")
    @Operation(summary = "Replace fraud rules", description = "Atomically swaps the live rules; the next evaluation uses the new set")
    public ResponseEntity<Map<String, Object>> updateRules(@RequestBody(required = false) FraudRules rules) {
        fraudDecisionService.updateRules(rules);
        log.info("Fraud rules replaced via API: version={}", rules.getVersion());
        return ResponseEntity.ok(Map.of("status", "UPDATED", "version", String.valueOf(rules.getVersion())));
    }
}
