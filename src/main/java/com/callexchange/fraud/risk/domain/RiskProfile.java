package com.callexchange.fraud.risk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-lived risk standing of one entity. {@code currentRiskScore} is exponentially smoothed so that a
 * single bad event raises the standing without saturating it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfile {

    private String entityId;
    private EntityKind entityKind;
    private double currentRiskScore;
    @Builder.Default
    private List<RiskScoreEntry> history = new ArrayList<>();
    private int fraudCount;
    private Instant lastCheckTime;
    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    /**
     * Appends an entry and drops the oldest ones until at most {@code maxEntries} remain.
     */
    public void appendHistory(RiskScoreEntry entry, int maxEntries) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(entry);
        while (history.size() > maxEntries) {
            history.remove(0);
        }
    }
}
