package com.sportsync.resolution.scoring;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of scoring one candidate: the combined confidence, its tier and the inputs that produced it.
 */
public record ConfidenceScore(double confidence, ConfidenceTier tier, MatchSignals signals) {

    public boolean isAutoAccept() {
        return tier == ConfidenceTier.AUTO_ACCEPT;
    }

    public boolean clearsReview() {
        return tier != ConfidenceTier.REJECT;
    }

    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>(signals.asMap());
        details.put("confidence", confidence);
        details.put("tier", tier.name());
        return details;
    }
}
