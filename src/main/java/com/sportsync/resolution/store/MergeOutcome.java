package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a merge moved from the loser to the survivor.
 * {@code alreadyMerged} is set when the loser no longer existed, so the call was a no-op.
 */
public record MergeOutcome(
        EntityKind kind,
        String survivorId,
        String loserId,
        int mappingsMoved,
        int aliasesMoved,
        int predictionsMoved,
        int statLinesMoved,
        boolean alreadyMerged
) {
    public static MergeOutcome noop(EntityKind kind, String survivorId, String loserId) {
        return new MergeOutcome(kind, survivorId, loserId, 0, 0, 0, 0, true);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("survivorId", survivorId);
        map.put("loserId", loserId);
        map.put("mappingsMoved", mappingsMoved);
        map.put("aliasesMoved", aliasesMoved);
        map.put("predictionsMoved", predictionsMoved);
        map.put("statLinesMoved", statLinesMoved);
        return map;
    }
}
