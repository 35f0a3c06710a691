package com.sportsync.resolution.cache;

import com.sportsync.resolution.core.model.EntityKind;

/**
 * Callback fired after a reconciliation merge has committed.
 */
public interface MergeListener {

    /**
     * @param kind       kind of the merged entities
     * @param loserId    the entity that was merged away and deleted
     * @param survivorId the entity that now owns the loser's references
     */
    void onMerge(EntityKind kind, String loserId, String survivorId);
}
