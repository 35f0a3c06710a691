package com.sportsync.resolution.reconcile;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.List;

/**
 * Canonical rows believed to describe the same real-world entity.
 *
 * @param kind   entity kind
 * @param ids    canonical ids, at least two
 * @param reason why the rows were grouped, e.g. {@code "same matchup within 2h"}
 */
public record DuplicateGroup(EntityKind kind, List<String> ids, String reason) {

    public DuplicateGroup {
        ids = List.copyOf(ids);
        if (ids.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two ids");
        }
    }
}
