package com.sportsync.resolution.audit;

/**
 * Types of auditable decisions made by the resolution engine.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_UPDATED,
    ENTITY_MERGED,
    MERGE_ABORTED,
    MAPPING_CREATED,
    MAPPING_UPDATED,
    ALIAS_CREATED,
    REVIEW_REQUESTED,
    REVIEW_APPROVED,
    REVIEW_REJECTED
}
