package com.sky.association.audit;

/**
 * Auditable operations on the sky model.
 */
public enum AuditAction {
    IMAGE_ADDED,
    IMAGE_FAILED_QA,
    SOURCES_EXTRACTED,
    SOURCES_PURGED,
    ASSOCIATED_SOURCE_CREATED,
    ASSOCIATED_SOURCE_REMOVED,
    CATALOG_MATCHES_RECORDED,
    CATALOG_MATCHES_REMOVED,
    IMAGE_REMOVED,
    STORE_CLEARED,
    RUN_COMPLETED
}
