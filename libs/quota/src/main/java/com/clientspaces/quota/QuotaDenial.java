package com.clientspaces.quota;

/**
 * Audit payload for one denied operation.
 *
 * @param tenantId      the tenant
 * @param planTier      the tier the check ran against
 * @param operationName the operation that was refused
 * @param reason        which check refused it
 * @param message       the user-facing denial message
 */
public record QuotaDenial(
        String tenantId, String planTier, String operationName, QuotaDenialReason reason, String message) {}
