package com.clientspaces.quota;

/**
 * Read-only access to how many resources of a kind a tenant currently has.
 */
@FunctionalInterface
public interface ResourceCountStore {

    long countActive(String tenantId, ResourceKind kind);
}
