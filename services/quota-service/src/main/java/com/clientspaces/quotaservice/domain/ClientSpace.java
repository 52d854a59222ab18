package com.clientspaces.quotaservice.domain;

import java.time.Instant;

/**
 * An externally shared workspace provisioned for one of a tenant's clients.
 *
 * @param id        local identifier
 * @param tenantId  owning tenant
 * @param name      display name
 * @param siteId    identifier of the backing site in the collaboration platform
 * @param siteUrl   URL of the backing site
 * @param createdAt when provisioning completed
 */
public record ClientSpace(String id, String tenantId, String name, String siteId, String siteUrl, Instant createdAt) {}
