package com.clientspaces.quotaservice.domain;

/**
 * A site created in the collaboration platform.
 */
public record ProvisionedSite(String siteId, String url) {}
