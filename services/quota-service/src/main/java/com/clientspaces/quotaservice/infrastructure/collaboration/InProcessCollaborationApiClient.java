package com.clientspaces.quotaservice.infrastructure.collaboration;

import com.clientspaces.quotaservice.domain.CollaborationApiClient;
import com.clientspaces.quotaservice.domain.ProvisionedSite;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the collaboration platform that answers locally and never fails.
 */
@Component
public class InProcessCollaborationApiClient implements CollaborationApiClient {

    private static final Logger log = LoggerFactory.getLogger(InProcessCollaborationApiClient.class);

    private static final String SITE_BASE_URL = "https://collaboration.local/sites/";

    @Override
    public ProvisionedSite createSite(String tenantId, String displayName) {
        String siteId = UUID.randomUUID().toString();
        String slug = displayName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        log.debug("Provisioned site {} for tenant {}", siteId, tenantId);
        return new ProvisionedSite(siteId, SITE_BASE_URL + slug + "-" + siteId.substring(0, 8));
    }

    @Override
    public String sendAssistantMessage(String tenantId, String message) {
        return "Received your message (" + message.length() + " characters).";
    }
}
