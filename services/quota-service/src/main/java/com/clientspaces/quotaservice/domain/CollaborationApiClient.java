package com.clientspaces.quotaservice.domain;

/**
 * Port to the third-party collaboration platform.
 *
 * <p>Implementations signal upstream failures with
 * {@link com.clientspaces.resilience.ExternalApiException} (status and sub-code only) and
 * transport failures with the usual {@code java.net} exceptions. Each call enforces its own
 * timeout.
 */
public interface CollaborationApiClient {

    ProvisionedSite createSite(String tenantId, String displayName) throws Exception;

    String sendAssistantMessage(String tenantId, String message) throws Exception;
}
