package com.clientspaces.quotaservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code clientspaces.service.*}.
 *
 * <pre>
 * clientspaces:
 *   service:
 *     name: quota-service
 *     environment: production
 * </pre>
 *
 * @param name        service name used as the metrics {@code service} tag and audit producer
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description
 */
@ConfigurationProperties(prefix = "clientspaces.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
