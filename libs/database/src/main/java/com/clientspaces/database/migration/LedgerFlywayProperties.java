package com.clientspaces.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the usage ledger database.
 *
 * <pre>{@code
 * clientspaces:
 *   flyway:
 *     ledger:
 *       url: jdbc:postgresql://localhost:5432/clientspaces_ledger
 *       username: clientspaces
 *       password: clientspaces_dev_password
 *       locations: classpath:db/migration/ledger
 *       enabled: true
 * }</pre>
 *
 * @param url       JDBC connection URL
 * @param username  database username
 * @param password  database password
 * @param locations Flyway migration locations
 * @param enabled   whether to migrate on startup
 */
@Validated
@ConfigurationProperties(prefix = "clientspaces.flyway.ledger")
public record LedgerFlywayProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/ledger";

    public LedgerFlywayProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
