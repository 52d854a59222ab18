package com.clientspaces.quotaservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Usage ledger backend, bound from {@code clientspaces.ledger.*}.
 *
 * @param store {@code memory} (default) or {@code jdbc}
 */
@ConfigurationProperties(prefix = "clientspaces.ledger")
public record LedgerProperties(Store store) {

    public enum Store {
        MEMORY,
        JDBC
    }

    public LedgerProperties {
        if (store == null) {
            store = Store.MEMORY;
        }
    }
}
