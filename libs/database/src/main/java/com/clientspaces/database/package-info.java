/**
 * Durable storage for the quota layer.
 *
 * <p>The usage ledger lives in its own PostgreSQL database, migrated by Flyway. Nothing here is
 * active unless {@code clientspaces.ledger.store=jdbc}; the in-memory ledger is the default.
 *
 * @see com.clientspaces.database.migration.LedgerDatabaseConfig
 * @see com.clientspaces.database.ledger.JdbcUsageLedgerStore
 */
package com.clientspaces.database;
