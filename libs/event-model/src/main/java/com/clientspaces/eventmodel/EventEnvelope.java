package com.clientspaces.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for audit events emitted by the client spaces platform.
 *
 * <p>The envelope carries standard metadata (identification, correlation, multi-tenancy,
 * versioning) alongside the event-specific payload. Audit consumers only ever read envelopes,
 * so the payload shape can evolve behind {@code eventVersion}.
 *
 * @param <T> the type of the event-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type/name of this event (e.g. "QuotaDenied"). */
        String eventType,

        /** Schema version of this event type. Starts at 1, increments on breaking changes. */
        int eventVersion,

        /** When the event occurred (ISO 8601 with millisecond precision). */
        Instant occurredAt,

        /** Name of the service that produced this event. */
        String producer,

        /** Tenant the event is about. */
        String tenantId,

        /** Correlation ID of the request that caused this event (nullable). */
        String correlationId,

        /** Event-specific data. */
        T payload) {}
