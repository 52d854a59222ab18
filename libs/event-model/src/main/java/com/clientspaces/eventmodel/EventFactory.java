package com.clientspaces.eventmodel;

import java.time.Clock;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 * <p>
 * Encapsulates default value logic (UUID generation, timestamp, version) so callers don't
 * repeat boilerplate.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a version-1 event envelope timestamped from the given clock.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String tenantId,
            String correlationId,
            T payload,
            Clock clock
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                clock.instant(),
                producer,
                tenantId,
                correlationId,
                payload
        );
    }
}
