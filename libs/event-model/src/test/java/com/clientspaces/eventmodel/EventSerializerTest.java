package com.clientspaces.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for EventSerializer and EventFactory.
 */
@DisplayName("EventSerializer")
class EventSerializerTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2026-03-14T09:30:00Z"), ZoneOffset.UTC);

    private EventEnvelope<Map<String, Object>> sampleEvent() {
        return EventFactory.create(
                EventType.QUOTA_DENIED,
                "quota-service", "tenant-1", "corr-1",
                Map.of("reason", "RATE_LIMITED", "limit", 300),
                CLOCK
        );
    }

    @Nested
    @DisplayName("EventFactory.create()")
    class Create {

        @Test
        @DisplayName("fills identity, version and clock timestamp")
        void fillsDefaults() {
            var event = sampleEvent();

            assertThat(event.eventId()).isNotBlank();
            assertThat(event.eventType()).isEqualTo("QuotaDenied");
            assertThat(event.eventVersion()).isEqualTo(1);
            assertThat(event.occurredAt()).isEqualTo(Instant.parse("2026-03-14T09:30:00Z"));
            assertThat(event.tenantId()).isEqualTo("tenant-1");
            assertThat(event.correlationId()).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("every event gets a fresh id")
        void freshIds() {
            assertThat(sampleEvent().eventId()).isNotEqualTo(sampleEvent().eventId());
        }
    }

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("writes occurredAt as an ISO 8601 string")
        void writesIsoTimestamp() {
            var json = EventSerializer.serialize(sampleEvent());

            assertThat(json).contains("\"occurredAt\":\"2026-03-14T09:30:00Z\"");
            assertThat(json).contains("\"eventType\":\"QuotaDenied\"");
            assertThat(json).contains("\"reason\":\"RATE_LIMITED\"");
        }

        @Test
        @DisplayName("writes record payloads and a missing correlation id as null")
        void writesRecordPayload() {
            var event = EventFactory.create(
                    EventType.QUOTA_DENIED, "quota-service", "tenant-2", null,
                    new SamplePayload("createClientSpace", 4), CLOCK);

            var json = EventSerializer.serialize(event);

            assertThat(json).contains("\"correlationId\":null");
            assertThat(json).contains("\"operation\":\"createClientSpace\"", "\"attempts\":4");
            assertThat(json).doesNotContain("\n");
        }

        @Test
        @DisplayName("an unserializable payload raises EventSerializationException")
        void unserializablePayload() {
            var event = EventFactory.create(
                    EventType.QUOTA_DENIED, "quota-service", "tenant-3", null, new Object(), CLOCK);

            assertThatThrownBy(() -> EventSerializer.serialize(event))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessageContaining(event.eventId());
        }
    }

    record SamplePayload(String operation, int attempts) {}
}
