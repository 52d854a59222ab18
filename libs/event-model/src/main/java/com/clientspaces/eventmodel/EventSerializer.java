package com.clientspaces.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Writes {@link EventEnvelope}s as single-line JSON for the audit log. Timestamps and durations
 * are ISO 8601 strings.
 */
public final class EventSerializer {

    private static final ObjectWriter WRITER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .build()
            .writer();

    private EventSerializer() {}

    /**
     * @throws EventSerializationException if the payload cannot be written
     */
    public static String serialize(EventEnvelope<?> event) {
        try {
            return WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    event.eventType() + " event " + event.eventId() + " is not serializable", e);
        }
    }

    /** An envelope could not be turned into JSON. */
    public static class EventSerializationException extends RuntimeException {

        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
