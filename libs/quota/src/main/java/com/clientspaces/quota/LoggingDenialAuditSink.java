package com.clientspaces.quota;

import com.clientspaces.eventmodel.EventEnvelope;
import com.clientspaces.eventmodel.EventFactory;
import com.clientspaces.eventmodel.EventSerializer;
import com.clientspaces.eventmodel.EventType;
import com.clientspaces.observability.CorrelationContext;
import com.clientspaces.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Writes each denial as a {@code QuotaDenied} event envelope, serialized to JSON, on the
 * {@code clientspaces.audit} logger at INFO.
 */
public class LoggingDenialAuditSink implements DenialAuditSink {

    /** Logger name that log routing uses to ship audit events. */
    public static final String AUDIT_LOGGER = "clientspaces.audit";

    private static final Logger log = LoggerFactory.getLogger(LoggingDenialAuditSink.class);
    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final String producer;
    private final Clock clock;

    public LoggingDenialAuditSink(String producer, Clock clock) {
        if (producer == null || producer.isBlank()) {
            throw new IllegalArgumentException("producer must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.producer = producer;
        this.clock = clock;
    }

    @Override
    public void denied(QuotaDenial denial) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElse(null);
        EventEnvelope<QuotaDenial> event = EventFactory.create(
                EventType.QUOTA_DENIED, producer, denial.tenantId(), correlationId, denial, clock);
        try {
            audit.info(EventSerializer.serialize(event));
        } catch (EventSerializer.EventSerializationException e) {
            log.warn("Could not serialize QuotaDenied event {} for tenant {}",
                    event.eventId(), denial.tenantId(), e);
        }
    }
}
