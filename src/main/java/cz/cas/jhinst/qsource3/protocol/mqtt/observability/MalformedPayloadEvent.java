package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import java.time.Instant;

/**
 * Record representing an inbound payload that could not be decoded and was
 * treated as an empty record.
 */
public record MalformedPayloadEvent(
    Instant timestamp,
    String topic,
    String rawPayload,
    Throwable cause
) {
}
