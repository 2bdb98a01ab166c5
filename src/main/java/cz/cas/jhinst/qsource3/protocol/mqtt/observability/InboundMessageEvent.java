package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import cz.cas.jhinst.qsource3.protocol.mqtt.internal.route.InboundKind;

import java.time.Instant;

/**
 * Record representing an inbound message after classification.
 */
public record InboundMessageEvent(
    Instant timestamp,
    String topic,
    InboundKind kind,
    String payload
) {
}
