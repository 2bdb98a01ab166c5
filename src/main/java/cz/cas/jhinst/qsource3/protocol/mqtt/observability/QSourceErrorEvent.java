package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the engine.
 */
public record QSourceErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
