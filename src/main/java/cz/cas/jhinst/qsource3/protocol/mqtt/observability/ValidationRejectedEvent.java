package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import cz.cas.jhinst.qsource3.api.ValidationFailure;

import java.time.Instant;

/**
 * Record representing a value refused by validation.
 */
public record ValidationRejectedEvent(
    Instant timestamp,
    Direction direction,
    ValidationFailure failure
) {
    public enum Direction {
        /** Reported by the device; dropped. */
        INBOUND,
        /** Requested by a caller; rejected synchronously. */
        OUTBOUND,
        /** Read from a settings file; the whole load was aborted. */
        SNAPSHOT
    }
}
