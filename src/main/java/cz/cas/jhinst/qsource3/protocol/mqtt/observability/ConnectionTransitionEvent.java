package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import cz.cas.jhinst.qsource3.api.ConnectionState;

import java.time.Instant;

/**
 * Record representing a transition of the broker session state machine.
 *
 * @param reason short diagnostic; for drops, the transport cause if any
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    String reason
) {
    public boolean isStateChange() {
        return oldState != newState;
    }
}
