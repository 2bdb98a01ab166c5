package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import cz.cas.jhinst.qsource3.api.RequestResult;

import java.time.Instant;
import java.util.List;

/**
 * Record representing one outbound operation, its arguments and its outcome.
 */
public record OutboundCallEvent(
    Instant timestamp,
    String operation,
    List<Object> arguments,
    RequestResult result
) {
}
