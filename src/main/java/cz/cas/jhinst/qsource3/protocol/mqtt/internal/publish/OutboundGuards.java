package cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish;

import cz.cas.jhinst.qsource3.api.RequestResult;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.OutboundCallEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * OutboundGuards
 * =============================================================================
 * Cross-cutting wrappers composed around every {@link OutboundOperation}.
 *
 * <pre>
 *   logged( requireConnected( operation ) )
 * </pre>
 *
 * Guards know nothing about individual settings. A field-specific check
 * belongs in the validator, not here.
 */
public final class OutboundGuards
{
    private OutboundGuards() {
    }

    /**
     * Short-circuits with {@link RequestResult.Rejected#notConnected(String)}
     * while the broker session is not established. {@code next} is not run, so
     * nothing is validated, mutated or published.
     */
    public static OutboundOperation requireConnected(BooleanSupplier connected,
                                                     String operation,
                                                     OutboundOperation next) {
        Objects.requireNonNull(connected, "connected");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(next, "next");

        return () -> connected.getAsBoolean()
                ? next.run()
                : RequestResult.Rejected.notConnected(operation);
    }

    /**
     * Reports the operation, its arguments and its outcome to {@code sink}
     * after {@code next} returns.
     */
    public static OutboundOperation logged(QSourceObservabilitySink sink,
                                           String operation,
                                           List<Object> arguments,
                                           OutboundOperation next) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(next, "next");
        List<Object> args = Collections.unmodifiableList(arguments);

        return () -> {
            RequestResult result = next.run();
            sink.onOutboundCall(new OutboundCallEvent(Instant.now(), operation, args, result));
            return result;
        };
    }
}
