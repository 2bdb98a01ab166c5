package cz.cas.jhinst.qsource3.api;

import java.util.Objects;

/**
 * A single telemetry value as reported by the device.
 */
public record TelemetryReading(TelemetryField field, double value)
{
    public TelemetryReading {
        Objects.requireNonNull(field, "field");
    }
}
