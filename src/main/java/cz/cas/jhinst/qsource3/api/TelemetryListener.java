package cz.cas.jhinst.qsource3.api;

/**
 * Receives device telemetry as it arrives. Telemetry is never stored, so a
 * listener attached late only sees future readings.
 */
@FunctionalInterface
public interface TelemetryListener
{
    void onTelemetry(TelemetryReading reading);
}
