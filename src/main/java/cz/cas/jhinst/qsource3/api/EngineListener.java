package cz.cas.jhinst.qsource3.api;

/**
 * Everything an operator-facing surface may want to observe, with no-op
 * defaults so implementations override only what they display.
 */
public interface EngineListener extends SettingsListener, TelemetryListener
{
    @Override
    default void onSettingChanged(SettingChange change) {}

    @Override
    default void onTelemetry(TelemetryReading reading) {}

    /**
     * Called for every connected or error marker from the device, repeats
     * included, and when the status falls back to {@link DeviceStatus#UNKNOWN}.
     */
    default void onDeviceStatusChanged(DeviceStatus status) {}

    default void onConnectionStateChanged(ConnectionState state) {}
}
