package cz.cas.jhinst.qsource3.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test listener that records every notification in arrival order.
 */
public final class RecordingEngineListener implements EngineListener {
    private final List<SettingChange> changes = new ArrayList<>();
    private final List<TelemetryReading> telemetry = new ArrayList<>();
    private final List<DeviceStatus> deviceStatuses = new ArrayList<>();
    private final List<ConnectionState> connectionStates = new ArrayList<>();

    @Override
    public synchronized void onSettingChanged(SettingChange change) {
        changes.add(change);
    }

    @Override
    public synchronized void onTelemetry(TelemetryReading reading) {
        telemetry.add(reading);
    }

    @Override
    public synchronized void onDeviceStatusChanged(DeviceStatus status) {
        deviceStatuses.add(status);
    }

    @Override
    public synchronized void onConnectionStateChanged(ConnectionState state) {
        connectionStates.add(state);
    }

    public synchronized List<SettingChange> changes() {
        return List.copyOf(changes);
    }

    public synchronized List<SettingChange> changesOf(SettingField field) {
        return changes.stream()
            .filter(c -> c.field() == field)
            .collect(Collectors.toList());
    }

    public synchronized List<TelemetryReading> telemetry() {
        return List.copyOf(telemetry);
    }

    public synchronized List<DeviceStatus> deviceStatuses() {
        return List.copyOf(deviceStatuses);
    }

    public synchronized List<ConnectionState> connectionStates() {
        return List.copyOf(connectionStates);
    }

    public synchronized void clear() {
        changes.clear();
        telemetry.clear();
        deviceStatuses.clear();
        connectionStates.clear();
    }
}
