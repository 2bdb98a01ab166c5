package cz.cas.jhinst.qsource3.protocol.mqtt;

import cz.cas.jhinst.qsource3.api.ConnectionState;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;
import cz.cas.jhinst.qsource3.api.QSourceController;
import cz.cas.jhinst.qsource3.api.RequestResult;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.SettingsSnapshot;
import cz.cas.jhinst.qsource3.api.SnapshotLoadException;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.api.ValidationFailure;
import cz.cas.jhinst.qsource3.core.SettingsMirror;
import cz.cas.jhinst.qsource3.core.SettingsSnapshotStore;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.connection.ConnectionSupervisor;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish.CommandPublisher;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ValidationRejectedEvent;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MqttQSourceController
 * =============================================================================
 * {@link QSourceController} implementation over MQTT.
 *
 * This class only delegates. Requests go to {@link CommandPublisher}, reads
 * go to {@link SettingsMirror}, status comes from
 * {@link ConnectionSupervisor} and {@link DeviceStatusTracker}.
 *
 * <h2>Settings files</h2>
 * A load replaces the whole mirror or nothing (origin
 * {@link UpdateOrigin#SNAPSHOT}). When pushing is enabled and the broker
 * session is up, every field is then published to the device in declaration
 * order. A push that fails is logged; it never undoes the load.
 */
public final class MqttQSourceController implements QSourceController
{
    private final SettingsMirror mirror;
    private final SettingsSnapshotStore store;
    private final CommandPublisher publisher;
    private final ConnectionSupervisor supervisor;
    private final DeviceStatusTracker deviceStatus;
    private final EngineListeners listeners;
    private final List<String> massRangeLabels;
    private final boolean pushLoadedSettings;
    private final QSourceObservabilitySink sink;

    public MqttQSourceController(SettingsMirror mirror,
                                 SettingsSnapshotStore store,
                                 CommandPublisher publisher,
                                 ConnectionSupervisor supervisor,
                                 DeviceStatusTracker deviceStatus,
                                 EngineListeners listeners,
                                 List<String> massRangeLabels,
                                 boolean pushLoadedSettings,
                                 QSourceObservabilitySink sink) {
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.deviceStatus = Objects.requireNonNull(deviceStatus, "deviceStatus");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
        this.massRangeLabels = List.copyOf(massRangeLabels);
        this.pushLoadedSettings = pushLoadedSettings;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public RequestResult request(SettingField field, Object value) {
        return publisher.request(field, value);
    }

    @Override
    public RequestResult requestCurrentValue(SettingField field) {
        return publisher.requestCurrentValue(field);
    }

    @Override
    public RequestResult requestDeviceState() {
        return publisher.requestDeviceState();
    }

    @Override
    public SettingsSnapshot getSettings() {
        return mirror.snapshot();
    }

    @Override
    public ConnectionState getConnectionState() {
        return supervisor.state();
    }

    @Override
    public DeviceStatus getDeviceStatus() {
        return deviceStatus.current();
    }

    @Override
    public List<String> massRangeLabels() {
        return massRangeLabels;
    }

    @Override
    public void loadSettings(Path file) throws SnapshotLoadException {
        Map<SettingField, Object> candidate = store.read(file);

        Optional<ValidationFailure> failure = mirror.replaceAll(candidate, UpdateOrigin.SNAPSHOT);
        if (failure.isPresent()) {
            sink.onValidationRejected(new ValidationRejectedEvent(
                    Instant.now(),
                    ValidationRejectedEvent.Direction.SNAPSHOT,
                    failure.get()));
            throw new SnapshotLoadException(failure.get());
        }

        if (pushLoadedSettings && supervisor.isPublishAllowed()) {
            for (SettingField field : SettingField.values()) {
                publisher.pushCurrent(field);
            }
        }
    }

    @Override
    public void saveSettings(Path file) throws IOException {
        store.write(file, mirror.snapshot());
    }

    @Override
    public void addListener(EngineListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(EngineListener listener) {
        listeners.remove(listener);
    }
}
