package cz.cas.jhinst.qsource3.protocol.mqtt;

import cz.cas.jhinst.qsource3.api.ConnectionState;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;
import cz.cas.jhinst.qsource3.api.SettingChange;
import cz.cas.jhinst.qsource3.api.TelemetryReading;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceErrorEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of engine notifications to registered listeners.
 * <p>
 * A listener that throws is reported to the observability sink; the remaining
 * listeners are still notified and the caller (mirror, router or supervisor)
 * never sees the exception.
 */
public final class EngineListeners implements EngineListener
{
    private final List<EngineListener> listeners = new CopyOnWriteArrayList<>();
    private final QSourceObservabilitySink sink;

    public EngineListeners(QSourceObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void add(EngineListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void remove(EngineListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onSettingChanged(SettingChange change) {
        fire("onSettingChanged", l -> l.onSettingChanged(change));
    }

    @Override
    public void onTelemetry(TelemetryReading reading) {
        fire("onTelemetry", l -> l.onTelemetry(reading));
    }

    @Override
    public void onDeviceStatusChanged(DeviceStatus status) {
        fire("onDeviceStatusChanged", l -> l.onDeviceStatusChanged(status));
    }

    @Override
    public void onConnectionStateChanged(ConnectionState state) {
        fire("onConnectionStateChanged", l -> l.onConnectionStateChanged(state));
    }

    private void fire(String callback, Consumer<EngineListener> call) {
        for (EngineListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                sink.onError(new QSourceErrorEvent(
                        Instant.now(),
                        "Listener " + listener + " failed in " + callback,
                        e));
            }
        }
    }
}
