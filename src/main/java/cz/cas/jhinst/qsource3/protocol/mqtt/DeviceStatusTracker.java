package cz.cas.jhinst.qsource3.protocol.mqtt;

import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last known status of the device behind the broker.
 * <p>
 * Device-connected and device-error markers are events: every marker is
 * reported to listeners, repeated ones included, so a front-end sees each
 * reconnect of the device. The reset to {@link DeviceStatus#UNKNOWN} on a
 * broker session drop is a local conclusion and is reported only when the
 * status actually changes.
 */
public final class DeviceStatusTracker
{
    private final AtomicReference<DeviceStatus> status = new AtomicReference<>(DeviceStatus.UNKNOWN);
    private final EngineListener listener;

    public DeviceStatusTracker(EngineListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public DeviceStatus current() {
        return status.get();
    }

    /**
     * Records a status announced by the device and always notifies.
     */
    public void report(DeviceStatus announced) {
        Objects.requireNonNull(announced, "announced");
        status.set(announced);
        listener.onDeviceStatusChanged(announced);
    }

    /**
     * Records a status concluded locally; notifies only on change.
     */
    public void update(DeviceStatus newStatus) {
        Objects.requireNonNull(newStatus, "newStatus");
        if (status.getAndSet(newStatus) != newStatus) {
            listener.onDeviceStatusChanged(newStatus);
        }
    }
}
