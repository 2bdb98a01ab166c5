package cz.cas.jhinst.qsource3.protocol.mqtt.internal.connection;

import cz.cas.jhinst.qsource3.api.ConnectionState;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;
import cz.cas.jhinst.qsource3.protocol.mqtt.DeviceStatusTracker;
import cz.cas.jhinst.qsource3.protocol.mqtt.MqttTopicScheme;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.route.InboundRouter;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ConnectionTransitionEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpoint;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpointListener;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ConnectionSupervisor
 * =============================================================================
 * Owns the broker session state machine.
 *
 * <pre>
 *   DISCONNECTED ──connect()──▶ CONNECTING ──transport up──▶ CONNECTED
 *        ▲                          │                            │
 *        └──────── transport down ──┴────────────────────────────┘
 * </pre>
 *
 * <h2>On transport up</h2>
 * <ol>
 *   <li>Subscribe to the four filters of {@link MqttTopicScheme#subscriptions()}</li>
 *   <li>Run the resync sequence</li>
 * </ol>
 *
 * <h2>On transport down</h2>
 * The device status goes back to {@link DeviceStatus#UNKNOWN}. Nothing is
 * retried; {@link #connect()} may be called again once DISCONNECTED. While
 * CONNECTING or CONNECTED it does nothing.
 *
 * {@link #disconnect()} keeps the endpoint reusable. {@link #shutdown()}
 * releases it for good.
 *
 * There is no timeout on CONNECTING. The endpoint's own connect failure
 * signal is the only way out besides success.
 */
public final class ConnectionSupervisor implements MqttEndpointListener
{
    private final MqttEndpoint endpoint;
    private final MqttTopicScheme topics;
    private final DeviceStatusTracker deviceStatus;
    private final EngineListener listener;
    private final QSourceObservabilitySink sink;

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);

    private volatile InboundRouter router;
    private volatile Runnable resync;

    public ConnectionSupervisor(MqttEndpoint endpoint,
                                MqttTopicScheme topics,
                                DeviceStatusTracker deviceStatus,
                                EngineListener listener,
                                QSourceObservabilitySink sink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.deviceStatus = Objects.requireNonNull(deviceStatus, "deviceStatus");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.endpoint.setListener(this);
    }

    /**
     * Completes wiring. The router and the resync sequence both depend on the
     * publisher, which in turn needs {@link #isPublishAllowed()}; hence the
     * two-step construction.
     */
    public void attach(InboundRouter router, Runnable resync) {
        this.router = Objects.requireNonNull(router, "router");
        this.resync = Objects.requireNonNull(resync, "resync");
    }

    public void connect() {
        if (router == null || resync == null) {
            throw new IllegalStateException("attach() must be called before connect()");
        }
        if (!state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
            // A session is already pending or up; a second one would replace it.
            return;
        }
        announce(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, "connect requested");
        try {
            endpoint.start();
        } catch (RuntimeException e) {
            transition(ConnectionState.DISCONNECTED, "connect failed: " + e);
            throw e;
        }
    }

    public void disconnect() {
        endpoint.stop();
        transition(ConnectionState.DISCONNECTED, "disconnect requested");
        deviceStatus.update(DeviceStatus.UNKNOWN);
    }

    /**
     * Disconnects and closes the endpoint. The supervisor cannot connect
     * afterwards.
     */
    public void shutdown() {
        disconnect();
        endpoint.close();
    }

    public ConnectionState state() {
        return state.get();
    }

    /**
     * @return true while outbound messages can actually reach the broker
     */
    public boolean isPublishAllowed() {
        return state.get() == ConnectionState.CONNECTED && endpoint.isConnected();
    }

    // -------------------------------------------------------------------------
    // MqttEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transition(ConnectionState.CONNECTED, "broker acknowledged session");
        for (String filter : topics.subscriptions()) {
            endpoint.subscribe(filter);
        }
        resync.run();
    }

    @Override
    public void onTransportDown(Throwable cause) {
        // Cause is diagnostic only.
        transition(ConnectionState.DISCONNECTED, cause == null ? "session closed" : cause.toString());
        deviceStatus.update(DeviceStatus.UNKNOWN);
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
        InboundRouter r = router;
        if (r != null) {
            r.route(topic, payload);
        }
    }

    private void transition(ConnectionState newState, String reason) {
        announce(state.getAndSet(newState), newState, reason);
    }

    private void announce(ConnectionState old, ConnectionState newState, String reason) {
        ConnectionTransitionEvent event = new ConnectionTransitionEvent(Instant.now(), old, newState, reason);
        sink.onConnectionTransition(event);
        if (event.isStateChange()) {
            listener.onConnectionStateChanged(newState);
        }
    }
}
