package cz.cas.jhinst.qsource3.protocol.mqtt.runtime;

import cz.cas.jhinst.qsource3.api.QSourceController;
import cz.cas.jhinst.qsource3.core.SettingsMirror;
import cz.cas.jhinst.qsource3.core.SettingsSnapshotStore;
import cz.cas.jhinst.qsource3.protocol.mqtt.DeviceStatusTracker;
import cz.cas.jhinst.qsource3.protocol.mqtt.EngineListeners;
import cz.cas.jhinst.qsource3.protocol.mqtt.MqttQSourceController;
import cz.cas.jhinst.qsource3.protocol.mqtt.MqttTopicScheme;
import cz.cas.jhinst.qsource3.protocol.mqtt.PayloadCodec;
import cz.cas.jhinst.qsource3.protocol.mqtt.config.EngineConfig;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.connection.ConnectionSupervisor;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.connection.ResyncSequence;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish.CommandPublisher;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.route.InboundClassifier;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.route.InboundRouter;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.NullObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpoint;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.netty.NettyMqttEndpoint;
import cz.cas.jhinst.qsource3.util.Jsons;

import java.util.Objects;

/**
 * QSourceRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the QSource3 MQTT engine.
 *
 * <h2>Wiring order</h2>
 * <ol>
 *   <li>Listener fan-out, device status and settings mirror</li>
 *   <li>Connection supervisor (registers itself on the endpoint)</li>
 *   <li>Command publisher, gated by the supervisor</li>
 *   <li>Resync sequence and inbound router, then attached to the supervisor</li>
 *   <li>Controller façade</li>
 * </ol>
 *
 * The endpoint defaults to {@link NettyMqttEndpoint} built from the
 * configuration. Tests substitute their own.
 */
public final class QSourceRuntime
{
    private final ConnectionSupervisor supervisor;
    private final MqttQSourceController controller;

    private QSourceRuntime(ConnectionSupervisor supervisor, MqttQSourceController controller) {
        this.supervisor = supervisor;
        this.controller = controller;
    }

    /**
     * Opens the broker session. Returns immediately; session progress is
     * reported through connection state notifications.
     */
    public void start() {
        supervisor.connect();
    }

    /**
     * Closes the broker session. {@link #start()} may be called again.
     */
    public void stop() {
        supervisor.disconnect();
    }

    /**
     * Stops and releases the transport. The runtime cannot be restarted.
     */
    public void close() {
        supervisor.shutdown();
    }

    public QSourceController controller() {
        return controller;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EngineConfig config;
        private QSourceObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MqttEndpoint endpoint;

        public Builder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(QSourceObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEndpoint(MqttEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public QSourceRuntime build() {
            Objects.requireNonNull(config, "config");
            QSourceObservabilitySink sink = Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. State and notification plumbing
            EngineListeners listeners = new EngineListeners(sink);
            DeviceStatusTracker deviceStatus = new DeviceStatusTracker(listeners);
            SettingsMirror mirror = new SettingsMirror(listeners);

            // 2. Transport and session state machine
            MqttEndpoint effectiveEndpoint = endpoint != null ? endpoint : new NettyMqttEndpoint(
                    config.brokerHost(),
                    config.brokerPort(),
                    config.clientId(),
                    config.username(),
                    config.password(),
                    config.keepAliveSeconds(),
                    config.connectTimeoutSeconds());
            MqttTopicScheme topics = new MqttTopicScheme(config.topicBase(), config.deviceName());
            ConnectionSupervisor supervisor = new ConnectionSupervisor(
                    effectiveEndpoint, topics, deviceStatus, listeners, sink);

            // 3. Outbound path
            PayloadCodec codec = new PayloadCodec(Jsons.mapper());
            CommandPublisher publisher = new CommandPublisher(
                    effectiveEndpoint, topics, codec, mirror, supervisor::isPublishAllowed, sink);

            // 4. Inbound path; the same resync runs on session up and on device-connected
            ResyncSequence resync = new ResyncSequence(publisher, config.resyncFields());
            InboundRouter router = new InboundRouter(
                    new InboundClassifier(), codec, mirror, listeners, deviceStatus, resync, sink);
            supervisor.attach(router, resync);

            // 5. Façade
            MqttQSourceController controller = new MqttQSourceController(
                    mirror,
                    new SettingsSnapshotStore(Jsons.mapper()),
                    publisher,
                    supervisor,
                    deviceStatus,
                    listeners,
                    config.massRangeLabels(),
                    config.pushLoadedSettings(),
                    sink);

            return new QSourceRuntime(supervisor, controller);
        }
    }
}
