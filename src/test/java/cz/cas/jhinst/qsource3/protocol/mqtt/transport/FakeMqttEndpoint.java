package cz.cas.jhinst.qsource3.protocol.mqtt.transport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FakeMqttEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link MqttEndpoint} implementation.
 *
 * <p>No broker is involved. {@link #start()} acknowledges the session at once,
 * outbound traffic is recorded, and tests inject inbound messages or session
 * drops directly.</p>
 */
public final class FakeMqttEndpoint implements MqttEndpoint {

    public record Published(String topic, byte[] payload) {
        public String payloadText() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private MqttEndpointListener listener;
    private boolean connected;
    private boolean closed;
    private boolean autoAcknowledge = true;
    private int starts;
    private final List<Published> published = new ArrayList<>();
    private final List<String> subscriptions = new ArrayList<>();

    @Override
    public synchronized void setListener(MqttEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        MqttEndpointListener l;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Endpoint has been closed");
            }
            starts++;
            if (!autoAcknowledge) {
                return;
            }
            connected = true;
            l = listener;
        }
        if (l != null) {
            l.onTransportUp();
        }
    }

    @Override
    public synchronized void stop() {
        connected = false;
    }

    @Override
    public synchronized void close() {
        connected = false;
        closed = true;
    }

    @Override
    public synchronized void subscribe(String topicFilter) {
        if (connected) {
            subscriptions.add(Objects.requireNonNull(topicFilter, "topicFilter"));
        }
    }

    @Override
    public synchronized void publish(String topic, byte[] payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (connected) {
            published.add(new Published(topic, payload));
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * When disabled, {@link #start()} leaves the session pending until
     * {@link #acknowledgeSession()} is called.
     */
    public synchronized void setAutoAcknowledge(boolean autoAcknowledge) {
        this.autoAcknowledge = autoAcknowledge;
    }

    public void acknowledgeSession() {
        MqttEndpointListener l;
        synchronized (this) {
            connected = true;
            l = listener;
        }
        if (l != null) {
            l.onTransportUp();
        }
    }

    public void injectMessage(String topic, String payload) {
        injectMessage(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    public void injectMessage(String topic, byte[] payload) {
        MqttEndpointListener l;
        synchronized (this) {
            l = listener;
        }
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onMessage(topic, payload);
    }

    public void dropSession(Throwable cause) {
        MqttEndpointListener l;
        synchronized (this) {
            boolean wasConnected = connected;
            connected = false;
            l = wasConnected ? listener : null;
        }
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    public synchronized List<Published> published() {
        return List.copyOf(published);
    }

    public synchronized List<String> publishedTopics() {
        return published.stream().map(Published::topic).toList();
    }

    public synchronized List<String> subscriptions() {
        return List.copyOf(subscriptions);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int starts() {
        return starts;
    }

    public synchronized void clear() {
        published.clear();
        subscriptions.clear();
    }
}
