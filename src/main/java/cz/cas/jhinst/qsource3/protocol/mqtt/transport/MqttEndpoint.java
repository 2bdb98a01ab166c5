package cz.cas.jhinst.qsource3.protocol.mqtt.transport;

/**
 * MqttEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a publish/subscribe broker session.
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>choosing subscriptions once the session is up</li>
 *   <li>feeding inbound messages into the router</li>
 *   <li>deciding whether publishing is currently allowed</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, another MQTT client library, or a
 * test harness.</p>
 */
public interface MqttEndpoint
{
    /**
     * Open the broker session.
     *
     * <p>Returns without waiting for the broker. When the broker acknowledges
     * the session the endpoint MUST notify its listener via
     * {@link MqttEndpointListener#onTransportUp()} exactly once per transition.
     * If the session cannot be established the endpoint MUST call
     * {@link MqttEndpointListener#onTransportDown(Throwable)} instead.</p>
     */
    void start();

    /**
     * Close the broker session.
     *
     * <p>The session ends at the caller's request, so the listener is not
     * notified. {@link #start()} may be called again afterwards. A session
     * that ends for any other reason MUST be reported via
     * {@link MqttEndpointListener#onTransportDown(Throwable)} exactly once.</p>
     */
    void stop();

    /**
     * Stop the session and release the endpoint's resources for good.
     * {@link #start()} fails afterwards.
     */
    void close();

    /**
     * Subscribe to a topic filter (MQTT wildcards allowed).
     */
    void subscribe(String topicFilter);

    /**
     * Publish a message, fire-and-forget.
     *
     * <p>The endpoint must not invent outbound traffic, and it must not queue
     * messages while the session is down; such messages are discarded.</p>
     */
    void publish(String topic, byte[] payload);

    /**
     * @return {@code true} while the broker session is acknowledged and open
     */
    boolean isConnected();

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MqttEndpointListener listener);
}
