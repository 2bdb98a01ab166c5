package cz.cas.jhinst.qsource3.protocol.mqtt.transport;

/**
 * MqttEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MqttEndpoint}.
 *
 * <p>Callbacks are delivered in a <em>serialized</em> manner by the
 * implementation (Netty endpoints deliver them on the channel's event loop).
 * They run concurrently with any thread that publishes.</p>
 */
public interface MqttEndpointListener
{
    /**
     * Called when the broker acknowledged the session.
     *
     * <p>This is a transport lifecycle signal only. It carries no device meaning.</p>
     */
    void onTransportUp();

    /**
     * Called when the session is lost or could not be established.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a message arrives on a subscribed topic.
     *
     * @param topic   the concrete topic the message was published to
     * @param payload raw payload bytes, exactly as received
     */
    void onMessage(String topic, byte[] payload);
}
