package cz.cas.jhinst.qsource3.protocol.mqtt.transport.netty;

import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpoint;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyMqttEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link MqttEndpoint} port, speaking MQTT
 * 3.1.1 over TCP through {@code netty-codec-mqtt}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode payloads</li>
 *   <li>Choose topics to subscribe or publish to</li>
 *   <li>Schedule reconnects</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Session semantics</h2>
 * <ul>
 *   <li>Clean session, QoS 0 for every subscription and publish</li>
 *   <li>The session is "up" only after an accepted CONNACK</li>
 *   <li>PINGREQ is sent whenever nothing was written for the keep-alive
 *       interval</li>
 *   <li>Each TCP connection produces at most one down notification</li>
 *   <li>Only the current channel may change the session flag or notify the
 *       listener; events from a superseded channel are dropped</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} opens a new TCP connection; it may be called again after
 *   the session dropped or after {@link #stop()}.
 * - {@link #stop()} sends DISCONNECT and closes the channel. The event loop
 *   group stays up.
 * - {@link #close()} stops and shuts down the event loop group. The endpoint
 *   cannot be restarted afterwards.
 */
public final class NettyMqttEndpoint implements MqttEndpoint
{
    private static final int MAX_MESSAGE_BYTES = 256 * 1024;
    private static final long STOP_TIMEOUT_SECONDS = 2;

    private final String host;
    private final int port;
    private final String clientId;
    private final String username;
    private final String password;
    private final int keepAliveSeconds;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean sessionUp = new AtomicBoolean(false);
    private final AtomicInteger nextMessageId = new AtomicInteger(1);

    private volatile MqttEndpointListener listener;
    private volatile Channel channel;

    /**
     * @param username         may be {@code null} for anonymous sessions
     * @param password         ignored unless {@code username} is set
     * @param keepAliveSeconds MQTT keep-alive; 0 disables pings
     */
    public NettyMqttEndpoint(String host,
                             int port,
                             String clientId,
                             String username,
                             String password,
                             int keepAliveSeconds,
                             int connectTimeoutSeconds)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.username = username;
        this.password = password;
        this.keepAliveSeconds = keepAliveSeconds;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) TimeUnit.SECONDS.toMillis(connectTimeoutSeconds))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new MqttDecoder(MAX_MESSAGE_BYTES));
                        p.addLast(MqttEncoder.INSTANCE);
                        p.addLast(new IdleStateHandler(0, keepAliveSeconds, 0));
                        p.addLast(new SessionHandler());
                    }
                });
    }

    @Override
    public void setListener(MqttEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        MqttEndpointListener l = requireListener();
        if (group.isShuttingDown()) {
            throw new IllegalStateException("Endpoint has been closed");
        }

        // Connect asynchronously; CONNECT is sent once the channel is active.
        ChannelFuture f = bootstrap.connect(host, port);
        Channel ch = f.channel();
        channel = ch;
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess() && isCurrent(ch)) {
                channel = null;
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        sessionUp.set(false);

        if (ch == null) {
            return;
        }
        if (ch.isActive()) {
            ch.writeAndFlush(bare(MqttMessageType.DISCONNECT));
        }
        ch.close().awaitUninterruptibly(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void close()
    {
        stop();
        group.shutdownGracefully().awaitUninterruptibly(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void subscribe(String topicFilter)
    {
        Objects.requireNonNull(topicFilter, "topicFilter");

        Channel ch = channel;
        if (ch == null || !sessionUp.get()) {
            return;
        }

        MqttMessage subscribe = MqttMessageBuilders.subscribe()
                .messageId(nextMessageId())
                .addSubscription(MqttQoS.AT_MOST_ONCE, topicFilter)
                .build();
        ch.writeAndFlush(subscribe).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void publish(String topic, byte[] payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !sessionUp.get()) {
            // Session not up. Caller decides how to handle this; we do not queue.
            return;
        }

        MqttPublishMessage publish = MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .messageId(0)
                .payload(Unpooled.wrappedBuffer(payload))
                .build();
        ch.writeAndFlush(publish).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public boolean isConnected()
    {
        return sessionUp.get();
    }

    private MqttEndpointListener requireListener()
    {
        MqttEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MqttEndpointListener must be set before start()");
        }
        return l;
    }

    private boolean isCurrent(Channel ch)
    {
        return ch != null && ch == channel;
    }

    private int nextMessageId()
    {
        return nextMessageId.getAndUpdate(id -> id >= 0xFFFF ? 1 : id + 1);
    }

    private MqttConnectMessage connectMessage()
    {
        MqttMessageBuilders.ConnectBuilder builder = MqttMessageBuilders.connect()
                .protocolVersion(MqttVersion.MQTT_3_1_1)
                .clientId(clientId)
                .cleanSession(true)
                .keepAlive(keepAliveSeconds);
        if (username != null) {
            builder.hasUser(true).username(username);
            if (password != null) {
                builder.hasPassword(true).password(password.getBytes(StandardCharsets.UTF_8));
            }
        }
        return builder.build();
    }

    private static MqttMessage bare(MqttMessageType type)
    {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }

    /**
     * SessionHandler
     * -------------------------------------------------------------------------
     * One instance per TCP connection. Runs the CONNECT/CONNACK handshake,
     * forwards PUBLISH payloads to the port listener and keeps the session
     * alive.
     */
    private final class SessionHandler extends SimpleChannelInboundHandler<MqttMessage>
    {
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            ctx.writeAndFlush(connectMessage());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg)
        {
            if (msg.decoderResult().isFailure()) {
                failure = msg.decoderResult().cause();
                ctx.close();
                return;
            }

            switch (msg.fixedHeader().messageType()) {
                case CONNACK -> onConnAck(ctx, (MqttConnAckMessage) msg);
                case PUBLISH -> onPublish(ctx, (MqttPublishMessage) msg);
                default -> {
                    // SUBACK, PINGRESP: nothing to do at QoS 0.
                }
            }
        }

        private void onConnAck(ChannelHandlerContext ctx, MqttConnAckMessage ack)
        {
            if (!isCurrent(ctx.channel())) {
                ctx.close();
                return;
            }

            MqttConnectReturnCode code = ack.variableHeader().connectReturnCode();
            if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
                failure = new IOException("Broker refused connection: " + code);
                ctx.close();
                return;
            }

            sessionUp.set(true);
            MqttEndpointListener l = listener;
            if (l != null) {
                l.onTransportUp();
            }
        }

        private void onPublish(ChannelHandlerContext ctx, MqttPublishMessage publish)
        {
            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = publish.payload();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            if (publish.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
                ctx.writeAndFlush(new MqttMessage(
                        new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 2),
                        MqttMessageIdVariableHeader.from(publish.variableHeader().packetId())));
            }

            MqttEndpointListener l = listener;
            if (l != null && isCurrent(ctx.channel())) {
                l.onMessage(publish.variableHeader().topicName(), bytes);
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(bare(MqttMessageType.PINGREQ));
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!isCurrent(ctx.channel())) {
                // Superseded or stopped: the current session is unaffected.
                return;
            }
            channel = null;
            sessionUp.set(false);

            MqttEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            ctx.close();
        }
    }
}
