package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

/**
 * No-op implementation of QSourceObservabilitySink.
 */
public final class NullObservabilitySink implements QSourceObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onInboundMessage(InboundMessageEvent event) {}

    @Override
    public void onOutboundCall(OutboundCallEvent event) {}

    @Override
    public void onValidationRejected(ValidationRejectedEvent event) {}

    @Override
    public void onMalformedPayload(MalformedPayloadEvent event) {}

    @Override
    public void onError(QSourceErrorEvent event) {}
}
