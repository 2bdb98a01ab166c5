package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

/**
 * Main interface for receiving engine observability events.
 * Every engine component receives its sink at construction; there is no
 * process-wide logger. Implementations can provide logging, metrics, or tracing.
 */
public interface QSourceObservabilitySink {
    /**
     * Called when the broker session state machine transitions.
     * @param event the transition event details
     */
    void onConnectionTransition(ConnectionTransitionEvent event);

    /**
     * Called for every inbound message once it has been classified.
     * @param event the classified message
     */
    void onInboundMessage(InboundMessageEvent event);

    /**
     * Called after every outbound operation, accepted or rejected.
     * @param event the operation, its arguments and outcome
     */
    void onOutboundCall(OutboundCallEvent event);

    /**
     * Called when a value fails validation, whichever direction it came from.
     * @param event the failure
     */
    void onValidationRejected(ValidationRejectedEvent event);

    /**
     * Called when an inbound payload cannot be decoded.
     * @param event the raw payload and decoding error
     */
    void onMalformedPayload(MalformedPayloadEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     * @param event the error event
     */
    void onError(QSourceErrorEvent event);
}
