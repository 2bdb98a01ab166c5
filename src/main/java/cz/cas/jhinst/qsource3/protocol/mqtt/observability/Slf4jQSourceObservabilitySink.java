package cz.cas.jhinst.qsource3.protocol.mqtt.observability;

import cz.cas.jhinst.qsource3.api.RequestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of QSourceObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jQSourceObservabilitySink implements QSourceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jQSourceObservabilitySink.class);

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("MQTT session: {} -> {} ({})",
                event.oldState(),
                event.newState(),
                event.reason());
        }
    }

    @Override
    public void onInboundMessage(InboundMessageEvent event) {
        switch (event.kind()) {
            case DEVICE_CONNECTED -> log.info("Device connected");
            case DEVICE_ERROR -> log.warn("Device error: {}", event.payload());
            default -> log.debug("Received message on topic {} ({}) with payload {}",
                event.topic(), event.kind(), event.payload());
        }
    }

    @Override
    public void onOutboundCall(OutboundCallEvent event) {
        if (event.result() instanceof RequestResult.Rejected rejected) {
            log.warn("{} {} rejected: {}", event.operation(), event.arguments(), rejected.message());
        } else {
            log.debug("Calling {} with args: {} -> {}", event.operation(), event.arguments(), event.result());
        }
    }

    @Override
    public void onValidationRejected(ValidationRejectedEvent event) {
        switch (event.direction()) {
            case INBOUND -> log.debug("Dropped device value: {}", event.failure().message());
            case OUTBOUND -> log.info("Rejected request: {}", event.failure().message());
            case SNAPSHOT -> log.warn("Rejected settings file: {}", event.failure().message());
        }
    }

    @Override
    public void onMalformedPayload(MalformedPayloadEvent event) {
        log.debug("Error decoding payload on topic {}: {}", event.topic(), event.cause().getMessage());
    }

    @Override
    public void onError(QSourceErrorEvent event) {
        log.error("QSource3 engine error: {}", event.message(), event.cause());
    }
}
