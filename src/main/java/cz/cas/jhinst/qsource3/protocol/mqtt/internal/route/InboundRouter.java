package cz.cas.jhinst.qsource3.protocol.mqtt.internal.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.TelemetryField;
import cz.cas.jhinst.qsource3.api.TelemetryListener;
import cz.cas.jhinst.qsource3.api.TelemetryReading;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.core.SettingsMirror;
import cz.cas.jhinst.qsource3.protocol.mqtt.DeviceStatusTracker;
import cz.cas.jhinst.qsource3.protocol.mqtt.PayloadCodec;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.InboundMessageEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.MalformedPayloadEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceErrorEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ValidationRejectedEvent;
import cz.cas.jhinst.qsource3.validation.ValidationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * InboundRouter
 * =============================================================================
 * Applies device reports to the settings mirror and forwards telemetry.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   MqttEndpoint.onMessage(topic, bytes)
 *        → InboundClassifier          (topic only)
 *            → PayloadCodec           (malformed → empty record)
 *                → SettingsMirror.setIfValid(..., DEVICE)
 *                → TelemetryListener.onTelemetry(...)
 * </pre>
 *
 * <h2>Error policy</h2>
 * Inbound reports are not answers to anything, so there is nobody to report a
 * problem to. Every problem is terminal here: it is sent to the observability
 * sink and the offending value is dropped. {@link #route(String, byte[])}
 * never throws.
 *
 * <h2>No suppression</h2>
 * A report carrying the value the mirror already holds is still applied and
 * still notifies listeners.
 */
public final class InboundRouter
{
    private final InboundClassifier classifier;
    private final PayloadCodec codec;
    private final SettingsMirror mirror;
    private final TelemetryListener telemetryListener;
    private final DeviceStatusTracker deviceStatus;
    private final Runnable onDeviceConnected;
    private final QSourceObservabilitySink sink;

    /**
     * @param onDeviceConnected run once per device-connected marker, after the
     *                          device status was updated
     */
    public InboundRouter(InboundClassifier classifier,
                         PayloadCodec codec,
                         SettingsMirror mirror,
                         TelemetryListener telemetryListener,
                         DeviceStatusTracker deviceStatus,
                         Runnable onDeviceConnected,
                         QSourceObservabilitySink sink) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.telemetryListener = Objects.requireNonNull(telemetryListener, "telemetryListener");
        this.deviceStatus = Objects.requireNonNull(deviceStatus, "deviceStatus");
        this.onDeviceConnected = Objects.requireNonNull(onDeviceConnected, "onDeviceConnected");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void route(String topic, byte[] payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        try {
            dispatch(classifier.classify(topic), payload);
        } catch (RuntimeException e) {
            sink.onError(new QSourceErrorEvent(Instant.now(), "Failed to route message on " + topic, e));
        }
    }

    private void dispatch(InboundMessage message, byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);
        sink.onInboundMessage(new InboundMessageEvent(Instant.now(), message.topic(), message.kind(), text));

        if (message instanceof InboundMessage.DeviceConnected) {
            deviceStatus.report(DeviceStatus.CONNECTED);
            onDeviceConnected.run();
        } else if (message instanceof InboundMessage.DeviceError) {
            deviceStatus.report(DeviceStatus.IO_ERROR);
        } else if (message instanceof InboundMessage.StateReport report) {
            applyStateReport(decode(report.topic(), payload, text));
        } else if (message instanceof InboundMessage.FieldReport report) {
            JsonNode value = decode(report.topic(), payload, text).get(PayloadCodec.VALUE_KEY);
            if (value != null) {
                applySetting(report.field(), value);
            }
        } else if (message instanceof InboundMessage.TelemetryReport report) {
            JsonNode value = decode(report.topic(), payload, text).get(PayloadCodec.VALUE_KEY);
            if (value != null) {
                forwardTelemetry(report.topic(), report.field(), value);
            }
        }
        // Ignored: nothing to do beyond the inbound event.
    }

    private void applyStateReport(ObjectNode record) {
        for (SettingField field : SettingField.values()) {
            field.stateReportKey()
                    .map(record::get)
                    .ifPresent(value -> applySetting(field, value));
        }
        for (TelemetryField field : TelemetryField.values()) {
            JsonNode value = record.get(field.reportKey());
            if (value != null) {
                forwardTelemetry(field.reportKey(), field, value);
            }
        }
    }

    private void applySetting(SettingField field, JsonNode value) {
        Object candidate = codec.toCandidate(value);
        ValidationResult result = mirror.setIfValid(field, candidate, UpdateOrigin.DEVICE);
        if (result instanceof ValidationResult.Invalid invalid) {
            sink.onValidationRejected(new ValidationRejectedEvent(
                    Instant.now(),
                    ValidationRejectedEvent.Direction.INBOUND,
                    invalid.failure()));
        }
    }

    private void forwardTelemetry(String source, TelemetryField field, JsonNode value) {
        if (!value.isNumber()) {
            sink.onMalformedPayload(new MalformedPayloadEvent(
                    Instant.now(),
                    source,
                    value.toString(),
                    new IllegalArgumentException("Telemetry value " + field.reportKey() + " is not numeric")));
            return;
        }
        telemetryListener.onTelemetry(new TelemetryReading(field, value.doubleValue()));
    }

    private ObjectNode decode(String topic, byte[] payload, String text) {
        try {
            return codec.decodeRecord(payload);
        } catch (IOException e) {
            sink.onMalformedPayload(new MalformedPayloadEvent(Instant.now(), topic, text, e));
            return JsonNodeFactory.instance.objectNode();
        }
    }
}
