package cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish;

import cz.cas.jhinst.qsource3.api.RequestResult;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.core.SettingsMirror;
import cz.cas.jhinst.qsource3.protocol.mqtt.MqttTopicScheme;
import cz.cas.jhinst.qsource3.protocol.mqtt.PayloadCodec;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ValidationRejectedEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.MqttEndpoint;
import cz.cas.jhinst.qsource3.validation.ValidationResult;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * CommandPublisher
 * =============================================================================
 * Turns operator intent into command messages.
 *
 * <h2>Set request</h2>
 * <ol>
 *   <li>Reject with {@code NOT_CONNECTED} if the broker session is down</li>
 *   <li>Validate; reject with {@code VALIDATION_FAILURE} on failure</li>
 *   <li>Apply the normalized value to the mirror (optimistic update)</li>
 *   <li>Publish {@code {"value": V}} to the field's command topic</li>
 * </ol>
 * A rejected request leaves the mirror untouched and publishes nothing.
 * Calibration curves are sent whole, as the ordered list of pairs.
 *
 * <h2>Pull request</h2>
 * Publishes {@code {}} to the same command topic. The mirror is not touched;
 * the answer arrives later as a field report.
 *
 * Every operation goes through {@link OutboundGuards}.
 */
public final class CommandPublisher
{
    private final MqttEndpoint endpoint;
    private final MqttTopicScheme topics;
    private final PayloadCodec codec;
    private final SettingsMirror mirror;
    private final BooleanSupplier publishAllowed;
    private final QSourceObservabilitySink sink;

    public CommandPublisher(MqttEndpoint endpoint,
                            MqttTopicScheme topics,
                            PayloadCodec codec,
                            SettingsMirror mirror,
                            BooleanSupplier publishAllowed,
                            QSourceObservabilitySink sink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.publishAllowed = Objects.requireNonNull(publishAllowed, "publishAllowed");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public RequestResult request(SettingField field, Object value) {
        Objects.requireNonNull(field, "field");
        return guarded("request", Arrays.asList(field, value), () -> {
            ValidationResult result = mirror.setIfValid(field, value, UpdateOrigin.OPERATOR);
            if (result instanceof ValidationResult.Invalid invalid) {
                sink.onValidationRejected(new ValidationRejectedEvent(
                        Instant.now(),
                        ValidationRejectedEvent.Direction.OUTBOUND,
                        invalid.failure()));
                return RequestResult.Rejected.invalid(invalid.failure());
            }
            Object stored = ((ValidationResult.Valid) result).value();
            return publish(topics.command(field), codec.encodeValue(stored));
        });
    }

    /**
     * Publishes the value currently held by the mirror without changing it.
     * Used to push a freshly loaded settings file to the device.
     */
    public RequestResult pushCurrent(SettingField field) {
        Objects.requireNonNull(field, "field");
        return guarded("pushCurrent", List.of(field),
                () -> publish(topics.command(field), codec.encodeValue(mirror.get(field))));
    }

    public RequestResult requestCurrentValue(SettingField field) {
        Objects.requireNonNull(field, "field");
        return guarded("requestCurrentValue", List.of(field),
                () -> publish(topics.command(field), codec.encodeRequest()));
    }

    public RequestResult requestDeviceState() {
        return guarded("requestDeviceState", List.of(),
                () -> publish(topics.stateCommand(), codec.encodeRequest()));
    }

    private RequestResult guarded(String operation, List<Object> arguments, OutboundOperation body) {
        OutboundOperation chain = OutboundGuards.logged(sink, operation, arguments,
                OutboundGuards.requireConnected(publishAllowed, operation, body));
        return chain.run();
    }

    private RequestResult publish(String topic, byte[] payload) {
        endpoint.publish(topic, payload);
        return new RequestResult.Accepted(topic, new String(payload, StandardCharsets.UTF_8));
    }
}
