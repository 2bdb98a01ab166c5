package cz.cas.jhinst.qsource3.protocol.mqtt.internal.route;

import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.TelemetryField;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundClassifier
 * =============================================================================
 * Maps an inbound topic to an {@link InboundMessage}.
 *
 * <h2>Precedence</h2>
 * First match wins:
 * <ol>
 *   <li>topic contains {@code /connected/}: device connected</li>
 *   <li>topic contains {@code /error/}: device error</li>
 *   <li>last level is {@code state}: bulk state report</li>
 *   <li>last level names a setting: field report</li>
 *   <li>last level names a telemetry value: telemetry report</li>
 * </ol>
 * Anything else is ignored.
 *
 * Names are compared against the whole last level, never as a suffix, so
 * {@code .../max_mz} is telemetry and not a report for {@code mz}.
 */
public final class InboundClassifier
{
    private static final String CONNECTED_MARKER = "/connected/";
    private static final String ERROR_MARKER = "/error/";
    private static final String STATE_LEVEL = "state";

    public InboundMessage classify(String topic) {
        Objects.requireNonNull(topic, "topic");

        if (topic.contains(CONNECTED_MARKER)) {
            return new InboundMessage.DeviceConnected(topic);
        }
        if (topic.contains(ERROR_MARKER)) {
            return new InboundMessage.DeviceError(topic);
        }

        String last = lastLevel(topic);
        if (STATE_LEVEL.equals(last)) {
            return new InboundMessage.StateReport(topic);
        }

        Optional<SettingField> field = SettingField.fromResponseName(last);
        if (field.isPresent()) {
            return new InboundMessage.FieldReport(topic, field.get());
        }

        Optional<TelemetryField> telemetry = TelemetryField.fromReportKey(last);
        if (telemetry.isPresent()) {
            return new InboundMessage.TelemetryReport(topic, telemetry.get());
        }

        return new InboundMessage.Ignored(topic);
    }

    static String lastLevel(String topic) {
        int slash = topic.lastIndexOf('/');
        return slash < 0 ? topic : topic.substring(slash + 1);
    }
}
