package cz.cas.jhinst.qsource3.protocol.mqtt.internal.route;

import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.TelemetryField;

import java.util.Objects;

/**
 * InboundMessage
 * =============================================================================
 * Semantic view of an inbound topic, before its payload is looked at.
 *
 * <p>Classification depends on the topic only. A message whose payload turns
 * out to be malformed keeps its classification and is routed with an empty
 * record.</p>
 */
public sealed interface InboundMessage
        permits InboundMessage.DeviceConnected,
                InboundMessage.DeviceError,
                InboundMessage.StateReport,
                InboundMessage.FieldReport,
                InboundMessage.TelemetryReport,
                InboundMessage.Ignored
{
    String topic();

    InboundKind kind();

    /** The device (re)attached to the broker; triggers a resync. */
    record DeviceConnected(String topic) implements InboundMessage {
        public DeviceConnected {
            Objects.requireNonNull(topic, "topic");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.DEVICE_CONNECTED;
        }
    }

    /** The device reported an I/O problem with the instrument. */
    record DeviceError(String topic) implements InboundMessage {
        public DeviceError {
            Objects.requireNonNull(topic, "topic");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.DEVICE_ERROR;
        }
    }

    /** Bulk report: flat record of settings and telemetry, any key optional. */
    record StateReport(String topic) implements InboundMessage {
        public StateReport {
            Objects.requireNonNull(topic, "topic");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.STATE_REPORT;
        }
    }

    /** Single-setting echo or confirmation carrying {@code {"value": V}}. */
    record FieldReport(String topic, SettingField field) implements InboundMessage {
        public FieldReport {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(field, "field");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.FIELD_REPORT;
        }
    }

    /** Single telemetry measurement carrying {@code {"value": V}}. */
    record TelemetryReport(String topic, TelemetryField field) implements InboundMessage {
        public TelemetryReport {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(field, "field");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.TELEMETRY_REPORT;
        }
    }

    record Ignored(String topic) implements InboundMessage {
        public Ignored {
            Objects.requireNonNull(topic, "topic");
        }

        @Override
        public InboundKind kind() {
            return InboundKind.IGNORED;
        }
    }
}
