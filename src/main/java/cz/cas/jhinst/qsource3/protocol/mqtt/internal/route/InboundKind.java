package cz.cas.jhinst.qsource3.protocol.mqtt.internal.route;

/**
 * Classification of an inbound topic.
 */
public enum InboundKind
{
    DEVICE_CONNECTED,
    DEVICE_ERROR,
    STATE_REPORT,
    FIELD_REPORT,
    TELEMETRY_REPORT,
    IGNORED
}
