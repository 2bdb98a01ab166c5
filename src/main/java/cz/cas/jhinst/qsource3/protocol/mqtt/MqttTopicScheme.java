package cz.cas.jhinst.qsource3.protocol.mqtt;

import cz.cas.jhinst.qsource3.api.SettingField;

import java.util.List;
import java.util.Objects;

/**
 * MqttTopicScheme
 * =============================================================================
 * Builds every topic the engine publishes to or subscribes to, for one
 * {@code {base}} and one {@code {device}}.
 *
 * <pre>
 *   {base}/cmnd/{device}/{code}        set ({"value": V}) or request ({})
 *   {base}/response/{device}/#         per-field echoes
 *   {base}/connected/{device}          device-connected marker
 *   {base}/error/{device}/#            device error marker
 *   {base}/status/{device}/state       bulk state report
 * </pre>
 *
 * The same command topic is used for "set" and "request current value"; only
 * the payload tells them apart.
 */
public final class MqttTopicScheme
{
    /** Command code of the bulk state request. */
    public static final String STATE_CODE = "state";

    private final String base;
    private final String device;

    public MqttTopicScheme(String base, String device) {
        this.base = requireLevel(base, "base");
        this.device = requireLevel(device, "device");
    }

    public String base() {
        return base;
    }

    public String device() {
        return device;
    }

    public String command(SettingField field) {
        Objects.requireNonNull(field, "field");
        return command(field.commandCode());
    }

    public String stateCommand() {
        return command(STATE_CODE);
    }

    public String responseFilter() {
        return base + "/response/" + device + "/#";
    }

    public String connectedTopic() {
        return base + "/connected/" + device;
    }

    public String errorFilter() {
        return base + "/error/" + device + "/#";
    }

    public String stateReportTopic() {
        return base + "/status/" + device + "/" + STATE_CODE;
    }

    /**
     * The four filters subscribed on every new broker session, in subscription
     * order.
     */
    public List<String> subscriptions() {
        return List.of(responseFilter(), connectedTopic(), errorFilter(), stateReportTopic());
    }

    private String command(String code) {
        return base + "/cmnd/" + device + "/" + code;
    }

    private static String requireLevel(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty() || value.contains("#") || value.contains("+")) {
            throw new IllegalArgumentException(name + " must be a non-empty topic prefix without wildcards: '" + value + "'");
        }
        return value;
    }
}
