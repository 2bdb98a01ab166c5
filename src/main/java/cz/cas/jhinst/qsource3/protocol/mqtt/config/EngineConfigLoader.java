package cz.cas.jhinst.qsource3.protocol.mqtt.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import cz.cas.jhinst.qsource3.api.SettingField;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@link EngineConfig} from a YAML file.
 *
 * <pre>
 * mqtt_broker: localhost
 * mqtt_port: 1883
 * mqtt_connection_timeout: 60
 * topic_base: jhinst
 * device_name: qsource3
 * mass_ranges: ["Range 1 (m/z 0-100)", "Range 2 (m/z 0-500)", "Range 3 (m/z 0-1000)"]
 *
 * # optional
 * mqtt_keepalive: 60            # defaults to mqtt_connection_timeout
 * mqtt_client_id: qsource3-gui
 * mqtt_username: operator
 * mqtt_password: secret
 * resync_fields: [dc_offset, calib_points_mz, calib_points_resolution]
 * push_loaded_settings: true
 * </pre>
 *
 * A missing required key or a value of the wrong type fails with an
 * {@link IllegalArgumentException} naming the key.
 */
public final class EngineConfigLoader
{
    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();

    private EngineConfigLoader() {
    }

    public static EngineConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");

        JsonNode root = YAML_MAPPER.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration " + file + " is not a YAML mapping");
        }
        return fromTree(root);
    }

    static EngineConfig fromTree(JsonNode root) {
        int timeout = requiredInt(root, "mqtt_connection_timeout");

        EngineConfig.Builder builder = EngineConfig.builder()
                .withBroker(requiredText(root, "mqtt_broker"), requiredInt(root, "mqtt_port"))
                .withConnectTimeoutSeconds(timeout)
                .withKeepAliveSeconds(root.has("mqtt_keepalive") ? requiredInt(root, "mqtt_keepalive") : timeout)
                .withTopicBase(requiredText(root, "topic_base"))
                .withDeviceName(requiredText(root, "device_name"))
                .withMassRangeLabels(textList(root, "mass_ranges"));

        if (root.has("mqtt_client_id")) {
            builder.withClientId(requiredText(root, "mqtt_client_id"));
        }
        if (root.has("mqtt_username")) {
            builder.withCredentials(
                    requiredText(root, "mqtt_username"),
                    root.has("mqtt_password") ? requiredText(root, "mqtt_password") : null);
        }
        if (root.has("resync_fields")) {
            builder.withResyncFields(resyncFields(root));
        }
        if (root.has("push_loaded_settings")) {
            JsonNode push = root.get("push_loaded_settings");
            if (!push.isBoolean()) {
                throw new IllegalArgumentException("push_loaded_settings must be true or false");
            }
            builder.withPushLoadedSettings(push.booleanValue());
        }
        return builder.build();
    }

    private static List<SettingField> resyncFields(JsonNode root) {
        List<SettingField> fields = new ArrayList<>();
        for (String key : textList(root, "resync_fields")) {
            fields.add(SettingField.fromSnapshotKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("resync_fields: unknown setting '" + key + "'")));
        }
        return fields;
    }

    private static JsonNode required(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing configuration key: " + key);
        }
        return node;
    }

    private static String requiredText(JsonNode root, String key) {
        JsonNode node = required(root, key);
        if (!node.isValueNode() || node.asText().isEmpty()) {
            throw new IllegalArgumentException(key + " must be a non-empty string");
        }
        return node.asText();
    }

    private static int requiredInt(JsonNode root, String key) {
        JsonNode node = required(root, key);
        if (!node.isIntegralNumber()) {
            throw new IllegalArgumentException(key + " must be an integer, got " + node);
        }
        return node.intValue();
    }

    private static List<String> textList(JsonNode root, String key) {
        JsonNode node = required(root, key);
        if (!node.isArray()) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }
}
