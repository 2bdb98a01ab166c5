package cz.cas.jhinst.qsource3.protocol.mqtt.config;

import cz.cas.jhinst.qsource3.api.SettingField;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregated configuration for the QSource3 MQTT engine.
 *
 * @param keepAliveSeconds   MQTT keep-alive sent in CONNECT; 0 disables pings
 * @param massRangeLabels    operator labels for mass range 0, 1 and 2
 * @param resyncFields       settings pulled one by one after every resync
 *                           state request
 * @param pushLoadedSettings whether a loaded settings file is sent to the
 *                           device right away
 */
public record EngineConfig(
    String brokerHost,
    int brokerPort,
    int connectTimeoutSeconds,
    int keepAliveSeconds,
    String clientId,
    String username,
    String password,
    String topicBase,
    String deviceName,
    List<String> massRangeLabels,
    List<SettingField> resyncFields,
    boolean pushLoadedSettings
) {
    public static final int DEFAULT_PORT = 1883;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    public static final List<SettingField> DEFAULT_RESYNC_FIELDS = List.of(
            SettingField.DC_OFFSET,
            SettingField.CALIB_POINTS_MZ,
            SettingField.CALIB_POINTS_RESOLUTION);

    public EngineConfig {
        Objects.requireNonNull(brokerHost, "brokerHost");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(topicBase, "topicBase");
        Objects.requireNonNull(deviceName, "deviceName");
        massRangeLabels = List.copyOf(Objects.requireNonNull(massRangeLabels, "massRangeLabels"));
        resyncFields = List.copyOf(Objects.requireNonNull(resyncFields, "resyncFields"));

        if (brokerPort < 1 || brokerPort > 65535) {
            throw new IllegalArgumentException("brokerPort must be 1-65535: " + brokerPort);
        }
        if (connectTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("connectTimeoutSeconds must be positive: " + connectTimeoutSeconds);
        }
        if (keepAliveSeconds < 0 || keepAliveSeconds > 65535) {
            throw new IllegalArgumentException("keepAliveSeconds must be 0-65535: " + keepAliveSeconds);
        }
        if (massRangeLabels.size() != 3) {
            throw new IllegalArgumentException("Exactly 3 mass range labels required, got " + massRangeLabels.size());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String brokerHost = "localhost";
        private int brokerPort = DEFAULT_PORT;
        private int connectTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int keepAliveSeconds = DEFAULT_TIMEOUT_SECONDS;
        private String clientId;
        private String username;
        private String password;
        private String topicBase;
        private String deviceName;
        private List<String> massRangeLabels = List.of("Range 0", "Range 1", "Range 2");
        private List<SettingField> resyncFields = DEFAULT_RESYNC_FIELDS;
        private boolean pushLoadedSettings = true;

        public Builder withBroker(String host, int port) {
            this.brokerHost = host;
            this.brokerPort = port;
            return this;
        }

        public Builder withConnectTimeoutSeconds(int seconds) {
            this.connectTimeoutSeconds = seconds;
            return this;
        }

        public Builder withKeepAliveSeconds(int seconds) {
            this.keepAliveSeconds = seconds;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder withCredentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder withTopicBase(String topicBase) {
            this.topicBase = topicBase;
            return this;
        }

        public Builder withDeviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder withMassRangeLabels(List<String> labels) {
            this.massRangeLabels = labels;
            return this;
        }

        public Builder withResyncFields(List<SettingField> fields) {
            this.resyncFields = fields;
            return this;
        }

        public Builder withPushLoadedSettings(boolean push) {
            this.pushLoadedSettings = push;
            return this;
        }

        public EngineConfig build() {
            String id = clientId != null
                    ? clientId
                    : "qsource3-" + UUID.randomUUID().toString().substring(0, 8);
            return new EngineConfig(
                    brokerHost,
                    brokerPort,
                    connectTimeoutSeconds,
                    keepAliveSeconds,
                    id,
                    username,
                    password,
                    topicBase,
                    deviceName,
                    massRangeLabels,
                    resyncFields,
                    pushLoadedSettings);
        }
    }
}
