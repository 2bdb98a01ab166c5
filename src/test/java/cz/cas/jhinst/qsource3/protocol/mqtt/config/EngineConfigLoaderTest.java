package cz.cas.jhinst.qsource3.protocol.mqtt.config;

import cz.cas.jhinst.qsource3.api.SettingField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EngineConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void fullConfigurationIsRead() throws Exception {
        EngineConfig config = EngineConfigLoader.load(resource("/engine-config.yaml"));

        assertEquals("broker.lab.local", config.brokerHost());
        assertEquals(1884, config.brokerPort());
        assertEquals(30, config.connectTimeoutSeconds());
        assertEquals(15, config.keepAliveSeconds());
        assertEquals("qsource3-test", config.clientId());
        assertEquals("operator", config.username());
        assertEquals("secret", config.password());
        assertEquals("lab", config.topicBase());
        assertEquals("qs3-a", config.deviceName());
        assertEquals(List.of("Low", "Mid", "High"), config.massRangeLabels());
        assertEquals(List.of(SettingField.CALIB_POINTS_MZ, SettingField.CALIB_POINTS_RESOLUTION), config.resyncFields());
        assertFalse(config.pushLoadedSettings());
    }

    @Test
    void minimalConfigurationGetsDefaults() throws Exception {
        Path file = write("""
                mqtt_broker: localhost
                mqtt_port: 1883
                mqtt_connection_timeout: 45
                topic_base: jhinst
                device_name: qsource3
                mass_ranges: [a, b, c]
                """);

        EngineConfig config = EngineConfigLoader.load(file);

        assertEquals(45, config.keepAliveSeconds());
        assertNull(config.username());
        assertTrue(config.clientId().startsWith("qsource3-"));
        assertEquals(EngineConfig.DEFAULT_RESYNC_FIELDS, config.resyncFields());
        assertTrue(config.pushLoadedSettings());
    }

    @Test
    void missingRequiredKeyIsNamed() throws Exception {
        Path file = write("""
                mqtt_broker: localhost
                mqtt_port: 1883
                mqtt_connection_timeout: 60
                device_name: qsource3
                mass_ranges: [a, b, c]
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EngineConfigLoader.load(file));

        assertTrue(e.getMessage().contains("topic_base"), e.getMessage());
    }

    @Test
    void unknownResyncFieldIsRejected() throws Exception {
        Path file = write("""
                mqtt_broker: localhost
                mqtt_port: 1883
                mqtt_connection_timeout: 60
                topic_base: jhinst
                device_name: qsource3
                mass_ranges: [a, b, c]
                resync_fields: [dc_offset, frequency]
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EngineConfigLoader.load(file));

        assertTrue(e.getMessage().contains("frequency"), e.getMessage());
    }

    @Test
    void nonIntegerPortIsRejected() throws Exception {
        Path file = write("""
                mqtt_broker: localhost
                mqtt_port: "eighteen"
                mqtt_connection_timeout: 60
                topic_base: jhinst
                device_name: qsource3
                mass_ranges: [a, b, c]
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EngineConfigLoader.load(file));

        assertTrue(e.getMessage().contains("mqtt_port"), e.getMessage());
    }

    @Test
    void massRangesMustLabelThreeRanges() throws Exception {
        Path file = write("""
                mqtt_broker: localhost
                mqtt_port: 1883
                mqtt_connection_timeout: 60
                topic_base: jhinst
                device_name: qsource3
                mass_ranges: [only-one]
                """);

        assertThrows(IllegalArgumentException.class, () -> EngineConfigLoader.load(file));
    }

    private Path write(String yaml) throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(EngineConfigLoaderTest.class.getResource(name).toURI());
    }
}
