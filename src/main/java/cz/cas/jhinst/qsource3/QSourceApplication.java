package cz.cas.jhinst.qsource3;

import cz.cas.jhinst.qsource3.api.ConnectionState;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;
import cz.cas.jhinst.qsource3.api.SettingChange;
import cz.cas.jhinst.qsource3.api.TelemetryReading;
import cz.cas.jhinst.qsource3.protocol.mqtt.config.EngineConfig;
import cz.cas.jhinst.qsource3.protocol.mqtt.config.EngineConfigLoader;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.Slf4jQSourceObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.runtime.QSourceRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point: connects to the broker, mirrors the device and logs
 * every notification until the JVM is asked to shut down.
 *
 * <pre>
 *   java -jar qsource3-mqtt.jar [config.yaml]
 * </pre>
 */
public final class QSourceApplication
{
    private static final Logger log = LoggerFactory.getLogger(QSourceApplication.class);

    private QSourceApplication() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        Path configFile = Path.of(args.length > 0 ? args[0] : "config.yaml");
        EngineConfig config = EngineConfigLoader.load(configFile);
        log.info("Loaded configuration from {}: broker {}:{}, device {}/{}",
                configFile, config.brokerHost(), config.brokerPort(), config.topicBase(), config.deviceName());

        QSourceRuntime runtime = QSourceRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jQSourceObservabilitySink())
                .build();
        runtime.controller().addListener(new LoggingListener());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            stopped.countDown();
        }, "qsource3-shutdown"));

        runtime.start();
        stopped.await();
    }

    private static final class LoggingListener implements EngineListener
    {
        @Override
        public void onSettingChanged(SettingChange change) {
            log.info("{} = {} ({})", change.field().snapshotKey(), change.value(), change.origin());
        }

        @Override
        public void onTelemetry(TelemetryReading reading) {
            log.debug("{} = {}", reading.field().reportKey(), reading.value());
        }

        @Override
        public void onDeviceStatusChanged(DeviceStatus status) {
            log.info("Device status: {}", status);
        }

        @Override
        public void onConnectionStateChanged(ConnectionState state) {
            log.info("Broker connection: {}", state);
        }
    }
}
