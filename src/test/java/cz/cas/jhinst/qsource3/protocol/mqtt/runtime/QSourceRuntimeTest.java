package cz.cas.jhinst.qsource3.protocol.mqtt.runtime;

import cz.cas.jhinst.qsource3.api.CalibrationPoint;
import cz.cas.jhinst.qsource3.api.ConnectionState;
import cz.cas.jhinst.qsource3.api.DeviceStatus;
import cz.cas.jhinst.qsource3.api.EngineListener;
import cz.cas.jhinst.qsource3.api.QSourceController;
import cz.cas.jhinst.qsource3.api.RecordingEngineListener;
import cz.cas.jhinst.qsource3.api.RejectionReason;
import cz.cas.jhinst.qsource3.api.RequestResult;
import cz.cas.jhinst.qsource3.api.SettingChange;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.SettingsSnapshot;
import cz.cas.jhinst.qsource3.api.SnapshotLoadException;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.api.ValidationFailure;
import cz.cas.jhinst.qsource3.protocol.mqtt.config.EngineConfig;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.QSourceErrorEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.RecordingObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ValidationRejectedEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.FakeMqttEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end engine behavior over an in-memory transport.
 */
final class QSourceRuntimeTest {

    @TempDir
    Path dir;

    private final FakeMqttEndpoint endpoint = new FakeMqttEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RecordingEngineListener listener = new RecordingEngineListener();

    private QSourceRuntime runtime;
    private QSourceController controller;

    @BeforeEach
    void build() {
        runtime = QSourceRuntime.builder()
                .withConfig(EngineConfig.builder()
                        .withTopicBase("jhinst")
                        .withDeviceName("qsource3")
                        .withMassRangeLabels(List.of("Low", "Mid", "High"))
                        .build())
                .withObservabilitySink(sink)
                .withEndpoint(endpoint)
                .build();
        controller = runtime.controller();
        controller.addListener(listener);
    }

    @Test
    void startConnectsSubscribesAndResyncs() {
        runtime.start();

        assertEquals(ConnectionState.CONNECTED, controller.getConnectionState());
        assertEquals(4, endpoint.subscriptions().size());
        assertEquals(List.of(
                "jhinst/cmnd/qsource3/state",
                "jhinst/cmnd/qsource3/dc_offst",
                "jhinst/cmnd/qsource3/calib_pnts_rf",
                "jhinst/cmnd/qsource3/calib_pnts_dc"), endpoint.publishedTopics());
    }

    @Test
    void deviceReportsFlowIntoTheMirror() {
        runtime.start();

        endpoint.injectMessage("jhinst/connected/qsource3", "1");
        endpoint.injectMessage("jhinst/status/qsource3/state", "{\"range\": 2, \"mz\": 800, \"max_mz\": 1000}");
        endpoint.injectMessage("jhinst/response/qsource3/calib_pnts_rf", "{\"value\": [[0, 0], [1000, 1010]]}");

        SettingsSnapshot settings = controller.getSettings();
        assertEquals(DeviceStatus.CONNECTED, controller.getDeviceStatus());
        assertEquals(2, settings.massRange());
        assertEquals(800.0, settings.mz());
        assertEquals(List.of(CalibrationPoint.of(0, 0), CalibrationPoint.of(1000, 1010)), settings.calibPointsMz());
        assertEquals(1, listener.telemetry().size());
    }

    @Test
    void requestWhileNotConnectedLeavesMirrorUnchanged() {
        RequestResult result = controller.request(SettingField.MZ, 100);

        RequestResult.Rejected rejected = assertInstanceOf(RequestResult.Rejected.class, result);
        assertEquals(RejectionReason.NOT_CONNECTED, rejected.reason());
        assertEquals(SettingsSnapshot.defaults(), controller.getSettings());
        assertTrue(endpoint.published().isEmpty());
    }

    @Test
    void operatorRequestAndDeviceEchoAreDistinguishableByOrigin() {
        runtime.start();
        listener.clear();

        controller.request(SettingField.MZ, 250);
        endpoint.injectMessage("jhinst/response/qsource3/mz", "{\"value\": 250}");

        assertEquals(List.of(
                new SettingChange(SettingField.MZ, 250.0, UpdateOrigin.OPERATOR),
                new SettingChange(SettingField.MZ, 250.0, UpdateOrigin.DEVICE)), listener.changes());
    }

    @Test
    void saveThenLoadRestoresSettingsAndPushesThemInOrder() throws Exception {
        // GIVEN: a non-default configuration saved to disk
        runtime.start();
        controller.request(SettingField.MASS_RANGE, 1);
        controller.request(SettingField.MZ, 321.5);
        controller.request(SettingField.DC_ON, false);
        controller.request(SettingField.CALIB_POINTS_RESOLUTION, List.of(List.of(1, 2), List.of(3, 4)));
        SettingsSnapshot saved = controller.getSettings();
        Path file = dir.resolve("settings.json");
        controller.saveSettings(file);

        // AND: the mirror has since moved on
        endpoint.injectMessage("jhinst/response/qsource3/mz", "{\"value\": 5}");
        endpoint.clear();
        listener.clear();

        // WHEN
        controller.loadSettings(file);

        // THEN: the saved snapshot is back, every field notified with SNAPSHOT origin
        assertEquals(saved, controller.getSettings());
        assertEquals(7, listener.changes().size());
        assertTrue(listener.changes().stream().allMatch(c -> c.origin() == UpdateOrigin.SNAPSHOT));

        // AND: all seven fields were pushed to the device in declaration order
        assertEquals(List.of(
                "jhinst/cmnd/qsource3/range",
                "jhinst/cmnd/qsource3/mz",
                "jhinst/cmnd/qsource3/dc_offst",
                "jhinst/cmnd/qsource3/is_dc_on",
                "jhinst/cmnd/qsource3/is_rod_polarity_positive",
                "jhinst/cmnd/qsource3/calib_pnts_rf",
                "jhinst/cmnd/qsource3/calib_pnts_dc"), endpoint.publishedTopics());
        assertEquals("{\"value\":321.5}", endpoint.published().get(1).payloadText());
    }

    @Test
    void loadWhileDisconnectedAppliesWithoutPushing() throws Exception {
        Path file = dir.resolve("settings.json");
        controller.saveSettings(file);

        controller.loadSettings(file);

        assertEquals(SettingsSnapshot.defaults(), controller.getSettings());
        assertTrue(endpoint.published().isEmpty());
    }

    @Test
    void invalidSettingsFileAbortsTheWholeLoad() throws Exception {
        // GIVEN
        Path file = dir.resolve("bad.json");
        Files.writeString(file, """
                {"mass_range": 1, "mz": 250, "dc_offset": 0, "dc_on": true,
                 "rod_polarity_positive": true,
                 "calib_points_mz": [[1, 2], ["a", 3]], "calib_points_resolution": [[0, 0]]}
                """);

        // WHEN
        SnapshotLoadException e = assertThrows(SnapshotLoadException.class, () -> controller.loadSettings(file));

        // THEN
        ValidationFailure failure = e.failure().orElseThrow();
        assertEquals(SettingField.CALIB_POINTS_MZ, failure.field());
        assertEquals(SettingsSnapshot.defaults(), controller.getSettings());
        assertTrue(listener.changes().isEmpty());
        assertTrue(sink.eventsOfType(ValidationRejectedEvent.class).stream()
                .anyMatch(r -> r.direction() == ValidationRejectedEvent.Direction.SNAPSHOT));
    }

    @Test
    void failingListenerDoesNotBreakOthersOrTheEngine() {
        controller.addListener(new EngineListener() {
            @Override
            public void onSettingChanged(SettingChange change) {
                throw new IllegalStateException("listener bug");
            }
        });
        runtime.start();

        RequestResult result = controller.request(SettingField.DC_OFFSET, 1.0);

        assertTrue(result.isAccepted());
        assertEquals(1, listener.changesOf(SettingField.DC_OFFSET).size());
        assertTrue(sink.hasEventOfType(QSourceErrorEvent.class));
    }

    @Test
    void stopDisconnectsAndForgetsDeviceStatus() {
        runtime.start();
        endpoint.injectMessage("jhinst/connected/qsource3", "1");

        runtime.stop();

        assertEquals(ConnectionState.DISCONNECTED, controller.getConnectionState());
        assertEquals(DeviceStatus.UNKNOWN, controller.getDeviceStatus());
        assertEquals(List.of(DeviceStatus.CONNECTED, DeviceStatus.UNKNOWN), listener.deviceStatuses());
    }

    @Test
    void startAfterStopOpensANewSession() {
        runtime.start();
        runtime.stop();

        runtime.start();

        assertEquals(ConnectionState.CONNECTED, controller.getConnectionState());
        assertEquals(2, endpoint.starts());
        assertTrue(controller.requestDeviceState().isAccepted());
    }

    @Test
    void closeReleasesTheEndpoint() {
        runtime.start();

        runtime.close();

        assertEquals(ConnectionState.DISCONNECTED, controller.getConnectionState());
        assertTrue(endpoint.isClosed());
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void massRangeLabelsComeFromConfiguration() {
        assertEquals(List.of("Low", "Mid", "High"), controller.massRangeLabels());
    }

    @Test
    void removedListenerIsNoLongerNotified() {
        runtime.start();
        controller.removeListener(listener);
        listener.clear();

        controller.request(SettingField.MZ, 1);

        assertTrue(listener.changes().isEmpty());
    }
}
