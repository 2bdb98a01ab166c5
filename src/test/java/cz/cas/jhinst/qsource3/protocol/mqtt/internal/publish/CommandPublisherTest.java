package cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish;

import cz.cas.jhinst.qsource3.api.CalibrationPoint;
import cz.cas.jhinst.qsource3.api.RecordingEngineListener;
import cz.cas.jhinst.qsource3.api.RejectionReason;
import cz.cas.jhinst.qsource3.api.RequestResult;
import cz.cas.jhinst.qsource3.api.SettingChange;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.SettingsSnapshot;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.api.ValidationFailure;
import cz.cas.jhinst.qsource3.core.SettingsMirror;
import cz.cas.jhinst.qsource3.protocol.mqtt.MqttTopicScheme;
import cz.cas.jhinst.qsource3.protocol.mqtt.PayloadCodec;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.OutboundCallEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.RecordingObservabilitySink;
import cz.cas.jhinst.qsource3.protocol.mqtt.observability.ValidationRejectedEvent;
import cz.cas.jhinst.qsource3.protocol.mqtt.transport.FakeMqttEndpoint;
import cz.cas.jhinst.qsource3.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CommandPublisherTest {

    private final FakeMqttEndpoint endpoint = new FakeMqttEndpoint();
    private final RecordingEngineListener listener = new RecordingEngineListener();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final SettingsMirror mirror = new SettingsMirror(listener);

    private final CommandPublisher publisher = new CommandPublisher(
            endpoint,
            new MqttTopicScheme("lab", "qs3"),
            new PayloadCodec(Jsons.mapper()),
            mirror,
            endpoint::isConnected,
            sink);

    @BeforeEach
    void connect() {
        endpoint.start();
    }

    @Test
    void acceptedRequestUpdatesMirrorThenPublishesValue() {
        RequestResult result = publisher.request(SettingField.MZ, 2000);

        assertEquals(new RequestResult.Accepted("lab/cmnd/qs3/mz", "{\"value\":2000.0}"), result);
        assertEquals(2000.0, mirror.get(SettingField.MZ));
        assertEquals(List.of(new SettingChange(SettingField.MZ, 2000.0, UpdateOrigin.OPERATOR)), listener.changes());
        assertEquals(1, endpoint.published().size());
        assertEquals("{\"value\":2000.0}", endpoint.published().get(0).payloadText());
    }

    @Test
    void zeroMzIsAccepted() {
        assertTrue(publisher.request(SettingField.MZ, 0).isAccepted());
    }

    @Test
    void eachFieldIsPublishedToItsCommandCode() {
        publisher.request(SettingField.MASS_RANGE, 1);
        publisher.request(SettingField.DC_OFFSET, -2.5);
        publisher.request(SettingField.DC_ON, false);
        publisher.request(SettingField.ROD_POLARITY_POSITIVE, true);

        assertEquals(List.of(
                "lab/cmnd/qs3/range",
                "lab/cmnd/qs3/dc_offst",
                "lab/cmnd/qs3/is_dc_on",
                "lab/cmnd/qs3/is_rod_polarity_positive"), endpoint.publishedTopics());
        assertEquals("{\"value\":1}", endpoint.published().get(0).payloadText());
        assertEquals("{\"value\":false}", endpoint.published().get(2).payloadText());
    }

    @Test
    void calibrationCurveIsPublishedWholeAndInOrder() {
        RequestResult result = publisher.request(SettingField.CALIB_POINTS_MZ, List.of(List.of(3, 4), List.of(1, 2)));

        RequestResult.Accepted accepted = assertInstanceOf(RequestResult.Accepted.class, result);
        assertEquals("lab/cmnd/qs3/calib_pnts_rf", accepted.topic());
        assertEquals("{\"value\":[[3.0,4.0],[1.0,2.0]]}", accepted.payload());
        assertEquals(List.of(CalibrationPoint.of(3, 4), CalibrationPoint.of(1, 2)),
                mirror.get(SettingField.CALIB_POINTS_MZ));
    }

    @Test
    void invalidMassRangeIsRejectedWithoutMutationOrPublish() {
        for (Object bad : new Object[] {-1, 3, 2.5, "1"}) {
            RequestResult result = publisher.request(SettingField.MASS_RANGE, bad);

            RequestResult.Rejected rejected = assertInstanceOf(RequestResult.Rejected.class, result);
            assertEquals(RejectionReason.VALIDATION_FAILURE, rejected.reason());
            assertEquals(SettingField.MASS_RANGE, rejected.failure().orElseThrow().field());
        }

        assertEquals(0, mirror.get(SettingField.MASS_RANGE));
        assertTrue(listener.changes().isEmpty());
        assertTrue(endpoint.published().isEmpty());
        assertEquals(4, sink.eventsOfType(ValidationRejectedEvent.class).size());
    }

    @Test
    void negativeMzIsRejected() {
        RequestResult result = publisher.request(SettingField.MZ, -1);

        RequestResult.Rejected rejected = assertInstanceOf(RequestResult.Rejected.class, result);
        assertEquals(ValidationFailure.Kind.OUT_OF_RANGE, rejected.failure().orElseThrow().kind());
        assertTrue(endpoint.published().isEmpty());
    }

    @Test
    void malformedCalibrationCurveIsRejected() {
        RequestResult result = publisher.request(SettingField.CALIB_POINTS_RESOLUTION,
                List.of(List.of(1, 2), List.of("a", 3)));

        RequestResult.Rejected rejected = assertInstanceOf(RequestResult.Rejected.class, result);
        assertEquals(ValidationFailure.Kind.MALFORMED_SHAPE, rejected.failure().orElseThrow().kind());
        assertEquals(SettingsSnapshot.defaults(), mirror.snapshot());
    }

    @Test
    void requestWhileDisconnectedIsRejectedBeforeValidation() {
        // GIVEN: a known mirror value and a dropped session
        publisher.request(SettingField.MZ, 10);
        endpoint.dropSession(null);
        endpoint.clear();
        listener.clear();

        // WHEN: both a valid and an invalid request are attempted
        RequestResult valid = publisher.request(SettingField.MZ, 20);
        RequestResult invalid = publisher.request(SettingField.MZ, -20);

        // THEN: both are NOT_CONNECTED, the mirror is untouched and nothing was sent
        for (RequestResult result : List.of(valid, invalid)) {
            RequestResult.Rejected rejected = assertInstanceOf(RequestResult.Rejected.class, result);
            assertEquals(RejectionReason.NOT_CONNECTED, rejected.reason());
            assertTrue(rejected.failure().isEmpty());
        }
        assertEquals(10.0, mirror.get(SettingField.MZ));
        assertTrue(listener.changes().isEmpty());
        assertTrue(endpoint.published().isEmpty());
        assertFalse(sink.hasEventOfType(ValidationRejectedEvent.class));
    }

    @Test
    void pullRequestsPublishEmptyRecordAndLeaveMirrorAlone() {
        RequestResult field = publisher.requestCurrentValue(SettingField.CALIB_POINTS_RESOLUTION);
        RequestResult state = publisher.requestDeviceState();

        assertEquals(new RequestResult.Accepted("lab/cmnd/qs3/calib_pnts_dc", "{}"), field);
        assertEquals(new RequestResult.Accepted("lab/cmnd/qs3/state", "{}"), state);
        assertTrue(listener.changes().isEmpty());
    }

    @Test
    void pushCurrentPublishesMirroredValueWithoutNotifying() {
        mirror.setIfValid(SettingField.DC_OFFSET, 4.25, UpdateOrigin.SNAPSHOT);
        listener.clear();

        RequestResult result = publisher.pushCurrent(SettingField.DC_OFFSET);

        assertEquals(new RequestResult.Accepted("lab/cmnd/qs3/dc_offst", "{\"value\":4.25}"), result);
        assertTrue(listener.changes().isEmpty());
    }

    @Test
    void everyOperationIsReportedWithItsOutcome() {
        publisher.request(SettingField.MZ, 5);
        publisher.request(SettingField.MZ, -5);
        publisher.requestDeviceState();

        List<OutboundCallEvent> calls = sink.eventsOfType(OutboundCallEvent.class);
        assertEquals(List.of("request", "request", "requestDeviceState"),
                calls.stream().map(OutboundCallEvent::operation).toList());
        assertEquals(List.of(SettingField.MZ, 5), calls.get(0).arguments());
        assertTrue(calls.get(0).result().isAccepted());
        assertFalse(calls.get(1).result().isAccepted());
    }
}
