package cz.cas.jhinst.qsource3.protocol.mqtt.internal.connection;

import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish.CommandPublisher;

import java.util.List;
import java.util.Objects;

/**
 * The fixed request sequence that rebuilds the mirror from the device.
 * <p>
 * One run publishes a bulk state request followed by one pull per configured
 * field, each exactly once, in list order. Runs are never merged: two
 * triggers produce two full sequences. The field list is configuration; it is
 * not derived from what the state report happens to contain.
 */
public final class ResyncSequence implements Runnable
{
    private final CommandPublisher publisher;
    private final List<SettingField> pulledFields;

    public ResyncSequence(CommandPublisher publisher, List<SettingField> pulledFields) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.pulledFields = List.copyOf(pulledFields);
    }

    @Override
    public void run() {
        publisher.requestDeviceState();
        for (SettingField field : pulledFields) {
            publisher.requestCurrentValue(field);
        }
    }
}
