package cz.cas.jhinst.qsource3.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * Read-only measurements reported by the device.
 * <p>
 * Telemetry is transient: it is forwarded to listeners and never stored.
 */
public enum TelemetryField
{
    MAX_MZ("max_mz"),
    FREQUENCY("frequency"),
    RF_AMPLITUDE("rf_amp"),
    DC1("dc1"),
    DC2("dc2"),
    CURRENT("current");

    private final String reportKey;

    TelemetryField(String reportKey) {
        this.reportKey = reportKey;
    }

    /** Key in the bulk state report, also used as a single-field topic level. */
    public String reportKey() {
        return reportKey;
    }

    public static Optional<TelemetryField> fromReportKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.reportKey.equals(key))
                .findFirst();
    }
}
