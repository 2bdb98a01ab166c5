package cz.cas.jhinst.qsource3.api;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * SettingField
 * -----------------------------------------------------------------------------
 * The seven operator-controllable, persisted settings of a QSource3 device.
 *
 * <h2>Naming</h2>
 * A single setting is known under several names depending on where it appears:
 * <ul>
 *   <li>{@link #snapshotKey()}: the key used in persisted settings files</li>
 *   <li>{@link #commandCode()}: the last topic level of the command address,
 *       used for both "set" and "request current value"</li>
 *   <li>{@link #stateReportKey()}: the key in the bulk state report, if the
 *       device includes the setting there at all</li>
 *   <li>{@link #responseNames()}: every last topic level under which the
 *       device may echo the setting on its response stream</li>
 * </ul>
 *
 * The calibration curves are never part of the bulk state report; they have
 * to be pulled individually after a reconnect.
 */
public enum SettingField
{
    MASS_RANGE("mass_range", "range", "range"),
    MZ("mz", "mz", "mz"),
    DC_OFFSET("dc_offset", "dc_offst", "dc_offst"),
    DC_ON("dc_on", "is_dc_on", "is_dc_on"),
    ROD_POLARITY_POSITIVE("rod_polarity_positive", "is_rod_polarity_positive", "is_rod_polarity_positive"),
    CALIB_POINTS_MZ("calib_points_mz", "calib_pnts_rf", null),
    CALIB_POINTS_RESOLUTION("calib_points_resolution", "calib_pnts_dc", null);

    private final String snapshotKey;
    private final String commandCode;
    private final String stateReportKey;

    SettingField(String snapshotKey, String commandCode, String stateReportKey) {
        this.snapshotKey = snapshotKey;
        this.commandCode = commandCode;
        this.stateReportKey = stateReportKey;
    }

    public String snapshotKey() {
        return snapshotKey;
    }

    public String commandCode() {
        return commandCode;
    }

    public Optional<String> stateReportKey() {
        return Optional.ofNullable(stateReportKey);
    }

    /**
     * Names accepted as the last topic level of a single-field report.
     * The command code comes first, followed by the long name when it differs.
     */
    public List<String> responseNames() {
        if (commandCode.equals(snapshotKey)) {
            return List.of(commandCode);
        }
        return List.of(commandCode, snapshotKey);
    }

    public boolean isCalibrationCurve() {
        return this == CALIB_POINTS_MZ || this == CALIB_POINTS_RESOLUTION;
    }

    public static Optional<SettingField> fromSnapshotKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.snapshotKey.equals(key))
                .findFirst();
    }

    public static Optional<SettingField> fromResponseName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.responseNames().contains(name))
                .findFirst();
    }
}
