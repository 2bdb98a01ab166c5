package cz.cas.jhinst.qsource3.api;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SettingsSnapshot
 * -----------------------------------------------------------------------------
 * Immutable, fully materialized copy of all seven device settings.
 *
 * <h2>Value representation</h2>
 * Each setting has exactly one canonical Java representation, which is also
 * what {@link #get(SettingField)} returns and what listeners receive:
 * <ul>
 *   <li>{@link SettingField#MASS_RANGE}: {@link Integer}</li>
 *   <li>{@link SettingField#MZ}, {@link SettingField#DC_OFFSET}: {@link Double}</li>
 *   <li>{@link SettingField#DC_ON}, {@link SettingField#ROD_POLARITY_POSITIVE}: {@link Boolean}</li>
 *   <li>calibration curves: unmodifiable {@code List<CalibrationPoint>}</li>
 * </ul>
 *
 * A snapshot carries no validation of its own; it is produced by the settings
 * mirror, which only ever holds values that passed validation.
 */
public record SettingsSnapshot(
        int massRange,
        double mz,
        double dcOffset,
        boolean dcOn,
        boolean rodPolarityPositive,
        List<CalibrationPoint> calibPointsMz,
        List<CalibrationPoint> calibPointsResolution
) {
    public SettingsSnapshot {
        calibPointsMz = List.copyOf(Objects.requireNonNull(calibPointsMz, "calibPointsMz"));
        calibPointsResolution = List.copyOf(Objects.requireNonNull(calibPointsResolution, "calibPointsResolution"));
    }

    /**
     * Engine start-up values: range 0, m/z 0, no DC offset, DC on, positive rod
     * polarity and single-point {@code (0, 0)} calibration curves.
     */
    public static SettingsSnapshot defaults() {
        return new SettingsSnapshot(
                0,
                0.0,
                0.0,
                true,
                true,
                List.of(CalibrationPoint.of(0, 0)),
                List.of(CalibrationPoint.of(0, 0))
        );
    }

    public Object get(SettingField field) {
        Objects.requireNonNull(field, "field");
        return switch (field) {
            case MASS_RANGE -> massRange;
            case MZ -> mz;
            case DC_OFFSET -> dcOffset;
            case DC_ON -> dcOn;
            case ROD_POLARITY_POSITIVE -> rodPolarityPositive;
            case CALIB_POINTS_MZ -> calibPointsMz;
            case CALIB_POINTS_RESOLUTION -> calibPointsResolution;
        };
    }

    /**
     * Returns all settings keyed by field, in declaration order.
     */
    public Map<SettingField, Object> asMap() {
        Map<SettingField, Object> values = new EnumMap<>(SettingField.class);
        for (SettingField field : SettingField.values()) {
            values.put(field, get(field));
        }
        return values;
    }

    /**
     * Builds a snapshot from canonical values, one per field.
     *
     * @throws IllegalArgumentException if a field is missing or its value is
     *                                  not in canonical form
     */
    @SuppressWarnings("unchecked")
    public static SettingsSnapshot fromMap(Map<SettingField, ?> values) {
        Objects.requireNonNull(values, "values");
        for (SettingField field : SettingField.values()) {
            if (values.get(field) == null) {
                throw new IllegalArgumentException("Missing value for " + field);
            }
        }
        try {
            return new SettingsSnapshot(
                    (Integer) values.get(SettingField.MASS_RANGE),
                    (Double) values.get(SettingField.MZ),
                    (Double) values.get(SettingField.DC_OFFSET),
                    (Boolean) values.get(SettingField.DC_ON),
                    (Boolean) values.get(SettingField.ROD_POLARITY_POSITIVE),
                    (List<CalibrationPoint>) values.get(SettingField.CALIB_POINTS_MZ),
                    (List<CalibrationPoint>) values.get(SettingField.CALIB_POINTS_RESOLUTION)
            );
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Settings values are not in canonical form", e);
        }
    }
}
