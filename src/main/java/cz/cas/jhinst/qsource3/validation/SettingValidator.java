package cz.cas.jhinst.qsource3.validation;

import cz.cas.jhinst.qsource3.api.CalibrationPoint;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.ValidationFailure;
import cz.cas.jhinst.qsource3.api.ValidationFailure.Kind;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SettingValidator
 * -----------------------------------------------------------------------------
 * Stateless validation and normalization, one rule per setting.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>mass range: an integral number in {0, 1, 2}</li>
 *   <li>m/z: a finite number, at least 0</li>
 *   <li>DC offset: any finite number</li>
 *   <li>DC on, rod polarity: a boolean</li>
 *   <li>calibration curves: a sequence whose every element is a pair of
 *       finite numbers, given either as {@link CalibrationPoint} or as a
 *       two-element list or array</li>
 * </ul>
 *
 * Booleans are never accepted as numbers. Calibration curves are checked for
 * shape only: neither ordering of x nor value ranges are constrained.
 *
 * <h2>Normalization</h2>
 * A valid candidate is returned in the canonical form listed on
 * {@link cz.cas.jhinst.qsource3.api.SettingsSnapshot}, so that values coming
 * from JSON ({@code Integer}, {@code Long}, {@code Double}, nested lists) and
 * from typed callers end up identical in the mirror.
 */
public final class SettingValidator
{
    private SettingValidator() {
    }

    public static ValidationResult validate(SettingField field, Object candidate) {
        Objects.requireNonNull(field, "field");
        return switch (field) {
            case MASS_RANGE -> massRange(candidate);
            case MZ -> mz(candidate);
            case DC_OFFSET -> dcOffset(candidate);
            case DC_ON, ROD_POLARITY_POSITIVE -> flag(field, candidate);
            case CALIB_POINTS_MZ, CALIB_POINTS_RESOLUTION -> calibrationPoints(field, candidate);
        };
    }

    public static ValidationResult massRange(Object candidate) {
        if (!(candidate instanceof Number n)) {
            return invalid(SettingField.MASS_RANGE, Kind.WRONG_TYPE, candidate, "Must be a number");
        }
        double d = n.doubleValue();
        if (d != 0 && d != 1 && d != 2) {
            return invalid(SettingField.MASS_RANGE, Kind.OUT_OF_RANGE, candidate, "Must be 0, 1, or 2");
        }
        return new ValidationResult.Valid((int) d);
    }

    public static ValidationResult mz(Object candidate) {
        if (!(candidate instanceof Number n)) {
            return invalid(SettingField.MZ, Kind.WRONG_TYPE, candidate, "Must be a number");
        }
        double d = n.doubleValue();
        if (!Double.isFinite(d) || d < 0) {
            return invalid(SettingField.MZ, Kind.OUT_OF_RANGE, candidate, "Must be a non-negative number");
        }
        return new ValidationResult.Valid(d);
    }

    public static ValidationResult dcOffset(Object candidate) {
        if (!(candidate instanceof Number n)) {
            return invalid(SettingField.DC_OFFSET, Kind.WRONG_TYPE, candidate, "Must be a number");
        }
        double d = n.doubleValue();
        if (!Double.isFinite(d)) {
            return invalid(SettingField.DC_OFFSET, Kind.OUT_OF_RANGE, candidate, "Must be a finite number");
        }
        return new ValidationResult.Valid(d);
    }

    public static ValidationResult dcOn(Object candidate) {
        return flag(SettingField.DC_ON, candidate);
    }

    public static ValidationResult rodPolarityPositive(Object candidate) {
        return flag(SettingField.ROD_POLARITY_POSITIVE, candidate);
    }

    public static ValidationResult calibrationPoints(SettingField field, Object candidate) {
        if (!field.isCalibrationCurve()) {
            throw new IllegalArgumentException(field + " is not a calibration curve");
        }
        List<?> elements = asList(candidate);
        if (elements == null) {
            return invalid(field, Kind.MALFORMED_SHAPE, candidate, "Must be a list of number pairs");
        }

        List<CalibrationPoint> points = new ArrayList<>(elements.size());
        for (Object element : elements) {
            CalibrationPoint point = toPoint(element);
            if (point == null) {
                return invalid(field, Kind.MALFORMED_SHAPE, candidate,
                        "Must be a list of number pairs, offending element: " + describe(element));
            }
            points.add(point);
        }
        return new ValidationResult.Valid(Collections.unmodifiableList(points));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static ValidationResult flag(SettingField field, Object candidate) {
        if (!(candidate instanceof Boolean b)) {
            return invalid(field, Kind.WRONG_TYPE, candidate, "Must be a boolean");
        }
        return new ValidationResult.Valid(b);
    }

    private static CalibrationPoint toPoint(Object element) {
        if (element instanceof CalibrationPoint p) {
            return Double.isFinite(p.x()) && Double.isFinite(p.y()) ? p : null;
        }
        List<?> pair = asList(element);
        if (pair == null || pair.size() != 2) {
            return null;
        }
        if (!(pair.get(0) instanceof Number x) || !(pair.get(1) instanceof Number y)) {
            return null;
        }
        if (!Double.isFinite(x.doubleValue()) || !Double.isFinite(y.doubleValue())) {
            return null;
        }
        return new CalibrationPoint(x.doubleValue(), y.doubleValue());
    }

    /**
     * Views lists and arrays (including primitive arrays) as a list, or
     * returns {@code null} for anything else.
     */
    private static List<?> asList(Object candidate) {
        if (candidate instanceof List<?> list) {
            return list;
        }
        if (candidate != null && candidate.getClass().isArray()) {
            int length = Array.getLength(candidate);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(Array.get(candidate, i));
            }
            return copy;
        }
        return null;
    }

    private static String describe(Object value) {
        List<?> list = asList(value);
        return list != null ? list.toString() : String.valueOf(value);
    }

    private static ValidationResult invalid(SettingField field, Kind kind, Object candidate, String rule) {
        String message = "Invalid " + field.snapshotKey() + " value " + describe(candidate) + ". " + rule + ".";
        return new ValidationResult.Invalid(new ValidationFailure(field, kind, candidate, message));
    }
}
