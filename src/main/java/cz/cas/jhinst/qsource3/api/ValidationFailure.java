package cz.cas.jhinst.qsource3.api;

import java.util.Objects;

/**
 * ValidationFailure
 * -----------------------------------------------------------------------------
 * Classified reason a candidate value was refused for a setting.
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>{@link Kind#WRONG_TYPE}: the value is not of the setting's type
 *       (e.g. a string where a number is expected)</li>
 *   <li>{@link Kind#OUT_OF_RANGE}: the type is right, the value is not
 *       (e.g. a negative m/z or a mass range of 3)</li>
 *   <li>{@link Kind#MALFORMED_SHAPE}: a calibration curve is not a sequence
 *       of numeric pairs</li>
 * </ul>
 *
 * @param field         the setting being validated
 * @param kind          failure classification
 * @param rejectedValue the candidate as received; may be {@code null}
 * @param message       human-readable explanation
 */
public record ValidationFailure(
        SettingField field,
        Kind kind,
        Object rejectedValue,
        String message
) {
    public enum Kind {
        WRONG_TYPE,
        OUT_OF_RANGE,
        MALFORMED_SHAPE
    }

    public ValidationFailure {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return field.snapshotKey() + " " + kind + ": " + message;
    }
}
