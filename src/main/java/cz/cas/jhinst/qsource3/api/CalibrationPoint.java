package cz.cas.jhinst.qsource3.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One (x, y) point of a calibration curve.
 * <p>
 * Points are kept in the order the operator or the device supplied them. No
 * monotonicity or range constraint is applied.
 * <p>
 * On the wire and in settings files a point is a two-element array {@code [x, y]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y"})
public record CalibrationPoint(double x, double y)
{
    public static CalibrationPoint of(double x, double y) {
        return new CalibrationPoint(x, y);
    }
}
