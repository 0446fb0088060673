package ou.capstone.sexa.value;

import ou.capstone.sexa.format.SexaFormatter;
import ou.capstone.sexa.split.Split60;

/**
 * Angle of earth rotation expressed in time; one hour is 15 degrees.
 * Stored in radians; any sign and magnitude.
 */
public final class HourAngle implements SexagesimalValue {

    private final double rad;

    private HourAngle(final double rad) {
        this.rad = rad;
    }

    /**
     * Builds an hour angle from sign, hour, minute and second components.
     */
    public static HourAngle fromHms(final boolean negative, final int h, final int m, final double s) {
        return fromHour(Split60.fromSexa(negative, h, m, s));
    }

    public static HourAngle fromRad(final double rad) {
        return new HourAngle(rad);
    }

    public static HourAngle fromHour(final double hour) {
        // 12 hours or pi radians in a half revolution
        return new HourAngle(hour / 12 * Math.PI);
    }

    public static HourAngle fromMin(final double min) {
        return new HourAngle(min / 60 / 12 * Math.PI);
    }

    public static HourAngle fromSec(final double sec) {
        return new HourAngle(sec / 3600 / 12 * Math.PI);
    }

    public double rad() {
        return rad;
    }

    public double hour() {
        return rad * 12 / Math.PI;
    }

    public double min() {
        return rad * 60 * 12 / Math.PI;
    }

    public double sec() {
        return rad * 3600 * 12 / Math.PI;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.HOUR_ANGLE;
    }

    @Override
    public double firstSegment() {
        return hour();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof HourAngle other && Double.compare(rad, other.rad) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(rad);
    }

    @Override
    public String toString() {
        return SexaFormatter.DEFAULT.format(this).text();
    }
}
