package ou.capstone.sexa.value;

import ou.capstone.sexa.format.SexaFormatter;
import ou.capstone.sexa.split.Split60;

/**
 * General purpose angle. Stored in radians; any sign and magnitude.
 */
public final class Angle implements SexagesimalValue {

    private final double rad;

    private Angle(final double rad) {
        this.rad = rad;
    }

    /**
     * Builds an angle from sign, degree, minute and second components.
     * Components are summed without range checks.
     */
    public static Angle fromDms(final boolean negative, final int d, final int m, final double s) {
        return fromDeg(Split60.fromSexa(negative, d, m, s));
    }

    public static Angle fromRad(final double rad) {
        return new Angle(rad);
    }

    public static Angle fromDeg(final double deg) {
        // 180 degrees or pi radians in a half circle
        return new Angle(deg / 180 * Math.PI);
    }

    public static Angle fromMin(final double min) {
        return new Angle(min / 60 / 180 * Math.PI);
    }

    public static Angle fromSec(final double sec) {
        return new Angle(sec / 3600 / 180 * Math.PI);
    }

    /** @return the angle in radians, the underlying representation */
    public double rad() {
        return rad;
    }

    public double deg() {
        return rad * 180 / Math.PI;
    }

    public double min() {
        return rad * 60 * 180 / Math.PI;
    }

    public double sec() {
        return rad * 3600 * 180 / Math.PI;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ANGLE;
    }

    @Override
    public double firstSegment() {
        return deg();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Angle other && Double.compare(rad, other.rad) == 0;
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
