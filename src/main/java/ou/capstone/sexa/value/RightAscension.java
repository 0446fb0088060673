package ou.capstone.sexa.value;

import ou.capstone.sexa.format.SexaFormatter;
import ou.capstone.sexa.split.Split60;

/**
 * Right ascension, stored in radians and always wrapped to [0, 2π),
 * that is [0, 24) hours. NaN and infinities are stored unchanged.
 */
public final class RightAscension implements SexagesimalValue {

    private static final double FULL_CIRCLE = 2 * Math.PI;

    private final double rad;

    private RightAscension(final double rad) {
        // non-finite input is kept so formatting can report it
        this.rad = Double.isFinite(rad) ? Split60.pmod(rad, FULL_CIRCLE) : rad;
    }

    /**
     * Builds a right ascension from hour, minute and second components.
     * There is no sign; values of 24 hours or more wrap around.
     */
    public static RightAscension fromHms(final int h, final int m, final double s) {
        return fromHour(Split60.fromSexa(false, h, m, s));
    }

    public static RightAscension fromRad(final double rad) {
        return new RightAscension(rad);
    }

    public static RightAscension fromDeg(final double deg) {
        return new RightAscension(deg / 180 * Math.PI);
    }

    public static RightAscension fromHour(final double hour) {
        return new RightAscension(hour / 12 * Math.PI);
    }

    public static RightAscension fromMin(final double min) {
        return new RightAscension(min / 60 / 12 * Math.PI);
    }

    public static RightAscension fromSec(final double sec) {
        return new RightAscension(sec / 3600 / 12 * Math.PI);
    }

    /**
     * Returns this right ascension moved by an hour angle, wrapped into range.
     */
    public RightAscension add(final HourAngle h) {
        return new RightAscension(rad + h.rad());
    }

    public double rad() {
        return rad;
    }

    public double deg() {
        return rad * 180 / Math.PI;
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
        return ValueKind.RIGHT_ASCENSION;
    }

    @Override
    public double firstSegment() {
        final double h = hour();
        return Double.isFinite(h) ? Split60.pmod(h, 24) : h;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof RightAscension other && Double.compare(rad, other.rad) == 0;
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
