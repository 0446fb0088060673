package ou.capstone.sexa.value;

import ou.capstone.sexa.format.SexaFormatter;

/**
 * A duration or relative time. Stored in seconds; negative values are
 * durations backwards.
 */
public final class Time implements SexagesimalValue {

    private static final double SECONDS_PER_DAY = 3600 * 24;

    private final double sec;

    private Time(final double sec) {
        this.sec = sec;
    }

    /**
     * Builds a time from sign, hour, minute and second components.
     */
    public static Time fromHms(final boolean negative, final int h, final int m, final double s) {
        final double total = (h * 60L + m) * 60L + s;
        return new Time(negative ? -total : total);
    }

    public static Time fromSec(final double sec) {
        return new Time(sec);
    }

    public static Time fromMin(final double min) {
        return new Time(min * 60);
    }

    public static Time fromHour(final double hour) {
        return new Time(hour * 3600);
    }

    public static Time fromDay(final double day) {
        return new Time(day * SECONDS_PER_DAY);
    }

    /** One day of earth rotation is 2π radians. */
    public static Time fromRad(final double rad) {
        return new Time(rad * 3600 * 12 / Math.PI);
    }

    /** @return the time in seconds, the underlying representation */
    public double sec() {
        return sec;
    }

    public double min() {
        return sec / 60;
    }

    public double hour() {
        return sec / 3600;
    }

    public double day() {
        return sec / SECONDS_PER_DAY;
    }

    public double rad() {
        return sec / 3600 / 12 * Math.PI;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.TIME;
    }

    @Override
    public double firstSegment() {
        return hour();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Time other && Double.compare(sec, other.sec) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(sec);
    }

    @Override
    public String toString() {
        return SexaFormatter.DEFAULT.format(this).text();
    }
}
