package ou.capstone.sexa.split;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.sexa.exceptions.FormatError;
import ou.capstone.sexa.exceptions.FormatOverflowException;

/**
 * Low-level arithmetic behind sexagesimal formatting.
 *
 * Splits a magnitude into a whole count of sixties and a decimal remainder
 * rounded at a fixed precision, refusing any result whose digits a double
 * can no longer carry exactly.
 */
public final class Split60 {

    /** Largest supported precision; 10^15 is the largest exact power of ten in a double. */
    public static final int MAX_PRECISION = 15;

    /** 52 mantissa bits in a double. */
    private static final double MAX_SIGNIFICANT = (double) (1L << 52);

    private static final double[] TEN_F = {
            1e0, 1e1, 1e2, 1e3, 1e4, 1e5, 1e6, 1e7,
            1e8, 1e9, 1e10, 1e11, 1e12, 1e13, 1e14, 1e15
    };

    private static final long[] TEN_I = {
            1L, 10L, 100L, 1_000L, 10_000L, 100_000L, 1_000_000L, 10_000_000L,
            100_000_000L, 1_000_000_000L, 10_000_000_000L, 100_000_000_000L,
            1_000_000_000_000L, 10_000_000_000_000L, 100_000_000_000_000L,
            1_000_000_000_000_000L
    };

    private Split60() {
        // Prevent instantiation
    }

    /**
     * Splits x at the given precision using "." as the decimal separator.
     *
     * @see #split(double, int, boolean, String)
     */
    public static SplitResult split(final double x, final int precision, final boolean pad)
            throws FormatOverflowException {
        return split(x, precision, pad, ".");
    }

    /**
     * Splits a decimal segment from a number that will be formatted in some
     * sexagesimal notation.
     * <p>
     * The result satisfies {@code quotient * 60 + remainder = |x|}, with the
     * remainder rounded to {@code precision} places and rendered as a string
     * in [0, 60). The remainder always has at least one digit left of the
     * separator, two when {@code pad} is set.
     * <p>
     * The usable precision shrinks as the magnitude grows: about 4.5 units
     * allow 15 places, 3600 allow 12, 1296000 allow 9.
     *
     * @param x         number to split, any sign
     * @param precision digits after the separator, 0 to 15
     * @param pad       zero-pad the remainder to two integer digits
     * @param separator decimal separator placed in the remainder
     * @return the sign, the count of sixties and the formatted remainder
     * @throws FormatOverflowException for NaN, infinities, a precision
     *                                 outside 0..15, or loss of precision
     */
    public static SplitResult split(final double x, final int precision, final boolean pad,
                                    final String separator) throws FormatOverflowException {
        final FormatError nonFinite = FormatError.ofNonFinite(x);
        if (nonFinite != null) {
            throw new FormatOverflowException(nonFinite);
        }
        if (precision < 0 || precision > MAX_PRECISION) {
            throw new FormatOverflowException(FormatError.INVALID_PRECISION);
        }
        final boolean negative = x < 0;
        final long scaled = scaled(Math.abs(x), precision);
        if (scaled < 0) {
            throw new FormatOverflowException(FormatError.LOSS_OF_PRECISION);
        }
        final long p60 = sixtyAt(precision);
        final int digits = pad ? precision + 2 : precision + 1;
        final String remainder = withSeparator(
                StringUtils.leftPad(Long.toString(scaled % p60), digits, '0'), precision, separator);
        return new SplitResult(negative, scaled / p60, remainder);
    }

    /**
     * Returns {@code x} scaled by 10^precision and rounded, or -1 if the
     * rounded value exceeds 2^52 (or x is not a number) so that not all
     * digits would be significant.
     *
     * @param x         non-negative value
     * @param precision 0 to 15
     * @throws IllegalArgumentException if precision is outside 0..15
     */
    public static long scaled(final double x, final int precision) {
        if (precision < 0 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Precision must be 0.." + MAX_PRECISION + ": " + precision);
        }
        final double xs = x * TEN_F[precision] + .5;
        if (!(xs <= MAX_SIGNIFICANT)) {
            return -1;
        }
        return (long) xs;
    }

    /** Returns 60 * 10^precision, one unit of the next larger segment at that precision. */
    public static long sixtyAt(final int precision) {
        return 60 * TEN_I[precision];
    }

    /**
     * Inserts the separator {@code precision} characters from the right of
     * a digit string. Precision 0 leaves the string as it is.
     */
    public static String withSeparator(final String digits, final int precision, final String separator) {
        if (precision <= 0) {
            return digits;
        }
        final int split = digits.length() - precision;
        return digits.substring(0, split) + separator + digits.substring(split);
    }

    /**
     * Combines sexagesimal components into a single value in the unit of
     * the first component.
     * <p>
     * No limits apply to the components; minutes or seconds above 60 fold
     * into the sum. The sum is negated when {@code negative} is set.
     */
    public static double fromSexa(final boolean negative, final int major, final int minor,
                                  final double seconds) {
        final double s = ((major * 60L + minor) * 60L + seconds) / 3600;
        return negative ? -s : s;
    }

    /** Positive modulo: the result lies in [0, y) for positive y. */
    public static double pmod(final double x, final double y) {
        double r = x % y;
        if (r < 0) {
            r += y;
        }
        // a tiny negative r can round up to y itself
        return r < y ? r : 0;
    }
}
