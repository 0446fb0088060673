package ou.capstone.sexa.exceptions;

/**
 * Reasons a value could not be rendered under an otherwise valid format.
 * The formatter prints asterisks in these cases and reports the constant
 * out-of-band.
 */
public enum FormatError {
    INVALID_PRECISION("Invalid precision"),
    LOSS_OF_PRECISION("Loss of precision"),
    DEGREE_OVERFLOW("Degrees overflow width"),
    HOUR_OVERFLOW("Hours overflow width"),
    POSITIVE_INFINITY("+Inf"),
    NEGATIVE_INFINITY("-Inf"),
    NAN("NaN");

    private final String message;

    FormatError(final String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * Maps a non-finite double to its error, or returns null for finite values.
     */
    public static FormatError ofNonFinite(final double x) {
        if (Double.isNaN(x)) {
            return NAN;
        }
        if (x == Double.POSITIVE_INFINITY) {
            return POSITIVE_INFINITY;
        }
        if (x == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INFINITY;
        }
        return null;
    }
}
