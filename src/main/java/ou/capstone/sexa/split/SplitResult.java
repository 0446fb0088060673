package ou.capstone.sexa.split;

/**
 * Result of {@link Split60#split}: the sign of the input, the whole number
 * of sixties in its magnitude, and the formatted remainder in [0, 60).
 */
public record SplitResult(boolean negative, long quotient, String remainder) {
}
