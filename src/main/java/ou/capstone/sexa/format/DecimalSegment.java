package ou.capstone.sexa.format;

/**
 * The segment that carries the fractional part of a formatted value.
 * Segments after it are not written.
 */
public enum DecimalSegment {
    SECONDS,
    MINUTES,
    FIRST
}
