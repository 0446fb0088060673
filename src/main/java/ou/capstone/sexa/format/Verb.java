package ou.capstone.sexa.format;

import java.util.Optional;

/**
 * Format verbs: which segment carries the decimal part and how its unit
 * symbol is placed.
 */
public enum Verb {
    DEFAULT('v', DecimalSegment.SECONDS, UnitConvention.APPEND),
    SEC_APPEND('s', DecimalSegment.SECONDS, UnitConvention.APPEND),
    SEC_COMBINE('c', DecimalSegment.SECONDS, UnitConvention.COMBINE),
    SEC_INSERT('d', DecimalSegment.SECONDS, UnitConvention.INSERT),
    MIN_APPEND('m', DecimalSegment.MINUTES, UnitConvention.APPEND),
    MIN_COMBINE('n', DecimalSegment.MINUTES, UnitConvention.COMBINE),
    MIN_INSERT('o', DecimalSegment.MINUTES, UnitConvention.INSERT),
    FIRST_APPEND('h', DecimalSegment.FIRST, UnitConvention.APPEND),
    FIRST_COMBINE('i', DecimalSegment.FIRST, UnitConvention.COMBINE),
    FIRST_INSERT('j', DecimalSegment.FIRST, UnitConvention.INSERT),
    // space separated numbers, no unit symbols
    PLAIN('x', DecimalSegment.SECONDS, UnitConvention.APPEND);

    private final char symbol;
    private final DecimalSegment segment;
    private final UnitConvention convention;

    Verb(final char symbol, final DecimalSegment segment, final UnitConvention convention) {
        this.symbol = symbol;
        this.segment = segment;
        this.convention = convention;
    }

    public char symbol() {
        return symbol;
    }

    public DecimalSegment segment() {
        return segment;
    }

    public UnitConvention convention() {
        return convention;
    }

    /**
     * Looks up a verb by its format character.
     *
     * @return the verb, or empty if {@code c} is not a recognized verb
     */
    public static Optional<Verb> of(final char c) {
        for (final Verb v : values()) {
            if (v.symbol == c) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
