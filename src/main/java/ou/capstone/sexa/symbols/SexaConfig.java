package ou.capstone.sexa.symbols;

import java.util.Objects;

/**
 * Symbols used when formatting sexagesimal values.
 * <p>
 * Build one at start-up and hand it to the formatter. Instances are
 * immutable; the {@code with} methods return modified copies.
 */
public record SexaConfig(
    /**
     * Symbols for angles.
     */
    UnitSymbols dmsUnits,

    /**
     * Symbols for hour angles, right ascensions and times.
     */
    UnitSymbols hmsUnits,

    /**
     * Decimal separator written into decimal-bearing segments.
     */
    String decimalSeparator,

    /**
     * Non-spacing mark that fuses a unit symbol with the decimal separator.
     */
    int combiningMark
) {
    public static final String DEFAULT_DECIMAL_SEPARATOR = ".";

    /** COMBINING DOT BELOW */
    public static final int DEFAULT_COMBINING_MARK = 0x0323;

    public SexaConfig {
        Objects.requireNonNull(dmsUnits, "dmsUnits");
        Objects.requireNonNull(hmsUnits, "hmsUnits");
        Objects.requireNonNull(decimalSeparator, "decimalSeparator");
        if (!Character.isValidCodePoint(combiningMark)) {
            throw new IllegalArgumentException("Invalid combining mark code point: " + combiningMark);
        }
    }

    /**
     * Unicode symbols, "." separator, U+0323 combining mark.
     */
    public static SexaConfig defaults() {
        return new SexaConfig(UnitSymbols.DMS, UnitSymbols.HMS,
                DEFAULT_DECIMAL_SEPARATOR, DEFAULT_COMBINING_MARK);
    }

    /**
     * Like {@link #defaults()} but with ASCII unit symbols.
     */
    public static SexaConfig ascii() {
        return new SexaConfig(UnitSymbols.DMS_ASCII, UnitSymbols.HMS_ASCII,
                DEFAULT_DECIMAL_SEPARATOR, DEFAULT_COMBINING_MARK);
    }

    public SexaConfig withDmsUnits(final UnitSymbols units) {
        return new SexaConfig(units, hmsUnits, decimalSeparator, combiningMark);
    }

    public SexaConfig withHmsUnits(final UnitSymbols units) {
        return new SexaConfig(dmsUnits, units, decimalSeparator, combiningMark);
    }

    public SexaConfig withDecimalSeparator(final String separator) {
        return new SexaConfig(dmsUnits, hmsUnits, separator, combiningMark);
    }

    public SexaConfig withCombiningMark(final int mark) {
        return new SexaConfig(dmsUnits, hmsUnits, decimalSeparator, mark);
    }

    /** Insert/combine/strip helper bound to this separator and mark. */
    public UnitFusion fusion() {
        return new UnitFusion(decimalSeparator, combiningMark);
    }

    @Override
    public String toString() {
        return String.format("SexaConfig{dmsUnits=%s, hmsUnits=%s, decimalSeparator='%s', combiningMark=U+%04X}",
                dmsUnits, hmsUnits, decimalSeparator, combiningMark);
    }
}
