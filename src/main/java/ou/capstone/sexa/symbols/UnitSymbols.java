package ou.capstone.sexa.symbols;

import java.util.Objects;

/**
 * Symbols written after the first (degree or hour), minute and second
 * segments of a formatted value.
 * <p>
 * Multi-character symbols are allowed, and so are empty ones when a fixed
 * width keeps the segments apart.
 */
public record UnitSymbols(String first, String minute, String second) {

    /** Degree, prime, double prime. */
    public static final UnitSymbols DMS = new UnitSymbols("°", "′", "″");

    /** Superscript h, m, s. */
    public static final UnitSymbols HMS = new UnitSymbols("ʰ", "ᵐ", "ˢ");

    public static final UnitSymbols DMS_ASCII = new UnitSymbols("d", "'", "\"");

    public static final UnitSymbols HMS_ASCII = new UnitSymbols("h", "m", "s");

    /** Space separated segments with no trailing symbol. */
    public static final UnitSymbols BLANK = new UnitSymbols(" ", " ", "");

    public UnitSymbols {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(minute, "minute");
        Objects.requireNonNull(second, "second");
    }

    @Override
    public String toString() {
        return String.format("UnitSymbols{%s %s %s}", first, minute, second);
    }
}
