package ou.capstone.sexa.symbols;

import java.util.Objects;

/**
 * Places unit symbols into formatted decimal numbers and takes them out
 * again.
 * <p>
 * A unit symbol may sit just before the decimal separator ("1°.25") or
 * replace it, followed by a combining mark so the separator is drawn
 * beneath the symbol ("1°̣25"). Numbers changed by either form are
 * restored by {@link #stripUnit(String, String)}.
 */
public final class UnitFusion {

    private final String decimalSeparator;
    private final String combiningMark;

    /**
     * @param decimalSeparator separator to look for; empty means numbers never
     *                         carry one and units are always appended
     * @param combiningMark    code point of a non-spacing mark, normally U+0323
     */
    public UnitFusion(final String decimalSeparator, final int combiningMark) {
        this.decimalSeparator = Objects.requireNonNull(decimalSeparator, "decimalSeparator");
        this.combiningMark = Character.toString(combiningMark);
    }

    public String decimalSeparator() {
        return decimalSeparator;
    }

    public String combiningMark() {
        return combiningMark;
    }

    /**
     * Inserts {@code unit} just before the first decimal separator in
     * {@code d}, or appends it when there is none.
     */
    public String insertUnit(final String d, final String unit) {
        final int i = separatorIndex(d);
        if (i < 0) {
            return d + unit;
        }
        return d.substring(0, i) + unit + d.substring(i);
    }

    /**
     * Replaces the first decimal separator in {@code d} with {@code unit}
     * followed by the combining mark, or appends the unit when there is no
     * separator.
     */
    public String combineUnit(final String d, final String unit) {
        final int i = separatorIndex(d);
        if (i < 0) {
            return d + unit;
        }
        return d.substring(0, i) + unit + combiningMark + d.substring(i + decimalSeparator.length());
    }

    /**
     * Reverses {@link #insertUnit} or {@link #combineUnit}.
     * <p>
     * Removes {@code unit} when it ends the string or precedes the decimal
     * separator, and turns unit plus combining mark back into the
     * separator. Any other string comes back unchanged.
     */
    public String stripUnit(final String d, final String unit) {
        final int xu = d.indexOf(unit);
        if (xu < 0) {
            return d;
        }
        final int xd = xu + unit.length();
        if (xd == d.length()) {
            return d.substring(0, xu);
        }
        if (!decimalSeparator.isEmpty() && d.startsWith(decimalSeparator, xd)) {
            return d.substring(0, xu) + d.substring(xd);
        }
        if (d.startsWith(combiningMark, xd)) {
            return d.substring(0, xu) + decimalSeparator + d.substring(xd + combiningMark.length());
        }
        return d;
    }

    /** True when {@code s} contains the combining mark. */
    public boolean hasCombiningMark(final String s) {
        return s.contains(combiningMark);
    }

    private int separatorIndex(final String d) {
        if (decimalSeparator.isEmpty()) {
            return -1;
        }
        return d.indexOf(decimalSeparator);
    }
}
