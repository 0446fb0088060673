package ou.capstone.sexa.format;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A parsed format specifier: {@code %[flags][width][.precision]verb}.
 * <p>
 * Width is the minimum number of digits in the first segment, not the
 * width of the whole string. Precision is the number of digits after the
 * decimal separator in the decimal-bearing segment. Either may be null
 * when not given; a width, when given, is at least 1.
 * <p>
 * The verb and precision are not validated here; the formatter reports an
 * unknown verb or a precision outside 0..15 as a specification error.
 */
public record FormatSpec(char verb, Integer width, Integer precision, Set<Flag> flags) {

    public enum Flag {
        /** Always write a sign. */
        PLUS('+'),
        /** Write a space where a plus sign would go. */
        SPACE(' '),
        /** Write every segment, even leading zero ones. */
        SHARP('#'),
        /** Zero-pad minutes and seconds; also the first segment when a width is given. */
        ZERO('0'),
        /** Pad the first segment on the right when a width is given. */
        MINUS('-');

        private final char symbol;

        Flag(final char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        static Flag of(final char c) {
            for (final Flag f : values()) {
                if (f.symbol == c) {
                    return f;
                }
            }
            return null;
        }
    }

    /** {@code %s}: seconds carry the decimal part, units appended. */
    public static final FormatSpec DEFAULT = new FormatSpec('s', null, null, Set.of());

    public FormatSpec {
        // "%0s" is the zero flag, so a zero width could not be written back
        if (width != null && width < 1) {
            throw new IllegalArgumentException("Width must be at least 1: " + width);
        }
        flags = flags == null || flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static FormatSpec of(final char verb) {
        return new FormatSpec(verb, null, null, Set.of());
    }

    public FormatSpec withWidth(final int w) {
        return new FormatSpec(verb, w, precision, flags);
    }

    public FormatSpec withPrecision(final int p) {
        return new FormatSpec(verb, width, p, flags);
    }

    public FormatSpec withFlags(final Flag... more) {
        final Set<Flag> merged = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
        Collections.addAll(merged, more);
        return new FormatSpec(verb, width, precision, merged);
    }

    public boolean has(final Flag flag) {
        return flags.contains(flag);
    }

    public boolean hasWidth() {
        return width != null;
    }

    /** Precision, or 0 when none was given. */
    public int precisionOrDefault() {
        return precision == null ? 0 : precision;
    }

    /**
     * Parses a specifier such as {@code "%s"}, {@code "%#.2c"} or {@code "%03s"}.
     *
     * @param text specifier starting with '%' and ending with the verb
     * @return the parsed specifier
     * @throws IllegalArgumentException if the text is not a specifier
     */
    public static FormatSpec parse(final String text) {
        if (text == null || text.length() < 2 || text.charAt(0) != '%') {
            throw new IllegalArgumentException("Format specifier must start with '%': " + text);
        }
        int pos = 1;
        final Set<Flag> flags = EnumSet.noneOf(Flag.class);
        while (pos < text.length()) {
            final Flag f = Flag.of(text.charAt(pos));
            if (f == null) {
                break;
            }
            flags.add(f);
            pos++;
        }

        final int widthStart = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        final Integer width = widthStart == pos ? null : number(text, widthStart, pos);

        Integer precision = null;
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            final int precStart = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            // "%.s" means precision 0
            precision = precStart == pos ? 0 : number(text, precStart, pos);
        }

        if (pos != text.length() - 1) {
            throw new IllegalArgumentException(pos >= text.length()
                    ? "Format specifier has no verb: " + text
                    : "Unexpected text after verb in format specifier: " + text);
        }
        return new FormatSpec(text.charAt(pos), width, precision, flags);
    }

    private static int number(final String text, final int from, final int to) {
        try {
            return Integer.parseInt(text.substring(from, to));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Number out of range in format specifier: " + text, e);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("%");
        for (final Flag f : flags) {
            sb.append(f.symbol());
        }
        if (width != null) {
            sb.append(width);
        }
        if (precision != null) {
            sb.append('.').append(precision);
        }
        return sb.append(verb).toString();
    }
}
