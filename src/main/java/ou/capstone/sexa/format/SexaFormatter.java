package ou.capstone.sexa.format;

import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sexa.exceptions.FormatError;
import ou.capstone.sexa.exceptions.FormatOverflowException;
import ou.capstone.sexa.format.FormatSpec.Flag;
import ou.capstone.sexa.split.Split60;
import ou.capstone.sexa.symbols.SexaConfig;
import ou.capstone.sexa.symbols.UnitFusion;
import ou.capstone.sexa.symbols.UnitSymbols;
import ou.capstone.sexa.value.SexagesimalValue;
import ou.capstone.sexa.value.ValueKind;

/**
 * Formats angles, hour angles, right ascensions and times in sexagesimal
 * notation.
 * <p>
 * Each call checks the verb, then the precision, then the value, splits
 * the value into segments and joins them with their unit symbols. A value
 * that cannot be shown under the specifier (NaN, infinity, too many
 * digits for a double, first segment wider than the width) is written as
 * asterisks, as many as the same specifier produces for zero, and the
 * reason is returned in {@link FormatResult#error()}.
 * <p>
 * Instances are immutable and hold no per-call state.
 */
public final class SexaFormatter {
    private static final Logger logger = LoggerFactory.getLogger(SexaFormatter.class);

    /** Formatter with {@link SexaConfig#defaults()}. */
    public static final SexaFormatter DEFAULT = new SexaFormatter(SexaConfig.defaults());

    // asterisk count if even zero cannot be formatted
    private static final int FALLBACK_OVERFLOW_WIDTH = 10;

    private final SexaConfig config;
    private final UnitFusion fusion;

    public SexaFormatter(final SexaConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.fusion = config.fusion();
    }

    public SexaConfig config() {
        return config;
    }

    /** Formats with {@link FormatSpec#DEFAULT}. */
    public FormatResult format(final SexagesimalValue value) {
        return format(value, FormatSpec.DEFAULT);
    }

    /**
     * Parses {@code spec} and formats the value.
     *
     * @throws IllegalArgumentException if {@code spec} is not a format specifier
     */
    public FormatResult format(final SexagesimalValue value, final String spec) {
        return format(value, FormatSpec.parse(spec));
    }

    /**
     * Formats a value.
     *
     * @param value value to format
     * @param spec  verb, flags, width and precision
     * @return the text, with the overflow reason when the value could not be shown
     */
    public FormatResult format(final SexagesimalValue value, final FormatSpec spec) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(spec, "spec");

        final Optional<Verb> verb = Verb.of(spec.verb());
        if (verb.isEmpty()) {
            logger.debug("Unknown verb '{}' in {}", spec.verb(), spec);
            return FormatResult.invalidSpec("%!" + spec.verb() + "(BADVERB)");
        }

        final int precision = spec.precisionOrDefault();
        if (precision < 0 || precision > Split60.MAX_PRECISION) {
            logger.debug("Precision {} out of range in {}", precision, spec);
            return FormatResult.invalidSpec("%!(BADPREC " + precision + ")");
        }

        final Job job = new Job(value.kind(), verb.get(), spec, precision,
                verb.get() == Verb.PLAIN ? UnitSymbols.BLANK : value.kind().units(config));
        final double x = value.firstSegment();
        try {
            final FormatError nonFinite = FormatError.ofNonFinite(x);
            if (nonFinite != null) {
                throw new FormatOverflowException(nonFinite);
            }
            return FormatResult.success(render(job, x));
        } catch (final FormatOverflowException e) {
            logger.debug("{} {} does not fit {}: {}", job.kind(), x, spec, e.getMessage());
            return FormatResult.overflow(StringUtils.repeat('*', overflowWidth(job)), e.getError());
        }
    }

    /**
     * Width of the overflow indicator: the length of zero under the same
     * specifier, not counting a combining mark.
     */
    private int overflowWidth(final Job job) {
        try {
            final String mock = render(job, 0);
            int width = mock.codePointCount(0, mock.length());
            if (fusion.hasCombiningMark(mock)) {
                width--;
            }
            return width;
        } catch (final FormatOverflowException e) {
            logger.debug("Zero does not fit {} either ({}), using {} asterisks",
                    job.spec(), e.getMessage(), FALLBACK_OVERFLOW_WIDTH);
            return FALLBACK_OVERFLOW_WIDTH;
        }
    }

    private String render(final Job job, final double x) throws FormatOverflowException {
        return switch (job.verb().segment()) {
            case SECONDS -> decimalSeconds(job, x);
            case MINUTES -> decimalMinutes(job, x);
            case FIRST   -> decimalFirst(job, x);
        };
    }

    private String decimalSeconds(final Job job, final double x) throws FormatOverflowException {
        long i = significant(Math.abs(x) * 3600, job.precision());
        final long p60 = Split60.sixtyAt(job.precision());
        final long sec = i % p60;
        i /= p60;
        final long min = i % 60;
        final long first = i / 60;

        final Head head = firstSegment(job, first, x < 0);
        final StringBuilder sb = new StringBuilder(head.text());
        boolean minElided = false;
        if (job.has(Flag.ZERO) && !head.elided()) {
            sb.append(StringUtils.leftPad(Long.toString(min), 2, '0')).append(job.units().minute());
        } else if (job.spec().hasWidth()) {
            sb.append(StringUtils.leftPad(Long.toString(min), 2)).append(job.units().minute());
        } else if (head.elided() && min == 0) {
            minElided = true;
        } else {
            sb.append(min).append(job.units().minute());
        }
        return sb.append(lastSegment(job, sec, job.units().second(), minElided)).toString();
    }

    private String decimalMinutes(final Job job, final double x) throws FormatOverflowException {
        final long i = significant(Math.abs(x) * 60, job.precision());
        final long p60 = Split60.sixtyAt(job.precision());
        final Head head = firstSegment(job, i / p60, x < 0);
        return head.text() + lastSegment(job, i % p60, job.units().minute(), head.elided());
    }

    private String decimalFirst(final Job job, final double x) throws FormatOverflowException {
        final int precision = job.precision();
        final long i = significant(Math.abs(x), precision);
        // at least one digit left of the separator
        final String digits = StringUtils.leftPad(Long.toString(i), precision + 1, '0');
        final String sign = sign(job, x < 0);

        String r;
        int trailing = 0;
        if (!job.spec().hasWidth()) {
            r = sign + digits;
        } else {
            final int target = precision + job.spec().width();
            if (digits.length() > target) {
                throw new FormatOverflowException(job.kind().widthOverflow());
            }
            // fixed width keeps a sign column
            final String signColumn = job.kind().showsSign() && sign.isEmpty() ? " " : sign;
            if (job.has(Flag.MINUS)) {
                r = signColumn + digits;
                trailing = target - digits.length();
            } else if (job.has(Flag.ZERO)) {
                r = signColumn + StringUtils.leftPad(digits, target, '0');
            } else {
                r = StringUtils.leftPad(signColumn + digits, target + signColumn.length());
            }
        }
        r = applyUnit(job, Split60.withSeparator(r, precision, config.decimalSeparator()), job.units().first());
        return r + StringUtils.repeat(' ', trailing);
    }

    /**
     * First segment with its sign. Without a width a zero first segment is
     * left out unless {@link Flag#SHARP} is set.
     */
    private Head firstSegment(final Job job, final long value, final boolean negative)
            throws FormatOverflowException {
        final String units = job.units().first();
        final String r;
        boolean elided = false;
        if (job.spec().hasWidth()) {
            final int width = job.spec().width();
            final String digits = Long.toString(value);
            if (digits.length() > width) {
                throw new FormatOverflowException(job.kind().widthOverflow());
            }
            if (job.has(Flag.MINUS)) {
                r = digits + units + StringUtils.repeat(' ', width - digits.length());
            } else if (job.has(Flag.ZERO)) {
                r = StringUtils.leftPad(digits, width, '0') + units;
            } else {
                r = StringUtils.leftPad(digits, width) + units;
            }
        } else if (value > 0 || job.has(Flag.SHARP)) {
            r = value + units;
        } else {
            r = "";
            elided = true;
        }
        return new Head(sign(job, negative) + r, elided);
    }

    /**
     * Decimal-bearing last segment. Zero-padded to two integer digits when
     * it follows another segment and {@link Flag#ZERO} is set.
     */
    private String lastSegment(final Job job, final long value, final String unit, final boolean first) {
        final int precision = job.precision();
        final boolean widthSpec = job.spec().hasWidth();
        int digits = precision + 1;
        if (job.has(Flag.ZERO) && (widthSpec || !first)) {
            digits++;
        }
        String r = StringUtils.leftPad(Long.toString(value), digits, '0');
        if (widthSpec && r.length() < precision + 2) {
            r = " " + r;
        }
        return applyUnit(job, Split60.withSeparator(r, precision, config.decimalSeparator()), unit);
    }

    private String applyUnit(final Job job, final String number, final String unit) {
        return switch (job.verb().convention()) {
            case APPEND  -> number + unit;
            case COMBINE -> fusion.combineUnit(number, unit);
            case INSERT  -> fusion.insertUnit(number, unit);
        };
    }

    private static String sign(final Job job, final boolean negative) {
        if (!job.kind().showsSign()) {
            return "";
        }
        if (negative) {
            return "-";
        }
        if (job.has(Flag.PLUS)) {
            return "+";
        }
        if (job.has(Flag.SPACE)) {
            return " ";
        }
        return "";
    }

    private static long significant(final double x, final int precision) throws FormatOverflowException {
        final long i = Split60.scaled(x, precision);
        if (i < 0) {
            throw new FormatOverflowException(FormatError.LOSS_OF_PRECISION);
        }
        return i;
    }

    /** Everything a single format call needs besides the value. */
    private record Job(ValueKind kind, Verb verb, FormatSpec spec, int precision, UnitSymbols units) {
        boolean has(final Flag flag) {
            return spec.has(flag);
        }
    }

    private record Head(String text, boolean elided) {
    }
}
