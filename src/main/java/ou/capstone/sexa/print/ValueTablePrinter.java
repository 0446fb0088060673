package ou.capstone.sexa.print;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.sexa.format.FormatResult;
import ou.capstone.sexa.format.FormatSpec;
import ou.capstone.sexa.format.SexaFormatter;

/**
 * Console table of values, one column per format specifier.
 *
 * Provides both {@link #print(List)} for CLI stdout and {@link #render(List)}
 * for tests/logging. Cells that overflow show asterisks and are explained
 * in notes below the table.
 */
public class ValueTablePrinter {

    protected static final int LABEL_COL_WIDTH = 12;
    protected static final String COLUMN_GAP = "  ";

    private final SexaFormatter formatter;
    private final List<FormatSpec> specs;

    public ValueTablePrinter(final SexaFormatter formatter, final List<FormatSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("At least one format specifier is required");
        }
        this.formatter = formatter;
        this.specs = List.copyOf(specs);
    }

    /**
     * Print directly to stdout for CLI usage.
     * Delegates to {@link #render(List)}.
     */
    public void print(final List<ValueRow> rows) {
        System.out.println(render(rows));
    }

    /**
     * Renders the table as a single String.
     *
     * @param rows values to show; if null/empty, an empty-state string is returned.
     * @return header, separator, one line per row, then any overflow notes
     */
    public String render(final List<ValueRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return "No values to display.";
        }

        final List<List<FormatResult>> cells = new ArrayList<>();
        for (final ValueRow row : rows) {
            final List<FormatResult> line = new ArrayList<>();
            for (final FormatSpec spec : specs) {
                line.add(formatter.format(row.value(), spec));
            }
            cells.add(line);
        }

        // Column widths fit the header and every cell
        final int[] widths = new int[specs.size()];
        for (int c = 0; c < specs.size(); c++) {
            widths[c] = specs.get(c).toString().length();
            for (final List<FormatResult> line : cells) {
                widths[c] = Math.max(widths[c], displayWidth(line.get(c).text()));
            }
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(pad("Value", LABEL_COL_WIDTH));
        for (int c = 0; c < specs.size(); c++) {
            sb.append(COLUMN_GAP).append(pad(specs.get(c).toString(), widths[c]));
        }
        sb.append('\n');
        sb.append("-".repeat(totalWidth(widths))).append('\n');

        final List<String> notes = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            final ValueRow row = rows.get(r);
            sb.append(pad(clamp(row.label(), LABEL_COL_WIDTH), LABEL_COL_WIDTH));
            for (int c = 0; c < specs.size(); c++) {
                final FormatResult cell = cells.get(r).get(c);
                sb.append(COLUMN_GAP).append(pad(cell.text(), widths[c]));
                final FormatSpec spec = specs.get(c);
                cell.error().ifPresent(e -> notes.add(String.format(Locale.ROOT,
                        "%s %s: %s", row.label(), spec, e.message())));
            }
            sb.append('\n');
        }

        if (!notes.isEmpty()) {
            sb.append('\n');
            for (final String note : notes) {
                sb.append("* ").append(note).append('\n');
            }
        }
        return sb.toString();
    }

    private static int totalWidth(final int[] widths) {
        int total = LABEL_COL_WIDTH;
        for (final int w : widths) {
            total += COLUMN_GAP.length() + w;
        }
        return total;
    }

    /** Code points, not counting non-spacing marks. */
    protected static int displayWidth(final String text) {
        return (int) text.codePoints()
                .filter(cp -> Character.getType(cp) != Character.NON_SPACING_MARK)
                .count();
    }

    protected static String pad(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        final int missing = width - displayWidth(v);
        return missing > 0 ? v + StringUtils.repeat(' ', missing) : v;
    }

    protected static String clamp(final String text, final int maxLength) {
        if (text == null) {
            return "-";
        }
        final String normalized = text.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return StringUtils.abbreviate(normalized, maxLength);
    }
}
