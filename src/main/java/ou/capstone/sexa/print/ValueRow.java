package ou.capstone.sexa.print;

import ou.capstone.sexa.value.SexagesimalValue;

/**
 * One labelled value in a {@link ValueTablePrinter} report.
 */
public record ValueRow(
        String label,
        SexagesimalValue value
) {}
