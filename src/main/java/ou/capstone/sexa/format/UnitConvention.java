package ou.capstone.sexa.format;

/**
 * How the unit symbol of the decimal-bearing segment meets its decimal
 * separator.
 */
public enum UnitConvention {
    /** 44.12″ */
    APPEND,
    /** 44″̣12, symbol over the separator */
    COMBINE,
    /** 44″.12 */
    INSERT
}
