package ou.capstone.sexa.value;

import ou.capstone.sexa.exceptions.FormatError;
import ou.capstone.sexa.symbols.SexaConfig;
import ou.capstone.sexa.symbols.UnitSymbols;

/**
 * The four kinds of sexagesimal value and the formatting conventions that
 * differ between them.
 */
public enum ValueKind {
    ANGLE,
    HOUR_ANGLE,
    RIGHT_ASCENSION,
    TIME;

    /** Degree symbols for angles, hour symbols for everything else. */
    public UnitSymbols units(final SexaConfig config) {
        return this == ANGLE ? config.dmsUnits() : config.hmsUnits();
    }

    /** Error reported when the first segment does not fit its width. */
    public FormatError widthOverflow() {
        return this == ANGLE ? FormatError.DEGREE_OVERFLOW : FormatError.HOUR_OVERFLOW;
    }

    /** Right ascension is never written with a sign. */
    public boolean showsSign() {
        return this != RIGHT_ASCENSION;
    }
}
