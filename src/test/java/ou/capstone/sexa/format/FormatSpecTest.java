package ou.capstone.sexa.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

import ou.capstone.sexa.format.FormatSpec.Flag;

/**
 * Tests for parsing format specifiers.
 */
final class FormatSpecTest {

    @Test
    void parsesBareVerb() {
        final FormatSpec spec = FormatSpec.parse("%s");
        assertEquals('s', spec.verb());
        assertNull(spec.width());
        assertNull(spec.precision());
        assertTrue(spec.flags().isEmpty());
        assertEquals(0, spec.precisionOrDefault());
    }

    @Test
    void zeroIsAFlagNotAWidth() {
        final FormatSpec spec = FormatSpec.parse("%03s");
        assertTrue(spec.has(Flag.ZERO));
        assertEquals(3, spec.width());

        final FormatSpec zeroOnly = FormatSpec.parse("%0s");
        assertTrue(zeroOnly.has(Flag.ZERO));
        assertFalse(zeroOnly.hasWidth());
    }

    @Test
    void parsesAllParts() {
        final FormatSpec spec = FormatSpec.parse("%+#-12.4j");
        assertEquals(Set.of(Flag.PLUS, Flag.SHARP, Flag.MINUS), spec.flags());
        assertEquals(12, spec.width());
        assertEquals(4, spec.precision());
        assertEquals('j', spec.verb());
    }

    @Test
    void spaceFlag() {
        assertTrue(FormatSpec.parse("% s").has(Flag.SPACE));
    }

    @Test
    void emptyPrecisionMeansZero() {
        assertEquals(0, FormatSpec.parse("%.s").precision());
    }

    @Test
    void unknownVerbAndLargePrecisionStillParse() {
        // reported later by the formatter as BADVERB / BADPREC
        assertEquals('q', FormatSpec.parse("%q").verb());
        assertEquals(16, FormatSpec.parse("%.16s").precision());
    }

    @Test
    void rejectsMalformedSpecifiers() {
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse(null));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("s"));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("%"));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("%3"));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("%.2"));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("%sx"));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.parse("%99999999999s"));
    }

    @Test
    void rejectsNegativeWidth() {
        assertThrows(IllegalArgumentException.class, () -> new FormatSpec('s', -1, null, Set.of()));
    }

    @Test
    void rejectsZeroWidth() {
        // would print as "%0s", which reads back as the zero flag
        assertThrows(IllegalArgumentException.class, () -> new FormatSpec('s', 0, null, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> FormatSpec.of('s').withWidth(0));
        assertFalse(FormatSpec.parse("%00s").hasWidth());
    }

    @Test
    void toStringRoundTrips() {
        for (final String text : new String[] {"%s", "%03s", "%+.2c", "%#m", "%-3.1h", "% .15x"}) {
            assertEquals(text, FormatSpec.parse(text).toString());
        }
    }

    @Test
    void withMethodsBuildSpecifiers() {
        final FormatSpec spec = FormatSpec.of('d').withWidth(2).withPrecision(3).withFlags(Flag.ZERO, Flag.PLUS);
        assertEquals("%+02.3d", spec.toString());
        assertEquals(FormatSpec.parse("%+02.3d"), spec);
    }

    @Test
    void verbLookup() {
        assertEquals(Verb.SEC_APPEND, Verb.of('s').orElseThrow());
        assertEquals(DecimalSegment.MINUTES, Verb.of('n').orElseThrow().segment());
        assertEquals(UnitConvention.INSERT, Verb.of('j').orElseThrow().convention());
        assertEquals(Verb.DEFAULT, Verb.of('v').orElseThrow());
        assertTrue(Verb.of('z').isEmpty());
    }
}
