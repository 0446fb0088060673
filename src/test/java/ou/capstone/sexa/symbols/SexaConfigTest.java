package ou.capstone.sexa.symbols;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SexaConfigTest {

    @Test
    void defaultsUseUnicodeSymbols() {
        final SexaConfig config = SexaConfig.defaults();
        assertEquals(UnitSymbols.DMS, config.dmsUnits());
        assertEquals(UnitSymbols.HMS, config.hmsUnits());
        assertEquals(".", config.decimalSeparator());
        assertEquals(0x0323, config.combiningMark());
    }

    @Test
    void withMethodsReturnModifiedCopies() {
        final SexaConfig base = SexaConfig.defaults();
        final SexaConfig comma = base.withDecimalSeparator(",");

        assertEquals(",", comma.decimalSeparator());
        assertEquals(".", base.decimalSeparator(), "Original must be unchanged");
        assertEquals(UnitSymbols.HMS_ASCII, base.withHmsUnits(UnitSymbols.HMS_ASCII).hmsUnits());
        assertEquals(UnitSymbols.DMS_ASCII, base.withDmsUnits(UnitSymbols.DMS_ASCII).dmsUnits());
        assertEquals(0x0307, base.withCombiningMark(0x0307).combiningMark());
    }

    @Test
    void fusionUsesConfiguredSeparator() {
        final UnitFusion fusion = SexaConfig.defaults().withDecimalSeparator(",").fusion();
        assertEquals("1°,5", fusion.insertUnit("1,5", "°"));
    }

    @Test
    void rejectsInvalidCodePoint() {
        assertThrows(IllegalArgumentException.class,
                () -> SexaConfig.defaults().withCombiningMark(-1));
    }

    @Test
    void toStringShowsMarkAsCodePoint() {
        assertTrue(SexaConfig.defaults().toString().contains("U+0323"));
    }
}
