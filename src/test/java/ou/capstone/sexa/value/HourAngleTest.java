package ou.capstone.sexa.value;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class HourAngleTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void testOneHourIsFifteenDegrees() {
        final HourAngle h = HourAngle.fromHms(false, 1, 0, 0);
        assertEquals(Math.toRadians(15), h.rad(), TOLERANCE);
        assertEquals(1, h.hour(), TOLERANCE);
        assertEquals(60, h.min(), TOLERANCE);
        assertEquals(3600, h.sec(), 1e-7);
    }

    @Test
    void testNegativeComponents() {
        final HourAngle h = HourAngle.fromHms(true, 2, 30, 0);
        assertEquals(-2.5, h.hour(), TOLERANCE);
        assertEquals(-2.5, h.firstSegment(), TOLERANCE);
        assertEquals(ValueKind.HOUR_ANGLE, h.kind());
    }

    @Test
    void testFactoriesAgree() {
        final double rad = HourAngle.fromHour(3).rad();
        assertEquals(rad, HourAngle.fromMin(180).rad(), TOLERANCE);
        assertEquals(rad, HourAngle.fromSec(10800).rad(), TOLERANCE);
        assertEquals(Math.PI / 4, rad, TOLERANCE);
    }

    @Test
    void testNoWrapping() {
        assertEquals(30, HourAngle.fromHour(30).hour(), TOLERANCE);
    }
}
