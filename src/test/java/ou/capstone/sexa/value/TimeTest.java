package ou.capstone.sexa.value;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TimeTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void testFromHms() {
        final Time t = Time.fromHms(false, 15, 22, 7);
        assertEquals(55327, t.sec(), TOLERANCE);
        assertEquals(55327 / 60.0, t.min(), TOLERANCE);
        assertEquals(55327 / 3600.0, t.hour(), TOLERANCE);
        assertEquals(ValueKind.TIME, t.kind());
    }

    @Test
    void testNegativeDuration() {
        final Time t = Time.fromHms(true, 1, 30, 0);
        assertEquals(-5400, t.sec(), TOLERANCE);
        assertEquals(-1.5, t.firstSegment(), TOLERANCE);
    }

    @Test
    void testDayAndRadians() {
        final Time day = Time.fromDay(1);
        assertEquals(86400, day.sec(), TOLERANCE);
        assertEquals(1, day.day(), TOLERANCE);
        assertEquals(2 * Math.PI, day.rad(), TOLERANCE);
        assertEquals(43200, Time.fromRad(Math.PI).sec(), 1e-6);
    }

    @Test
    void testFactoriesAgree() {
        assertEquals(Time.fromSec(7200), Time.fromHour(2));
        assertEquals(Time.fromSec(120), Time.fromMin(2));
    }
}
