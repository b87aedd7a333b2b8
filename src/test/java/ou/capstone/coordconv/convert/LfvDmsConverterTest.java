package ou.capstone.coordconv.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

import ou.capstone.coordconv.geo.Coordinate;

class LfvDmsConverterTest {

    private final FormatConverter converter =
            ConverterRegistry.standard().get(CoordinateFormat.DMS_LFV);

    @Test
    void testFormat_LatitudeFirstWithSpacedSeconds() {
        assertEquals("S27 7 32 460 W109 16 36 880",
                converter.format(new Coordinate(-109.27691111, -27.12568333)));
    }

    @Test
    void testParse_SecondsAsTwoIntegers() {
        Coordinate c = converter.parse("N57 42 12 345 E11 58 23 456").orElseThrow();

        assertEquals(57 + 42 / 60.0 + 12.345 / 3600.0, c.getLatitude(), 1e-9);
        assertEquals(11 + 58 / 60.0 + 23.456 / 3600.0, c.getLongitude(), 1e-9);
    }

    @Test
    void testParse_SecondsFractionKeepsLeadingZeros() {
        Coordinate c = converter.parse("S0 0 5 050 W0 0 5 005").orElseThrow();

        assertEquals(-5.05 / 3600.0, c.getLatitude(), 1e-12);
        assertEquals(-5.005 / 3600.0, c.getLongitude(), 1e-12);
    }

    @Test
    void testParse_RejectsOtherDialects() {
        assertFalse(converter.parse("N57 42 12.345 E11 58 23.456").isPresent());
        assertFalse(converter.parse("E11 58 23 456 N57 42 12 345").isPresent());
        assertFalse(converter.parse("W109 16'36.88\", S27 07'32.46\"").isPresent());
        assertFalse(converter.parse(null).isPresent());
    }

    @Test
    void testRoundTrip_WithinAMillisecondOfArc() {
        Coordinate original = new Coordinate(-109.276911111, 52.520008);
        Coordinate back = converter.parse(converter.format(original)).orElseThrow();

        assertEquals(original.getLongitude(), back.getLongitude(), 0.0005 / 3600.0 + 1e-12);
        assertEquals(original.getLatitude(), back.getLatitude(), 0.0005 / 3600.0 + 1e-12);
    }
}
