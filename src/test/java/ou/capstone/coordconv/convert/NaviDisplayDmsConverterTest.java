package ou.capstone.coordconv.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

import ou.capstone.coordconv.geo.Coordinate;

class NaviDisplayDmsConverterTest {

    private final FormatConverter converter =
            ConverterRegistry.standard().get(CoordinateFormat.DMS_NAVI_DISPLAY);

    @Test
    void testFormat_LatitudeFirstTabSeparated() {
        assertEquals("S27°7′32.5″\tW109°16′36.9″",
                converter.format(new Coordinate(-109.27691111, -27.12568333)));
    }

    @Test
    void testParse_GlyphNotation() {
        Coordinate c = converter.parse("N57°42′12.3″\tE11°58′23.4″").orElseThrow();

        assertEquals(57 + 42 / 60.0 + 12.3 / 3600.0, c.getLatitude(), 1e-9);
        assertEquals(11 + 58 / 60.0 + 23.4 / 3600.0, c.getLongitude(), 1e-9);
    }

    @Test
    void testParse_RejectsAsciiPunctuation() {
        assertFalse(converter.parse("N57°42'12.3\" E11°58'23.4\"").isPresent());
        assertFalse(converter.parse("N57 42 12.3 E11 58 23.4").isPresent());
    }

    @Test
    void testRoundTrip_WithinATenthOfASecond() {
        Coordinate original = new Coordinate(13.404954, -52.520008);
        Coordinate back = converter.parse(converter.format(original)).orElseThrow();

        assertEquals(original.getLongitude(), back.getLongitude(), 0.05 / 3600.0 + 1e-12);
        assertEquals(original.getLatitude(), back.getLatitude(), 0.05 / 3600.0 + 1e-12);
    }
}
