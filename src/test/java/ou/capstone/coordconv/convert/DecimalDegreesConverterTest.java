package ou.capstone.coordconv.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import ou.capstone.coordconv.geo.Coordinate;

class DecimalDegreesConverterTest {

    private final FormatConverter converter =
            ConverterRegistry.standard().get(CoordinateFormat.DECIMAL_DEGREES);

    @Test
    void testParse_LongitudeFirst() {
        Optional<Coordinate> result = converter.parse("-27.1234567, 109.2345678");

        assertTrue(result.isPresent());
        assertEquals(-27.1234567, result.get().getLongitude(), 1e-12);
        assertEquals(109.2345678, result.get().getLatitude(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "12.5 -3.25       | 12.5 | -3.25",
        "12.5,-3.25       | 12.5 | -3.25",
        "  +12.5 ,  3.    | 12.5 | 3.0",
        ".5, -.25         | 0.5  | -0.25",
        "180 90           | 180  | 90"
    })
    void testParse_CommaOrSpaceSeparators(String input, double lon, double lat) {
        Optional<Coordinate> result = converter.parse(input);

        assertTrue(result.isPresent(), "Should parse: " + input);
        assertEquals(lon, result.get().getLongitude(), 1e-12);
        assertEquals(lat, result.get().getLatitude(), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "abc",
        "1.25",
        "1, 2, 3",
        "0x10, 0x20",
        "1e5, 2",
        "12.5W 3.25N"
    })
    void testParse_RejectsOtherShapes(String input) {
        assertFalse(converter.parse(input).isPresent(), "Should reject: " + input);
    }

    @Test
    void testParse_RejectsNull() {
        assertFalse(converter.parse(null).isPresent());
    }

    @Test
    void testFormat_SevenFractionDigits() {
        assertEquals("-27.1234567, 109.2345678",
                converter.format(new Coordinate(-27.1234567, 109.2345678)));
        assertEquals("0.0000000, 1.5000000",
                converter.format(new Coordinate(0.0, 1.5)));
    }

    @ParameterizedTest
    @CsvSource({
        "-109.276911111, -27.125683333",
        "13.404954, 52.520008",
        "179.99999999, -89.99999999",
        "0.00000004, -0.00000004"
    })
    void testRoundTrip_WithinSevenDecimals(double lon, double lat) {
        Coordinate original = new Coordinate(lon, lat);
        Coordinate back = converter.parse(converter.format(original)).orElseThrow();

        assertEquals(lon, back.getLongitude(), 0.5e-7);
        assertEquals(lat, back.getLatitude(), 0.5e-7);
    }
}
