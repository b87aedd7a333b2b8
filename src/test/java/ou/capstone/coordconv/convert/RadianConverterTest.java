package ou.capstone.coordconv.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ou.capstone.coordconv.geo.Coordinate;

class RadianConverterTest {

    private final FormatConverter converter =
            ConverterRegistry.standard().get(CoordinateFormat.RADIAN);

    @ParameterizedTest
    @ValueSource(strings = {
        "-27.1234567, 109.2345678",
        "1.5707963, -0.7853982",
        "W109 16'36.88\", S27 07'32.46\"",
        "PID 80000000, 0",
        ""
    })
    void testParse_AlwaysRejects(String input) {
        assertFalse(converter.parse(input).isPresent());
    }

    @Test
    void testFormat_RescalesByQuarterTurn() {
        assertEquals("1.5707963, -0.7853982", converter.format(new Coordinate(90.0, -45.0)));
        assertEquals("0.0000000, 3.1415927", converter.format(new Coordinate(0.0, 180.0)));
    }

    @Test
    void testRoundTrip_OutputIsNotParsed() {
        String text = converter.format(new Coordinate(90.0, -45.0));

        assertFalse(converter.parse(text).isPresent());
    }
}
