package ou.capstone.coordconv.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ConverterRegistryTest {

    private final ConverterRegistry registry = ConverterRegistry.standard();

    @Test
    void testFormatNames_FollowDetectionPriority() {
        assertEquals(List.of(
                "Decimal Degrees",
                "WolframAlpha Degrees",
                "Hex Fixed Point",
                "Hex Fixed Point (C)",
                "Decimal Fixed Point",
                "Degrees Minutes Seconds",
                "DMS (LFV)",
                "DMS (Navi Display)",
                "Radian",
                "Parcel ID"), registry.formatNames());
    }

    @Test
    void testConverters_AlignWithEnumOrder() {
        CoordinateFormat[] formats = CoordinateFormat.values();

        assertEquals(formats.length, registry.size());
        for (int i = 0; i < formats.length; i++) {
            assertSame(registry.get(formats[i]), registry.converters().get(i));
            assertEquals(formats[i].displayName(), registry.converters().get(i).name());
        }
    }

    @Test
    void testStandard_IsShared() {
        assertSame(ConverterRegistry.standard(), ConverterRegistry.standard());
    }

    @ParameterizedTest
    @CsvSource({
        "Hex Fixed Point, HEX_FIXED_POINT",
        "hex fixed point (c), HEX_FIXED_POINT_C",
        "parcel_id, PARCEL_ID",
        "DMS, DMS",
        "0, DECIMAL_DEGREES",
        "9, PARCEL_ID",
        "' 5 ', DMS"
    })
    void testFind_ByNameConstantOrIndex(String key, CoordinateFormat expected) {
        assertEquals(Optional.of(expected), registry.find(key));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "10", "-1", "Mercator", "99999999999999"})
    void testFind_UnknownKeysAreEmpty(String key) {
        assertFalse(registry.find(key).isPresent());
    }

    @Test
    void testIsParseable_OnlyRadianIsFormatOnly() {
        for (CoordinateFormat format : CoordinateFormat.values()) {
            assertEquals(format != CoordinateFormat.RADIAN, format.isParseable(), format.name());
        }
    }
}
