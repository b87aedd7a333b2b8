package ou.capstone.coordconv.convert;

import java.util.Locale;

/**
 * Bit-packed parcel ID component.
 * <pre>
 *   bit 31      hemisphere flag (set for West / South)
 *   bits 11-30  scaled magnitude with its low 8 bits cleared, shifted left by 3
 *   bits 0-7    extended area: the low 8 bits of the scaled magnitude
 * </pre>
 */
public final class ParcelIdCodec implements ComponentCodec {

    static final long HEMISPHERE_BIT = 0x80000000L;
    static final long MAGNITUDE_MASK = 0x7FFFFFFFL;
    static final long EXTENDED_AREA_MASK = 0xFFL;
    private static final int SHIFT = 3;

    @Override
    public double decode(final String token) {
        final long word = Long.parseLong(token, 16);
        final boolean negative = (word & HEMISPHERE_BIT) != 0;
        final double magnitude = unpack(word & MAGNITUDE_MASK) / (double) FixedPoint.SCALE;
        return negative ? -magnitude : magnitude;
    }

    @Override
    public String encode(final double degrees) {
        final long scaled = Math.round(Math.abs(degrees) * FixedPoint.SCALE);
        long word = pack(scaled);
        if (Math.copySign(1.0, degrees) < 0) {
            word |= HEMISPHERE_BIT;
        }
        return Long.toHexString(word).toUpperCase(Locale.ROOT);
    }

    static long pack(final long scaled) {
        final long coarse = (scaled & ~EXTENDED_AREA_MASK) << SHIFT;
        return (coarse | (scaled & EXTENDED_AREA_MASK)) & MAGNITUDE_MASK;
    }

    static long unpack(final long magnitude) {
        final long extendedArea = magnitude & EXTENDED_AREA_MASK;
        if (extendedArea != 0) {
            return ((magnitude >>> SHIFT) & ~EXTENDED_AREA_MASK) | extendedArea;
        }
        return magnitude >>> SHIFT;
    }
}
