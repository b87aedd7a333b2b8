package ou.capstone.coordconv.convert;

/**
 * Arithmetic shared by the fixed-point formats: degrees scaled to units of
 * 1/256 arc-second, stored in a 32-bit word.
 */
public final class FixedPoint {

    /** Units per degree: 60 * 60 * 256. */
    public static final long SCALE = 60L * 60L * 256L;

    /** 2^32, the modulus of the 32-bit word. */
    public static final long WORD_RANGE = 1L << 32;

    private FixedPoint() {
        // Utility class
    }

    /**
     * Reads a raw word: values up to the axis threshold are non-negative
     * degrees, larger values are two's-complement negatives.
     */
    public static double toDegrees(final long raw, final Axis axis) {
        if (raw <= axis.fixedPointThreshold()) {
            return raw / (double) SCALE;
        }
        return (raw - WORD_RANGE) / (double) SCALE;
    }

    /** Scales degrees, truncating toward zero. */
    public static long truncate(final double degrees) {
        return (long) (degrees * SCALE);
    }

    /** Scales degrees, rounding half up. */
    public static long round(final double degrees) {
        return (long) Math.floor(degrees * SCALE + 0.5);
    }

    /**
     * Two's-complement wraparound of a scaled value into an unsigned 32-bit
     * word. Zero stays zero; values outside the word wrap modulo 2^32.
     */
    public static long toWord(final long scaled) {
        return Math.floorMod(scaled, WORD_RANGE);
    }
}
