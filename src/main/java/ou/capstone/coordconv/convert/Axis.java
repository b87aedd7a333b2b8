package ou.capstone.coordconv.convert;

import java.util.Locale;

/** Coordinate axis, with the fixed-point range threshold and hemisphere letters. */
public enum Axis {

    LONGITUDE(0x9e34000L, 'E', 'W'),
    LATITUDE(0x4f1a000L, 'N', 'S');

    private final long fixedPointThreshold;
    private final char positiveHemisphere;
    private final char negativeHemisphere;

    Axis(final long fixedPointThreshold,
         final char positiveHemisphere,
         final char negativeHemisphere) {
        this.fixedPointThreshold = fixedPointThreshold;
        this.positiveHemisphere = positiveHemisphere;
        this.negativeHemisphere = negativeHemisphere;
    }

    /** Largest raw fixed-point value read as non-negative (180 or 90 degrees). */
    public long fixedPointThreshold() {
        return fixedPointThreshold;
    }

    /** @return the hemisphere letter for a value; zero counts as positive */
    public char hemisphereOf(final double degrees) {
        return degrees < 0 ? negativeHemisphere : positiveHemisphere;
    }

    /**
     * Sign for a hemisphere flag: a letter of this axis, '+' or '-'.
     *
     * @throws IllegalArgumentException for a letter of the other axis
     */
    public int signOf(final char flag) {
        final char upper = Character.toUpperCase(flag);
        if (upper == positiveHemisphere || upper == '+') {
            return 1;
        }
        if (upper == negativeHemisphere || upper == '-') {
            return -1;
        }
        throw new IllegalArgumentException("Invalid " + name().toLowerCase(Locale.ROOT) + " hemisphere: " + flag);
    }
}
