package ou.capstone.coordconv.convert;

/**
 * An angle split into hemisphere sign, whole degrees, whole minutes and
 * fractional seconds.
 */
public record DmsAngle(boolean negative, long degrees, long minutes, double seconds) {

    private static final double MINUTE_PRECISION = 1e8;

    /**
     * Decomposes a value in degrees. Degrees and minutes are truncated; the
     * minutes are first rounded to 8 decimals so float drift cannot drop a
     * whole minute. Seconds never come out negative.
     */
    public static DmsAngle of(final double value) {
        final double magnitude = Math.abs(value);
        final long degrees = (long) magnitude;
        final double totalMinutes =
                Math.round((magnitude - degrees) * 60.0 * MINUTE_PRECISION) / MINUTE_PRECISION;
        final long minutes = (long) totalMinutes;
        double seconds = (totalMinutes - minutes) * 60.0;
        if (seconds < 0) {
            seconds = 0.0;
        }
        return new DmsAngle(value < 0, degrees, minutes, seconds);
    }

    /**
     * Combines textual fields into degrees. A space inside the seconds field
     * stands for the decimal point.
     *
     * @param sign +1 or -1
     */
    public static double toDegrees(final int sign,
                                   final String degrees,
                                   final String minutes,
                                   final String seconds) {
        final double value = Long.parseLong(degrees)
                + Long.parseLong(minutes) / 60.0
                + Double.parseDouble(seconds.trim().replace(' ', '.')) / 3600.0;
        return sign * value;
    }
}
