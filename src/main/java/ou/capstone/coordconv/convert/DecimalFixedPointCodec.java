package ou.capstone.coordconv.convert;

/**
 * Fixed-point degrees as a decimal integer. Input may carry a sign; output
 * is rounded and goes through the same 32-bit wraparound as the hex format,
 * so negative values are written as {@code 2^32 + y}.
 */
public final class DecimalFixedPointCodec implements ComponentCodec {

    private final Axis axis;

    public DecimalFixedPointCodec(final Axis axis) {
        this.axis = axis;
    }

    @Override
    public double decode(final String token) {
        return FixedPoint.toDegrees(Long.parseLong(token), axis);
    }

    @Override
    public String encode(final double degrees) {
        return Long.toString(FixedPoint.toWord(FixedPoint.round(degrees)));
    }
}
