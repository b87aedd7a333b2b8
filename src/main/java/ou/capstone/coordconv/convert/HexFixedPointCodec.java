package ou.capstone.coordconv.convert;

/**
 * Fixed-point degrees as a lowercase hexadecimal 32-bit word. Encoding
 * truncates toward zero; negative values wrap to two's complement.
 */
public final class HexFixedPointCodec implements ComponentCodec {

    private final Axis axis;
    private final String prefix;

    public HexFixedPointCodec(final Axis axis) {
        this(axis, "");
    }

    /**
     * @param prefix text written before each encoded number (e.g. {@code 0x});
     *               decoding expects the grammar to have stripped it already
     */
    public HexFixedPointCodec(final Axis axis, final String prefix) {
        this.axis = axis;
        this.prefix = prefix;
    }

    @Override
    public double decode(final String token) {
        return FixedPoint.toDegrees(Long.parseLong(token, 16), axis);
    }

    @Override
    public String encode(final double degrees) {
        return prefix + Long.toHexString(FixedPoint.toWord(FixedPoint.truncate(degrees)));
    }
}
