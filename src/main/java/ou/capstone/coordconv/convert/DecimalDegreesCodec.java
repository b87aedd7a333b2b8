package ou.capstone.coordconv.convert;

import java.util.Locale;

/** Plain signed decimal degrees with a fixed number of fractional digits. */
public final class DecimalDegreesCodec implements ComponentCodec {

    private final String pattern;

    public DecimalDegreesCodec(final int fractionDigits) {
        this.pattern = "%." + fractionDigits + "f";
    }

    @Override
    public double decode(final String token) {
        return Double.parseDouble(token);
    }

    @Override
    public String encode(final double degrees) {
        return String.format(Locale.ROOT, pattern, degrees);
    }
}
