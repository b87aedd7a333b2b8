package ou.capstone.coordconv.convert;

import java.util.Locale;

/**
 * Unsigned decimal degrees followed by a hemisphere letter, e.g. {@code 109.27691111W}.
 */
public final class HemisphereDegreesCodec implements ComponentCodec {

    private final Axis axis;
    private final String pattern;

    public HemisphereDegreesCodec(final Axis axis, final int fractionDigits) {
        this.axis = axis;
        this.pattern = "%." + fractionDigits + "f%c";
    }

    @Override
    public double decode(final String token) {
        final String trimmed = token.trim();
        if (trimmed.length() < 2) {
            throw new IllegalArgumentException("Missing hemisphere in '" + token + "'");
        }
        final char flag = trimmed.charAt(trimmed.length() - 1);
        if (flag == '+' || flag == '-') {
            throw new IllegalArgumentException("Sign is not a hemisphere letter: " + flag);
        }
        final int sign = axis.signOf(flag);
        final double magnitude = Double.parseDouble(trimmed.substring(0, trimmed.length() - 1).trim());
        return sign * magnitude;
    }

    @Override
    public String encode(final double degrees) {
        return String.format(Locale.ROOT, pattern, Math.abs(degrees), axis.hemisphereOf(degrees));
    }
}
