package ou.capstone.coordconv.convert;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * LFV dialect: latitude first, seconds written as two integers standing for
 * whole and fraction, e.g. {@code N57 42 12 345 E11 58 23 456}.
 */
public final class LfvDmsConverter implements FormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(LfvDmsConverter.class);

    private static final Pattern GRAMMAR = Pattern.compile(
            "^\\s*([NS])\\s*(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)"
                    + "\\s+([EW])\\s*(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final String name;

    public LfvDmsConverter(final String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Coordinate> parse(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        final Matcher m = GRAMMAR.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            final double latitude = DmsAngle.toDegrees(
                    Axis.LATITUDE.signOf(m.group(1).charAt(0)),
                    m.group(2), m.group(3), m.group(4) + "." + m.group(5));
            final double longitude = DmsAngle.toDegrees(
                    Axis.LONGITUDE.signOf(m.group(6).charAt(0)),
                    m.group(7), m.group(8), m.group(9) + "." + m.group(10));
            return Optional.of(new Coordinate(longitude, latitude));
        } catch (final IllegalArgumentException e) {
            logger.debug("{} rejected '{}': {}", name, text, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String format(final Coordinate coordinate) {
        return component(Axis.LATITUDE, coordinate.getLatitude())
                + " " + component(Axis.LONGITUDE, coordinate.getLongitude());
    }

    private static String component(final Axis axis, final double value) {
        final DmsAngle angle = DmsAngle.of(value);
        final String seconds = String.format(Locale.ROOT, "%.3f", angle.seconds()).replace('.', ' ');
        return String.format(Locale.ROOT, "%c%d %d %s",
                axis.hemisphereOf(value), angle.degrees(), angle.minutes(), seconds);
    }

    @Override
    public String toString() {
        return name;
    }
}
