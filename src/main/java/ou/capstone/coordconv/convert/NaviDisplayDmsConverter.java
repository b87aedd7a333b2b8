package ou.capstone.coordconv.convert;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * Navigation display dialect with degree, prime and double prime glyphs,
 * latitude first, tab separated: {@code N57°42′12.3″<TAB>E11°58′23.4″}.
 */
public final class NaviDisplayDmsConverter implements FormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(NaviDisplayDmsConverter.class);

    static final char DEGREE = '°';
    static final char PRIME = '′';
    static final char DOUBLE_PRIME = '″';

    private static final Pattern GRAMMAR = Pattern.compile(
            "^\\s*([NS])(\\d+)" + DEGREE + "(\\d+)" + PRIME + "(\\d+(?:\\.\\d+)?)" + DOUBLE_PRIME
                    + "\\s+([EW])(\\d+)" + DEGREE + "(\\d+)" + PRIME + "(\\d+(?:\\.\\d+)?)" + DOUBLE_PRIME
                    + "\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final String name;

    public NaviDisplayDmsConverter(final String name) {
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
                    Axis.LATITUDE.signOf(m.group(1).charAt(0)), m.group(2), m.group(3), m.group(4));
            final double longitude = DmsAngle.toDegrees(
                    Axis.LONGITUDE.signOf(m.group(5).charAt(0)), m.group(6), m.group(7), m.group(8));
            return Optional.of(new Coordinate(longitude, latitude));
        } catch (final IllegalArgumentException e) {
            logger.debug("{} rejected '{}': {}", name, text, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String format(final Coordinate coordinate) {
        return component(Axis.LATITUDE, coordinate.getLatitude())
                + "\t" + component(Axis.LONGITUDE, coordinate.getLongitude());
    }

    private static String component(final Axis axis, final double value) {
        final DmsAngle angle = DmsAngle.of(value);
        return String.format(Locale.ROOT, "%c%d%c%d%c%.1f%c",
                axis.hemisphereOf(value), angle.degrees(), DEGREE,
                angle.minutes(), PRIME, angle.seconds(), DOUBLE_PRIME);
    }

    @Override
    public String toString() {
        return name;
    }
}
