package ou.capstone.coordconv.convert;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * Degrees/minutes/seconds in any punctuation dialect, e.g.
 * {@code W109 16'36.88", S27 07'32.46"} or {@code 27 7 32.46 S 109 16 36.88 W}.
 *
 * Input is first reduced by {@link DmsNormalizer}, then matched against four
 * layouts in a fixed order: front flag longitude first, front flag latitude
 * first, trailing flag longitude first, trailing flag latitude first.
 */
public final class DmsConverter implements FormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(DmsConverter.class);

    // integer seconds, optionally followed by '.' or ' ' and the fraction
    private static final String SEC = "(\\d+(?:[. ]\\d+)?)";
    private static final String LON_FLAG = "([EW+-])";
    private static final String LAT_FLAG = "([NS+-])";

    private static final List<Variant> VARIANTS = List.of(
            new Variant("front flag, longitude first",
                    front(LON_FLAG, LAT_FLAG), true, true),
            new Variant("front flag, latitude first",
                    front(LAT_FLAG, LON_FLAG), true, false),
            new Variant("trailing flag, longitude first",
                    trailing(LON_FLAG, LAT_FLAG), false, true),
            new Variant("trailing flag, latitude first",
                    trailing(LAT_FLAG, LON_FLAG), false, false));

    private final String name;

    public DmsConverter(final String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Coordinate> parse(final String text) {
        final String normalized = DmsNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (final Variant variant : VARIANTS) {
            final Matcher m = variant.pattern().matcher(normalized);
            if (!m.matches()) {
                continue;
            }
            try {
                final Coordinate coordinate = variant.read(m);
                logger.debug("{} matched '{}' as {}", name, normalized, variant.description());
                return Optional.of(coordinate);
            } catch (final IllegalArgumentException e) {
                logger.debug("{} rejected '{}': {}", name, normalized, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public String format(final Coordinate coordinate) {
        final DmsAngle lon = DmsAngle.of(coordinate.getLongitude());
        final DmsAngle lat = DmsAngle.of(coordinate.getLatitude());
        return String.format(Locale.ROOT, "%c%d %d'%.1f\", %c%d %d'%.1f\"",
                Axis.LONGITUDE.hemisphereOf(coordinate.getLongitude()),
                lon.degrees(), lon.minutes(), lon.seconds(),
                Axis.LATITUDE.hemisphereOf(coordinate.getLatitude()),
                lat.degrees(), lat.minutes(), lat.seconds());
    }

    @Override
    public String toString() {
        return name;
    }

    private static Pattern front(final String firstFlag, final String secondFlag) {
        return Pattern.compile("^" + firstFlag + " ?(\\d+) (\\d+) " + SEC
                + " " + secondFlag + " ?(\\d+) (\\d+) " + SEC + "$");
    }

    private static Pattern trailing(final String firstFlag, final String secondFlag) {
        return Pattern.compile("^(\\d+) (\\d+) " + SEC + " ?" + firstFlag
                + " ?(\\d+) (\\d+) " + SEC + " ?" + secondFlag + "$");
    }

    /** One physical layout of the generic grammar. */
    private record Variant(String description, Pattern pattern, boolean frontFlag, boolean longitudeFirst) {

        Coordinate read(final Matcher m) {
            final double first = component(m, 0, longitudeFirst ? Axis.LONGITUDE : Axis.LATITUDE);
            final double second = component(m, 4, longitudeFirst ? Axis.LATITUDE : Axis.LONGITUDE);
            return longitudeFirst ? new Coordinate(first, second) : new Coordinate(second, first);
        }

        private double component(final Matcher m, final int offset, final Axis axis) {
            final int flagGroup = frontFlag ? offset + 1 : offset + 4;
            final int fieldStart = frontFlag ? offset + 2 : offset + 1;
            final int sign = axis.signOf(m.group(flagGroup).charAt(0));
            return DmsAngle.toDegrees(sign,
                    m.group(fieldStart), m.group(fieldStart + 1), m.group(fieldStart + 2));
        }
    }
}
