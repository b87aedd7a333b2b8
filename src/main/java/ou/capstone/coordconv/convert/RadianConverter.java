package ou.capstone.coordconv.convert;

import java.util.Locale;
import java.util.Optional;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * Display-only format: each component rescaled by {@code deg / 90 * acos(0)}
 * and printed like decimal degrees. Never accepts input.
 */
public final class RadianConverter implements FormatConverter {

    private static final double QUARTER_TURN = Math.acos(0);

    private final String name;

    public RadianConverter(final String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Coordinate> parse(final String text) {
        return Optional.empty();
    }

    @Override
    public String format(final Coordinate coordinate) {
        return String.format(Locale.ROOT, "%.7f, %.7f",
                toRadian(coordinate.getLongitude()),
                toRadian(coordinate.getLatitude()));
    }

    static double toRadian(final double degrees) {
        return degrees / 90.0 * QUARTER_TURN;
    }

    @Override
    public String toString() {
        return name;
    }
}
