package ou.capstone.coordconv.convert;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * Converter for formats that write a longitude token and a latitude token
 * inside a fixed envelope. The grammar must capture the longitude token in
 * group 1 and the latitude token in group 2; the layout is a
 * {@link String#format} pattern with two {@code %s} slots, longitude first.
 */
public final class PairFormatConverter implements FormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(PairFormatConverter.class);

    private final String name;
    private final Pattern grammar;
    private final String layout;
    private final ComponentCodec longitudeCodec;
    private final ComponentCodec latitudeCodec;

    public PairFormatConverter(final String name,
                               final Pattern grammar,
                               final String layout,
                               final ComponentCodec longitudeCodec,
                               final ComponentCodec latitudeCodec) {
        this.name = Objects.requireNonNull(name, "name");
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.longitudeCodec = Objects.requireNonNull(longitudeCodec, "longitudeCodec");
        this.latitudeCodec = Objects.requireNonNull(latitudeCodec, "latitudeCodec");
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
        final Matcher m = grammar.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            final double longitude = longitudeCodec.decode(m.group(1));
            final double latitude = latitudeCodec.decode(m.group(2));
            return Optional.of(new Coordinate(longitude, latitude));
        } catch (final IllegalArgumentException e) {
            logger.debug("{} rejected '{}': {}", name, text, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String format(final Coordinate coordinate) {
        return String.format(Locale.ROOT, layout,
                longitudeCodec.encode(coordinate.getLongitude()),
                latitudeCodec.encode(coordinate.getLatitude()));
    }

    @Override
    public String toString() {
        return name;
    }
}
