package ou.capstone.coordconv.convert;

import java.util.Optional;

import ou.capstone.coordconv.geo.Coordinate;

/**
 * Bidirectional codec between a {@link Coordinate} and one textual dialect.
 * Implementations are stateless and safe to share between threads.
 */
public interface FormatConverter {

    /** @return the display name of this format */
    String name();

    /**
     * Parses the given text.
     *
     * @param text input text (may be null)
     * @return the parsed coordinate, or empty if this format rejects the input
     */
    Optional<Coordinate> parse(String text);

    /**
     * Renders a coordinate in this format. Never fails for a finite coordinate.
     *
     * @param coordinate the coordinate to render
     * @return the formatted text
     */
    String format(Coordinate coordinate);
}
