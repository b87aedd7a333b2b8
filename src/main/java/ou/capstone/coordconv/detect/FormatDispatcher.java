package ou.capstone.coordconv.detect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.convert.ConverterRegistry;
import ou.capstone.coordconv.convert.CoordinateFormat;
import ou.capstone.coordconv.convert.FormatConverter;
import ou.capstone.coordconv.exceptions.UnrecognizedFormatException;
import ou.capstone.coordconv.geo.Coordinate;

/**
 * Auto-detects the format of an input string and renders coordinates in
 * every supported format.
 *
 * Stateless and reentrant: the detected coordinate is returned to the
 * caller and passed back in for formatting. Use {@link ConversionSession}
 * when a single "current coordinate" slot is wanted.
 */
public final class FormatDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(FormatDispatcher.class);

    private final ConverterRegistry registry;

    public FormatDispatcher() {
        this(ConverterRegistry.standard());
    }

    public FormatDispatcher(final ConverterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ConverterRegistry registry() {
        return registry;
    }

    /** @return format names in detection order */
    public List<String> listFormatNames() {
        return registry.formatNames();
    }

    /**
     * Tries every converter in priority order and returns the first match.
     *
     * @param text input text
     * @return the matching format and the parsed coordinate
     * @throws UnrecognizedFormatException if no converter accepts the text
     */
    public Detection detectAndParse(final String text) throws UnrecognizedFormatException {
        if (text == null || text.isBlank()) {
            logger.debug("Blank input, nothing to detect");
            throw new UnrecognizedFormatException(text == null ? "" : text);
        }
        for (final CoordinateFormat format : CoordinateFormat.values()) {
            if (!format.isParseable()) {
                continue;
            }
            final FormatConverter converter = registry.get(format);
            final Optional<Coordinate> parsed = converter.parse(text);
            if (parsed.isPresent()) {
                logger.debug("'{}' detected as {}: {}", text, converter.name(), parsed.get());
                return new Detection(format, converter.name(), parsed.get());
            }
            logger.trace("{} rejected '{}'", converter.name(), text);
        }
        logger.info("No format recognized input '{}'", text);
        throw new UnrecognizedFormatException(text);
    }

    /**
     * Renders the coordinate in every format.
     *
     * @return rendered strings aligned index for index with {@link #listFormatNames()}
     */
    public List<String> formatAll(final Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate");
        final List<String> rendered = new ArrayList<>(registry.size());
        for (final FormatConverter converter : registry.converters()) {
            rendered.add(converter.format(coordinate));
        }
        return Collections.unmodifiableList(rendered);
    }

    public String formatOne(final CoordinateFormat format, final Coordinate coordinate) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(coordinate, "coordinate");
        return registry.get(format).format(coordinate);
    }

    /**
     * @param nameOrIndex display name, enum constant name or zero-based index
     * @throws IllegalArgumentException if no such format exists
     */
    public String formatOne(final String nameOrIndex, final Coordinate coordinate) {
        final CoordinateFormat format = registry.find(nameOrIndex)
                .orElseThrow(() -> new IllegalArgumentException("Unknown format: " + nameOrIndex));
        return formatOne(format, coordinate);
    }

    /** @throws IllegalArgumentException if the index is out of range */
    public String formatOne(final int index, final Coordinate coordinate) {
        final CoordinateFormat format = registry.find(index)
                .orElseThrow(() -> new IllegalArgumentException("Format index out of range: " + index));
        return formatOne(format, coordinate);
    }
}
