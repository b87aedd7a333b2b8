package ou.capstone.coordconv.print;

import java.util.ArrayList;
import java.util.List;

import ou.capstone.coordconv.detect.Detection;
import ou.capstone.coordconv.geo.Coordinate;

/** Minimal UI-friendly view of one conversion: the input, the match and every rendering. */
public record ConversionView(
        String input,
        String detectedFormat,
        Coordinate coordinate,
        List<Entry> entries
) {
    /** One rendered representation. */
    public record Entry(int index, String formatName, String value, boolean detected) {
    }

    public ConversionView {
        entries = (entries == null) ? List.of() : List.copyOf(entries);
    }

    /**
     * Builds a view from a detection and the rendered strings.
     *
     * @param names format names in registry order
     * @param values rendered strings aligned with {@code names}
     */
    public static ConversionView of(final String input,
                                    final Detection detection,
                                    final List<String> names,
                                    final List<String> values) {
        if (names.size() != values.size()) {
            throw new IllegalArgumentException("Names and values must be aligned");
        }
        final List<Entry> entries = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            entries.add(new Entry(i, names.get(i), values.get(i),
                    names.get(i).equals(detection.name())));
        }
        return new ConversionView(input, detection.name(), detection.coordinate(), entries);
    }
}
