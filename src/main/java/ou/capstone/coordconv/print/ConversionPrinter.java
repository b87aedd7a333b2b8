package ou.capstone.coordconv.print;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Console printer for a conversion: a short header followed by one row per
 * format.
 *
 * Subclasses customize how rows are styled via
 * {@link #decorateRow(ConversionView.Entry, String)} and
 * {@link #decorateHeader(String)}.
 *
 * Provides both {@link #print(ConversionView)} for CLI stdout and
 * {@link #render(ConversionView)} for tests/logging.
 */
public abstract class ConversionPrinter {

    protected static final int INDEX_COL_WIDTH  = 3;
    protected static final int FORMAT_COL_WIDTH = 24;
    protected static final int VALUE_COL_WIDTH  = 40;

    protected static final String DETECTED_MARKER = "*";

    /**
     * Print directly to stdout for CLI usage.
     * Delegates to {@link #render(ConversionView)}.
     */
    public void print(final ConversionView view) {
        System.out.println(render(view));
    }

    /**
     * Renders the conversion table as a single String.
     *
     * @param view the conversion; if null or without entries, an empty-state string is returned
     * @return the complete table (header, separator, rows)
     */
    public String render(final ConversionView view) {
        if (view == null || view.entries().isEmpty()) {
            return "No conversion to display.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(decorateHeader("Input:    " + clean(view.input()))).append('\n');
        sb.append(decorateHeader("Detected: " + view.detectedFormat())).append('\n');
        sb.append(buildColumnHeader()).append('\n');
        sb.append(buildSeparator()).append('\n');

        for (final ConversionView.Entry entry : view.entries()) {
            sb.append(decorateRow(entry, formatRow(entry))).append('\n');
        }
        return sb.toString();
    }

    // Hooks for subclasses

    // Customize a complete row.
    protected abstract String decorateRow(ConversionView.Entry entry, String row);

    // Customize the input/detected header lines.
    protected String decorateHeader(final String line) {
        return line;
    }

    // Rows

    private String buildColumnHeader() {
        return String.format(Locale.ROOT, " %s  %s  %s",
                pad("#", INDEX_COL_WIDTH),
                pad("Format", FORMAT_COL_WIDTH),
                "Value");
    }

    private String buildSeparator() {
        return "-".repeat(1 + INDEX_COL_WIDTH + 2 + FORMAT_COL_WIDTH + 2 + VALUE_COL_WIDTH);
    }

    protected final String formatRow(final ConversionView.Entry entry) {
        final String marker = entry.detected() ? DETECTED_MARKER : " ";
        final String index  = pad(Integer.toString(entry.index()), INDEX_COL_WIDTH);
        final String format = pad(StringUtils.abbreviate(entry.formatName(), FORMAT_COL_WIDTH), FORMAT_COL_WIDTH);
        return String.format(Locale.ROOT, "%s%s  %s  %s", marker, index, format, entry.value());
    }

    // Helper methods

    protected static String pad(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        return StringUtils.rightPad(v, width);
    }

    protected static String clean(final String text) {
        if (text == null) {
            return "-";
        }
        return StringUtils.normalizeSpace(text);
    }
}
