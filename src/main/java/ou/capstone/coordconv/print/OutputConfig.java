package ou.capstone.coordconv.print;

/**
 * Configuration for conversion output.
 * Controls how a conversion is displayed to the user.
 */
public record OutputConfig(
    /**
     * TABLE for the console table, JSON for machine-readable output.
     */
    OutputMode outputMode,

    /**
     * Whether ANSI colors are used in TABLE mode.
     */
    boolean color,

    /**
     * Name or index of a single format to print, or null for all formats.
     */
    String singleFormat
) {
    public enum OutputMode {
        TABLE,
        JSON
    }

    public boolean isSingleFormat() {
        return singleFormat != null && !singleFormat.isBlank();
    }

    @Override
    public String toString() {
        return String.format("OutputConfig{outputMode=%s, color=%s, singleFormat=%s}",
                outputMode, color, singleFormat);
    }
}
