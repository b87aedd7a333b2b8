package ou.capstone.coordconv.print;

/**
 * Printer that highlights the detected format and bolds the header lines.
 */
public final class ConversionColorPrinter extends ConversionPrinter {

    private final AnsiOutputHelper ansi;

    public ConversionColorPrinter() {
        this.ansi = new AnsiOutputHelper(true);
    }

    @Override
    protected String decorateRow(final ConversionView.Entry entry, final String row) {
        return entry.detected() ? ansi.colorGreen(row) : row;
    }

    @Override
    protected String decorateHeader(final String line) {
        return ansi.bold(line);
    }
}
