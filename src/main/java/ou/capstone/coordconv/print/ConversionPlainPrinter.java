package ou.capstone.coordconv.print;

/** Printer with ANSI colors disabled (plain text). */
public final class ConversionPlainPrinter extends ConversionPrinter {

    @Override
    protected String decorateRow(final ConversionView.Entry entry, final String row) {
        // No coloring
        return row;
    }
}
