package ou.capstone.coordconv.print;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ou.capstone.coordconv.detect.Detection;
import ou.capstone.coordconv.detect.FormatDispatcher;

final class ConversionPrinterTest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream buffer;

    private final FormatDispatcher dispatcher = new FormatDispatcher();

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private ConversionView convert(final String input) throws Exception {
        final Detection detection = dispatcher.detectAndParse(input);
        return ConversionView.of(input, detection,
                dispatcher.listFormatNames(), dispatcher.formatAll(detection.coordinate()));
    }

    @Test
    void printsEmptyState() {
        new ConversionPlainPrinter().print(null);

        assertTrue(buffer.toString().contains("No conversion to display."),
                "Should print a helpful empty-state message.");
    }

    @Test
    void printsHeaderAndOneRowPerFormat() throws Exception {
        new ConversionPlainPrinter().print(convert("-27.1234567, 109.2345678"));
        final String out = buffer.toString();

        assertTrue(out.contains("Input:    -27.1234567, 109.2345678"));
        assertTrue(out.contains("Detected: Decimal Degrees"));
        for (final String name : dispatcher.listFormatNames()) {
            assertTrue(out.contains(name), "Missing row for " + name);
        }
        assertTrue(out.contains("fe82938f, 6001c71"), "Hex row should be rendered");
    }

    @Test
    void marksDetectedRow() throws Exception {
        final String out = new ConversionPlainPrinter().render(convert("PID 80000000, 00000000"));

        final String pidRow = out.lines()
                .filter(l -> l.contains("Parcel ID") && !l.startsWith("Detected"))
                .findFirst().orElseThrow();
        assertTrue(pidRow.startsWith("*9"), pidRow);

        final String ddRow = out.lines()
                .filter(l -> l.contains("Decimal Degrees") && !l.startsWith("Detected"))
                .findFirst().orElseThrow();
        assertTrue(ddRow.startsWith(" 0"), ddRow);
    }

    @Test
    void plainPrinterHasNoAnsiCodes() throws Exception {
        final String out = new ConversionPlainPrinter().render(convert("1, 2"));

        assertFalse(out.contains("\u001B["));
    }

    @Test
    void colorPrinterHighlightsDetectedRow() throws Exception {
        final String out = new ConversionColorPrinter().render(convert("1, 2"));

        assertTrue(out.contains("\u001B[32m*0"), "Detected row should be green");
        assertTrue(out.contains("\u001B[1mDetected: Decimal Degrees"), "Header should be bold");
    }

    @Test
    void viewRequiresAlignedLists() throws Exception {
        final Detection detection = dispatcher.detectAndParse("1, 2");

        assertThrows(IllegalArgumentException.class,
                () -> ConversionView.of("1, 2", detection, List.of("a", "b"), List.of("x")));
    }

    @Test
    void viewFlagsOnlyTheDetectedEntry() throws Exception {
        final ConversionView view = convert("0xfff8f800, 0xfff1f000");

        assertEquals(1, view.entries().stream().filter(ConversionView.Entry::detected).count());
        assertEquals("Hex Fixed Point (C)", view.detectedFormat());
    }
}
