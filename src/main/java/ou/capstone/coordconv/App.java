package ou.capstone.coordconv;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.convert.CoordinateFormat;
import ou.capstone.coordconv.detect.Detection;
import ou.capstone.coordconv.detect.FormatDispatcher;
import ou.capstone.coordconv.exceptions.CoordinateException;
import ou.capstone.coordconv.exceptions.UnrecognizedFormatException;
import ou.capstone.coordconv.print.ConversionColorPrinter;
import ou.capstone.coordconv.print.ConversionPlainPrinter;
import ou.capstone.coordconv.print.ConversionPrinter;
import ou.capstone.coordconv.print.ConversionView;
import ou.capstone.coordconv.print.JsonConversionWriter;
import ou.capstone.coordconv.print.OutputConfig;

/**
 * Command-line front end for the coordinate converter.
 *
 * Orchestrates the flow between components:
 * - Argument parsing
 * - Format auto-detection via FormatDispatcher
 * - Rendering in every format (or a single one)
 * - Display as a table or as JSON
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // The input is not marked as required so that `--help` and `--list`
        // work on their own; it is checked by hand below.
        final Option inputOption = Option.builder("i")
                .longOpt("input").hasArg()
                .desc("Coordinate text to convert (positional arguments are used when absent)").get();
        final Option formatOption = Option.builder("f")
                .longOpt("format").hasArg()
                .desc("Only print this format (name or index, see --list)").get();
        final Option listOption = Option.builder("l")
                .longOpt("list")
                .desc("List the supported formats in detection order").get();
        final Option jsonOption = Option.builder("j")
                .longOpt("json")
                .desc("Print the conversion as JSON").get();
        final Option noColorOption = Option.builder()
                .longOpt("no-color")
                .desc("Disable ANSI colors in table output").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( inputOption );
        options.addOption( formatOption );
        options.addOption( listOption );
        options.addOption( jsonOption );
        options.addOption( noColorOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption)
                || (line.getOptions().length == 0 && line.getArgList().isEmpty())) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("app [options] [coordinate text]",
                    "Coordinate Format Converter Options", options,
                    "Formats are tried in the order shown by --list.",
                    true);
            exitHandler.exit(0);
            return;
        }

        final FormatDispatcher dispatcher = new FormatDispatcher();

        if (line.hasOption(listOption)) {
            final List<String> names = dispatcher.listFormatNames();
            for (int i = 0; i < names.size(); i++) {
                System.out.println(i + "  " + names.get(i));
            }
            return;
        }

        final String input = line.hasOption(inputOption)
                ? line.getOptionValue(inputOption)
                : String.join(" ", line.getArgList());
        if (input == null || input.isBlank()) {
            throw new ParseException("Invalid options: coordinate input is required");
        }

        final OutputConfig config = new OutputConfig(
                line.hasOption(jsonOption) ? OutputConfig.OutputMode.JSON : OutputConfig.OutputMode.TABLE,
                !line.hasOption(noColorOption),
                line.getOptionValue(formatOption));
        logger.debug("Using {}", config);

        try {
            final Detection detection = dispatcher.detectAndParse(input);
            logger.info("Input detected as {}", detection.name());

            ConversionView view = ConversionView.of(input, detection,
                    dispatcher.listFormatNames(), dispatcher.formatAll(detection.coordinate()));

            if (config.isSingleFormat()) {
                final CoordinateFormat selected = dispatcher.registry().find(config.singleFormat())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown format: " + config.singleFormat()));
                final List<ConversionView.Entry> entries = view.entries().stream()
                        .filter(e -> e.index() == selected.ordinal())
                        .collect(Collectors.toList());
                if (config.outputMode() == OutputConfig.OutputMode.TABLE) {
                    System.out.println(entries.get(0).value());
                    return;
                }
                view = new ConversionView(view.input(), view.detectedFormat(), view.coordinate(), entries);
            }

            displayResults(view, config);

        } catch (final UnrecognizedFormatException e) {
            logger.warn("Unrecognized input: {}", e.getInput());
            System.err.println("Unrecognized coordinate format: " + e.getInput());
            System.err.println("Run with --list to see the supported formats.");
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final CoordinateException e) {
            logger.error("Conversion failed", e);
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    /**
     * Displays a conversion as a table or as JSON.
     *
     * @param view the conversion to display
     * @param config output settings
     * @throws CoordinateException if JSON rendering fails
     */
    private static void displayResults(final ConversionView view,
                                       final OutputConfig config) throws CoordinateException {
        if (config.outputMode() == OutputConfig.OutputMode.JSON) {
            System.out.println(new JsonConversionWriter().write(view));
            return;
        }
        final ConversionPrinter printer = config.color()
                ? new ConversionColorPrinter()
                : new ConversionPlainPrinter();
        printer.print(view);
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
