package ou.capstone.sexa;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sexa.exceptions.SexaException;
import ou.capstone.sexa.format.FormatResult;
import ou.capstone.sexa.format.FormatSpec;
import ou.capstone.sexa.format.SexaFormatter;
import ou.capstone.sexa.format.Verb;
import ou.capstone.sexa.print.ValueRow;
import ou.capstone.sexa.print.ValueTablePrinter;
import ou.capstone.sexa.symbols.SexaConfig;
import ou.capstone.sexa.symbols.SymbolConfigLoader;
import ou.capstone.sexa.value.Angle;
import ou.capstone.sexa.value.HourAngle;
import ou.capstone.sexa.value.RightAscension;
import ou.capstone.sexa.value.SexagesimalValue;
import ou.capstone.sexa.value.Time;
import ou.capstone.sexa.value.ValueKind;

/**
 * Command line front end for the sexagesimal formatter.
 *
 * Builds one value from either a raw number or sign plus components,
 * then prints it under a format specifier (or under every verb with
 * --table).
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
        final Option kindOption = Option.builder("k")
                .longOpt("kind").hasArg()
                .desc("Value kind: 'angle', 'hour-angle', 'ra' or 'time' (default: angle)").get();
        final Option radOption = Option.builder("r")
                .longOpt("rad").hasArg()
                .desc("Raw value: radians, or seconds for --kind time").get();
        final Option componentsOption = Option.builder("c")
                .longOpt("components").numberOfArgs(3)
                .desc("Degrees (or hours), minutes and seconds").get();
        final Option negativeOption = Option.builder("n")
                .longOpt("negative")
                .desc("Negate the value given with --components").get();
        final Option formatOption = Option.builder("f")
                .longOpt("format").hasArg()
                .desc("Format specifier, e.g. '%s', '%#.2c', '%03s' (default: %s)").get();
        final Option asciiOption = Option.builder()
                .longOpt("ascii")
                .desc("Use ASCII unit symbols").get();
        final Option symbolsOption = Option.builder()
                .longOpt("symbols").hasArg()
                .desc("JSON file with unit symbols and decimal separator").get();
        final Option tableOption = Option.builder("t")
                .longOpt("table")
                .desc("Show the value under every verb, using flags/width/precision from --format").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( kindOption );
        options.addOption( radOption );
        options.addOption( componentsOption );
        options.addOption( negativeOption );
        options.addOption( formatOption );
        options.addOption( asciiOption );
        options.addOption( symbolsOption );
        options.addOption( tableOption );
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

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("app",
                    "Sexagesimal formatter options", options,
                    "Example: app --kind ra --components 9 14 55.8 --format %.1s",
                    true);
            exitHandler.exit(0);
            return;
        }

        final boolean radProvided = line.hasOption(radOption);
        final boolean componentsProvided = line.hasOption(componentsOption);
        if (radProvided == componentsProvided) {
            throw new ParseException("Invalid options: exactly one of --rad or --components is required");
        }

        try {
            final ValueKind kind = parseKind(line.getOptionValue(kindOption, "angle"));
            final SexagesimalValue value = radProvided
                    ? fromRaw(kind, parseNumber(line.getOptionValue(radOption)))
                    : fromComponents(kind, line.hasOption(negativeOption), line.getOptionValues(componentsOption));

            final SexaConfig config;
            if (line.hasOption(symbolsOption)) {
                config = new SymbolConfigLoader().loadFile(Path.of(line.getOptionValue(symbolsOption)));
            } else if (line.hasOption(asciiOption)) {
                config = new SymbolConfigLoader().loadResource(SymbolConfigLoader.ASCII_RESOURCE);
            } else {
                config = SexaConfig.defaults();
            }
            final SexaFormatter formatter = new SexaFormatter(config);
            final FormatSpec spec = FormatSpec.parse(line.getOptionValue(formatOption, "%s"));

            logger.info("Formatting {} {} with {}", kind, value.firstSegment(), spec);

            if (line.hasOption(tableOption)) {
                printTable(formatter, spec, kind, value);
                exitHandler.exit(0);
                return;
            }

            final FormatResult result = formatter.format(value, spec);
            System.out.println(result.text());
            if (result.isSpecError()) {
                System.err.println("Invalid format specifier: " + spec);
                exitHandler.exit(1);
                return;
            }
            if (result.error().isPresent()) {
                System.err.println("Value overflow: " + result.error().get().message());
                exitHandler.exit(1);
                return;
            }
            exitHandler.exit(0);
        } catch (final SexaException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.err.println("\nConfiguration Error: " + e.getMessage());
            exitHandler.exit(1);
        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    private static void printTable(final SexaFormatter formatter, final FormatSpec template,
                                   final ValueKind kind, final SexagesimalValue value) {
        final List<FormatSpec> specs = new ArrayList<>();
        for (final Verb verb : Verb.values()) {
            if (verb == Verb.DEFAULT) {
                continue;
            }
            specs.add(new FormatSpec(verb.symbol(), template.width(), template.precision(), template.flags()));
        }
        final ValueTablePrinter printer = new ValueTablePrinter(formatter, specs);
        printer.print(List.of(new ValueRow(kind.name().toLowerCase(Locale.ROOT), value)));
    }

    static ValueKind parseKind(final String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "angle":
                return ValueKind.ANGLE;
            case "hour-angle":
            case "hourangle":
                return ValueKind.HOUR_ANGLE;
            case "ra":
            case "right-ascension":
                return ValueKind.RIGHT_ASCENSION;
            case "time":
                return ValueKind.TIME;
            default:
                throw new IllegalArgumentException("Unknown value kind '" + raw + "'");
        }
    }

    static SexagesimalValue fromRaw(final ValueKind kind, final double raw) {
        return switch (kind) {
            case ANGLE           -> Angle.fromRad(raw);
            case HOUR_ANGLE      -> HourAngle.fromRad(raw);
            case RIGHT_ASCENSION -> RightAscension.fromRad(raw);
            case TIME            -> Time.fromSec(raw);
        };
    }

    static SexagesimalValue fromComponents(final ValueKind kind, final boolean negative,
                                           final String[] components) {
        if (components == null || components.length != 3) {
            throw new IllegalArgumentException("--components needs exactly three values");
        }
        final int major = parseInt(components[0]);
        final int minor = parseInt(components[1]);
        final double seconds = parseNumber(components[2]);
        return switch (kind) {
            case ANGLE           -> Angle.fromDms(negative, major, minor, seconds);
            case HOUR_ANGLE      -> HourAngle.fromHms(negative, major, minor, seconds);
            case TIME            -> Time.fromHms(negative, major, minor, seconds);
            case RIGHT_ASCENSION -> {
                if (negative) {
                    throw new IllegalArgumentException("Right ascension cannot be negative");
                }
                yield RightAscension.fromHms(major, minor, seconds);
            }
        };
    }

    private static int parseInt(final String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Not a whole number: '" + raw + "'", e);
        }
    }

    private static double parseNumber(final String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + raw + "'", e);
        }
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
