package ou.capstone.sexa.symbols;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sexa.exceptions.SexaException;

/**
 * Reads a {@link SexaConfig} from JSON.
 * <p>
 * Expected shape (every key optional, missing keys keep the defaults):
 * <pre>
 * {
 *   "dms": { "first": "°", "minute": "′", "second": "″" },
 *   "hms": { "first": "ʰ", "minute": "ᵐ", "second": "ˢ" },
 *   "decimalSeparator": ".",
 *   "combiningMark": "̣"
 * }
 * </pre>
 * Bundled files live on the classpath under /symbols/.
 */
public class SymbolConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(SymbolConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/symbols/default.json";
    public static final String ASCII_RESOURCE = "/symbols/ascii.json";

    private static final String FIELD_DMS = "dms";
    private static final String FIELD_HMS = "hms";
    private static final String FIELD_FIRST = "first";
    private static final String FIELD_MINUTE = "minute";
    private static final String FIELD_SECOND = "second";
    private static final String FIELD_DECIMAL_SEPARATOR = "decimalSeparator";
    private static final String FIELD_COMBINING_MARK = "combiningMark";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads a configuration from a classpath resource such as
     * {@link #ASCII_RESOURCE}.
     *
     * @throws SexaException if the resource is missing or not valid JSON
     */
    public SexaConfig loadResource(final String resourcePath) throws SexaException {
        logger.debug("Loading symbol configuration from resource {}", resourcePath);
        try (InputStream is = SymbolConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new SexaException("Symbol configuration not found on classpath: " + resourcePath);
            }
            return fromTree(mapper.readTree(is), resourcePath);
        } catch (final IOException e) {
            throw new SexaException("Unable to read symbol configuration " + resourcePath, e);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @throws SexaException if the file cannot be read or is not valid JSON
     */
    public SexaConfig loadFile(final Path path) throws SexaException {
        logger.debug("Loading symbol configuration from file {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(is), path.toString());
        } catch (final IOException e) {
            throw new SexaException("Unable to read symbol configuration " + path, e);
        }
    }

    /**
     * Parses a configuration from a JSON string.
     *
     * @throws SexaException if the text is not valid JSON or has invalid values
     */
    public SexaConfig parse(final String json) throws SexaException {
        try {
            return fromTree(mapper.readTree(json), "<string>");
        } catch (final IOException e) {
            throw new SexaException("Malformed symbol configuration", e);
        }
    }

    private SexaConfig fromTree(final JsonNode root, final String source) throws SexaException {
        if (root == null || !root.isObject()) {
            throw new SexaException("Symbol configuration must be a JSON object: " + source);
        }
        final SexaConfig defaults = SexaConfig.defaults();

        final UnitSymbols dms = readUnits(root.get(FIELD_DMS), defaults.dmsUnits(), source);
        final UnitSymbols hms = readUnits(root.get(FIELD_HMS), defaults.hmsUnits(), source);
        final String separator = text(root, FIELD_DECIMAL_SEPARATOR, defaults.decimalSeparator());

        final String markText = text(root, FIELD_COMBINING_MARK, null);
        final int mark;
        if (markText == null) {
            mark = defaults.combiningMark();
        } else if (markText.codePointCount(0, markText.length()) == 1) {
            mark = markText.codePointAt(0);
        } else {
            throw new SexaException("combiningMark must be a single character in " + source);
        }

        final SexaConfig config = new SexaConfig(dms, hms, separator, mark);
        logger.info("Loaded symbol configuration from {}: {}", source, config);
        return config;
    }

    private static UnitSymbols readUnits(final JsonNode node, final UnitSymbols fallback,
                                         final String source) throws SexaException {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isObject()) {
            throw new SexaException("Unit symbols must be a JSON object in " + source);
        }
        return new UnitSymbols(
                text(node, FIELD_FIRST, fallback.first()),
                text(node, FIELD_MINUTE, fallback.minute()),
                text(node, FIELD_SECOND, fallback.second()));
    }

    private static String text(final JsonNode node, final String field, final String fallback) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }
}
