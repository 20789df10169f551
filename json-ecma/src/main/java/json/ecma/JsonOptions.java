package json.ecma;

import java.util.logging.Logger;

/// Limits applied to every `stringify` and `parse` call of an {@link EcmaJson}.
///
/// The defaults can be changed for the whole JVM with system properties:
///
/// | Property | Default | Meaning |
/// |----------|---------|---------|
/// | `json.ecma.maxDepth` | `1000` | deepest nesting of arrays and objects (and revive walks) |
/// | `json.ecma.maxStringLength` | `Integer.MAX_VALUE - 8` | longest output string `stringify` may build |
///
/// Properties are read once, when this class is initialized. An invalid value
/// is logged as a warning and the built-in default is used instead.
///
/// @param maxDepth        the maximum nesting depth, at least 1
/// @param maxStringLength the maximum output length in UTF-16 code units, at least 1
public record JsonOptions(int maxDepth, int maxStringLength) {

    private static final Logger LOG = Logger.getLogger(JsonOptions.class.getName());

    /// System property overriding the default maximum depth
    public static final String MAX_DEPTH_PROPERTY = "json.ecma.maxDepth";

    /// System property overriding the default maximum output length
    public static final String MAX_STRING_LENGTH_PROPERTY = "json.ecma.maxStringLength";

    static final int DEFAULT_MAX_DEPTH = 1000;
    static final int DEFAULT_MAX_STRING_LENGTH = Integer.MAX_VALUE - 8;

    private static final JsonOptions DEFAULTS = new JsonOptions(
            readPositive(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH),
            readPositive(MAX_STRING_LENGTH_PROPERTY, DEFAULT_MAX_STRING_LENGTH));

    public JsonOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxStringLength < 1) {
            throw new IllegalArgumentException("maxStringLength must be positive: " + maxStringLength);
        }
    }

    /// {@return the options configured by system properties, or the built-in defaults}
    public static JsonOptions defaults() {
        return DEFAULTS;
    }

    public JsonOptions withMaxDepth(int maxDepth) {
        return new JsonOptions(maxDepth, maxStringLength);
    }

    public JsonOptions withMaxStringLength(int maxStringLength) {
        return new JsonOptions(maxDepth, maxStringLength);
    }

    static int readPositive(String property, int defaultValue) {
        final String propertyValue = System.getProperty(property);
        if (propertyValue == null) {
            LOG.fine(() -> property + " not specified, using default: " + defaultValue);
            return defaultValue;
        }
        try {
            final int parsed = Integer.parseInt(propertyValue.trim());
            if (parsed >= 1) {
                LOG.fine(() -> property + " set to " + parsed + " via system property");
                return parsed;
            }
        } catch (NumberFormatException e) {
            LOG.finer(() -> "Unparseable " + property + ": " + e.getMessage());
        }
        LOG.warning(() -> "Invalid " + property + ": " + propertyValue + ". Using default: " + defaultValue);
        return defaultValue;
    }
}
