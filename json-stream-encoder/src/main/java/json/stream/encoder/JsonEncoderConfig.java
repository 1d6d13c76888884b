package json.stream.encoder;

import java.util.logging.Logger;

/// Process-wide defaults for {@link JsonEncoder}, read once from system properties.
///
/// | property                              | default | meaning                         |
/// |---------------------------------------|---------|---------------------------------|
/// | `json.stream.encoder.maxDepth`        | 200     | container nesting capacity      |
/// | `json.stream.encoder.workBufferSize`  | 512     | scratch buffer size in bytes    |
///
/// Values that are not integers, or that fall outside the accepted range, are logged and
/// replaced by the default.
public final class JsonEncoderConfig {

    private static final Logger LOGGER = Logger.getLogger(JsonEncoderConfig.class.getName());

    /// System property key for the maximum container depth
    public static final String MAX_DEPTH_PROPERTY = "json.stream.encoder.maxDepth";

    /// System property key for the scratch buffer size
    public static final String WORK_BUFFER_SIZE_PROPERTY = "json.stream.encoder.workBufferSize";

    public static final int DEFAULT_MAX_DEPTH = 200;
    public static final int DEFAULT_WORK_BUFFER_SIZE = 512;

    /// Hard ceiling on depth so a stray property cannot size a huge stack.
    public static final int MAX_DEPTH_LIMIT = 1 << 16;

    /// Hard ceiling on the scratch buffer size.
    public static final int WORK_BUFFER_SIZE_LIMIT = 1 << 20;

    private static final int CONFIGURED_MAX_DEPTH;
    private static final int CONFIGURED_WORK_BUFFER_SIZE;

    static {
        CONFIGURED_MAX_DEPTH = readInt(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH, 1, MAX_DEPTH_LIMIT);
        CONFIGURED_WORK_BUFFER_SIZE = readInt(WORK_BUFFER_SIZE_PROPERTY, DEFAULT_WORK_BUFFER_SIZE,
                ScratchBuffer.MIN_CAPACITY, WORK_BUFFER_SIZE_LIMIT);
    }

    private JsonEncoderConfig() {
        throw new AssertionError("JsonEncoderConfig cannot be instantiated");
    }

    /// {@return the configured maximum container depth}
    public static int maxDepth() {
        return CONFIGURED_MAX_DEPTH;
    }

    /// {@return the configured scratch buffer size in bytes}
    public static int workBufferSize() {
        return CONFIGURED_WORK_BUFFER_SIZE;
    }

    /// Parses an integer setting, falling back to `defaultValue` when it is absent or unusable.
    static int parse(String key, String propertyValue, int defaultValue, int min, int max) {
        if (propertyValue == null) {
            LOGGER.fine(() -> key + " not specified, using default: " + defaultValue);
            return defaultValue;
        }
        final int value;
        try {
            value = Integer.parseInt(propertyValue.trim());
        } catch (NumberFormatException e) {
            LOGGER.warning(() -> "Invalid " + key + ": " + propertyValue + ". Using default: " + defaultValue);
            return defaultValue;
        }
        if (value < min || value > max) {
            LOGGER.warning(() -> key + " out of range [" + min + ", " + max + "]: " + value
                    + ". Using default: " + defaultValue);
            return defaultValue;
        }
        LOGGER.config(() -> key + " set to " + value + " via system property");
        return value;
    }

    private static int readInt(String key, int defaultValue, int min, int max) {
        return parse(key, System.getProperty(key), defaultValue, min, max);
    }
}
