package json.stream.encoder;

import java.util.Objects;
import java.util.logging.Logger;

/// Streaming JSON encoder that turns a sequence of typed calls into JSON text pushed to a
/// {@link JsonSink}.
///
/// The document is never held in memory. All working storage (the container stack, the
/// scratch buffer used for escaping and hex output, the number buffer) is allocated by the
/// constructor, so once an encoder exists its encoding paths do not allocate. That makes it
/// usable from crash handlers, shutdown hooks and low-memory paths.
///
/// ```
/// var sink = new ByteArrayJsonSink();
/// var encoder = new JsonEncoder();
/// encoder.beginEncode(false, sink);
/// encoder.beginObject(null);
/// encoder.addIntegerElement("x", 5);
/// encoder.endEncode();
/// sink.toString(); // {"x":5}
/// ```
///
/// Every operation returns a {@link JsonEncodeStatus}. After a failure the session should be
/// abandoned: nothing is rolled back and further calls may leave the document malformed.
///
/// Inside an object every element needs a member name; inside an array or at the document root
/// the name is ignored and may be `null`.
///
/// Instances are not thread-safe. One encoder serves one session at a time and may be reused
/// for later sessions via {@link #beginEncode(boolean, JsonSink)}.
public final class JsonEncoder {

    private static final Logger LOG = Logger.getLogger(JsonEncoder.class.getName());

    /// Hex digits used for control-character escapes and data elements.
    private static final byte[] HEX_NYBBLES = {
            '0', '1', '2', '3', '4', '5', '6', '7',
            '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

    private static final byte[] TRUE = {'t', 'r', 'u', 'e'};
    private static final byte[] FALSE = {'f', 'a', 'l', 's', 'e'};
    private static final byte[] NULL = {'n', 'u', 'l', 'l'};
    private static final byte[] QUOTE = {'"'};
    private static final byte[] COMMA = {','};
    private static final byte[] COLON = {':'};
    private static final byte[] PRETTY_COLON = {':', ' '};
    private static final byte[] NEWLINE = {'\n'};
    private static final byte[] INDENT = {' ', ' ', ' ', ' '};
    private static final byte[] BEGIN_ARRAY = {'['};
    private static final byte[] END_ARRAY = {']'};
    private static final byte[] BEGIN_OBJECT = {'{'};
    private static final byte[] END_OBJECT = {'}'};

    private static final byte UTF8_REPLACEMENT = '?';

    /// Used until the first session starts.
    private static final JsonSink NO_SESSION = (data, offset, length) -> {
        LOG.warning(() -> "JsonEncoder used before beginEncode");
        return JsonEncodeStatus.CANNOT_ADD_DATA;
    };

    private final int maxDepth;
    /// `containerIsObject[d]` describes the container open at depth `d`; slot 0 is the root.
    private final boolean[] containerIsObject;
    private final ScratchBuffer scratch;
    private final byte[] numberBuffer = new byte[32];

    private JsonSink sink = NO_SESSION;
    private boolean prettyPrint;
    private int depth;
    private boolean containerFirstEntry = true;

    /// Creates an encoder sized from {@link JsonEncoderConfig}.
    public JsonEncoder() {
        this(JsonEncoderConfig.maxDepth(), JsonEncoderConfig.workBufferSize());
    }

    /// Creates an encoder with explicit capacities.
    ///
    /// @param maxDepth       maximum number of simultaneously open containers, at least 1
    /// @param workBufferSize scratch buffer size in bytes, at least 16
    /// @throws IllegalArgumentException if either value is too small
    public JsonEncoder(int maxDepth, int workBufferSize) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.containerIsObject = new boolean[maxDepth + 1];
        this.scratch = new ScratchBuffer(workBufferSize);
        this.scratch.reset(NO_SESSION);
    }

    /// Runs a complete session into memory and returns the document text.
    ///
    /// Containers left open by `body` are closed before returning.
    ///
    /// @param prettyPrint whether to indent the output
    /// @param body        the calls making up the document
    /// @return the encoded document
    /// @throws JsonEncodeException if `body` or the final close returns a failure status
    public static String encodeToString(boolean prettyPrint, JsonEncoding body) {
        Objects.requireNonNull(body, "body must not be null");
        final var sink = new ByteArrayJsonSink();
        final var encoder = new JsonEncoder();
        encoder.beginEncode(prettyPrint, sink);
        body.encode(encoder).orThrow("encode");
        encoder.endEncode().orThrow("endEncode");
        return sink.toString();
    }

    // ------------------------------------------------------------------
    // Session
    // ------------------------------------------------------------------

    /// Starts a new session, discarding any state left by a previous one.
    ///
    /// @param prettyPrint whether to put each element on its own line, indented four spaces per level
    /// @param sink        receiver of the output
    public void beginEncode(boolean prettyPrint, JsonSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.prettyPrint = prettyPrint;
        this.depth = 0;
        this.containerIsObject[0] = false;
        this.containerFirstEntry = true;
        this.scratch.reset(sink);
        LOG.fine(() -> "beginEncode prettyPrint=" + prettyPrint);
    }

    /// Closes every container still open, innermost first.
    ///
    /// @return {@link JsonEncodeStatus#OK}, or the first failure, at which point closing stops
    public JsonEncodeStatus endEncode() {
        while (depth > 0) {
            final JsonEncodeStatus result = endContainer();
            if (result != JsonEncodeStatus.OK) {
                LOG.warning(() -> "endEncode stopped at depth " + depth + ": " + result.description());
                return result;
            }
        }
        LOG.fine("endEncode complete");
        return JsonEncodeStatus.OK;
    }

    /// {@return the number of currently open containers}
    public int depth() {
        return depth;
    }

    /// {@return the maximum number of simultaneously open containers}
    public int maxDepth() {
        return maxDepth;
    }

    /// {@return whether the current session pretty-prints}
    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ------------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------------

    /// Writes whatever must precede a new element: the separating comma, the pretty-print line
    /// break and indentation, and inside an object the quoted member name and colon.
    ///
    /// The typed `add*` and `begin*` methods call this themselves. Call it directly only when
    /// following it with {@link #addRawJsonData}.
    ///
    /// @param name member name; required inside an object, ignored elsewhere
    /// @return {@link JsonEncodeStatus#INVALID_DATA} if `name` is missing inside an object
    public JsonEncodeStatus beginElement(String name) {
        JsonEncodeStatus result;
        if (containerFirstEntry) {
            containerFirstEntry = false;
        } else if ((result = add(COMMA)) != JsonEncodeStatus.OK) {
            return result;
        }

        if (prettyPrint && depth > 0 && (result = newlineAndIndent(depth)) != JsonEncodeStatus.OK) {
            return result;
        }

        if (containerIsObject[depth]) {
            if (name == null) {
                LOG.warning("Name was null inside an object");
                return JsonEncodeStatus.INVALID_DATA;
            }
            if ((result = addQuotedEscaped(name)) != JsonEncodeStatus.OK) {
                return result;
            }
            return add(prettyPrint ? PRETTY_COLON : COLON);
        }
        return JsonEncodeStatus.OK;
    }

    /// Opens an array.
    ///
    /// @param name member name when inside an object
    /// @return {@link JsonEncodeStatus#DEPTH_EXCEEDED} without writing anything if
    ///         {@link #maxDepth()} containers are already open
    public JsonEncodeStatus beginArray(String name) {
        return beginContainer(name, false);
    }

    /// Opens an object.
    ///
    /// @param name member name when inside an object
    /// @return {@link JsonEncodeStatus#DEPTH_EXCEEDED} without writing anything if
    ///         {@link #maxDepth()} containers are already open
    public JsonEncodeStatus beginObject(String name) {
        return beginContainer(name, true);
    }

    /// Closes the innermost open container. Does nothing at the document root.
    public JsonEncodeStatus endContainer() {
        if (depth <= 0) {
            return JsonEncodeStatus.OK;
        }

        final boolean isObject = containerIsObject[depth];
        depth--;

        if (prettyPrint && !containerFirstEntry) {
            final JsonEncodeStatus result = newlineAndIndent(depth);
            if (result != JsonEncodeStatus.OK) {
                return result;
            }
        }
        containerFirstEntry = false;
        return add(isObject ? END_OBJECT : END_ARRAY);
    }

    private JsonEncodeStatus beginContainer(String name, boolean isObject) {
        if (depth >= maxDepth) {
            LOG.warning(() -> "Cannot open " + (isObject ? "object" : "array") + ": maximum depth " + maxDepth + " reached");
            return JsonEncodeStatus.DEPTH_EXCEEDED;
        }
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }

        depth++;
        containerIsObject[depth] = isObject;
        containerFirstEntry = true;

        return add(isObject ? BEGIN_OBJECT : BEGIN_ARRAY);
    }

    private JsonEncodeStatus newlineAndIndent(int levels) {
        JsonEncodeStatus result = add(NEWLINE);
        for (int i = 0; i < levels && result == JsonEncodeStatus.OK; i++) {
            result = add(INDENT);
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Scalars
    // ------------------------------------------------------------------

    public JsonEncodeStatus addBooleanElement(String name, boolean value) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return add(value ? TRUE : FALSE);
    }

    public JsonEncodeStatus addNullElement(String name) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return add(NULL);
    }

    /// Adds a signed 64-bit integer.
    public JsonEncodeStatus addIntegerElement(String name, long value) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return sink.addJsonData(numberBuffer, 0, NumberFormatter.formatSigned(value, numberBuffer, 0));
    }

    /// Adds an unsigned 64-bit integer; `value` is read as unsigned, so `-1L` is written as
    /// `18446744073709551615`.
    public JsonEncodeStatus addUnsignedIntegerElement(String name, long value) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return sink.addJsonData(numberBuffer, 0, NumberFormatter.formatUnsigned(value, numberBuffer, 0));
    }

    /// Adds a double with {@link NumberFormatter#MAX_SIGNIFICANT_DIGITS} significant digits.
    ///
    /// Non-finite values are written as the bare words `nan` and `inf`, which JSON parsers
    /// reject; callers that need strictly valid output must filter them first.
    public JsonEncodeStatus addFloatingPointElement(String name, double value) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return sink.addJsonData(numberBuffer, 0, NumberFormatter.formatDouble(value, numberBuffer, 0));
    }

    // ------------------------------------------------------------------
    // Strings
    // ------------------------------------------------------------------

    /// Adds an escaped, quoted string. A `null` value is written as `null`.
    public JsonEncodeStatus addStringElement(String name, CharSequence value) {
        if (value == null) {
            return addNullElement(name);
        }
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return addQuotedEscaped(value);
    }

    /// Adds an escaped, quoted string from UTF-8 bytes. A `null` array is written as `null`.
    public JsonEncodeStatus addStringElement(String name, byte[] utf8, int offset, int length) {
        if (utf8 == null) {
            return addNullElement(name);
        }
        Objects.checkFromIndexSize(offset, length, utf8.length);
        JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        if ((result = add(QUOTE)) != JsonEncodeStatus.OK) {
            return result;
        }
        if ((result = appendEscaped(utf8, offset, length)) != JsonEncodeStatus.OK) {
            return result;
        }
        return add(QUOTE);
    }

    /// Opens a string element whose content follows in any number of
    /// {@link #appendStringElement} calls and is closed by {@link #endStringElement()}.
    public JsonEncodeStatus beginStringElement(String name) {
        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return add(QUOTE);
    }

    /// Appends escaped text to the string opened by {@link #beginStringElement}.
    ///
    /// A surrogate pair split across two calls is written as two `?` characters.
    public JsonEncodeStatus appendStringElement(CharSequence value) {
        Objects.requireNonNull(value, "value must not be null");
        return appendUtf8(value, 0, value.length(), true);
    }

    /// Appends escaped UTF-8 bytes to the string opened by {@link #beginStringElement}.
    public JsonEncodeStatus appendStringElement(byte[] utf8, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, utf8.length);
        return appendEscaped(utf8, offset, length);
    }

    public JsonEncodeStatus endStringElement() {
        return add(QUOTE);
    }

    // ------------------------------------------------------------------
    // Binary data
    // ------------------------------------------------------------------

    /// Adds `data` as a string of uppercase hex digit pairs. A `null` array is written as `null`.
    public JsonEncodeStatus addDataElement(String name, byte[] data) {
        if (data == null) {
            return addNullElement(name);
        }
        return addDataElement(name, data, 0, data.length);
    }

    /// Adds a slice of `data` as a string of uppercase hex digit pairs. A `null` array is
    /// written as `null`.
    public JsonEncodeStatus addDataElement(String name, byte[] data, int offset, int length) {
        if (data == null) {
            return addNullElement(name);
        }
        Objects.checkFromIndexSize(offset, length, data.length);
        JsonEncodeStatus result = beginDataElement(name);
        if (result == JsonEncodeStatus.OK) {
            result = appendDataElement(data, offset, length);
        }
        if (result == JsonEncodeStatus.OK) {
            result = endDataElement();
        }
        return result;
    }

    /// Opens a hex data element continued by {@link #appendDataElement} and closed by
    /// {@link #endDataElement()}.
    public JsonEncodeStatus beginDataElement(String name) {
        return beginStringElement(name);
    }

    public JsonEncodeStatus appendDataElement(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        final int end = offset + length;
        for (int i = offset; i < end; i++) {
            final JsonEncodeStatus result = scratch.reserve();
            if (result != JsonEncodeStatus.OK) {
                return result;
            }
            scratch.put(HEX_NYBBLES[(data[i] >> 4) & 0x0F], HEX_NYBBLES[data[i] & 0x0F]);
        }
        return scratch.flush();
    }

    public JsonEncodeStatus endDataElement() {
        return endStringElement();
    }

    // ------------------------------------------------------------------
    // Raw JSON
    // ------------------------------------------------------------------

    /// Adds a pre-encoded JSON value, copied verbatim. A `null` array is written as `null`.
    ///
    /// Only the first non-whitespace byte is checked: it must be able to start a JSON value
    /// (`[`, `{`, `"`, `t`, `f`, `n`, `-` or a digit).
    ///
    /// @return {@link JsonEncodeStatus#INVALID_CHARACTER} for any other first byte and
    ///         {@link JsonEncodeStatus#INVALID_DATA} for an empty or all-whitespace payload,
    ///         in both cases without writing anything
    public JsonEncodeStatus addJsonElement(String name, byte[] json) {
        if (json == null) {
            return addNullElement(name);
        }
        return addJsonElement(name, json, 0, json.length);
    }

    /// Adds a slice of a pre-encoded JSON value; see {@link #addJsonElement(String, byte[])}.
    public JsonEncodeStatus addJsonElement(String name, byte[] json, int offset, int length) {
        if (json == null) {
            return addNullElement(name);
        }
        Objects.checkFromIndexSize(offset, length, json.length);
        final int end = offset + length;
        int index = offset;
        while (index < end && isJsonWhitespace(json[index])) {
            index++;
        }
        final JsonEncodeStatus validation = validateJsonStart(index < end ? (json[index] & 0xFF) : -1);
        if (validation != JsonEncodeStatus.OK) {
            return validation;
        }

        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return sink.addJsonData(json, offset, length);
    }

    /// Adds pre-encoded JSON text, written as UTF-8; see {@link #addJsonElement(String, byte[])}.
    public JsonEncodeStatus addJsonElement(String name, CharSequence json) {
        if (json == null) {
            return addNullElement(name);
        }
        final int length = json.length();
        int index = 0;
        while (index < length && json.charAt(index) < 0x80 && isJsonWhitespace((byte) json.charAt(index))) {
            index++;
        }
        final JsonEncodeStatus validation = validateJsonStart(index < length ? json.charAt(index) : -1);
        if (validation != JsonEncodeStatus.OK) {
            return validation;
        }

        final JsonEncodeStatus result = beginElement(name);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        return appendUtf8(json, 0, length, false);
    }

    /// Passes bytes straight to the sink: no separator, no validation, no escaping.
    public JsonEncodeStatus addRawJsonData(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        return sink.addJsonData(data, offset, length);
    }

    private static JsonEncodeStatus validateJsonStart(int first) {
        if (first < 0) {
            LOG.warning("JSON element contained no JSON data");
            return JsonEncodeStatus.INVALID_DATA;
        }
        switch (first) {
            case '[':
            case '{':
            case '"':
            case 'f':
            case 't':
            case 'n':
            case '-':
            case '0':
            case '1':
            case '2':
            case '3':
            case '4':
            case '5':
            case '6':
            case '7':
            case '8':
            case '9':
                return JsonEncodeStatus.OK;
            default:
                LOG.warning(() -> "Invalid character '" + (char) first + "' at start of JSON element");
                return JsonEncodeStatus.INVALID_CHARACTER;
        }
    }

    private static boolean isJsonWhitespace(byte b) {
        return b == ' ' || b == '\r' || b == '\n' || b == '\t' || b == '\f';
    }

    // ------------------------------------------------------------------
    // Escaping
    // ------------------------------------------------------------------

    private JsonEncodeStatus add(byte[] literal) {
        return sink.addJsonData(literal, 0, literal.length);
    }

    private JsonEncodeStatus addQuotedEscaped(CharSequence value) {
        JsonEncodeStatus result = add(QUOTE);
        if (result != JsonEncodeStatus.OK) {
            return result;
        }
        if ((result = appendUtf8(value, 0, value.length(), true)) != JsonEncodeStatus.OK) {
            return result;
        }
        return add(QUOTE);
    }

    /// Escapes arbitrarily long input one scratch-buffer-sized slice at a time.
    private JsonEncodeStatus appendEscaped(byte[] src, int offset, int length) {
        final int sliceSize = scratch.capacity();
        final int end = offset + length;
        for (int start = offset; start < end; start += sliceSize) {
            final JsonEncodeStatus result = escapeSlice(src, start, Math.min(end, start + sliceSize));
            if (result != JsonEncodeStatus.OK) {
                return result;
            }
        }
        return JsonEncodeStatus.OK;
    }

    private JsonEncodeStatus escapeSlice(byte[] src, int start, int end) {
        JsonEncodeStatus result;
        int i = start;
        while (i < end) {
            // Copy the run of bytes that need no escaping in bulk.
            int runEnd = i;
            while (runEnd < end && needsNoEscape(src[runEnd])) {
                runEnd++;
            }
            while (i < runEnd) {
                i += scratch.putRun(src, i, runEnd - i);
                if (i < runEnd && (result = scratch.flush()) != JsonEncodeStatus.OK) {
                    return result;
                }
            }
            if (i < end) {
                if ((result = scratch.reserve()) != JsonEncodeStatus.OK) {
                    return result;
                }
                putEscaped(src[i]);
                i++;
            }
        }
        return scratch.flush();
    }

    /// Writes `value[start, end)` as UTF-8, one scratch-buffer-sized slice at a time, escaping
    /// when `escape` is set.
    private JsonEncodeStatus appendUtf8(CharSequence value, int start, int end, boolean escape) {
        final int sliceSize = scratch.capacity();
        int i = start;
        while (i < end) {
            final int sliceEnd = Math.min(end, i + sliceSize);
            for (; i < sliceEnd; i++) {
                final JsonEncodeStatus result = scratch.reserve();
                if (result != JsonEncodeStatus.OK) {
                    return result;
                }
                final char c = value.charAt(i);
                if (c < 0x80) {
                    if (escape) {
                        putEscaped((byte) c);
                    } else {
                        scratch.put((byte) c);
                    }
                } else if (c < 0x800) {
                    scratch.put((byte) (0xC0 | (c >> 6)), (byte) (0x80 | (c & 0x3F)));
                } else if (Character.isSurrogate(c)) {
                    if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(value.charAt(i + 1))) {
                        final int codePoint = Character.toCodePoint(c, value.charAt(++i));
                        scratch.put((byte) (0xF0 | (codePoint >> 18)), (byte) (0x80 | ((codePoint >> 12) & 0x3F)));
                        scratch.put((byte) (0x80 | ((codePoint >> 6) & 0x3F)), (byte) (0x80 | (codePoint & 0x3F)));
                    } else {
                        scratch.put(UTF8_REPLACEMENT);
                    }
                } else {
                    scratch.put((byte) (0xE0 | (c >> 12)));
                    scratch.put((byte) (0x80 | ((c >> 6) & 0x3F)), (byte) (0x80 | (c & 0x3F)));
                }
            }
            final JsonEncodeStatus result = scratch.flush();
            if (result != JsonEncodeStatus.OK) {
                return result;
            }
        }
        return JsonEncodeStatus.OK;
    }

    private static boolean needsNoEscape(byte b) {
        return b != '\\' && b != '"' && (b & 0xFF) >= 0x20;
    }

    /// Writes one input byte, escaped if needed. The caller must have reserved room.
    private void putEscaped(byte b) {
        switch (b) {
            case '\\':
            case '"':
                scratch.put((byte) '\\', b);
                break;
            case '\b':
                scratch.put((byte) '\\', (byte) 'b');
                break;
            case '\f':
                scratch.put((byte) '\\', (byte) 'f');
                break;
            case '\n':
                scratch.put((byte) '\\', (byte) 'n');
                break;
            case '\r':
                scratch.put((byte) '\\', (byte) 'r');
                break;
            case '\t':
                scratch.put((byte) '\\', (byte) 't');
                break;
            default:
                if ((b & 0xFF) < 0x20) {
                    scratch.put((byte) '\\', (byte) 'u');
                    scratch.put((byte) '0', (byte) '0');
                    scratch.put(HEX_NYBBLES[(b >> 4) & 0x0F], HEX_NYBBLES[b & 0x0F]);
                } else {
                    scratch.put(b);
                }
                break;
        }
    }
}
