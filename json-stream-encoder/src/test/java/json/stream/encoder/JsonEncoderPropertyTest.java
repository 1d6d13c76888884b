package json.stream.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Checks encoder output against an independent parser.
class JsonEncoderPropertyTest extends JsonEncoderLoggingConfig {

    static final Logger LOG = Logger.getLogger(JsonEncoderPropertyTest.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Property(tries = 500)
    void anyStringSurvivesEscaping(@ForAll String value, @ForAll boolean pretty) throws Exception {
        final var text = JsonEncoder.encodeToString(pretty, e -> {
            e.beginObject(null).orThrow("beginObject");
            return e.addStringElement(value, value);
        });
        // Unpaired surrogates are replaced the same way String.getBytes replaces them.
        final var expected = new String(value.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        final JsonNode tree = MAPPER.readTree(text);
        assertThat(tree.get(expected).asText()).isEqualTo(expected);
    }

    @Property(tries = 500)
    void anyAsciiBytesSurviveEscaping(@ForAll("asciiBytes") byte[] value) throws Exception {
        final var sink = new ByteArrayJsonSink();
        final var encoder = new JsonEncoder(4, 16);
        encoder.beginEncode(false, sink);
        assertThat(encoder.addStringElement(null, value, 0, value.length)).isEqualTo(JsonEncodeStatus.OK);

        assertThat(MAPPER.readValue(sink.toByteArray(), String.class))
                .isEqualTo(new String(value, StandardCharsets.US_ASCII));
    }

    @Property(tries = 200)
    void nestedStructuresAreWellFormed(@ForAll("shapes") List<Integer> shape, @ForAll boolean pretty) throws Exception {
        final var sink = new ByteArrayJsonSink();
        final var encoder = new JsonEncoder();
        encoder.beginEncode(pretty, sink);
        encoder.beginArray(null).orThrow("root");
        int opened = 1;
        for (final int step : shape) {
            switch (step) {
                case 0 -> encoder.beginObject("o" + opened++);
                case 1 -> encoder.beginArray("a" + opened++);
                case 2 -> encoder.addIntegerElement("i", step);
                case 3 -> encoder.addFloatingPointElement("f", 1.5);
                case 4 -> encoder.addStringElement("s", "x\"y");
                default -> {
                    if (encoder.depth() > 1) {
                        encoder.endContainer();
                    }
                }
            }
        }
        assertThat(encoder.endEncode()).isEqualTo(JsonEncodeStatus.OK);
        LOG.finest(() -> sink.toString());

        assertThat(MAPPER.readTree(sink.toString()).isArray()).isTrue();
    }

    @Provide
    Arbitrary<List<Integer>> shapes() {
        return Arbitraries.integers().between(0, 5).list().ofMaxSize(40);
    }

    @Provide
    Arbitrary<byte[]> asciiBytes() {
        return Arbitraries.bytes().between((byte) 0, (byte) 127).array(byte[].class).ofMaxSize(200);
    }
}
