package json.stream.encoder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonEncoderConfigTest extends JsonEncoderLoggingConfig {

    private static final String KEY = JsonEncoderConfig.MAX_DEPTH_PROPERTY;

    @Test
    void absentPropertyUsesDefault() {
        assertThat(JsonEncoderConfig.parse(KEY, null, 200, 1, 1000)).isEqualTo(200);
    }

    @Test
    void validPropertyIsUsed() {
        assertThat(JsonEncoderConfig.parse(KEY, " 64 ", 200, 1, 1000)).isEqualTo(64);
    }

    @Test
    void nonNumericPropertyFallsBack() {
        assertThat(JsonEncoderConfig.parse(KEY, "deep", 200, 1, 1000)).isEqualTo(200);
    }

    @Test
    void outOfRangePropertyFallsBack() {
        assertThat(JsonEncoderConfig.parse(KEY, "0", 200, 1, 1000)).isEqualTo(200);
        assertThat(JsonEncoderConfig.parse(KEY, "1001", 200, 1, 1000)).isEqualTo(200);
    }

    @Test
    void configuredValuesAreWithinLimits() {
        assertThat(JsonEncoderConfig.maxDepth()).isBetween(1, JsonEncoderConfig.MAX_DEPTH_LIMIT);
        assertThat(JsonEncoderConfig.workBufferSize())
                .isBetween(ScratchBuffer.MIN_CAPACITY, JsonEncoderConfig.WORK_BUFFER_SIZE_LIMIT);
    }
}
