package json.stream.encoder;

import net.jqwik.api.*;

import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Round-trip properties of the hand-written number formatting.
class NumberFormatterPropertyTest extends JsonEncoderLoggingConfig {

    static final Logger LOG = Logger.getLogger(NumberFormatterPropertyTest.class.getName());

    /// Relative error allowed after rounding to seven significant digits.
    private static final double SEVEN_DIGIT_TOLERANCE = 1e-6;

    private final byte[] buffer = new byte[32];

    @Property
    void unsignedRoundTrips(@ForAll long value) {
        final int length = NumberFormatter.formatUnsigned(value, buffer, 0);
        final var text = new String(buffer, 0, length, StandardCharsets.US_ASCII);

        assertThat(Long.parseUnsignedLong(text)).isEqualTo(value);
        assertThat(text).doesNotStartWith("-");
        assertThat(text.length() == 1 || text.charAt(0) != '0').isTrue();
    }

    @Property
    void signedRoundTrips(@ForAll long value) {
        final int length = NumberFormatter.formatSigned(value, buffer, 0);
        final var text = new String(buffer, 0, length, StandardCharsets.US_ASCII);

        assertThat(Long.parseLong(text)).isEqualTo(value);
    }

    @Example
    void signedBoundaries() {
        for (long value : new long[]{Long.MIN_VALUE, Long.MIN_VALUE + 1, -1, 0, 1, Long.MAX_VALUE}) {
            signedRoundTrips(value);
        }
    }

    @Property(tries = 2000)
    void finiteDoublesRoundTripWithinSevenSignificantDigits(@ForAll double value) {
        Assume.that(Double.isFinite(value));
        final int length = NumberFormatter.formatDouble(value, buffer, 0);
        final var text = new String(buffer, 0, length, StandardCharsets.US_ASCII);
        LOG.finest(() -> value + " -> " + text);

        assertThat(length).isLessThanOrEqualTo(NumberFormatter.MAX_DOUBLE_LENGTH);
        assertThat(significantDigits(text)).isLessThanOrEqualTo(NumberFormatter.MAX_SIGNIFICANT_DIGITS);

        final double parsed = Double.parseDouble(text);
        if (value == 0) {
            assertThat(parsed).isZero();
        } else {
            assertThat(Math.abs(parsed - value) / Math.abs(value)).isLessThanOrEqualTo(SEVEN_DIGIT_TOLERANCE);
            assertThat(Math.signum(parsed)).isEqualTo(Math.signum(value));
        }
    }

    @Property
    void wholeNumbersBelowTenMillionAreExact(@ForAll("smallWholeNumbers") long value) {
        final int length = NumberFormatter.formatDouble(value, buffer, 0);
        final var text = new String(buffer, 0, length, StandardCharsets.US_ASCII);

        assertThat(Double.parseDouble(text)).isEqualTo((double) value);
    }

    @Provide
    Arbitrary<Long> smallWholeNumbers() {
        return Arbitraries.longs().between(-9_999_999L, 9_999_999L);
    }

    private static int significantDigits(String text) {
        final int exponentAt = text.indexOf('e');
        final var mantissa = exponentAt < 0 ? text : text.substring(0, exponentAt);
        int count = 0;
        for (int i = 0; i < mantissa.length(); i++) {
            if (Character.isDigit(mantissa.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
