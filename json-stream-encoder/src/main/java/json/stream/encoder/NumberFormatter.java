package json.stream.encoder;

/// Writes integers and doubles as ASCII decimal text straight into a caller-supplied buffer.
///
/// None of the methods allocate, consult the default locale, or go through
/// {@link String#valueOf}/{@link Double#toString}. Each returns the number of bytes written;
/// nothing is terminated.
///
/// Doubles are written with a fixed number of significant digits, rounded half-up, and in
/// exponent form whenever the decimal exponent is not zero:
///
/// | value        | text          |
/// |--------------|---------------|
/// | `1.5`        | `1.5`         |
/// | `1234.5678`  | `1.234568e+3` |
/// | `0.001`      | `1e-3`        |
/// | `-0.0`       | `0`           |
/// | `NaN`        | `nan`         |
/// | `±Infinity`  | `inf`         |
///
/// The format is stable: existing consumers compare these bytes exactly, so it must not be
/// swapped for a general-purpose formatter.
public final class NumberFormatter {

    /// Significant digits used for doubles by {@link JsonEncoder}.
    public static final int MAX_SIGNIFICANT_DIGITS = 7;

    /// Longest output of {@link #formatUnsigned}: `18446744073709551615`.
    public static final int MAX_UNSIGNED_LENGTH = 20;

    /// Longest output of {@link #formatSigned}: `-9223372036854775808`.
    public static final int MAX_SIGNED_LENGTH = 20;

    /// Upper bound on the output of {@link #formatDouble} at {@link #MAX_SIGNIFICANT_DIGITS}.
    public static final int MAX_DOUBLE_LENGTH = 20;

    /// Upper bound for significant digits: `10^digits` must still fit in a `long`.
    static final int SIGNIFICANT_DIGITS_LIMIT = 17;

    /// Largest double below 10. A normalised mantissa above this really belongs to the next
    /// decade (0.1, 0.01, ... normalise to 10.000...01).
    private static final double NORMALIZED_CEILING = 9.99999999999999822364316059975;

    /// Below this exponent `10^exponent` is no longer a normal double.
    private static final int MIN_NORMAL_POWER = -307;
    private static final int SUBNORMAL_SHIFT = 100;
    private static final double SUBNORMAL_SCALE = 1e100;

    private static final byte[] NAN = {'n', 'a', 'n'};
    private static final byte[] INF = {'i', 'n', 'f'};

    private NumberFormatter() {
        throw new AssertionError("NumberFormatter cannot be instantiated");
    }

    /// Writes `value`, read as an unsigned 64-bit integer, in minimal decimal form.
    ///
    /// @param value  the bits of an unsigned 64-bit integer
    /// @param dst    destination buffer with room for {@link #MAX_UNSIGNED_LENGTH} bytes
    /// @param offset index of the first byte to write
    /// @return the number of bytes written
    public static int formatUnsigned(long value, byte[] dst, int offset) {
        if (value == 0) {
            dst[offset] = '0';
            return 1;
        }
        int length = 0;
        for (long v = value; v != 0; v = Long.divideUnsigned(v, 10)) {
            length++;
        }
        long v = value;
        for (int i = offset + length - 1; i >= offset; i--) {
            dst[i] = (byte) ('0' + Long.remainderUnsigned(v, 10));
            v = Long.divideUnsigned(v, 10);
        }
        return length;
    }

    /// Writes a signed 64-bit integer in minimal decimal form.
    ///
    /// @param value  the value
    /// @param dst    destination buffer with room for {@link #MAX_SIGNED_LENGTH} bytes
    /// @param offset index of the first byte to write
    /// @return the number of bytes written
    public static int formatSigned(long value, byte[] dst, int offset) {
        if (value < 0) {
            dst[offset] = '-';
            // -Long.MIN_VALUE wraps to itself, whose unsigned reading is 2^63.
            return formatUnsigned(-value, dst, offset + 1) + 1;
        }
        return formatUnsigned(value, dst, offset);
    }

    /// Writes a double with at most `maxSignificantDigits` significant digits.
    ///
    /// @param value                the value
    /// @param dst                  destination buffer
    /// @param offset               index of the first byte to write
    /// @param maxSignificantDigits digits to keep, between 1 and 17
    /// @return the number of bytes written
    /// @throws IllegalArgumentException if `maxSignificantDigits` is out of range
    public static int formatDouble(double value, byte[] dst, int offset, int maxSignificantDigits) {
        if (maxSignificantDigits < 1 || maxSignificantDigits > SIGNIFICANT_DIGITS_LIMIT) {
            throw new IllegalArgumentException("maxSignificantDigits must be between 1 and "
                    + SIGNIFICANT_DIGITS_LIMIT + ", got: " + maxSignificantDigits);
        }
        // Negative infinity is written unsigned, like positive infinity.
        if (value < 0 && value != Double.NEGATIVE_INFINITY) {
            dst[offset] = '-';
            return formatPositiveDouble(-value, dst, offset + 1, maxSignificantDigits) + 1;
        }
        return formatPositiveDouble(Math.abs(value), dst, offset, maxSignificantDigits);
    }

    /// Writes a double using {@link #MAX_SIGNIFICANT_DIGITS}.
    public static int formatDouble(double value, byte[] dst, int offset) {
        return formatDouble(value, dst, offset, MAX_SIGNIFICANT_DIGITS);
    }

    private static int formatPositiveDouble(double value, byte[] dst, int offset, int maxSignificantDigits) {
        if (value == 0) {
            dst[offset] = '0';
            return 1;
        }
        if (Double.isNaN(value)) {
            return copy(NAN, dst, offset);
        }
        if (Double.isInfinite(value)) {
            return copy(INF, dst, offset);
        }

        // The cast truncates toward zero, so values below 1 need one more step down.
        int exponent = (int) Math.log10(value);
        if (value < 1.0) {
            exponent--;
        }

        double normalized = scaleDown(value, exponent);
        if (normalized > NORMALIZED_CEILING) {
            exponent++;
            normalized = scaleDown(value, exponent);
        }

        final double digitsAndRemainder = normalized * Math.pow(10, maxSignificantDigits - 1);
        long digits = (long) digitsAndRemainder;
        // 0.5 is exact in binary, so this is a true half-up comparison.
        if (digitsAndRemainder - digits >= 0.5) {
            digits++;
            if (digits >= (long) Math.pow(10, maxSignificantDigits)) {
                exponent++;
                digits /= 10;
            }
        }

        for (int i = maxSignificantDigits; i > 1; i--) {
            dst[offset + i] = (byte) ('0' + digits % 10);
            digits /= 10;
        }
        dst[offset] = (byte) ('0' + digits);
        dst[offset + 1] = '.';

        // Strip trailing zeros, and the '.' as well when nothing follows it.
        int end = maxSignificantDigits;
        for (int i = maxSignificantDigits; i > 0; i--) {
            if (dst[offset + i] != '0') {
                end = dst[offset + i] == '.' ? i : i + 1;
                break;
            }
        }

        int pos = offset + end;
        if (exponent != 0) {
            dst[pos++] = 'e';
            if (exponent > 0) {
                dst[pos++] = '+';
            }
            pos += formatSigned(exponent, dst, pos);
        }
        return pos - offset;
    }

    /// Computes `value / 10^exponent`, splitting the division when `10^exponent` would underflow.
    private static double scaleDown(double value, int exponent) {
        if (exponent < MIN_NORMAL_POWER) {
            return (value * SUBNORMAL_SCALE) / Math.pow(10, exponent + SUBNORMAL_SHIFT);
        }
        return value / Math.pow(10, exponent);
    }

    private static int copy(byte[] literal, byte[] dst, int offset) {
        System.arraycopy(literal, 0, dst, offset, literal.length);
        return literal.length;
    }
}
