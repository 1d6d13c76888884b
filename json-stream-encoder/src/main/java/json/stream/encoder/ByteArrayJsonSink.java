package json.stream.encoder;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// Collects the encoded document in a growable in-memory buffer.
///
/// Growing the buffer allocates, so this sink suits ordinary callers and tests rather than
/// allocation-sensitive paths; those should use {@link BufferedJsonSink} in front of a
/// pre-opened destination.
public final class ByteArrayJsonSink implements JsonSink {

    private byte[] buffer;
    private int size;

    public ByteArrayJsonSink() {
        this(256);
    }

    public ByteArrayJsonSink(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must not be negative, got: " + initialCapacity);
        }
        this.buffer = new byte[initialCapacity];
    }

    @Override
    public JsonEncodeStatus addJsonData(byte[] data, int offset, int length) {
        if (size + length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + length));
        }
        System.arraycopy(data, offset, buffer, size, length);
        size += length;
        return JsonEncodeStatus.OK;
    }

    /// {@return the number of bytes collected so far}
    public int size() {
        return size;
    }

    /// {@return a copy of the bytes collected so far}
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /// Discards the collected bytes, keeping the buffer for reuse.
    public void reset() {
        size = 0;
    }

    /// {@return the collected bytes decoded as UTF-8}
    @Override
    public String toString() {
        return new String(buffer, 0, size, StandardCharsets.UTF_8);
    }
}
