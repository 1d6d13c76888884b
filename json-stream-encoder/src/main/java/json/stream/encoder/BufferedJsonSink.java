package json.stream.encoder;

import java.util.Objects;

/// Fixed-capacity buffer in front of another sink.
///
/// The buffer is allocated once, so buffering never allocates. Runs are gathered until the next
/// one would not fit, then the buffer drains to the downstream sink; a run at least as large
/// as the whole buffer bypasses it. Call {@link #flush()} once the session has ended.
///
/// A downstream failure is returned from the write that triggered the drain; the buffered
/// bytes are dropped.
public final class BufferedJsonSink implements JsonSink {

    private final JsonSink downstream;
    private final byte[] buffer;
    private int position;

    public BufferedJsonSink(JsonSink downstream, int capacity) {
        this.downstream = Objects.requireNonNull(downstream, "downstream must not be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.buffer = new byte[capacity];
    }

    @Override
    public JsonEncodeStatus addJsonData(byte[] data, int offset, int length) {
        if (length > buffer.length - position) {
            final JsonEncodeStatus result = flush();
            if (result != JsonEncodeStatus.OK) {
                return result;
            }
            if (length >= buffer.length) {
                return downstream.addJsonData(data, offset, length);
            }
        }
        System.arraycopy(data, offset, buffer, position, length);
        position += length;
        return JsonEncodeStatus.OK;
    }

    /// Hands all buffered bytes to the downstream sink.
    public JsonEncodeStatus flush() {
        if (position == 0) {
            return JsonEncodeStatus.OK;
        }
        final int length = position;
        position = 0;
        return downstream.addJsonData(buffer, 0, length);
    }

    /// {@return the number of bytes waiting to be flushed}
    public int pending() {
        return position;
    }
}
