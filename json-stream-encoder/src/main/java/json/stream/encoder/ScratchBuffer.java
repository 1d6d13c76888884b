package json.stream.encoder;

/// Fixed-size staging area that drains to a {@link JsonSink} before it can overflow.
///
/// Writers call {@link #reserve()} before emitting one logical unit (a plain byte, an escape
/// sequence, a UTF-8 encoded char or a hex pair). `reserve` flushes whenever fewer than
/// {@link #HEADROOM} bytes remain, so a unit of up to six bytes always fits and input of any
/// length passes through in constant space.
final class ScratchBuffer {

    /// Worst-case expansion of one input unit: a six-byte control-character escape.
    static final int HEADROOM = 6;

    /// Smallest capacity accepted, leaving room for a few units between flushes.
    static final int MIN_CAPACITY = 16;

    private final byte[] buffer;
    private JsonSink sink;
    private int position;

    ScratchBuffer(int capacity) {
        if (capacity < MIN_CAPACITY) {
            throw new IllegalArgumentException("scratch buffer capacity must be at least " + MIN_CAPACITY + ", got: " + capacity);
        }
        this.buffer = new byte[capacity];
    }

    /// Binds the buffer to the sink of a new session and discards anything pending.
    void reset(JsonSink sink) {
        this.sink = sink;
        this.position = 0;
    }

    int capacity() {
        return buffer.length;
    }

    int pending() {
        return position;
    }

    /// Makes sure at least {@link #HEADROOM} bytes are free, flushing if necessary.
    JsonEncodeStatus reserve() {
        if (buffer.length - position < HEADROOM) {
            return flush();
        }
        return JsonEncodeStatus.OK;
    }

    /// Appends one byte. The caller must have reserved room.
    void put(byte b) {
        buffer[position++] = b;
    }

    void put(byte first, byte second) {
        buffer[position++] = first;
        buffer[position++] = second;
    }

    /// Copies as many bytes of `src` as fit before the headroom mark and returns how many were taken.
    int putRun(byte[] src, int offset, int length) {
        final int room = buffer.length - HEADROOM - position;
        if (room <= 0) {
            return 0;
        }
        final int count = Math.min(room, length);
        System.arraycopy(src, offset, buffer, position, count);
        position += count;
        return count;
    }

    /// Hands everything pending to the sink. Pending bytes are discarded even when the sink fails.
    JsonEncodeStatus flush() {
        if (position == 0) {
            return JsonEncodeStatus.OK;
        }
        final int length = position;
        position = 0;
        return sink.addJsonData(buffer, 0, length);
    }
}
