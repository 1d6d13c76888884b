package json.stream.encoder;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes encoded runs straight to an {@link OutputStream}.
///
/// An {@link IOException} is logged and reported as {@link JsonEncodeStatus#CANNOT_ADD_DATA};
/// the first one is kept and available from {@link #failure()}. No buffering is done here:
/// wrap the stream, or put a {@link BufferedJsonSink} in front, when the stream is unbuffered.
public final class OutputStreamJsonSink implements JsonSink, Closeable {

    private static final Logger LOG = Logger.getLogger(OutputStreamJsonSink.class.getName());

    private final OutputStream out;
    private IOException failure;

    public OutputStreamJsonSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public JsonEncodeStatus addJsonData(byte[] data, int offset, int length) {
        try {
            out.write(data, offset, length);
            return JsonEncodeStatus.OK;
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            }
            LOG.warning(() -> "Cannot write " + length + " bytes of JSON: " + e.getMessage());
            return JsonEncodeStatus.CANNOT_ADD_DATA;
        }
    }

    /// {@return the first write failure, or `null` if every write succeeded}
    public IOException failure() {
        return failure;
    }

    /// Flushes the underlying stream.
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
