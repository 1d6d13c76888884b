package json.stream.encoder;

/// Receives the finished byte runs produced by a {@link JsonEncoder}.
///
/// Runs arrive in document order and each run is delivered exactly once. The array passed in
/// is owned by the encoder (a reused scratch buffer or a shared literal table): implementations
/// must copy what they need before returning and must never write into it.
///
/// Any state a sink needs, such as a stream or a buffer, is captured by the implementation.
@FunctionalInterface
public interface JsonSink {

    /// Accepts `length` bytes of encoded JSON starting at `offset`.
    ///
    /// @param data   the encoder-owned bytes
    /// @param offset index of the first byte to consume
    /// @param length number of bytes to consume, possibly zero
    /// @return {@link JsonEncodeStatus#OK} if the bytes were taken, otherwise a failure status
    ///         (conventionally {@link JsonEncodeStatus#CANNOT_ADD_DATA})
    JsonEncodeStatus addJsonData(byte[] data, int offset, int length);
}
