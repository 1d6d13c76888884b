package json.stream.encoder;

/// The body of an encoding session passed to {@link JsonEncoder#encodeToString(boolean, JsonEncoding)}.
@FunctionalInterface
public interface JsonEncoding {

    /// Issues the calls that make up one document.
    ///
    /// @param encoder an encoder whose session has already begun
    /// @return {@link JsonEncodeStatus#OK}, or the first failure returned by `encoder`
    JsonEncodeStatus encode(JsonEncoder encoder);
}
