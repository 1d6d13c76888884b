package json.stream.encoder;

/// Result of every {@link JsonEncoder} operation and every {@link JsonSink} write.
///
/// Encoding paths report failures by value rather than by throwing so that they can run
/// where unwinding and allocation are unwelcome. Callers that prefer exceptions can bridge
/// with {@link #orThrow(String)}.
public enum JsonEncodeStatus {
    /// The operation completed and all of its bytes reached the sink.
    OK("OK"),
    /// A structural or content check failed, e.g. a raw JSON fragment that cannot start a value.
    INVALID_CHARACTER("Invalid character"),
    /// The sink refused a write.
    CANNOT_ADD_DATA("Cannot add data"),
    /// Reserved for partial-document conditions.
    INCOMPLETE("Incomplete data"),
    /// The call itself was malformed, e.g. a missing member name inside an object.
    INVALID_DATA("Invalid data"),
    /// Opening another container would exceed the encoder's fixed nesting capacity.
    DEPTH_EXCEEDED("Maximum depth exceeded");

    private final String description;

    JsonEncodeStatus(String description) {
        this.description = description;
    }

    /// {@return the human-readable description of this status}
    public String description() {
        return description;
    }

    /// {@return `true` if this is {@link #OK}}
    public boolean isOk() {
        return this == OK;
    }

    /// Converts a failure status into a {@link JsonEncodeException}.
    ///
    /// @param operation short name of what was being encoded, used in the exception message
    /// @return this status, which is always {@link #OK}
    /// @throws JsonEncodeException if this status is not {@link #OK}
    public JsonEncodeStatus orThrow(String operation) {
        if (this != OK) {
            throw new JsonEncodeException(this, operation + " failed: " + description);
        }
        return this;
    }
}
