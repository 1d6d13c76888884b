package json.stream.encoder;

import java.util.Objects;

/// Exception thrown by the convenience entry points when an encoding session fails.
///
/// The low-level {@link JsonEncoder} operations never throw this; they return a
/// {@link JsonEncodeStatus} instead.
public final class JsonEncodeException extends RuntimeException {

    private final JsonEncodeStatus status;

    public JsonEncodeException(JsonEncodeStatus status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public JsonEncodeException(JsonEncodeStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    /// {@return the status that caused the failure}
    public JsonEncodeStatus status() {
        return status;
    }
}
