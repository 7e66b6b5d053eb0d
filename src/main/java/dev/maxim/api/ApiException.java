package dev.maxim.api;

import java.util.OptionalInt;
import javax.annotation.Nullable;

/** Thrown when a call to the Maxim API fails or returns an error response. */
public class ApiException extends RuntimeException {
    private final @Nullable Integer statusCode;

    public ApiException(String message) {
        this(message, (Throwable) null);
    }

    public ApiException(String message, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public ApiException(Throwable cause) {
        super(cause);
        this.statusCode = null;
    }

    /** A non-2xx response. */
    public ApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response, empty when no response was received. */
    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
