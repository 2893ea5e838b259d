package com.example.thumbgen_backend.exception;

/**
 * Failure talking to an external provider. {@code statusCode} is -1 when no HTTP response was received.
 */
public class ProviderException extends RuntimeException {
    private final int statusCode;

    public ProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isUnauthorized() {
        return statusCode == 401 || statusCode == 403;
    }
}
