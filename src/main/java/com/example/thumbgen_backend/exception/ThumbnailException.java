package com.example.thumbgen_backend.exception;

import org.springframework.web.server.ResponseStatusException;

/**
 * Pipeline error with a stable kind and an upper-snake reason code, rendered by Spring's default error handling.
 */
public class ThumbnailException extends ResponseStatusException {
    private final ErrorKind kind;

    public ThumbnailException(ErrorKind kind, String code) {
        super(kind.status(), code);
        this.kind = kind;
    }

    public ThumbnailException(ErrorKind kind, String code, Throwable cause) {
        super(kind.status(), code, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ThumbnailException invalid(String code) {
        return new ThumbnailException(ErrorKind.INVALID_INPUT, code);
    }

    public static ThumbnailException notFound(String code) {
        return new ThumbnailException(ErrorKind.NOT_FOUND, code);
    }

    public static ThumbnailException forbidden(String code) {
        return new ThumbnailException(ErrorKind.FORBIDDEN, code);
    }

    public static ThumbnailException conflict(String code) {
        return new ThumbnailException(ErrorKind.CONFLICT, code);
    }

    public static ThumbnailException external(String code) {
        return new ThumbnailException(ErrorKind.EXTERNAL_FAILURE, code);
    }

    public static ThumbnailException external(String code, Throwable cause) {
        return new ThumbnailException(ErrorKind.EXTERNAL_FAILURE, code, cause);
    }
}
