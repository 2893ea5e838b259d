package com.example.thumbgen_backend.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT),
    EXTERNAL_FAILURE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
