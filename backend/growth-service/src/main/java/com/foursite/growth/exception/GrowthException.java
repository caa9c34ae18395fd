package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of all business errors raised by the growth engine
 */
public class GrowthException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // stable machine-readable code
    private final String code;
    private final HttpStatus status;
    private final boolean retryable;

    public GrowthException(String code, HttpStatus status, String message) {
        this(code, status, message, false, null);
    }

    public GrowthException(String code, HttpStatus status, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
