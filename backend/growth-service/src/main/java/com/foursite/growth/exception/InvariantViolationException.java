package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal consistency check failed. Never retried.
 */
public class InvariantViolationException extends GrowthException {

    public InvariantViolationException(String message) {
        super("INVARIANT_VIOLATION", HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
