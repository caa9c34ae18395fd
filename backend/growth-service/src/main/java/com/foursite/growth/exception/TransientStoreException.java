package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

/**
 * The store stayed unavailable after retries. Callers resend with the same idempotency key.
 */
public class TransientStoreException extends GrowthException {

    public TransientStoreException(String message, Throwable cause) {
        super("TRANSIENT_STORE_ERROR", HttpStatus.SERVICE_UNAVAILABLE, message, true, cause);
    }
}
