package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised while loading configuration with an unusable threshold, duration or rate
 */
public class InvalidThresholdException extends GrowthException {

    public InvalidThresholdException(String message) {
        super("INVALID_THRESHOLD", HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
