package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

/**
 * The target exists but its state does not allow the operation
 */
public class ConflictException extends GrowthException {

    public ConflictException(String code, String message) {
        super(code, HttpStatus.CONFLICT, message);
    }
}
