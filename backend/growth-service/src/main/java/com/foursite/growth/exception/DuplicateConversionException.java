package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

public class DuplicateConversionException extends GrowthException {

    public DuplicateConversionException(String referrerId, String refereeId) {
        super("DUPLICATE_CONVERSION", HttpStatus.CONFLICT,
                "Referral " + referrerId + " -> " + refereeId + " already converted");
    }
}
