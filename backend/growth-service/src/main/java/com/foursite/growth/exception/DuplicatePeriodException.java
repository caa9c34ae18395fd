package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class DuplicatePeriodException extends GrowthException {

    public DuplicatePeriodException(UUID referralEdgeId, String period) {
        super("DUPLICATE_PERIOD", HttpStatus.CONFLICT,
                "Period " + period + " already settled for referral " + referralEdgeId);
    }
}
