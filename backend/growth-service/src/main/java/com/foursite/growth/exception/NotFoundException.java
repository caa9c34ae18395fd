package com.foursite.growth.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends GrowthException {

    public NotFoundException(String code, String message) {
        super(code, HttpStatus.NOT_FOUND, message);
    }

    public static NotFoundException site(String siteId) {
        return new NotFoundException("SITE_NOT_FOUND", "Site not found: " + siteId);
    }

    public static NotFoundException member(String userId) {
        return new NotFoundException("MEMBER_NOT_FOUND", "Member not found: " + userId);
    }
}
