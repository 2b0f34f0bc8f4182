package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class BadRequestException extends MarketplaceException {

    public BadRequestException(String reason) {
        super(HttpStatus.BAD_REQUEST, "BAD_REQUEST", reason);
    }
}
