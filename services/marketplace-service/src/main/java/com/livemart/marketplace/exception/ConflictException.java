package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends MarketplaceException {

    public ConflictException(String reason, Throwable cause) {
        super(HttpStatus.CONFLICT, "CONFLICT", reason, cause);
    }
}
