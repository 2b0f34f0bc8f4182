package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends MarketplaceException {

    public ForbiddenException(String reason) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", reason);
    }
}
