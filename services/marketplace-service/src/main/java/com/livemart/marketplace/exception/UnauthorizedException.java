package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends MarketplaceException {

    public UnauthorizedException(String reason) {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", reason);
    }
}
