package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Base of every failure the API reports with a stable error code next to the HTTP status.
 */
public abstract class MarketplaceException extends ResponseStatusException {

    private final String code;

    protected MarketplaceException(HttpStatus status, String code, String reason) {
        super(status, reason);
        this.code = code;
    }

    protected MarketplaceException(HttpStatus status, String code, String reason, Throwable cause) {
        super(status, reason, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
