package com.livemart.marketplace.exception;

import org.springframework.http.HttpStatus;

/**
 * The document store timed out or could not be reached. The caller may retry.
 */
public class StoreUnavailableException extends MarketplaceException {

    public StoreUnavailableException(String reason, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "UNAVAILABLE", reason, cause);
    }
}
