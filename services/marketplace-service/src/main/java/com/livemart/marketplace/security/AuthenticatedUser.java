package com.livemart.marketplace.security;

/**
 * Identity decoded from a verified bearer token.
 */
public record AuthenticatedUser(String userId, String email) {

    public static final String REQUEST_ATTRIBUTE = "livemart.authenticatedUser";
}
