package com.livemart.marketplace.security;

import com.livemart.marketplace.exception.ForbiddenException;
import com.livemart.marketplace.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Attaches the acting user to requests on user-scoped routes. A token whose user differs from the
 * {@code userId} path variable is refused.
 */
@Component
public class AuthInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String USER_ID_VARIABLE = "userId";

    private final JwtTokenProvider tokenProvider;
    private final boolean required;

    public AuthInterceptor(JwtTokenProvider tokenProvider,
                           @Value("${marketplace.auth.required:true}") boolean required) {
        this.tokenProvider = tokenProvider;
        this.required = required;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            if (required) {
                throw new UnauthorizedException("Missing bearer token");
            }
            return true;
        }
        if (!header.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Authorization header must use the Bearer scheme");
        }

        AuthenticatedUser user = tokenProvider.verify(header.substring(BEARER_PREFIX.length()).trim());

        String pathUserId = pathVariables(request).get(USER_ID_VARIABLE);
        if (pathUserId != null && !pathUserId.equals(user.userId())) {
            throw new ForbiddenException("Token does not belong to user " + pathUserId);
        }
        request.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, user);
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
    }
}
