package com.livemart.marketplace.security;

import com.livemart.marketplace.exception.ForbiddenException;
import com.livemart.marketplace.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthInterceptorTest {

    private final JwtTokenProvider tokenProvider = new JwtTokenProvider(
            "unit-test-secret-for-livemart-tokens-0123456789", Duration.ofHours(1));

    @Test
    void shouldAttachUserWhenTokenMatchesPath() {
        AuthInterceptor interceptor = new AuthInterceptor(tokenProvider, true);
        MockHttpServletRequest request = request("user-1", tokenProvider.issue("user-1", "a@b.c", Instant.now()));

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(request.getAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE))
                .isEqualTo(new AuthenticatedUser("user-1", "a@b.c"));
    }

    @Test
    void shouldRefuseTokenOfAnotherUser() {
        AuthInterceptor interceptor = new AuthInterceptor(tokenProvider, true);
        MockHttpServletRequest request = request("user-2", tokenProvider.issue("user-1", "a@b.c", Instant.now()));

        assertThatThrownBy(() -> interceptor.preHandle(request, new MockHttpServletResponse(), new Object()))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void shouldRequireTokenWhenConfigured() {
        AuthInterceptor interceptor = new AuthInterceptor(tokenProvider, true);

        assertThatThrownBy(() -> interceptor.preHandle(request("user-1", null), new MockHttpServletResponse(), new Object()))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void shouldLetAnonymousRequestThroughWhenNotRequired() {
        AuthInterceptor interceptor = new AuthInterceptor(tokenProvider, false);

        assertThat(interceptor.preHandle(request("user-1", null), new MockHttpServletResponse(), new Object())).isTrue();
    }

    @Test
    void shouldRejectInvalidTokenEvenWhenNotRequired() {
        AuthInterceptor interceptor = new AuthInterceptor(tokenProvider, false);

        assertThatThrownBy(() -> interceptor.preHandle(request("user-1", "bogus"), new MockHttpServletResponse(), new Object()))
                .isInstanceOf(UnauthorizedException.class);
    }

    private static MockHttpServletRequest request(String pathUserId, String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/cart/" + pathUserId);
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("userId", pathUserId));
        if (token != null) {
            request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return request;
    }
}
