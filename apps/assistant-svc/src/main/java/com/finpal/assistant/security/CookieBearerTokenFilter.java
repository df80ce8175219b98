package com.finpal.assistant.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;

/**
 * Lets browser pages authenticate with the cookie set at login: upgrades it into an
 * Authorization: Bearer header. An explicit Authorization header is left untouched.
 */
public class CookieBearerTokenFilter extends OncePerRequestFilter {
    public static final String TOKEN_COOKIE = "finpal_token";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (hasAuthHeader(request) || request.getCookies() == null) {
            filterChain.doFilter(request, response);
            return;
        }
        String token = Arrays.stream(request.getCookies())
                .filter(c -> TOKEN_COOKIE.equals(c.getName()))
                .findFirst()
                .map(Cookie::getValue)
                .filter(StringUtils::hasText)
                .orElse(null);
        filterChain.doFilter(token != null ? new BearerHeaderRequest(request, token) : request, response);
    }

    private boolean hasAuthHeader(HttpServletRequest request) {
        String h = request.getHeader(HttpHeaders.AUTHORIZATION);
        return h != null && !h.isBlank();
    }

    private static final class BearerHeaderRequest extends HttpServletRequestWrapper {
        private final String token;

        BearerHeaderRequest(HttpServletRequest request, String token) {
            super(request);
            this.token = token;
        }

        @Override
        public String getHeader(String name) {
            if (HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name)) {
                return "Bearer " + token;
            }
            return super.getHeader(name);
        }
    }
}
