package com.flagship.pawnshop.access;

import com.flagship.pawnshop.config.PawnshopProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet filter that resolves the session for each request.
 *
 * Token sources, in order:
 * 1. {@code Authorization: Bearer <token>} header
 * 2. the access token cookie, with or without a {@code Bearer } prefix
 *
 * The filter never rejects a request. A missing or invalid token just leaves
 * {@link CallerContext} empty, and guarded handlers answer 401.
 *
 * Order: runs right after the correlation id filter so auth logs carry the id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final PawnshopProperties properties;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String token = extractToken(request);
            if (token != null) {
                authService.resolveCaller(token).ifPresent(caller -> {
                    CallerContext.set(caller);
                    MDC.put(CallerContext.USER_MDC_KEY, caller.getUsername());
                });
            }

            filterChain.doFilter(request, response);

        } finally {
            CallerContext.clear();
            MDC.remove(CallerContext.USER_MDC_KEY);
        }
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return blankToNull(header.substring(BEARER_PREFIX.length()));
        }

        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        String cookieName = properties.getSecurity().getCookieName();
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                String value = cookie.getValue();
                if (value != null && value.startsWith(BEARER_PREFIX)) {
                    value = value.substring(BEARER_PREFIX.length());
                }
                return blankToNull(value);
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
