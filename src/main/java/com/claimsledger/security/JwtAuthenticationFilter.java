package com.claimsledger.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Per-request JWT authentication filter.
 *
 * FLOW:
 *   1. Extract "Authorization: Bearer <token>" header
 *   2. Validate token signature and expiry via JwtTokenProvider
 *   3. Principal = token subject (the actor), authorities = ROLE_<role>
 *   4. Set UsernamePasswordAuthenticationToken into SecurityContext
 *   5. Continue filter chain
 *
 * Identity is owned by the external provider, so there is no user lookup
 * here. An invalid or missing token leaves the context empty and the
 * authorization rules in SecurityConfig answer 401.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtTokenProvider tokenProvider;

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {

        log.debug("Authentication filter: {} {}", request.getMethod(), request.getRequestURI());

        String token = extractBearerToken(request);

        if (StringUtils.hasText(token)) {
            if (tokenProvider.isValid(token)) {
                String actor = tokenProvider.extractActor(token);
                List<SimpleGrantedAuthority> authorities = tokenProvider.extractRoles(token).stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)))
                        .toList();

                MDC.put("actor", actor);

                var auth = new UsernamePasswordAuthenticationToken(actor, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("✓ Caller authenticated - actor={}, authorities={}", actor, authorities);
            } else {
                log.warn("✗ Invalid JWT token - signature or expiry check failed");
            }
        } else {
            log.debug("No JWT token in request (public endpoint or unauthenticated)");
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("actor");
        }
    }

    /**
     * Extract the raw token from "Authorization: Bearer <token>".
     * Returns null if the header is absent or malformed.
     */
    private String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (StringUtils.hasText(header) && header.startsWith("Bearer ")) {
            return header.substring(7).strip();
        }
        return null;
    }
}
