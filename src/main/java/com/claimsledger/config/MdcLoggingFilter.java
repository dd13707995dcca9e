package com.claimsledger.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a correlation id on every log line of a request.
 *
 * Usage in logback pattern: %X{requestId} %X{method} %X{path} %X{actor}
 *
 * An incoming X-Request-Id (from a gateway or a batch importer) is reused so
 * one id follows the call across systems; otherwise a new one is generated.
 * The id is always echoed in the X-Request-Id response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcLoggingFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final int MAX_INCOMING_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        try {
            MDC.put("requestId", requestId);
            MDC.put("method",    request.getMethod());
            MDC.put("path",      request.getRequestURI());
            response.setHeader(REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }

    static String resolveRequestId(String incoming) {
        if (StringUtils.hasText(incoming)
                && incoming.length() <= MAX_INCOMING_ID_LENGTH
                && incoming.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }
}
