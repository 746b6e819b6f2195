package com.lihtcmate.backend.global.web;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the {@code X-Request-Id} and, on property-scoped routes, the property id into the MDC for the
 * duration of the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String PROPERTY_ID_MDC_KEY = "propertyId";

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);
    private static final Pattern PROPERTY_PATH = Pattern.compile("^/api/properties/([0-9a-fA-F-]{36})(/.*)?$");
    private static final int MAX_REQUEST_ID_LENGTH = 64;
    private static final long SLOW_REQUEST_MILLIS = 10_000L;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        String propertyId = propertyIdOf(request.getRequestURI());
        if (propertyId != null) {
            MDC.put(PROPERTY_ID_MDC_KEY, propertyId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000L;
            if (elapsedMillis >= SLOW_REQUEST_MILLIS) {
                log.warn("Slow request {} {} took {} ms (status {})",
                        request.getMethod(), request.getRequestURI(), elapsedMillis, response.getStatus());
            }
            MDC.remove(REQUEST_ID_MDC_KEY);
            MDC.remove(PROPERTY_ID_MDC_KEY);
        }
    }

    static String propertyIdOf(String requestUri) {
        if (requestUri == null) {
            return null;
        }
        Matcher matcher = PROPERTY_PATH.matcher(requestUri);
        return matcher.matches() ? matcher.group(1).toLowerCase() : null;
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header) && header.trim().length() <= MAX_REQUEST_ID_LENGTH) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }
}
