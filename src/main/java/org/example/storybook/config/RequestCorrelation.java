package org.example.storybook.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

/**
 * Request id shared by the correlation filter, log lines (MDC key {@code requestId}) and
 * responses. Background tasks carry the id of the request that submitted them.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";

    static final int MAX_REQUEST_ID_LENGTH = 80;

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request != null && request.getAttribute(ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        String fromMdc = MDC.get(ATTRIBUTE_NAME);
        return fromMdc == null || fromMdc.isBlank() ? UNKNOWN : fromMdc;
    }

    /**
     * Trimmed, length-capped header value, or null when absent or blank.
     */
    static String normalize(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        String trimmed = headerValue.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
