package org.example.storybook.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Accepts or assigns an {@code X-Request-Id} for every request and exposes it on the MDC while the
 * request is handled. Task submissions copy this MDC onto the worker that runs the task.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelationFilter.class);

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestCorrelation.normalize(request.getHeader(RequestCorrelation.HEADER_NAME));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            // status polling is chatty, keep it at debug
            log.debug("{} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), (System.nanoTime() - startedAt) / 1_000_000);
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
        }
    }
}
