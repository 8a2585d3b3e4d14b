package com.flagship.order_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Opens the request log scope: correlation ID and, when the caller names one, the tenant.
 *
 * The correlation ID goes back in the response header so a client can quote it
 * when reporting a failed allocation.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = LogContext.correlationIdFrom(request.getHeader(LogContext.CORRELATION_ID_HEADER));
        String tenantId = request.getHeader(LogContext.TENANT_ID_HEADER);
        response.setHeader(LogContext.CORRELATION_ID_HEADER, correlationId);

        try (MDC.MDCCloseable ignored = MDC.putCloseable(LogContext.CORRELATION_ID_KEY, correlationId)) {
            if (tenantId != null && !tenantId.isBlank()) {
                MDC.put(LogContext.TENANT_ID_KEY, tenantId.trim());
            }
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(LogContext.TENANT_ID_KEY);
            MDC.remove(LogContext.PAYMENT_NUMBER_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // actuator probes
        return request.getRequestURI().startsWith("/actuator");
    }
}
