package com.flagship.fraud_decisions.observability;

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
 * Extracts or generates the request id of each HTTP request.
 *
 * The id is put in the MDC and echoed in the response header. The MDC keys the ingestion
 * controller adds are cleared here too, after the exception handler has used them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            CorrelationContext.setRequestId(request.getHeader(CorrelationContext.REQUEST_ID_HEADER));
            String requestId = CorrelationContext.getRequestId();

            MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
            response.setHeader(CorrelationContext.REQUEST_ID_HEADER, requestId);

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRACE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Don't filter actuator endpoints to reduce noise
        return request.getRequestURI().startsWith("/actuator");
    }
}
