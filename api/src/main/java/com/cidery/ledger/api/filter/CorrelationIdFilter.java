package com.cidery.ledger.api.filter;

import com.cidery.ledger.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filter to extract and set correlation ID from HTTP headers, and to tag the request's
 * log lines with the batch or vessel named in its path
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String BATCH_ID_KEY = "batchId";
    public static final String VESSEL_ID_KEY = "vesselId";

    private static final Pattern LEDGER_PATH = Pattern.compile("^/api/(batches|vessels)/([^/]+)");

    private final CorrelationIdService correlationIdService;

    public CorrelationIdFilter(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String correlationId = request.getHeader(CORRELATION_ID_HEADER);
            if (correlationId != null && !correlationId.isEmpty()) {
                correlationIdService.setCorrelationId(correlationId);
            } else {
                correlationId = correlationIdService.generateCorrelationId();
            }
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            tagLedgerRecord(request.getRequestURI());

            filterChain.doFilter(request, response);
        } finally {
            correlationIdService.clear();
            MDC.remove(BATCH_ID_KEY);
            MDC.remove(VESSEL_ID_KEY);
        }
    }

    private static void tagLedgerRecord(String path) {
        if (path == null) {
            return;
        }
        Matcher matcher = LEDGER_PATH.matcher(path);
        if (matcher.find()) {
            MDC.put("batches".equals(matcher.group(1)) ? BATCH_ID_KEY : VESSEL_ID_KEY, matcher.group(2));
        }
    }
}
