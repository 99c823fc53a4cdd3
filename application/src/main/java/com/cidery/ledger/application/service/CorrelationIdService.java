package com.cidery.ledger.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for managing correlation and causation IDs
 * The causation id is the ledger operation currently executing.
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String CAUSATION_ID_KEY = "causationId";

    /**
     * Generate a new correlation ID
     */
    public String generateCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        log.debug("Generated correlation ID: {}", correlationId);
        return correlationId;
    }

    /**
     * Current correlation ID, generating one when the caller did not supply it
     */
    public String getOrCreateCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : generateCorrelationId();
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.isEmpty()) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public void setCausationId(String causationId) {
        if (causationId != null && !causationId.isEmpty()) {
            MDC.put(CAUSATION_ID_KEY, causationId);
        }
    }

    public void clearCausationId() {
        MDC.remove(CAUSATION_ID_KEY);
    }

    /**
     * Clear correlation and causation IDs from MDC
     */
    public void clear() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(CAUSATION_ID_KEY);
    }
}
