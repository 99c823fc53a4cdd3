package com.cidery.ledger.api.service;

import com.cidery.ledger.application.service.LedgerOperation;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the acting user of a request. Authentication happens upstream; the
 * gateway forwards the user id as a header.
 */
@Component
public class ActorExtractor {

    private static final Logger log = LoggerFactory.getLogger(ActorExtractor.class);

    public static final String USER_ID_HEADER = "X-User-Id";

    public String extract(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null) {
            userId = request.getHeader("user-id");
        }
        if (userId == null || userId.isBlank()) {
            log.warn("No user id on {} {}, recording as {}", request.getMethod(), request.getRequestURI(),
                    LedgerOperation.SYSTEM_ACTOR);
            return LedgerOperation.SYSTEM_ACTOR;
        }
        return userId.trim();
    }
}
