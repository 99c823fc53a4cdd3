package com.cidery.ledger.api.filter;

import com.cidery.ledger.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter(new CorrelationIdService());

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testBatchPathTaggedForDurationOfRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/batches/B-2024-07/transfers");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(MDC.getCopyOfContextMap());

        filter.doFilter(request, response, chain);

        assertEquals("B-2024-07", seen.get(CorrelationIdFilter.BATCH_ID_KEY));
        assertEquals("corr-42", seen.get("correlationId"));
        assertFalse(seen.containsKey(CorrelationIdFilter.VESSEL_ID_KEY));
        assertEquals("corr-42", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdFilter.BATCH_ID_KEY));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    void testVesselPathTaggedAndCorrelationIdGenerated() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/vessels/T1/contents");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(MDC.getCopyOfContextMap());

        filter.doFilter(request, response, chain);

        assertEquals("T1", seen.get(CorrelationIdFilter.VESSEL_ID_KEY));
        assertNotNull(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdFilter.VESSEL_ID_KEY));
    }

    @Test
    void testKeysClearedWhenChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/batches/B1");
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class,
                () -> filter.doFilter(request, new MockHttpServletResponse(), chain));

        assertNull(MDC.get(CorrelationIdFilter.BATCH_ID_KEY));
    }

    @Test
    void testCollectionPathNotTagged() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/blends");
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(MDC.getCopyOfContextMap());

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertFalse(seen.containsKey(CorrelationIdFilter.BATCH_ID_KEY));
        assertFalse(seen.containsKey(CorrelationIdFilter.VESSEL_ID_KEY));
    }
}
