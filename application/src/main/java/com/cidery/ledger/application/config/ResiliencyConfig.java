package com.cidery.ledger.application.config;

import com.cidery.ledger.domain.exception.ConcurrentLedgerModificationException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resiliency configuration
 * Bounded retries for ledger write conflicts and a circuit breaker around event publishing
 */
@Configuration
public class ResiliencyConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Retry for optimistic locking conflicts on ledger commands.
     * Each attempt runs in a fresh transaction. A stale caller-supplied version has no
     * cause attached and fails at once; validation failures are never retried.
     */
    @Bean("ledgerRetry")
    public Retry ledgerRetry(RetryRegistry registry,
                             @Value("${ledger.retry.max-attempts:3}") int maxAttempts,
                             @Value("${ledger.retry.wait-ms:50}") long waitMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryOnException(e -> e instanceof ConcurrentLedgerModificationException && e.getCause() != null)
                .build();

        return registry.retry("ledger", config);
    }

    /**
     * Circuit breaker for the outbound ledger event stream
     */
    @Bean("eventPublishingCircuitBreaker")
    public CircuitBreaker eventPublishingCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(Exception.class)
                .build();

        return registry.circuitBreaker("eventPublishing", config);
    }
}
