package com.platform.drengine.core;

import com.platform.drengine.error.ValidationException;
import com.platform.drengine.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Watches the circuit breakers guarding the DR engine's collaborators.
 */
@Slf4j
@Component
public class CircuitBreakerManager {
    
    public static final String STORAGE = "storage";
    public static final String METRICS = "metrics";
    public static final String ROUTER = "router";
    public static final String NOTIFICATION = "notification";
    
    private static final List<String> BREAKERS = List.of(STORAGE, METRICS, ROUTER, NOTIFICATION);
    
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    
    public CircuitBreakerManager(
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
    }
    
    @PostConstruct
    public void init() {
        for (String name : BREAKERS) {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(name);
            registerEventListeners(cb, name);
        }
        
        log.info("CircuitBreakerManager initialized for {}", BREAKERS);
    }
    
    private void registerEventListeners(CircuitBreaker circuitBreaker, String name) {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String fromState = event.getStateTransition().getFromState().name();
                String toState = event.getStateTransition().getToState().name();
                
                if ("OPEN".equals(toState)) {
                    log.warn("Circuit breaker {} opened (was {})", name, fromState);
                } else {
                    log.info("Circuit breaker {} state change: {} -> {}", name, fromState, toState);
                }
                metricsRegistry.recordCircuitBreakerStateChange(name, toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}", 
                name, event.getThrowable().getMessage()));
    }
    
    /**
     * Get all circuit breaker states.
     */
    public Map<String, CircuitBreakerStatus> getAllStates() {
        Map<String, CircuitBreakerStatus> states = new LinkedHashMap<>();
        
        for (String name : BREAKERS) {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(name);
            CircuitBreaker.Metrics metrics = cb.getMetrics();
            
            states.put(name, new CircuitBreakerStatus(
                cb.getState().name(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getFailureRate(),
                metrics.getSlowCallRate()
            ));
        }
        
        return states;
    }
    
    /**
     * Reset circuit breaker (clear metrics and transition to closed).
     */
    public void reset(String name) {
        if (!BREAKERS.contains(name)) {
            throw new ValidationException("name", name, "Unknown circuit breaker: " + name);
        }
        circuitBreakerRegistry.circuitBreaker(name).reset();
        log.info("Reset circuit breaker {}", name);
    }
    
    /**
     * Circuit breaker status record.
     */
    public record CircuitBreakerStatus(
        String state,
        int successfulCalls,
        int failedCalls,
        float failureRate,
        float slowCallRate
    ) {}
}
