package com.platform.drengine.core;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry engine with exponential backoff and jitter.
 * 
 * Only read paths go through here (metrics sampling, lag probes, artifact reads for
 * verification). Write paths are never retried.
 */
@Slf4j
@Component
public class RetryEngine {
    
    private static final Set<ErrorCode> RETRYABLE_CODES = EnumSet.of(
        ErrorCode.STORAGE_UNAVAILABLE,
        ErrorCode.METRICS_UNAVAILABLE,
        ErrorCode.REGION_UNREACHABLE,
        ErrorCode.LAG_PROBE_FAILED,
        ErrorCode.ROUTER_UNAVAILABLE,
        ErrorCode.DATABASE_ERROR
    );
    
    private final MetricsRegistry metricsRegistry;
    private final DrEngineProperties.Retry config;
    private final Sleeper sleeper;
    
    public RetryEngine(MetricsRegistry metricsRegistry, DrEngineProperties properties, Sleeper sleeper) {
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getRetry();
        this.sleeper = sleeper;
    }
    
    /**
     * Execute a read operation with retry logic. The last failure is rethrown once
     * attempts are exhausted.
     */
    public <T> T executeWithRetry(String operationName, String system, Supplier<T> operation) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        int attempt = 0;
        RuntimeException lastException = null;
        
        while (attempt < maxAttempts) {
            try {
                T result = operation.get();
                
                if (attempt > 0) {
                    log.info("{}.{} succeeded after {} attempts", system, operationName, attempt + 1);
                }
                return result;
                
            } catch (RuntimeException e) {
                lastException = e;
                attempt++;
                
                if (!isRetryable(e)) {
                    throw e;
                }
                
                metricsRegistry.recordRetryAttempt(system, attempt);
                log.warn("{}.{} failed (attempt {}/{}): {}", 
                    system, operationName, attempt, maxAttempts, e.getMessage());
                
                if (attempt < maxAttempts) {
                    Duration delay = calculateDelay(attempt);
                    log.debug("Retrying in {}ms", delay.toMillis());
                    
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new ExternalSystemException(ErrorCode.INTERNAL_ERROR, system,
                            "Retry of " + operationName + " interrupted", ie);
                    }
                }
            }
        }
        
        log.error("{}.{} failed after {} attempts", system, operationName, maxAttempts);
        throw lastException;
    }
    
    /**
     * Calculate delay with exponential backoff and jitter.
     */
    Duration calculateDelay(int attempt) {
        long initialDelayMs = config.getInitialDelay().toMillis();
        double exponentialDelay = initialDelayMs * Math.pow(config.getMultiplier(), attempt - 1);
        
        long baseDelay = Math.min((long) exponentialDelay, config.getMaxDelay().toMillis());
        
        long jitter = (long) (baseDelay * config.getJitterFactor() * ThreadLocalRandom.current().nextDouble());
        
        if (ThreadLocalRandom.current().nextBoolean()) {
            return Duration.ofMillis(Math.min(baseDelay + jitter, config.getMaxDelay().toMillis()));
        } else {
            return Duration.ofMillis(Math.max(initialDelayMs, baseDelay - jitter));
        }
    }
    
    private boolean isRetryable(RuntimeException e) {
        if (e instanceof DrEngineException drException) {
            return RETRYABLE_CODES.contains(drException.getErrorCode());
        }
        return true;
    }
}
