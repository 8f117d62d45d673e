package com.platform.drengine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central registry for all DR engine metrics.
 * Provides methods for recording backup, replication, health, failover and recovery test metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicLong> gaugeValues;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }
    
    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k -> 
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record the duration of an operation.
     */
    public void recordDuration(String name, Duration duration, String... tags) {
        String key = name + String.join(".", tags);
        timers.computeIfAbsent(key, k ->
            Timer.builder(name)
                .tags(tags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(duration);
    }
    
    /**
     * Set a gauge value, registering the gauge on first use.
     */
    public void setGauge(String name, long value, String... tags) {
        String key = name + String.join(".", tags);
        gaugeValues.computeIfAbsent(key, k -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(name, holder, AtomicLong::get)
                .tags(tags)
                .register(meterRegistry);
            return holder;
        }).set(value);
    }
    
    /**
     * Current value of a gauge, or -1 when never set.
     */
    public long getGauge(String name, String... tags) {
        AtomicLong holder = gaugeValues.get(name + String.join(".", tags));
        return holder != null ? holder.get() : -1;
    }
    
    /**
     * Record retry attempt.
     */
    public void recordRetryAttempt(String system, int attemptNumber) {
        incrementCounter("drengine.retry.attempt", "system", system, "attempt", String.valueOf(attemptNumber));
    }
    
    /**
     * Record circuit breaker state change.
     */
    public void recordCircuitBreakerStateChange(String name, String state) {
        incrementCounter("drengine.circuitbreaker.state", "name", name, "state", state);
        
        int stateValue;
        switch (state.toLowerCase()) {
            case "open" -> stateValue = 0;
            case "half_open" -> stateValue = 1;
            case "closed" -> stateValue = 2;
            default -> stateValue = -1;
        }
        
        setGauge("drengine.circuitbreaker.current", stateValue, "name", name);
    }
    
    // ==================== Backup ====================
    
    public void recordBackupExecution(String type, String outcome, Duration duration, long storedBytes) {
        incrementCounter("drengine.backup.executions", "type", type, "outcome", outcome);
        recordDuration("drengine.backup.duration", duration, "type", type);
        if (storedBytes > 0) {
            setGauge("drengine.backup.last.size.bytes", storedBytes, "type", type);
        }
        log.debug("Recorded backup execution: type={}, outcome={}, duration={}ms", type, outcome, duration.toMillis());
    }
    
    // ==================== Replication ====================
    
    public void recordReplicationLag(String primaryRegion, String replicaRegion, Duration lag) {
        setGauge("drengine.replication.lag.micros", lag.toNanos() / 1_000,
            "primary", primaryRegion, "replica", replicaRegion);
    }
    
    // ==================== Health ====================
    
    public void recordHealthSeverity(String primaryRegion, int severityLevel) {
        setGauge("drengine.health.severity", severityLevel, "region", primaryRegion);
    }
    
    // ==================== Failover ====================
    
    /**
     * Record a state transition.
     */
    public void recordStateTransition(String machine, Object fromState, Object toState) {
        String from = fromState != null ? fromState.toString() : "null";
        String to = toState != null ? toState.toString() : "unknown";
        
        incrementCounter("drengine.state.transition", 
            "machine", machine, 
            "from", from, 
            "to", to);
        
        log.debug("Recorded state transition for {}: {} -> {}", machine, from, to);
    }
    
    /**
     * Increment invalid transition counter.
     */
    public void incrementInvalidTransitions(String machine) {
        incrementCounter("drengine.state.transition.invalid", "machine", machine);
    }
    
    public void recordFailoverOutcome(String triggerType, String outcome, Duration duration) {
        incrementCounter("drengine.failover.outcomes", "trigger", triggerType, "outcome", outcome);
        recordDuration("drengine.failover.duration", duration, "outcome", outcome);
    }
    
    // ==================== Recovery tests ====================
    
    public void recordRecoveryTest(String scenario, boolean passed) {
        incrementCounter("drengine.recoverytest.runs", "scenario", scenario, "passed", String.valueOf(passed));
    }
}
