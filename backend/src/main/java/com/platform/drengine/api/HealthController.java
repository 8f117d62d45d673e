package com.platform.drengine.api;

import com.platform.drengine.core.CircuitBreakerManager;
import com.platform.drengine.health.HealthMonitor;
import com.platform.drengine.health.HealthSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for health snapshots and circuit breaker states.
 */
@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class HealthController {
    
    private final HealthMonitor healthMonitor;
    private final CircuitBreakerManager circuitBreakerManager;
    
    @GetMapping("/regions")
    public Set<String> monitoredRegions() {
        return healthMonitor.monitoredRegions();
    }
    
    /**
     * Evaluate the region now. The snapshot is persisted and published like a scheduled one.
     */
    @PostMapping("/regions/{region}/snapshots")
    public HealthSnapshot snapshot(@PathVariable String region) {
        log.info("API: Health snapshot of {}", region);
        return healthMonitor.snapshot(region);
    }
    
    @GetMapping("/regions/{region}/latest")
    public HealthSnapshot latest(@PathVariable String region) {
        return healthMonitor.latest(region);
    }
    
    /**
     * Snapshots in {@code [from, to)}; defaults to the last 24 hours.
     */
    @GetMapping("/regions/{region}/snapshots")
    public List<HealthSnapshot> history(
            @PathVariable String region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(Duration.ofHours(24));
        return healthMonitor.history(region, start, end);
    }
    
    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerManager.CircuitBreakerStatus>> getCircuitBreakers() {
        return ResponseEntity.ok(circuitBreakerManager.getAllStates());
    }
    
    @PostMapping("/circuit-breakers/{name}/reset")
    public ResponseEntity<Void> resetCircuitBreaker(@PathVariable String name) {
        log.info("API: Reset circuit breaker {}", name);
        circuitBreakerManager.reset(name);
        return ResponseEntity.noContent().build();
    }
}
