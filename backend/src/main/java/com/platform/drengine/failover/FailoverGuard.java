package com.platform.drengine.failover;

import com.platform.drengine.error.FailoverInProgressException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-active-failover check per primary region.
 * 
 * Claiming is an atomic check-and-set over the in-memory claims and the persisted
 * non-terminal events, so a concurrent second trigger fails fast instead of queueing.
 */
@Component
public class FailoverGuard {
    
    private final ConcurrentMap<String, UUID> claims = new ConcurrentHashMap<>();
    private final FailoverEventRepository repository;
    
    public FailoverGuard(FailoverEventRepository repository) {
        this.repository = repository;
    }
    
    /**
     * @throws FailoverInProgressException when the region already has an active failover
     */
    public void claim(String primaryRegion, UUID eventId) {
        claims.compute(primaryRegion, (region, existing) -> {
            if (existing != null) {
                throw new FailoverInProgressException(region, existing);
            }
            repository.findActive(region).ifPresent(active -> {
                throw new FailoverInProgressException(region, active.getId());
            });
            return eventId;
        });
    }
    
    public void release(String primaryRegion, UUID eventId) {
        claims.remove(primaryRegion, eventId);
    }
    
    public Optional<UUID> activeClaim(String primaryRegion) {
        return Optional.ofNullable(claims.get(primaryRegion));
    }
}
