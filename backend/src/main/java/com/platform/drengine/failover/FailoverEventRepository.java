package com.platform.drengine.failover;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FailoverEventRepository {
    
    FailoverEvent save(FailoverEvent event);
    
    Optional<FailoverEvent> findById(UUID id);
    
    /**
     * Non-terminal event of the primary region, if any.
     */
    Optional<FailoverEvent> findActive(String primaryRegion);
    
    List<FailoverEvent> findNonTerminal();
    
    /**
     * Events of the region, newest first.
     */
    List<FailoverEvent> findByPrimaryRegion(String primaryRegion);
    
    List<FailoverEvent> findStartedBetween(Instant from, Instant to);
}
