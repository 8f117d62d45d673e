package com.platform.drengine.persistence.repository;

import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.persistence.entity.FailoverEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for failover events.
 */
@Repository
public interface FailoverEventJpaRepository extends JpaRepository<FailoverEventEntity, String> {
    
    List<FailoverEventEntity> findByPrimaryRegionAndStateNotInOrderByStartedAtDesc(String primaryRegion, Collection<FailoverState> states);
    
    List<FailoverEventEntity> findByStateNotIn(Collection<FailoverState> states);
    
    List<FailoverEventEntity> findByPrimaryRegionOrderByStartedAtDesc(String primaryRegion);
    
    List<FailoverEventEntity> findByStartedAtGreaterThanEqualAndStartedAtBeforeOrderByStartedAtAsc(Instant from, Instant to);
}
