package com.platform.drengine.persistence.repository;

import com.platform.drengine.persistence.entity.RecoveryTestEntity;
import com.platform.drengine.recoverytest.TestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for recovery tests.
 */
@Repository
public interface RecoveryTestJpaRepository extends JpaRepository<RecoveryTestEntity, String> {
    
    List<RecoveryTestEntity> findByStatus(TestStatus status);
    
    List<RecoveryTestEntity> findByScheduledForGreaterThanEqualAndScheduledForBeforeOrderByScheduledForAsc(Instant from, Instant to);
    
    List<RecoveryTestEntity> findByCompletedAtGreaterThanEqualAndCompletedAtBefore(Instant from, Instant to);
}
