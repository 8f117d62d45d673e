package com.platform.drengine.persistence.repository;

import com.platform.drengine.backup.ExecutionStatus;
import com.platform.drengine.persistence.entity.BackupExecutionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for backup executions.
 */
@Repository
public interface BackupExecutionJpaRepository extends JpaRepository<BackupExecutionEntity, String> {
    
    List<BackupExecutionEntity> findByJobIdInOrderByStartedAtAsc(Collection<String> jobIds);
    
    List<BackupExecutionEntity> findByStatus(ExecutionStatus status);
    
    /**
     * Executions started in {@code [from, to)}.
     */
    List<BackupExecutionEntity> findByStartedAtGreaterThanEqualAndStartedAtBeforeOrderByStartedAtAsc(Instant from, Instant to);
}
