package com.platform.drengine.persistence.adapter;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupJobStats;
import com.platform.drengine.backup.BackupRepository;
import com.platform.drengine.backup.ExecutionStatus;
import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.entity.BackupExecutionEntity;
import com.platform.drengine.persistence.entity.BackupJobEntity;
import com.platform.drengine.persistence.repository.BackupExecutionJpaRepository;
import com.platform.drengine.persistence.repository.BackupJobJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Backup jobs and executions over Spring Data JPA. Domain objects carry no version, so
 * saves of existing rows reuse the stored one.
 */
@Component
public class JpaBackupRepository implements BackupRepository {
    
    private final BackupJobJpaRepository jobs;
    private final BackupExecutionJpaRepository executions;
    private final EntityMappers mappers;
    
    public JpaBackupRepository(BackupJobJpaRepository jobs, BackupExecutionJpaRepository executions, EntityMappers mappers) {
        this.jobs = jobs;
        this.executions = executions;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public BackupJob saveJob(BackupJob job) {
        BackupJobEntity entity = mappers.toEntity(job);
        entity.setVersion(jobs.findById(entity.getId()).map(BackupJobEntity::getVersion).orElse(null));
        return mappers.toDomain(jobs.save(entity));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<BackupJob> findJob(UUID jobId) {
        return jobs.findById(jobId.toString()).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupJob> findAllJobs() {
        return jobs.findAll().stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupJob> findActiveJobs() {
        return jobs.findByActiveTrue().stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional
    public void updateNextExecution(UUID jobId, Instant nextExecution) {
        jobs.updateNextExecution(jobId.toString(), nextExecution);
    }
    
    @Override
    @Transactional
    public void updateStats(UUID jobId, BackupJobStats stats) {
        jobs.updateStats(jobId.toString(), mappers.toJson(stats));
    }
    
    @Override
    @Transactional
    public void deactivateJob(UUID jobId) {
        jobs.deactivate(jobId.toString());
    }
    
    @Override
    @Transactional
    public BackupExecution saveExecution(BackupExecution execution) {
        BackupExecutionEntity entity = mappers.toEntity(execution);
        entity.setVersion(executions.findById(entity.getId()).map(BackupExecutionEntity::getVersion).orElse(null));
        return mappers.toDomain(executions.save(entity));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<BackupExecution> findExecution(UUID executionId) {
        return executions.findById(executionId.toString()).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupExecution> findExecutionsByJobs(List<UUID> jobIds) {
        if (jobIds.isEmpty()) {
            return List.of();
        }
        return executions.findByJobIdInOrderByStartedAtAsc(jobIds.stream().map(UUID::toString).toList()).stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupExecution> findExecutionsByStatus(ExecutionStatus status) {
        return executions.findByStatus(status).stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupExecution> findExecutionsStartedBetween(Instant from, Instant to) {
        return executions.findByStartedAtGreaterThanEqualAndStartedAtBeforeOrderByStartedAtAsc(from, to).stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional
    public void deleteExecution(UUID executionId) {
        executions.deleteById(executionId.toString());
    }
}
