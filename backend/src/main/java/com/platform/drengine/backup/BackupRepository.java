package com.platform.drengine.backup;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of backup jobs and their executions.
 */
public interface BackupRepository {

    BackupJob saveJob(BackupJob job);

    Optional<BackupJob> findJob(UUID jobId);

    List<BackupJob> findAllJobs();

    List<BackupJob> findActiveJobs();

    void updateNextExecution(UUID jobId, Instant nextExecution);

    void updateStats(UUID jobId, BackupJobStats stats);

    void deactivateJob(UUID jobId);

    BackupExecution saveExecution(BackupExecution execution);

    Optional<BackupExecution> findExecution(UUID executionId);

    /**
     * Executions of the jobs, oldest first.
     */
    List<BackupExecution> findExecutionsByJobs(List<UUID> jobIds);

    List<BackupExecution> findExecutionsByStatus(ExecutionStatus status);

    List<BackupExecution> findExecutionsStartedBetween(Instant from, Instant to);

    void deleteExecution(UUID executionId);
}
