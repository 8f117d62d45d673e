package com.platform.drengine.backup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBackupRepository implements BackupRepository {

    private final Map<UUID, BackupJob> jobs = new ConcurrentHashMap<>();
    private final Map<UUID, BackupExecution> executions = new ConcurrentHashMap<>();

    @Override
    public BackupJob saveJob(BackupJob job) {
        jobs.put(job.getId(), job.toBuilder().build());
        return job;
    }

    @Override
    public Optional<BackupJob> findJob(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(j -> j.toBuilder().build());
    }

    @Override
    public List<BackupJob> findAllJobs() {
        return jobs.values().stream().map(j -> j.toBuilder().build()).toList();
    }

    @Override
    public List<BackupJob> findActiveJobs() {
        return findAllJobs().stream().filter(BackupJob::isActive).toList();
    }

    @Override
    public void updateNextExecution(UUID jobId, Instant nextExecution) {
        jobs.computeIfPresent(jobId, (id, j) -> j.toBuilder().nextExecution(nextExecution).build());
    }

    @Override
    public void updateStats(UUID jobId, BackupJobStats stats) {
        jobs.computeIfPresent(jobId, (id, j) -> j.toBuilder().stats(stats).build());
    }

    @Override
    public void deactivateJob(UUID jobId) {
        jobs.computeIfPresent(jobId, (id, j) -> j.toBuilder().active(false).build());
    }

    @Override
    public BackupExecution saveExecution(BackupExecution execution) {
        executions.put(execution.getId(), execution.toBuilder().build());
        return execution;
    }

    @Override
    public Optional<BackupExecution> findExecution(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<BackupExecution> findExecutionsByJobs(List<UUID> jobIds) {
        return executions.values().stream()
            .filter(e -> jobIds.contains(e.getJobId()))
            .sorted(Comparator.comparing(BackupExecution::getStartedAt))
            .toList();
    }

    @Override
    public List<BackupExecution> findExecutionsByStatus(ExecutionStatus status) {
        return executions.values().stream().filter(e -> e.getStatus() == status).toList();
    }

    @Override
    public List<BackupExecution> findExecutionsStartedBetween(Instant from, Instant to) {
        return executions.values().stream()
            .filter(e -> !e.getStartedAt().isBefore(from) && e.getStartedAt().isBefore(to))
            .sorted(Comparator.comparing(BackupExecution::getStartedAt))
            .toList();
    }

    @Override
    public void deleteExecution(UUID executionId) {
        executions.remove(executionId);
    }

    public List<BackupExecution> allExecutions() {
        return new ArrayList<>(executions.values());
    }
}
