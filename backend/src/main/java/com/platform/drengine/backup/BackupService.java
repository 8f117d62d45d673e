package com.platform.drengine.backup;

import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CronSchedules;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.replication.RegionDataSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Entry point for backup jobs: definition, manual runs, execution lookup and
 * the restore-chain queries used by recovery tests.
 */
@Slf4j
@Service
public class BackupService {

    private static final Pattern STORAGE_PREFIX = Pattern.compile("[A-Za-z0-9_\\-]+(/[A-Za-z0-9_\\-]+)*");

    private final BackupRepository repository;
    private final BackupExecutor executor;
    private final RegionDataSources regionDataSources;
    private final DrConfigurationService configurationService;
    private final DrEngineProperties.Backup config;
    private final Clock clock;

    public BackupService(BackupRepository repository, BackupExecutor executor, RegionDataSources regionDataSources,
                         DrConfigurationService configurationService, DrEngineProperties properties, Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.regionDataSources = regionDataSources;
        this.configurationService = configurationService;
        this.config = properties.getBackup();
        this.clock = clock;
    }

    /**
     * Define a new backup job. Missing schedule and retention come from the job's DR configuration.
     */
    public UUID scheduleJob(BackupJobRequest request) {
        if (!regionDataSources.isKnownRegion(request.sourceRegion())) {
            throw new ValidationException(ErrorCode.UNKNOWN_REGION, "Unknown source region: " + request.sourceRegion());
        }

        BackupScope scope = request.scope() != null ? request.scope() : new BackupScope(List.of(), List.of(), null);
        String configurationScope = request.configurationScope() != null
            ? request.configurationScope()
            : scope.isTenantScoped() ? DrConfiguration.tenantScope(scope.tenantId()) : DrConfiguration.SYSTEM_SCOPE;
        DrConfiguration drConfiguration = configurationService.get(configurationScope);

        String schedule = request.schedule() != null ? request.schedule() : drConfiguration.getBackupSchedule();
        int retentionDays = request.retentionDays() != null ? request.retentionDays() : drConfiguration.getRetentionDays();
        if (retentionDays <= 0) {
            throw new ValidationException("retentionDays", retentionDays, "Retention must be positive");
        }
        String storagePrefix = request.storagePrefix() != null ? request.storagePrefix() : config.getDefaultStoragePrefix();
        if (!STORAGE_PREFIX.matcher(storagePrefix).matches()) {
            throw new ValidationException("storagePrefix", storagePrefix, "Must be a relative path of [A-Za-z0-9_-] segments");
        }

        Instant now = clock.instant();
        BackupJob job = BackupJob.builder()
            .id(UUID.randomUUID())
            .name(request.name())
            .type(request.type())
            .schedule(schedule)
            .sourceRegion(request.sourceRegion())
            .scope(scope)
            .storagePrefix(storagePrefix)
            .retentionDays(retentionDays)
            .allowParallel(request.allowParallel())
            .priority(request.priority() != null ? request.priority() : BackupPriority.MEDIUM)
            .compression(request.compression() != null ? request.compression() : CompressionLevel.MEDIUM)
            .verifyAfterWrite(request.verifyAfterWrite() == null || request.verifyAfterWrite())
            .active(true)
            .configurationScope(configurationScope)
            .nextExecution(CronSchedules.nextAfter(schedule, now))
            .createdAt(now)
            .build();

        repository.saveJob(job);
        log.info("[AUDIT] Backup job '{}' ({}) scheduled: type={}, schedule='{}', region={}, next={}",
            job.getName(), job.getId(), job.getType(), schedule, job.getSourceRegion(), job.getNextExecution());
        return job.getId();
    }

    /**
     * Start the job now. Returns the running execution when one is already in flight.
     */
    public UUID executeNow(UUID jobId, Optional<BackupType> typeOverride) {
        BackupJob job = job(jobId);
        if (!job.isActive()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "Backup job " + jobId + " is deactivated");
        }
        return executor.start(job, typeOverride.orElse(job.getType()));
    }

    public BackupExecution executionStatus(UUID executionId) {
        return repository.findExecution(executionId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.BACKUP_EXECUTION_NOT_FOUND, "BackupExecution", executionId));
    }

    /**
     * Executions of a job, newest first.
     */
    public List<BackupExecution> listExecutions(UUID jobId) {
        job(jobId);
        return repository.findExecutionsByJobs(List.of(jobId)).stream()
            .sorted(Comparator.comparing(BackupExecution::getStartedAt).reversed())
            .toList();
    }

    public BackupJob job(UUID jobId) {
        return repository.findJob(jobId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.BACKUP_JOB_NOT_FOUND, "BackupJob", jobId));
    }

    public List<BackupJob> listJobs() {
        return repository.findAllJobs();
    }

    public void deactivateJob(UUID jobId) {
        BackupJob job = job(jobId);
        repository.deactivateJob(jobId);
        log.info("[AUDIT] Backup job '{}' ({}) deactivated", job.getName(), jobId);
    }

    /**
     * Latest successful FULL of the job's lineage started at or before {@code asOf}, followed by the
     * successful incrementals after it, oldest first. Empty when no such full exists.
     */
    public List<BackupExecution> restoreChain(UUID jobId, Instant asOf) {
        List<BackupExecution> candidates = successfulLineage(job(jobId)).stream()
            .filter(e -> !e.getStartedAt().isAfter(asOf))
            .toList();

        Optional<BackupExecution> full = candidates.stream()
            .filter(e -> e.getEffectiveType() == BackupType.FULL)
            .max(Comparator.comparing(BackupExecution::getStartedAt));
        if (full.isEmpty()) {
            return List.of();
        }

        Instant fullStart = full.get().getStartedAt();
        return candidates.stream()
            .filter(e -> e.getEffectiveType() == BackupType.FULL && e.getId().equals(full.get().getId())
                || e.getEffectiveType() == BackupType.INCREMENTAL && e.getStartedAt().isAfter(fullStart))
            .sorted(Comparator.comparing(BackupExecution::getStartedAt))
            .toList();
    }

    /**
     * Successful log archives of the lineage whose capture window overlaps {@code (after, asOf]}, oldest first.
     */
    public List<BackupExecution> logArchivesCovering(UUID jobId, Instant after, Instant asOf) {
        return successfulLineage(job(jobId)).stream()
            .filter(e -> e.getEffectiveType() == BackupType.LOG_ARCHIVE)
            .filter(e -> e.getStartedAt().isAfter(after))
            .filter(e -> e.getBaselineAt() == null || e.getBaselineAt().isBefore(asOf))
            .sorted(Comparator.comparing(BackupExecution::getStartedAt))
            .toList();
    }

    /**
     * Estimated time to restore the job's current chain, from the average throughput of the
     * lineage's successful executions.
     */
    public RestoreEstimate estimateRestore(UUID jobId) {
        List<BackupExecution> chain = restoreChain(jobId, clock.instant());
        long totalBytes = chain.stream().mapToLong(BackupExecution::getStoredSizeBytes).sum();

        List<BackupExecution> timed = successfulLineage(job(jobId)).stream()
            .filter(e -> !e.duration().isZero())
            .toList();
        long bytes = timed.stream().mapToLong(BackupExecution::getStoredSizeBytes).sum();
        long millis = timed.stream().mapToLong(e -> e.duration().toMillis()).sum();

        if (millis == 0 || bytes == 0) {
            return new RestoreEstimate(chain.size(), totalBytes, 0.0, null);
        }
        double bytesPerSecond = bytes * 1000.0 / millis;
        Duration estimate = Duration.ofMillis((long) Math.ceil(totalBytes * 1000.0 / bytesPerSecond));
        return new RestoreEstimate(chain.size(), totalBytes, bytesPerSecond, estimate);
    }

    /**
     * Failure signals of the jobs backing up {@code sourceRegion} in the 24 hours before {@code now}.
     */
    public BackupHealthSummary backupHealth(String sourceRegion, Instant now) {
        List<BackupJob> jobs = repository.findAllJobs().stream()
            .filter(job -> sourceRegion.equals(job.getSourceRegion()))
            .toList();
        Set<UUID> jobIds = jobs.stream().map(BackupJob::getId).collect(Collectors.toSet());

        int maxConsecutive = jobs.stream()
            .filter(BackupJob::isActive)
            .mapToInt(job -> job.getStats().getConsecutiveFailures())
            .max()
            .orElse(0);
        List<BackupExecution> lastDay = repository.findExecutionsStartedBetween(now.minus(Duration.ofHours(24)), now).stream()
            .filter(e -> jobIds.contains(e.getJobId()))
            .toList();
        int failures = (int) lastDay.stream().filter(e -> e.getStatus() == ExecutionStatus.FAILED).count();

        return new BackupHealthSummary(sourceRegion, jobs.size(), maxConsecutive, failures, lastDay.size());
    }

    /**
     * Flag executions whose artifacts a recovery test restored successfully.
     */
    public void markRecoveryTested(List<UUID> executionIds) {
        for (UUID executionId : executionIds) {
            repository.findExecution(executionId)
                .filter(e -> !e.isRecoveryTested())
                .ifPresent(e -> repository.saveExecution(e.toBuilder().recoveryTested(true).build()));
        }
    }

    private List<BackupExecution> successfulLineage(BackupJob job) {
        List<UUID> lineageJobs = repository.findAllJobs().stream()
            .filter(job::sameLineage)
            .map(BackupJob::getId)
            .toList();
        return repository.findExecutionsByJobs(lineageJobs.isEmpty() ? List.of(job.getId()) : lineageJobs).stream()
            .filter(BackupExecution::isSuccessful)
            .toList();
    }
}
