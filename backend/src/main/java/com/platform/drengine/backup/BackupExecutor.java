package com.platform.drengine.backup;

import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineConfig;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.LoggingConfig;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.storage.Checksums;
import com.platform.drengine.storage.StorageBackend;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs backup executions.
 *
 * At most one execution per job is running at any time. A second start request for a
 * job with an execution in flight returns the in-flight execution ID. Jobs that do not
 * allow parallel runs additionally share one exclusive slot.
 *
 * Each execution is finalized exactly once, as COMPLETED or FAILED. Failed executions
 * are never retried here; the next scheduled tick is the retry.
 */
@Slf4j
@Component
public class BackupExecutor {

    private static final DateTimeFormatter DAY_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

    private final BackupRepository repository;
    private final BackupSource source;
    private final BackupArtifactCodec codec;
    private final StorageBackend storage;
    private final RetryEngine retryEngine;
    private final DrConfigurationService configurationService;
    private final NotificationChannel notificationChannel;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final Executor executor;
    private final DrEngineProperties.Backup config;
    private final Clock clock;

    private final ConcurrentMap<UUID, UUID> running = new ConcurrentHashMap<>();
    private final Semaphore exclusiveSlot = new Semaphore(1, true);

    public BackupExecutor(
            BackupRepository repository,
            BackupSource source,
            BackupArtifactCodec codec,
            StorageBackend storage,
            RetryEngine retryEngine,
            DrConfigurationService configurationService,
            NotificationChannel notificationChannel,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            @Qualifier(DrEngineConfig.TASK_EXECUTOR) Executor executor,
            DrEngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.source = source;
        this.codec = codec;
        this.storage = storage;
        this.retryEngine = retryEngine;
        this.configurationService = configurationService;
        this.notificationChannel = notificationChannel;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.executor = executor;
        this.config = properties.getBackup();
        this.clock = clock;
    }

    /**
     * Start an execution of the job, or return the one already running.
     */
    public UUID start(BackupJob job, BackupType requestedType) {
        BackupExecution[] created = new BackupExecution[1];

        UUID executionId = running.compute(job.getId(), (jobId, inFlight) -> {
            if (inFlight != null) {
                return inFlight;
            }
            created[0] = repository.saveExecution(BackupExecution.builder()
                .id(UUID.randomUUID())
                .jobId(jobId)
                .requestedType(requestedType)
                .effectiveType(requestedType)
                .status(ExecutionStatus.RUNNING)
                .startedAt(clock.instant())
                .build());
            return created[0].getId();
        });

        if (created[0] == null) {
            log.info("Backup job '{}' already running as execution {}", job.getName(), executionId);
            return executionId;
        }

        BackupExecution execution = created[0];
        log.info("Backup execution {} started for job '{}' ({})", execution.getId(), job.getName(), requestedType);
        try {
            executor.execute(() -> run(job, execution));
        } catch (RejectedExecutionException e) {
            log.error("Backup execution {} rejected by executor: {}", execution.getId(), e.getMessage());
            finalizeExecution(job, failed(execution, "Executor rejected the backup: " + e.getMessage()));
        }
        return execution.getId();
    }

    public boolean isRunning(UUID jobId) {
        return running.containsKey(jobId);
    }

    public Optional<UUID> runningExecution(UUID jobId) {
        return Optional.ofNullable(running.get(jobId));
    }

    private void run(BackupJob job, BackupExecution execution) {
        LoggingConfig.setBackupContext(job.getId().toString(), execution.getId().toString());
        Span span = tracer.spanBuilder("backup.execute")
            .setAttribute("backup.job_id", job.getId().toString())
            .setAttribute("backup.execution_id", execution.getId().toString())
            .setAttribute("backup.requested_type", execution.getRequestedType().name())
            .setAttribute("backup.source_region", job.getSourceRegion())
            .startSpan();

        // latest persisted state, so a failure keeps the effective type and baseline
        BackupExecution[] current = {execution};
        BackupExecution result;
        boolean slotHeld = false;
        try (Scope ignored = span.makeCurrent();
             DrConfigurationService.Lease lease = configurationService.acquire(job.getConfigurationScope())) {

            if (!job.isAllowParallel()) {
                slotHeld = exclusiveSlot.tryAcquire(config.getExclusiveSlotWait().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!job.isAllowParallel() && !slotHeld) {
                result = failed(execution, "Timed out after " + config.getExclusiveSlotWait()
                    + " waiting for the exclusive backup slot");
            } else {
                result = perform(job, execution, current);
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = failed(current[0], "Interrupted while waiting for the exclusive backup slot");
        } catch (RuntimeException e) {
            log.error("Backup execution {} failed: {}", execution.getId(), e.getMessage(), e);
            span.recordException(e);
            result = failed(current[0], describe(e));
        } finally {
            if (slotHeld) {
                exclusiveSlot.release();
            }
        }

        try {
            finalizeExecution(job, result);
            span.setAttribute("backup.status", result.getStatus().name());
            if (!result.isSuccessful()) {
                span.setStatus(StatusCode.ERROR, String.valueOf(result.getErrorDetail()));
            }
        } finally {
            span.end();
            LoggingConfig.clearBackupContext();
        }
    }

    private BackupExecution perform(BackupJob job, BackupExecution execution, BackupExecution[] current) {
        List<BackupExecution> lineage = successfulLineage(job);
        BackupType effectiveType = effectiveType(execution.getRequestedType(), lineage);
        Instant baseline = baseline(effectiveType, lineage);

        if (effectiveType != execution.getRequestedType()) {
            log.info("No successful full backup in lineage of job '{}', taking FULL instead of {}",
                job.getName(), execution.getRequestedType());
        }
        BackupExecution inProgress = repository.saveExecution(execution.toBuilder()
            .effectiveType(effectiveType)
            .baselineAt(baseline)
            .build());
        current[0] = inProgress;

        Instant capturedUntil = execution.getStartedAt();
        CaptureResult capture = source.capture(job.getSourceRegion(), job.getScope(), effectiveType,
            baseline, effectiveType == BackupType.FULL ? null : capturedUntil);

        ArtifactHeader header = new ArtifactHeader(
            ArtifactHeader.CURRENT_FORMAT,
            execution.getId(),
            job.getId(),
            effectiveType,
            clock.instant(),
            baseline,
            capturedUntil,
            job.getScope(),
            capture.tables(),
            capture.records().size(),
            capture.latestChangeAt()
        );
        byte[] artifact = codec.encode(header, capture.records(), job.getCompression());
        String key = storageKey(job, execution.getId(), effectiveType, execution.getStartedAt());

        // write path: no retry
        String checksum = storage.put(key, artifact);

        VerificationState verification = VerificationState.NOT_VERIFIED;
        if (job.isVerifyAfterWrite()) {
            byte[] stored = retryEngine.executeWithRetry("get", "storage", () -> storage.get(key));
            verification = checksum.equals(Checksums.sha256Hex(stored))
                ? VerificationState.VERIFIED
                : VerificationState.MISMATCH;
        }

        BackupExecution.BackupExecutionBuilder builder = inProgress.toBuilder()
            .completedAt(clock.instant())
            .rawSizeBytes(codec.rawSize(header, capture.records()))
            .storedSizeBytes(artifact.length)
            .recordCount(capture.records().size())
            .tablesBackedUp(capture.tables())
            .latestChangeAt(capture.latestChangeAt())
            .storageKey(key)
            .checksum(checksum)
            .verification(verification);

        if (verification == VerificationState.MISMATCH) {
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.BACKUP_VERIFICATION_FAILED,
                NotificationSeverity.WARNING,
                "Backup artifact " + key + " does not match its checksum after write",
                Map.of("jobId", job.getId().toString(), "executionId", execution.getId().toString(), "storageKey", key),
                clock.instant()));
            return builder
                .status(ExecutionStatus.FAILED)
                .errorDetail("Artifact read back from storage does not match checksum " + checksum)
                .build();
        }
        return builder.status(ExecutionStatus.COMPLETED).build();
    }

    /**
     * Persist the terminal state, update job statistics and release the per-job slot.
     */
    private void finalizeExecution(BackupJob job, BackupExecution result) {
        try {
            repository.saveExecution(result);

            BackupJobStats previous = repository.findJob(job.getId())
                .map(BackupJob::getStats)
                .orElse(BackupJobStats.empty());
            BackupJobStats stats = result.isSuccessful()
                ? previous.withSuccess(result.duration(), result.getStoredSizeBytes(), result.getCompletedAt())
                : previous.withFailure(result.getErrorDetail(), result.getCompletedAt());
            repository.updateStats(job.getId(), stats);

            metricsRegistry.recordBackupExecution(
                result.getEffectiveType().name(),
                result.getStatus().name(),
                result.duration(),
                result.getStoredSizeBytes());

            if (result.isSuccessful()) {
                log.info("[AUDIT] Backup execution {} of job '{}' COMPLETED: type={}, records={}, stored={}B, ratio={}, checksum={}, verification={}",
                    result.getId(), job.getName(), result.getEffectiveType(), result.getRecordCount(),
                    result.getStoredSizeBytes(), String.format("%.2f", result.compressionRatio()),
                    result.getChecksum(), result.getVerification());
            } else {
                log.warn("[AUDIT] Backup execution {} of job '{}' FAILED: {} (consecutive failures: {})",
                    result.getId(), job.getName(), result.getErrorDetail(), stats.getConsecutiveFailures());
                if (stats.getConsecutiveFailures() == config.getConsecutiveFailureAlert()) {
                    notificationChannel.notify(DrEvent.create(
                        DrEvent.EventType.BACKUP_FAILURE_STREAK,
                        NotificationSeverity.CRITICAL,
                        "Backup job '" + job.getName() + "' failed " + stats.getConsecutiveFailures() + " times in a row",
                        Map.of("jobId", job.getId().toString(),
                            "sourceRegion", job.getSourceRegion(),
                            "lastError", String.valueOf(result.getErrorDetail())),
                        clock.instant()));
                }
            }
        } finally {
            running.remove(job.getId(), result.getId());
        }
    }

    private List<BackupExecution> successfulLineage(BackupJob job) {
        List<UUID> lineageJobs = repository.findAllJobs().stream()
            .filter(job::sameLineage)
            .map(BackupJob::getId)
            .toList();
        return repository.findExecutionsByJobs(lineageJobs.isEmpty() ? List.of(job.getId()) : lineageJobs).stream()
            .filter(BackupExecution::isSuccessful)
            .sorted(Comparator.comparing(BackupExecution::getStartedAt))
            .toList();
    }

    static BackupType effectiveType(BackupType requested, List<BackupExecution> successfulLineage) {
        if (requested == BackupType.INCREMENTAL
                && successfulLineage.stream().noneMatch(e -> e.getEffectiveType() == BackupType.FULL)) {
            return BackupType.FULL;
        }
        return requested;
    }

    static Instant baseline(BackupType type, List<BackupExecution> successfulLineage) {
        return switch (type) {
            case FULL -> null;
            case INCREMENTAL -> latestStart(successfulLineage, BackupType.FULL, BackupType.INCREMENTAL)
                .orElse(Instant.EPOCH);
            case LOG_ARCHIVE -> latestStart(successfulLineage, BackupType.LOG_ARCHIVE)
                .or(() -> latestStart(successfulLineage, BackupType.FULL))
                .orElse(Instant.EPOCH);
        };
    }

    private static Optional<Instant> latestStart(List<BackupExecution> executions, BackupType... types) {
        List<BackupType> wanted = List.of(types);
        return executions.stream()
            .filter(e -> wanted.contains(e.getEffectiveType()))
            .map(BackupExecution::getStartedAt)
            .max(Comparator.naturalOrder());
    }

    static String storageKey(BackupJob job, UUID executionId, BackupType type, Instant startedAt) {
        return job.getStoragePrefix() + "/" + job.getId() + "/" + DAY_PATH.format(startedAt) + "/"
            + executionId + "." + type.getFileTag() + ".jsonl.gz";
    }

    private BackupExecution failed(BackupExecution execution, String detail) {
        return execution.toBuilder()
            .status(ExecutionStatus.FAILED)
            .completedAt(clock.instant())
            .errorDetail(detail)
            .build();
    }

    private static String describe(RuntimeException e) {
        if (e instanceof DrEngineException drException) {
            return drException.getErrorCode().getCode() + ": " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
