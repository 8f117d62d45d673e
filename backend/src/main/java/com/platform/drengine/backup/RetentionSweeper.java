package com.platform.drengine.backup;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.storage.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Deletes backup executions past their job's retention.
 * 
 * Kept regardless of age:
 * - the most recent successful FULL of each lineage, with every successful execution after it
 *   (the current restore chain);
 * - recovery-tested executions until retention plus the grace window has passed;
 * - running executions.
 */
@Slf4j
@Service
public class RetentionSweeper {
    
    private final BackupRepository repository;
    private final StorageBackend storage;
    private final MetricsRegistry metricsRegistry;
    private final DrEngineProperties.Backup config;
    private final Clock clock;
    
    public RetentionSweeper(BackupRepository repository, StorageBackend storage, MetricsRegistry metricsRegistry,
                            DrEngineProperties properties, Clock clock) {
        this.repository = repository;
        this.storage = storage;
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getBackup();
        this.clock = clock;
    }
    
    @Scheduled(cron = "${drengine.backup.retention-cron:0 0 3 * * *}", zone = "UTC")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
            metricsRegistry.incrementCounter("drengine.backup.retention.error");
        }
    }
    
    /**
     * @return number of executions deleted
     */
    public int sweep() {
        Instant now = clock.instant();
        int deleted = 0;
        int skipped = 0;
        
        for (List<BackupJob> lineage : lineages(repository.findAllJobs())) {
            Map<UUID, BackupJob> jobs = lineage.stream().collect(Collectors.toMap(BackupJob::getId, Function.identity()));
            List<BackupExecution> executions = repository.findExecutionsByJobs(new ArrayList<>(jobs.keySet()));
            Set<UUID> chain = currentChain(executions);
            
            for (BackupExecution execution : executions) {
                BackupJob job = jobs.get(execution.getJobId());
                if (!isExpired(execution, job, chain, now)) {
                    continue;
                }
                try {
                    if (execution.getStorageKey() != null) {
                        storage.delete(execution.getStorageKey());
                    }
                    repository.deleteExecution(execution.getId());
                    deleted++;
                    log.info("[AUDIT] Backup execution {} of job '{}' deleted by retention (started {}, {} days)",
                        execution.getId(), job.getName(), execution.getStartedAt(), job.getRetentionDays());
                } catch (DrEngineException e) {
                    // row stays so the next sweep retries the artifact
                    skipped++;
                    log.warn("Could not delete backup execution {}: {}", execution.getId(), e.getMessage());
                }
            }
        }
        
        metricsRegistry.setGauge("drengine.backup.retention.last_deleted", deleted);
        log.info("Retention sweep complete: deleted={}, skipped={}", deleted, skipped);
        return deleted;
    }
    
    private boolean isExpired(BackupExecution execution, BackupJob job, Set<UUID> chain, Instant now) {
        if (!execution.getStatus().isTerminal() || chain.contains(execution.getId())) {
            return false;
        }
        Instant cutoff = now.minus(Duration.ofDays(job.getRetentionDays()));
        if (!execution.getStartedAt().isBefore(cutoff)) {
            return false;
        }
        if (execution.isRecoveryTested()) {
            return execution.getStartedAt().isBefore(cutoff.minus(config.getRetentionGrace()));
        }
        return true;
    }
    
    static Set<UUID> currentChain(List<BackupExecution> executions) {
        Optional<BackupExecution> latestFull = executions.stream()
            .filter(BackupExecution::isSuccessful)
            .filter(e -> e.getEffectiveType() == BackupType.FULL)
            .max(Comparator.comparing(BackupExecution::getStartedAt));
        
        Set<UUID> chain = new HashSet<>();
        latestFull.ifPresent(full -> executions.stream()
            .filter(BackupExecution::isSuccessful)
            .filter(e -> !e.getStartedAt().isBefore(full.getStartedAt()))
            .forEach(e -> chain.add(e.getId())));
        return chain;
    }
    
    private static List<List<BackupJob>> lineages(List<BackupJob> jobs) {
        List<List<BackupJob>> lineages = new ArrayList<>();
        for (BackupJob job : jobs) {
            lineages.stream()
                .filter(group -> group.get(0).sameLineage(job))
                .findFirst()
                .ifPresentOrElse(group -> group.add(job), () -> {
                    List<BackupJob> group = new ArrayList<>();
                    group.add(job);
                    lineages.add(group);
                });
        }
        return lineages;
    }
}
