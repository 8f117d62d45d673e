package com.platform.drengine.backup;

import com.platform.drengine.core.CronSchedules;
import com.platform.drengine.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Fires due backup jobs.
 * 
 * Each tick starts every active job whose {@code nextExecution} has passed and moves
 * {@code nextExecution} to the first cron instant after now. Ticks missed while the engine was
 * down therefore fire once, not once per missed instant. Starting a job that is still running
 * returns the running execution, so re-issuing a tick is harmless.
 */
@Slf4j
@Service
public class BackupScheduler {
    
    private final BackupRepository repository;
    private final BackupExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public BackupScheduler(BackupRepository repository, BackupExecutor executor,
                           MetricsRegistry metricsRegistry, Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    @Scheduled(fixedDelayString = "${drengine.backup.scheduler-tick-ms:60000}")
    public void tick() {
        Instant now = clock.instant();
        int fired = 0;
        
        for (BackupJob job : repository.findActiveJobs()) {
            if (job.getNextExecution() == null || job.getNextExecution().isAfter(now)) {
                continue;
            }
            try {
                executor.start(job, job.getType());
                fired++;
            } catch (RuntimeException e) {
                log.error("Scheduled backup of job '{}' could not be started: {}", job.getName(), e.getMessage(), e);
                metricsRegistry.incrementCounter("drengine.backup.scheduler.error", "job", job.getName());
            }
            repository.updateNextExecution(job.getId(), CronSchedules.nextAfter(job.getSchedule(), now));
        }
        
        if (fired > 0) {
            log.debug("Backup scheduler tick fired {} jobs", fired);
        }
    }
}
