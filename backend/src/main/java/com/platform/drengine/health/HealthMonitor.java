package com.platform.drengine.health;

import com.platform.drengine.backup.BackupHealthSummary;
import com.platform.drengine.backup.BackupService;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationTopologyManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Health Monitor.
 *
 * Each snapshot refreshes the lag of the region's replication links, samples the metrics
 * source, reads backup failure counts, classifies the result and appends it to the snapshot
 * store. Persisted snapshots are published as {@link HealthSnapshotRecordedEvent}; the
 * failover orchestrator sees nothing else.
 */
@Slf4j
@Service
public class HealthMonitor {

    private final HealthSnapshotRepository repository;
    private final MetricsSource metricsSource;
    private final ReplicationTopologyManager topologyManager;
    private final BackupService backupService;
    private final HealthClassifier classifier;
    private final RetryEngine retryEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsRegistry metricsRegistry;
    private final DrEngineProperties.Health config;
    private final Clock clock;

    public HealthMonitor(
            HealthSnapshotRepository repository,
            MetricsSource metricsSource,
            ReplicationTopologyManager topologyManager,
            BackupService backupService,
            HealthClassifier classifier,
            RetryEngine retryEngine,
            ApplicationEventPublisher eventPublisher,
            MetricsRegistry metricsRegistry,
            DrEngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.metricsSource = metricsSource;
        this.topologyManager = topologyManager;
        this.backupService = backupService;
        this.classifier = classifier;
        this.retryEngine = retryEngine;
        this.eventPublisher = eventPublisher;
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getHealth();
        this.clock = clock;
    }

    /**
     * Evaluate, persist and publish a snapshot of the primary region.
     */
    public HealthSnapshot snapshot(String primaryRegion) {
        Instant now = clock.instant();
        List<String> notes = new ArrayList<>();

        MetricsSample sample;
        try {
            sample = retryEngine.executeWithRetry("sample", "metrics", () -> metricsSource.sample(primaryRegion));
        } catch (DrEngineException e) {
            log.warn("Metrics unavailable for {}: {}", primaryRegion, e.getMessage());
            notes.add("metrics source unavailable: " + e.getMessage());
            sample = MetricsSample.unavailable();
        }

        boolean lagUnknown = false;
        List<Duration> lags = new ArrayList<>();
        for (ReplicationLink link : topologyManager.linksForPrimary(primaryRegion)) {
            try {
                lags.add(topologyManager.refreshLag(link).getLastLag());
            } catch (DrEngineException e) {
                lagUnknown = true;
                notes.add("lag of " + link.getPrimaryRegion() + " -> " + link.getReplicaRegion() + " unknown: " + e.getMessage());
            }
        }
        Duration maxLag = lags.stream().filter(Objects::nonNull).max(Comparator.naturalOrder()).orElse(null);

        BackupHealthSummary backups = backupService.backupHealth(primaryRegion, now);

        HealthClassifier.Classification classification = classifier.classify(new HealthClassifier.Inputs(
            maxLag,
            lagUnknown,
            sample.saturationPercent(),
            backups.maxConsecutiveFailures(),
            backups.failuresLast24h()));

        HealthSnapshot snapshot = repository.save(new HealthSnapshot(
            UUID.randomUUID(),
            primaryRegion,
            now,
            sample.activeConnections(),
            maxLag,
            sample.saturationPercent(),
            backups.failuresLast24h(),
            backups.maxConsecutiveFailures(),
            classification.indicators(),
            classification.severity(),
            classification.failoverRecommended(),
            notes));

        metricsRegistry.recordHealthSeverity(primaryRegion, snapshot.severity().getLevel());
        if (snapshot.severity() != Severity.HEALTHY) {
            log.warn("Health of {} is {} ({} indicators raised, failover recommended: {})",
                primaryRegion, snapshot.severity(), snapshot.raisedIndicators(), snapshot.failoverRecommended());
        } else {
            log.debug("Health of {} is HEALTHY", primaryRegion);
        }

        eventPublisher.publishEvent(new HealthSnapshotRecordedEvent(snapshot));
        return snapshot;
    }

    public HealthSnapshot latest(String primaryRegion) {
        return repository.findLatest(primaryRegion)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.RESOURCE_NOT_FOUND, "HealthSnapshot", primaryRegion));
    }

    public List<HealthSnapshot> history(String primaryRegion, Instant from, Instant to) {
        return repository.findBetween(primaryRegion, from, to);
    }

    /**
     * Configured primaries plus every region that is the primary of an active link.
     */
    public Set<String> monitoredRegions() {
        Set<String> regions = new LinkedHashSet<>(config.getPrimaryRegions());
        topologyManager.allLinks().stream()
            .filter(ReplicationLink::isActive)
            .map(ReplicationLink::getPrimaryRegion)
            .forEach(regions::add);
        return regions;
    }

    @Scheduled(fixedDelayString = "${drengine.health.interval-ms:300000}")
    public void tick() {
        for (String region : monitoredRegions()) {
            try {
                snapshot(region);
            } catch (RuntimeException e) {
                log.error("Health snapshot of {} failed: {}", region, e.getMessage(), e);
                metricsRegistry.incrementCounter("drengine.health.snapshot.error", "region", region);
            }
        }
    }

    @Scheduled(cron = "${drengine.health.prune-cron:0 30 * * * *}", zone = "UTC")
    public void prune() {
        Instant cutoff = clock.instant().minus(config.getSnapshotRetention());
        int removed = repository.deleteCapturedBefore(cutoff);
        if (removed > 0) {
            log.info("Pruned {} health snapshots captured before {}", removed, cutoff);
        }
    }
}
