package com.platform.drengine.replication;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.error.LagTooHighException;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the replication links between regions.
 * 
 * One link per (primary, replica) pair. Lag is refreshed on a fixed interval and on demand
 * by the health monitor and the failover safety check. Switching a link from ASYNC to SYNC
 * requires the current lag to be strictly below the configured threshold.
 */
@Slf4j
@Service
public class ReplicationTopologyManager {
    
    private final ReplicationLinkRepository linkRepository;
    private final LagProbe lagProbe;
    private final RegionController regionController;
    private final RegionDataSources regions;
    private final RetryEngine retryEngine;
    private final NotificationChannel notificationChannel;
    private final MetricsRegistry metricsRegistry;
    private final DrEngineProperties.Replication config;
    private final Clock clock;
    
    public ReplicationTopologyManager(
            ReplicationLinkRepository linkRepository,
            LagProbe lagProbe,
            RegionController regionController,
            RegionDataSources regions,
            RetryEngine retryEngine,
            NotificationChannel notificationChannel,
            MetricsRegistry metricsRegistry,
            DrEngineProperties properties,
            Clock clock) {
        this.linkRepository = linkRepository;
        this.lagProbe = lagProbe;
        this.regionController = regionController;
        this.regions = regions;
        this.retryEngine = retryEngine;
        this.notificationChannel = notificationChannel;
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getReplication();
        this.clock = clock;
    }
    
    /**
     * Establish a link. An already active link for the pair is returned unchanged;
     * a dropped one is reactivated under its original ID.
     */
    public synchronized UUID establishLink(String primaryRegion, String replicaRegion,
                                           ReplicationMode mode, boolean crossRegion) {
        validateRegion("primaryRegion", primaryRegion);
        validateRegion("replicaRegion", replicaRegion);
        if (primaryRegion.equals(replicaRegion)) {
            throw new ValidationException("replicaRegion", replicaRegion, "Replica region must differ from primary region");
        }
        if (mode == null) {
            throw new ValidationException("mode", null, "Replication mode is required");
        }
        
        Optional<ReplicationLink> existing = linkRepository.findByPair(primaryRegion, replicaRegion);
        if (existing.isPresent() && existing.get().isActive()) {
            log.info("Link {} -> {} already active as {}", primaryRegion, replicaRegion, existing.get().getId());
            return existing.get().getId();
        }
        
        regionController.applyReplicationMode(primaryRegion, replicaRegion, mode);
        
        ReplicationLink link = existing
            .map(dropped -> dropped.toBuilder()
                .status(LinkStatus.ACTIVE)
                .mode(mode)
                .crossRegion(crossRegion)
                .lastLag(null)
                .lastMeasuredAt(null)
                .consecutiveProbeErrors(0)
                .build())
            .orElseGet(() -> ReplicationLink.builder()
                .id(UUID.randomUUID())
                .primaryRegion(primaryRegion)
                .replicaRegion(replicaRegion)
                .slotId(ReplicationLink.slotIdFor(primaryRegion, replicaRegion))
                .mode(mode)
                .crossRegion(crossRegion)
                .status(LinkStatus.ACTIVE)
                .createdAt(Instant.now(clock))
                .build());
        
        link = linkRepository.save(link);
        log.info("[AUDIT] Replication link {} established: {} -> {} ({}, crossRegion={})",
            link.getId(), primaryRegion, replicaRegion, mode, crossRegion);
        metricsRegistry.incrementCounter("drengine.replication.links.established", "mode", mode.name());
        return link.getId();
    }
    
    /**
     * Measure the current lag of a link.
     */
    public Duration currentLag(UUID linkId) {
        return refreshLag(requireLink(linkId)).getLastLag();
    }
    
    /**
     * Probe the link and record the result. Probe failures degrade the link and propagate.
     */
    public ReplicationLink refreshLag(ReplicationLink link) {
        Duration lag;
        try {
            lag = retryEngine.executeWithRetry("measureLag", "replication",
                () -> lagProbe.measureLag(link.getPrimaryRegion(), link.getReplicaRegion()));
        } catch (RuntimeException e) {
            recordProbeFailure(link, e);
            if (e instanceof DrEngineException drException) {
                throw drException;
            }
            throw new ExternalSystemException(ErrorCode.LAG_PROBE_FAILED, link.getReplicaRegion(),
                "Lag probe failed for link " + link.getId() + ": " + e.getMessage(), e);
        }
        
        Duration previous = link.getLastLag();
        link.setLastLag(lag);
        link.setLastMeasuredAt(Instant.now(clock));
        link.setConsecutiveProbeErrors(0);
        if (link.getStatus() == LinkStatus.DEGRADED) {
            link.setStatus(LinkStatus.ACTIVE);
            log.info("Replication link {} recovered, lag {}", link.getId(), lag);
        }
        ReplicationLink saved = linkRepository.save(link);
        metricsRegistry.recordReplicationLag(link.getPrimaryRegion(), link.getReplicaRegion(), lag);
        
        Duration alertThreshold = config.getLagAlertThreshold();
        boolean wasBelow = previous == null || previous.compareTo(alertThreshold) <= 0;
        if (wasBelow && lag.compareTo(alertThreshold) > 0) {
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.REPLICATION_LAG_HIGH,
                NotificationSeverity.WARNING,
                String.format("Replication lag %s -> %s is %s (alert threshold %s)",
                    link.getPrimaryRegion(), link.getReplicaRegion(), lag, alertThreshold),
                Map.of("linkId", link.getId().toString(), "lagMillis", String.valueOf(lag.toMillis())),
                Instant.now(clock)));
        }
        return saved;
    }
    
    /**
     * Change the replication mode of a link. Lag rejections come back as a result.
     */
    public ReconfigureResult reconfigure(UUID linkId, ReplicationMode mode) {
        ReplicationLink link = requireLink(linkId);
        if (!link.isActive()) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "Link " + linkId + " is dropped");
        }
        try {
            return switchMode(link, mode);
        } catch (LagTooHighException e) {
            log.warn("Mode switch of link {} to {} rejected: {}", linkId, mode, e.getMessage());
            metricsRegistry.incrementCounter("drengine.replication.reconfigure.rejected");
            return ReconfigureResult.lagTooHigh(linkId, link.getMode(), e.getCurrentLag(), e.getThreshold());
        }
    }
    
    private ReconfigureResult switchMode(ReplicationLink link, ReplicationMode target) {
        if (link.getMode() == target) {
            return ReconfigureResult.unchanged(link.getId(), target);
        }
        
        Duration lag = null;
        if (link.getMode() == ReplicationMode.ASYNC && target == ReplicationMode.SYNC) {
            lag = refreshLag(link).getLastLag();
            Duration threshold = config.getSyncSwitchMaxLag();
            if (lag.compareTo(threshold) >= 0) {
                throw new LagTooHighException(link.getId(), lag, threshold);
            }
        }
        
        regionController.applyReplicationMode(link.getPrimaryRegion(), link.getReplicaRegion(), target);
        ReplicationMode previous = link.getMode();
        link.setMode(target);
        linkRepository.save(link);
        
        log.info("[AUDIT] Replication link {} switched {} -> {}", link.getId(), previous, target);
        return ReconfigureResult.applied(link.getId(), target, lag);
    }
    
    public void dropLink(UUID linkId) {
        ReplicationLink link = requireLink(linkId);
        if (!link.isActive()) {
            return;
        }
        link.setStatus(LinkStatus.DROPPED);
        linkRepository.save(link);
        log.info("[AUDIT] Replication link {} dropped ({} -> {})", linkId, link.getPrimaryRegion(), link.getReplicaRegion());
    }
    
    public ReplicationLink link(UUID linkId) {
        return requireLink(linkId);
    }
    
    /**
     * Active links replicating from the region, lowest lag first.
     */
    public List<ReplicationLink> linksForPrimary(String primaryRegion) {
        return linkRepository.findByPrimaryRegion(primaryRegion).stream()
            .filter(ReplicationLink::isActive)
            .sorted(Comparator.comparing(ReplicationLink::getLastLag,
                Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }
    
    public Optional<ReplicationLink> linkBetween(String primaryRegion, String replicaRegion) {
        return linkRepository.findByPair(primaryRegion, replicaRegion).filter(ReplicationLink::isActive);
    }
    
    public List<ReplicationLink> allLinks() {
        return linkRepository.findAll();
    }
    
    @Scheduled(fixedDelayString = "${drengine.replication.lag-refresh-interval-ms:30000}")
    public void refreshAll() {
        for (ReplicationLink link : linkRepository.findAll()) {
            if (!link.isActive()) {
                continue;
            }
            try {
                refreshLag(link);
            } catch (DrEngineException e) {
                log.warn("Lag refresh failed for link {}: {}", link.getId(), e.getMessage());
            }
        }
    }
    
    private void recordProbeFailure(ReplicationLink link, Exception e) {
        link.setConsecutiveProbeErrors(link.getConsecutiveProbeErrors() + 1);
        boolean degradedNow = link.getStatus() == LinkStatus.ACTIVE;
        link.setStatus(LinkStatus.DEGRADED);
        linkRepository.save(link);
        metricsRegistry.incrementCounter("drengine.replication.probe.failures", "replica", link.getReplicaRegion());
        
        if (degradedNow) {
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.REPLICATION_LINK_DEGRADED,
                NotificationSeverity.WARNING,
                String.format("Replication link %s -> %s degraded: %s",
                    link.getPrimaryRegion(), link.getReplicaRegion(), e.getMessage()),
                Map.of("linkId", link.getId().toString()),
                Instant.now(clock)));
        }
    }
    
    private ReplicationLink requireLink(UUID linkId) {
        return linkRepository.findById(linkId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.REPLICATION_LINK_NOT_FOUND, "ReplicationLink", linkId));
    }
    
    private void validateRegion(String field, String region) {
        if (region == null || region.isBlank()) {
            throw new ValidationException(field, region, field + " is required");
        }
        if (!regions.isKnownRegion(region)) {
            throw new ValidationException(ErrorCode.UNKNOWN_REGION, "Region is not configured: " + region);
        }
    }
}
