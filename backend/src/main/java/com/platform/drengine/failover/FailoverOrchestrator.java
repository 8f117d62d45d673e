package com.platform.drengine.failover;

import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineConfig;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.Sleeper;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.error.FailoverInProgressException;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.health.HealthSnapshot;
import com.platform.drengine.health.HealthSnapshotRecordedEvent;
import com.platform.drengine.health.Indicator;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.LoggingConfig;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.LinkStatus;
import com.platform.drengine.replication.RegionController;
import com.platform.drengine.replication.RegionDataSources;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationTopologyManager;
import com.platform.drengine.routing.ConnectionRouter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Failover Orchestrator.
 *
 * A trigger that passes the per-region guard creates a {@link FailoverEvent} and runs it
 * asynchronously through safety check, drain, promotion, rerouting and verification.
 * Failures before promotion end the event ABORTED with production untouched (or writes
 * resumed). Failures from promotion on trigger one best-effort rollback; a failed rollback
 * is escalated as a critical notification and never retried.
 */
@Slf4j
@Service
public class FailoverOrchestrator {

    private final FailoverEventRepository repository;
    private final FailoverStateMachine stateMachine;
    private final FailoverGuard guard;
    private final ReplicationTopologyManager topologyManager;
    private final RegionController regionController;
    private final RegionDataSources regionDataSources;
    private final ConnectionRouter router;
    private final NotificationChannel notificationChannel;
    private final DrConfigurationService configurationService;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final Executor executor;
    private final Sleeper sleeper;
    private final DrEngineProperties.Failover config;
    private final Clock clock;

    private final ConcurrentMap<UUID, RunControl> runs = new ConcurrentHashMap<>();

    public FailoverOrchestrator(
            FailoverEventRepository repository,
            FailoverStateMachine stateMachine,
            FailoverGuard guard,
            ReplicationTopologyManager topologyManager,
            RegionController regionController,
            RegionDataSources regionDataSources,
            ConnectionRouter router,
            NotificationChannel notificationChannel,
            DrConfigurationService configurationService,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            @Qualifier(DrEngineConfig.TASK_EXECUTOR) Executor executor,
            Sleeper sleeper,
            DrEngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.guard = guard;
        this.topologyManager = topologyManager;
        this.regionController = regionController;
        this.regionDataSources = regionDataSources;
        this.router = router;
        this.notificationChannel = notificationChannel;
        this.configurationService = configurationService;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.executor = executor;
        this.sleeper = sleeper;
        this.config = properties.getFailover();
        this.clock = clock;
    }

    /**
     * Start a failover. Contention and approval outcomes are returned, not thrown;
     * unknown regions are rejected with a {@link ValidationException}.
     */
    public FailoverTriggerResult trigger(FailoverRequest request) {
        validate(request);

        DrConfigurationService.Lease lease = configurationService.acquire(request.configurationScope());
        DrConfiguration drConfiguration = lease.configuration();

        if (request.triggerType() == TriggerType.AUTOMATIC) {
            if (!drConfiguration.isAutoFailover()) {
                lease.close();
                log.info("Automatic failover of {} not started: auto failover disabled for scope {}",
                    request.primaryRegion(), drConfiguration.getScopeKey());
                return FailoverTriggerResult.autoFailoverDisabled("Auto failover is disabled for " + drConfiguration.getScopeKey());
            }
            if (drConfiguration.isApprovalRequired()) {
                lease.close();
                notificationChannel.notify(DrEvent.create(
                    DrEvent.EventType.FAILOVER_APPROVAL_REQUIRED,
                    NotificationSeverity.CRITICAL,
                    "Failover of " + request.primaryRegion() + " to " + request.targetRegion() + " is recommended and awaits approval",
                    Map.of("primaryRegion", request.primaryRegion(),
                        "targetRegion", request.targetRegion(),
                        "reason", String.valueOf(request.reason())),
                    clock.instant()));
                return FailoverTriggerResult.approvalRequired("Operator approval required for " + drConfiguration.getScopeKey());
            }
        }

        FailoverEvent event = FailoverEvent.builder()
            .id(UUID.randomUUID())
            .primaryRegion(request.primaryRegion())
            .targetRegion(request.targetRegion())
            .triggerType(request.triggerType())
            .requestedBy(request.requestedBy() != null ? request.requestedBy() : "unknown")
            .reason(request.reason())
            .overrideSafetyChecks(request.overrideSafetyChecks())
            .configurationScope(drConfiguration.getScopeKey())
            .state(FailoverState.IDLE)
            .startedAt(clock.instant())
            .build();

        try {
            guard.claim(request.primaryRegion(), event.getId());
        } catch (FailoverInProgressException e) {
            lease.close();
            log.warn("Failover trigger for {} rejected: {}", request.primaryRegion(), e.getMessage());
            metricsRegistry.incrementCounter("drengine.failover.rejected", "trigger", request.triggerType().name());
            return FailoverTriggerResult.inProgress(e.getActiveEventId(), e.getMessage());
        }

        RunControl control = new RunControl(lease);
        try {
            persist(event);
            runs.put(event.getId(), control);
        } catch (RuntimeException e) {
            guard.release(event.getPrimaryRegion(), event.getId());
            lease.close();
            throw e;
        }

        log.info("[AUDIT] Failover {} triggered ({}) by {}: {} -> {}, override safety checks: {}",
            event.getId(), event.getTriggerType(), event.getRequestedBy(),
            event.getPrimaryRegion(), event.getTargetRegion(), event.isOverrideSafetyChecks());
        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.FAILOVER_STARTED,
            NotificationSeverity.WARNING,
            "Failover of " + event.getPrimaryRegion() + " to " + event.getTargetRegion() + " started",
            context(event),
            clock.instant()));

        try {
            executor.execute(() -> run(event, control));
        } catch (RejectedExecutionException e) {
            log.error("Failover {} rejected by executor: {}", event.getId(), e.getMessage());
            abort(event, "Executor rejected the failover run: " + e.getMessage());
            finish(event, control);
        }
        return FailoverTriggerResult.accepted(event.getId());
    }

    /**
     * Ask a running failover to stop. Only possible before promotion starts.
     */
    public FailoverCancelResult cancel(UUID eventId, String requestedBy) {
        FailoverEvent event = event(eventId);
        RunControl control = runs.get(eventId);
        if (control == null || event.isTerminal()) {
            return FailoverCancelResult.alreadyTerminal(eventId, event.getState());
        }
        if (!control.requestCancel(requestedBy)) {
            log.warn("Cancellation of failover {} by {} rejected: past point of no return", eventId, requestedBy);
            return FailoverCancelResult.pastPointOfNoReturn(eventId, event.getState());
        }
        log.info("[AUDIT] Cancellation of failover {} requested by {} in {}", eventId, requestedBy, event.getState());
        return FailoverCancelResult.requested(eventId, event.getState());
    }

    public FailoverEvent event(UUID eventId) {
        return repository.findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.FAILOVER_EVENT_NOT_FOUND, "FailoverEvent", eventId));
    }

    public Optional<FailoverEvent> activeEvent(String primaryRegion) {
        return repository.findActive(primaryRegion);
    }

    public List<FailoverEvent> events(String primaryRegion) {
        return repository.findByPrimaryRegion(primaryRegion);
    }

    /**
     * Automatic trigger path: a snapshot recommending failover starts one towards the
     * lowest-lag active replica, unless traffic has already moved off the region.
     */
    @EventListener
    public void onHealthSnapshot(HealthSnapshotRecordedEvent recorded) {
        HealthSnapshot snapshot = recorded.snapshot();
        if (!snapshot.failoverRecommended()) {
            return;
        }
        String primary = snapshot.primaryRegion();

        Optional<String> routed;
        try {
            routed = router.currentTarget(primary);
        } catch (DrEngineException e) {
            log.warn("Route lookup for {} failed ({}), evaluating automatic failover with unknown route",
                primary, e.getMessage());
            metricsRegistry.incrementCounter("drengine.failover.auto_trigger_errors", "stage", "route_lookup");
            routed = Optional.empty();
        }
        if (routed.isPresent() && !routed.get().equals(primary)) {
            log.info("Failover recommended for {} but traffic already routed to {}", primary, routed.get());
            return;
        }

        Optional<ReplicationLink> candidate = topologyManager.linksForPrimary(primary).stream()
            .filter(link -> link.getStatus() == LinkStatus.ACTIVE)
            .findFirst();
        if (candidate.isEmpty()) {
            log.error("Failover recommended for {} but no active replica is available", primary);
            return;
        }

        String reason = "snapshot " + snapshot.id() + ": " + snapshot.indicators().stream()
            .filter(Indicator::isRaised)
            .map(Indicator::detail)
            .collect(Collectors.joining("; "));
        String target = candidate.get().getReplicaRegion();
        try {
            FailoverTriggerResult result = trigger(FailoverRequest.automatic(primary, target, reason));
            log.info("Automatic failover trigger for {}: {} ({})", primary, result.status(), result.message());
        } catch (DrEngineException e) {
            log.error("Automatic failover trigger for {} -> {} failed: {}", primary, target, e.getMessage());
            metricsRegistry.incrementCounter("drengine.failover.auto_trigger_errors", "stage", "trigger");
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.FAILOVER_TRIGGER_FAILED,
                NotificationSeverity.CRITICAL,
                "Automatic failover of " + primary + " was recommended but could not be triggered: " + e.getMessage(),
                Map.of("primaryRegion", primary,
                    "targetRegion", target,
                    "snapshotId", String.valueOf(snapshot.id()),
                    "errorCode", e.getErrorCode().getCode()),
                clock.instant()));
        }
    }

    private void run(FailoverEvent event, RunControl control) {
        LoggingConfig.setFailoverContext(event.getId().toString(), event.getPrimaryRegion());
        Span span = tracer.spanBuilder("failover.run")
            .setAttribute("failover.event_id", event.getId().toString())
            .setAttribute("failover.primary_region", event.getPrimaryRegion())
            .setAttribute("failover.target_region", event.getTargetRegion())
            .setAttribute("failover.trigger", event.getTriggerType().name())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            execute(event, control);
        } catch (RuntimeException e) {
            log.error("Failover {} failed unexpectedly in {}: {}", event.getId(), event.getState(), e.getMessage(), e);
            span.recordException(e);
            if (!event.isTerminal()) {
                if (event.getState().isBeforePointOfNoReturn()) {
                    abort(event, "Unexpected failure: " + e.getMessage());
                } else if (event.getState() != FailoverState.ROLLING_BACK) {
                    rollback(event, e);
                }
            }
        } finally {
            span.setAttribute("failover.final_state", String.valueOf(event.getState()));
            if (event.getOutcome() != FailoverOutcome.SUCCEEDED) {
                span.setStatus(StatusCode.ERROR, String.valueOf(event.getFailureDetail()));
            }
            span.end();
            finish(event, control);
            LoggingConfig.clearFailoverContext();
        }
    }

    private void execute(FailoverEvent event, RunControl control) {
        advance(event, FailoverState.SAFETY_CHECK, "triggered " + event.getTriggerType() + " by " + event.getRequestedBy());

        Optional<String> unsafe = safetyCheck(event, control);
        if (control.isCancelled()) {
            abortCancelled(event, control);
            return;
        }
        if (unsafe.isPresent()) {
            abort(event, "Safety check failed: " + unsafe.get());
            return;
        }

        advance(event, FailoverState.DRAINING, "safety check passed");
        if (!drain(event, control)) {
            return;
        }

        if (!control.enterPointOfNoReturn()) {
            resumeWrites(event);
            abortCancelled(event, control);
            return;
        }

        try {
            event.setReplicaLagAtPromotion(lastKnownLag(event));
            advance(event, FailoverState.PROMOTING, "drain finished");
            regionController.promote(event.getTargetRegion());

            advance(event, FailoverState.REROUTING, event.getTargetRegion() + " promoted");
            router.updateTarget(event.getPrimaryRegion(), event.getTargetRegion());

            advance(event, FailoverState.VERIFYING, "traffic routed to " + event.getTargetRegion());
            if (!regionController.healthCheck(event.getTargetRegion())) {
                throw new ExternalSystemException(ErrorCode.PROMOTION_FAILED, event.getTargetRegion(),
                    "Synthetic health check failed on new primary " + event.getTargetRegion());
            }
        } catch (RuntimeException e) {
            log.error("Failover {} failed in {}: {}", event.getId(), event.getState(), e.getMessage());
            rollback(event, e);
            return;
        }

        event.setOutcome(FailoverOutcome.SUCCEEDED);
        event.setCompleted(true);
        advance(event, FailoverState.COMPLETED, "new primary " + event.getTargetRegion() + " verified");
        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.FAILOVER_COMPLETED,
            NotificationSeverity.WARNING,
            "Failover of " + event.getPrimaryRegion() + " to " + event.getTargetRegion() + " completed",
            context(event),
            clock.instant()));
    }

    /**
     * Polls until the target is safe, the poll timeout passes or the run is cancelled.
     *
     * @return the reason the failover is unsafe, empty when safe or cancelled
     */
    private Optional<String> safetyCheck(FailoverEvent event, RunControl control) {
        if (event.isOverrideSafetyChecks()) {
            log.warn("Failover {} overrides safety checks (requested by {})", event.getId(), event.getRequestedBy());
            return Optional.empty();
        }

        Instant deadline = clock.instant().plus(config.getSafetyPollTimeout());
        while (true) {
            Optional<String> unsafe = evaluateSafety(event);
            if (unsafe.isEmpty() || control.isCancelled()) {
                return Optional.empty();
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return unsafe;
            }
            log.debug("Failover {} not yet safe ({}), polling again", event.getId(), unsafe.get());
            if (!pause(min(config.getSafetyPollInterval(), remaining))) {
                return Optional.of("interrupted while polling replica lag");
            }
        }
    }

    private Optional<String> evaluateSafety(FailoverEvent event) {
        Optional<ReplicationLink> targetLink = topologyManager.linkBetween(event.getPrimaryRegion(), event.getTargetRegion());
        if (targetLink.isEmpty()) {
            return Optional.of("no active replication link " + event.getPrimaryRegion() + " -> " + event.getTargetRegion());
        }

        Duration lag;
        try {
            lag = topologyManager.refreshLag(targetLink.get()).getLastLag();
        } catch (DrEngineException e) {
            return Optional.of("target lag unknown: " + e.getMessage());
        }
        if (lag.compareTo(config.getSafetyLagBound()) > 0) {
            return Optional.of("target lag " + lag + " exceeds " + config.getSafetyLagBound());
        }

        boolean fallbackAvailable = topologyManager.linksForPrimary(event.getPrimaryRegion()).stream()
            .filter(link -> !link.getReplicaRegion().equals(event.getTargetRegion()))
            .anyMatch(link -> link.isHealthy(config.getFallbackMaxLag()));
        if (!fallbackAvailable) {
            return Optional.of("no healthy fallback link besides " + event.getTargetRegion());
        }
        return Optional.empty();
    }

    /**
     * Stops writes on the primary and waits for in-flight transactions, terminating the rest
     * after the grace period.
     *
     * @return false when the event was aborted
     */
    private boolean drain(FailoverEvent event, RunControl control) {
        String primary = event.getPrimaryRegion();
        try {
            regionController.stopWrites(primary);
        } catch (RuntimeException e) {
            if (event.isOverrideSafetyChecks()) {
                log.warn("Failover {}: primary {} did not accept write stop ({}), continuing under override",
                    event.getId(), primary, e.getMessage());
                return true;
            }
            abort(event, "Could not stop writes on " + primary + ": " + e.getMessage());
            return false;
        }

        Instant deadline = clock.instant().plus(config.getDrainGrace());
        try {
            while (true) {
                if (control.isCancelled()) {
                    resumeWrites(event);
                    abortCancelled(event, control);
                    return false;
                }
                int inFlight = regionController.inFlightWrites(primary);
                if (inFlight == 0) {
                    return true;
                }
                Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    int terminated = regionController.terminateInFlightWrites(primary);
                    event.setTerminatedTransactions(terminated);
                    log.warn("Failover {}: drain grace {} elapsed, terminated {} transactions on {}",
                        event.getId(), config.getDrainGrace(), terminated, primary);
                    return true;
                }
                if (!pause(min(config.getDrainPollInterval(), remaining))) {
                    resumeWrites(event);
                    abort(event, "Interrupted while draining");
                    return false;
                }
            }
        } catch (RuntimeException e) {
            resumeWrites(event);
            abort(event, "Drain failed on " + primary + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Route traffic back to the original primary and reopen it for writes. Attempted once.
     */
    private void rollback(FailoverEvent event, Exception cause) {
        event.setFailureDetail(cause.getMessage());
        event.setCompleted(false);
        advance(event, FailoverState.ROLLING_BACK, "failure in " + event.getState() + ": " + cause.getMessage());

        String primary = event.getPrimaryRegion();
        try {
            router.updateTarget(primary, primary);
            regionController.resumeWrites(primary);
            if (!regionController.healthCheck(primary)) {
                throw new ExternalSystemException(ErrorCode.ROLLBACK_FAILED, primary,
                    "Original primary " + primary + " failed its health check");
            }
        } catch (RuntimeException e) {
            event.setRollbackSuccessful(false);
            event.setOutcome(FailoverOutcome.ROLLBACK_FAILED);
            event.setFailureDetail(cause.getMessage() + "; rollback failed: " + e.getMessage());
            advance(event, FailoverState.ROLLED_BACK, "rollback failed: " + e.getMessage());
            log.error("[AUDIT] Failover {} rollback FAILED, manual intervention required: {}", event.getId(), e.getMessage());

            Map<String, String> context = context(event);
            context.put("rollbackError", String.valueOf(e.getMessage()));
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.ROLLBACK_FAILED,
                NotificationSeverity.CRITICAL,
                "Rollback of failover " + primary + " -> " + event.getTargetRegion()
                    + " failed. Manual intervention required.",
                context,
                clock.instant()));
            return;
        }

        event.setRollbackSuccessful(true);
        event.setOutcome(FailoverOutcome.ROLLED_BACK);
        advance(event, FailoverState.ROLLED_BACK, "traffic restored to " + primary);
        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.FAILOVER_ROLLED_BACK,
            NotificationSeverity.WARNING,
            "Failover of " + primary + " to " + event.getTargetRegion() + " rolled back: " + cause.getMessage(),
            context(event),
            clock.instant()));
    }

    private void abort(FailoverEvent event, String reason) {
        event.setOutcome(FailoverOutcome.ABORTED);
        event.setCompleted(false);
        event.setFailureDetail(reason);
        advance(event, FailoverState.ABORTED, reason);
        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.FAILOVER_ABORTED,
            NotificationSeverity.INFO,
            "Failover of " + event.getPrimaryRegion() + " to " + event.getTargetRegion() + " aborted: " + reason,
            context(event),
            clock.instant()));
    }

    private void abortCancelled(FailoverEvent event, RunControl control) {
        event.setCancelledBy(control.cancelledBy());
        abort(event, "Cancelled by " + control.cancelledBy() + " during " + event.getState());
    }

    private void resumeWrites(FailoverEvent event) {
        try {
            regionController.resumeWrites(event.getPrimaryRegion());
        } catch (RuntimeException e) {
            log.error("Failover {}: could not resume writes on {}: {}", event.getId(), event.getPrimaryRegion(), e.getMessage());
            event.setFailureDetail("writes could not be resumed on " + event.getPrimaryRegion() + ": " + e.getMessage());
        }
    }

    private void finish(FailoverEvent event, RunControl control) {
        try {
            if (event.getOutcome() != null) {
                Duration duration = event.duration() != null ? event.duration() : Duration.ZERO;
                metricsRegistry.recordFailoverOutcome(event.getTriggerType().name(), event.getOutcome().name(), duration);
            }
        } finally {
            runs.remove(event.getId());
            guard.release(event.getPrimaryRegion(), event.getId());
            control.lease().close();
        }
    }

    private void advance(FailoverEvent event, FailoverState target, String reason) {
        stateMachine.transition(event, target, reason);
        persist(event);
    }

    private void persist(FailoverEvent event) {
        FailoverEvent saved = repository.save(event);
        event.setVersion(saved.getVersion());
    }

    private Duration lastKnownLag(FailoverEvent event) {
        return topologyManager.linkBetween(event.getPrimaryRegion(), event.getTargetRegion())
            .map(ReplicationLink::getLastLag)
            .orElse(null);
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void validate(FailoverRequest request) {
        if (request.primaryRegion() == null || request.targetRegion() == null) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, "Primary and target regions are required");
        }
        if (request.triggerType() == null) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, "Trigger type is required");
        }
        if (request.primaryRegion().equals(request.targetRegion())) {
            throw new ValidationException("targetRegion", request.targetRegion(), "Target must differ from the primary");
        }
        for (String region : List.of(request.primaryRegion(), request.targetRegion())) {
            if (!regionDataSources.isKnownRegion(region)) {
                throw new ValidationException(ErrorCode.UNKNOWN_REGION, "Unknown region: " + region);
            }
        }
    }

    private static Map<String, String> context(FailoverEvent event) {
        Map<String, String> context = new HashMap<>();
        context.put("eventId", event.getId().toString());
        context.put("primaryRegion", event.getPrimaryRegion());
        context.put("targetRegion", event.getTargetRegion());
        context.put("triggerType", event.getTriggerType().name());
        context.put("state", event.getState().name());
        return context;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Cancellation handshake between {@link #cancel} and the run: whichever of cancel and
     * promotion gets here first wins.
     */
    private static final class RunControl {

        private final DrConfigurationService.Lease lease;
        private boolean cancelRequested;
        private boolean pointOfNoReturn;
        private String cancelledBy;

        RunControl(DrConfigurationService.Lease lease) {
            this.lease = lease;
        }

        synchronized boolean requestCancel(String requestedBy) {
            if (pointOfNoReturn) {
                return false;
            }
            if (!cancelRequested) {
                cancelRequested = true;
                cancelledBy = requestedBy != null ? requestedBy : "unknown";
            }
            return true;
        }

        synchronized boolean enterPointOfNoReturn() {
            if (cancelRequested) {
                return false;
            }
            pointOfNoReturn = true;
            return true;
        }

        synchronized boolean isCancelled() {
            return cancelRequested;
        }

        synchronized String cancelledBy() {
            return cancelledBy;
        }

        DrConfigurationService.Lease lease() {
            return lease;
        }
    }
}
