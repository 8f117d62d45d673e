package com.platform.drengine.failover;

import com.platform.drengine.MutableClock;
import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.config.InMemoryDrConfigurationRepository;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.health.HealthSnapshot;
import com.platform.drengine.health.HealthSnapshotRecordedEvent;
import com.platform.drengine.health.Indicator;
import com.platform.drengine.health.IndicatorType;
import com.platform.drengine.health.Severity;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.InMemoryReplicationLinkRepository;
import com.platform.drengine.replication.LagProbe;
import com.platform.drengine.replication.RegionController;
import com.platform.drengine.replication.RegionDataSources;
import com.platform.drengine.replication.ReplicationMode;
import com.platform.drengine.replication.ReplicationTopologyManager;
import com.platform.drengine.routing.ConnectionRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FailoverOrchestratorTest {

    private static final String PRIMARY = "us-east-1";
    private static final String TARGET = "us-west-2";
    private static final String FALLBACK = "eu-west-1";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T12:00:00Z"));
    private final Deque<Runnable> queued = new ArrayDeque<>();
    private boolean queueRuns;

    private InMemoryFailoverEventRepository repository;
    private LagProbe lagProbe;
    private RegionController regionController;
    private ConnectionRouter router;
    private NotificationChannel notificationChannel;
    private RegionDataSources regions;
    private DrConfigurationService configurationService;
    private ReplicationTopologyManager topologyManager;
    private FailoverOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        DrEngineProperties properties = new DrEngineProperties();
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        repository = new InMemoryFailoverEventRepository();
        lagProbe = mock(LagProbe.class);
        regionController = mock(RegionController.class);
        router = mock(ConnectionRouter.class);
        notificationChannel = mock(NotificationChannel.class);
        regions = mock(RegionDataSources.class);
        when(regions.isKnownRegion(anyString())).thenAnswer(inv -> !"mars-1".equals(inv.getArgument(0)));
        when(router.currentTarget(anyString())).thenReturn(Optional.empty());
        when(regionController.inFlightWrites(PRIMARY)).thenReturn(0);
        when(regionController.healthCheck(anyString())).thenReturn(true);

        configurationService = new DrConfigurationService(new InMemoryDrConfigurationRepository(), clock);
        topologyManager = new ReplicationTopologyManager(new InMemoryReplicationLinkRepository(), lagProbe,
            regionController, regions, new RetryEngine(metrics, properties, d -> { }), notificationChannel,
            metrics, properties, clock);
        Executor executor = command -> {
            if (queueRuns) {
                queued.add(command);
            } else {
                command.run();
            }
        };

        orchestrator = new FailoverOrchestrator(repository, new FailoverStateMachine(metrics, clock),
            new FailoverGuard(repository), topologyManager, regionController, regions, router, notificationChannel,
            configurationService, metrics, OpenTelemetry.noop().getTracer("test"), executor, clock::advance,
            properties, clock);

        topologyManager.establishLink(PRIMARY, TARGET, ReplicationMode.ASYNC, true);
        topologyManager.establishLink(PRIMARY, FALLBACK, ReplicationMode.ASYNC, true);
        lag(TARGET, Duration.ofSeconds(2));
        lag(FALLBACK, Duration.ofSeconds(10));
        topologyManager.refreshAll();
    }

    @Test
    void recommendedSnapshotRunsAutomaticFailoverToCompletion() {
        enableAutoFailover(false);

        orchestrator.onHealthSnapshot(new HealthSnapshotRecordedEvent(criticalSnapshot()));

        FailoverEvent event = orchestrator.events(PRIMARY).get(0);
        assertThat(event.getTriggerType()).isEqualTo(TriggerType.AUTOMATIC);
        assertThat(event.getTargetRegion()).isEqualTo(TARGET);
        assertThat(event.getState()).isEqualTo(FailoverState.COMPLETED);
        assertThat(event.getOutcome()).isEqualTo(FailoverOutcome.SUCCEEDED);
        assertThat(event.getCompleted()).isTrue();
        assertThat(event.getRollbackSuccessful()).isNull();
        assertThat(event.getReplicaLagAtPromotion()).isEqualTo(Duration.ofSeconds(2));
        assertThat(event.getTransitions()).extracting(StateTransition::to).containsExactly(
            FailoverState.SAFETY_CHECK, FailoverState.DRAINING, FailoverState.PROMOTING,
            FailoverState.REROUTING, FailoverState.VERIFYING, FailoverState.COMPLETED);
        verify(regionController).stopWrites(PRIMARY);
        verify(regionController).promote(TARGET);
        verify(router).updateTarget(PRIMARY, TARGET);
        assertThat(configurationService.references(DrConfiguration.SYSTEM_SCOPE)).isZero();
    }

    @Test
    void lagExactlyAtTheBoundIsSafe() {
        lag(TARGET, Duration.ofSeconds(30));

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.COMPLETED);
    }

    @Test
    void lagOneMicrosecondOverTheBoundAbortsAfterPolling() {
        lag(TARGET, Duration.ofSeconds(30).plusNanos(1_000));
        Instant started = clock.instant();

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.ABORTED);
        assertThat(event.getFailureDetail()).contains("Safety check failed").contains("exceeds");
        assertThat(Duration.between(started, clock.instant())).isEqualTo(Duration.ofSeconds(60));
        verify(regionController, never()).stopWrites(anyString());
        verify(regionController, never()).promote(anyString());
    }

    @Test
    void lagRecoveringWithinThePollWindowLetsTheFailoverProceed() {
        when(lagProbe.measureLag(PRIMARY, TARGET))
            .thenReturn(Duration.ofMinutes(2), Duration.ofMinutes(1), Duration.ofSeconds(3));

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.COMPLETED);
    }

    @Test
    void missingFallbackLinkAbortsUnlessOverridden() {
        lag(FALLBACK, Duration.ofMinutes(10));
        topologyManager.refreshAll();

        assertThat(triggerManual(false).getFailureDetail()).contains("no healthy fallback");

        FailoverEvent overridden = triggerManual(true);
        assertThat(overridden.getState()).isEqualTo(FailoverState.COMPLETED);
        assertThat(overridden.isOverrideSafetyChecks()).isTrue();
    }

    @Test
    void promotionFailureRollsBackToReachablePrimary() {
        doThrow(new ExternalSystemException(ErrorCode.PROMOTION_FAILED, TARGET, "replica refused promotion"))
            .when(regionController).promote(TARGET);

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.ROLLED_BACK);
        assertThat(event.getRollbackSuccessful()).isTrue();
        assertThat(event.getCompleted()).isFalse();
        assertThat(event.getOutcome()).isEqualTo(FailoverOutcome.ROLLED_BACK);
        assertThat(event.getTransitions()).extracting(StateTransition::to).containsSubsequence(
            FailoverState.PROMOTING, FailoverState.ROLLING_BACK, FailoverState.ROLLED_BACK);
        verify(router).updateTarget(PRIMARY, PRIMARY);
        verify(regionController).resumeWrites(PRIMARY);
    }

    @Test
    void failedRollbackIsEscalatedAndNotRetried() {
        doThrow(new ExternalSystemException(ErrorCode.PROMOTION_FAILED, TARGET, "replica refused promotion"))
            .when(regionController).promote(TARGET);
        when(regionController.healthCheck(PRIMARY)).thenReturn(false);

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.ROLLED_BACK);
        assertThat(event.getRollbackSuccessful()).isFalse();
        assertThat(event.getOutcome()).isEqualTo(FailoverOutcome.ROLLBACK_FAILED);
        ArgumentCaptor<DrEvent> events = ArgumentCaptor.forClass(DrEvent.class);
        verify(notificationChannel, atLeastOnce()).notify(events.capture());
        assertThat(events.getAllValues())
            .filteredOn(e -> e.eventType() == DrEvent.EventType.ROLLBACK_FAILED)
            .singleElement()
            .satisfies(e -> assertThat(e.severity()).isEqualTo(NotificationSeverity.CRITICAL));
        verify(regionController, times(1)).healthCheck(PRIMARY);
    }

    @Test
    void verificationFailureAfterReroutingRollsBack() {
        when(regionController.healthCheck(TARGET)).thenReturn(false);

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.ROLLED_BACK);
        assertThat(event.getTransitions()).extracting(StateTransition::from).contains(FailoverState.VERIFYING);
    }

    @Test
    void secondTriggerForTheSameRegionIsRejectedWhileTheFirstIsActive() {
        queueRuns = true;

        FailoverTriggerResult first = orchestrator.trigger(manualRequest(false));
        FailoverTriggerResult second = orchestrator.trigger(manualRequest(false));

        assertThat(first.status()).isEqualTo(FailoverTriggerResult.Status.ACCEPTED);
        assertThat(second.status()).isEqualTo(FailoverTriggerResult.Status.REJECTED_IN_PROGRESS);
        assertThat(second.eventId()).isEqualTo(first.eventId());
        assertThat(orchestrator.activeEvent(PRIMARY)).map(FailoverEvent::getId).contains(first.eventId());

        queued.poll().run();

        assertThat(orchestrator.activeEvent(PRIMARY)).isEmpty();
        assertThat(orchestrator.trigger(manualRequest(false)).status()).isEqualTo(FailoverTriggerResult.Status.ACCEPTED);
    }

    @Test
    void cancellationBeforePromotionAbortsTheRun() {
        queueRuns = true;
        UUID eventId = orchestrator.trigger(manualRequest(false)).eventId();

        FailoverCancelResult cancel = orchestrator.cancel(eventId, "alice");
        queued.poll().run();

        assertThat(cancel.isAccepted()).isTrue();
        FailoverEvent event = orchestrator.event(eventId);
        assertThat(event.getState()).isEqualTo(FailoverState.ABORTED);
        assertThat(event.getCancelledBy()).isEqualTo("alice");
        verify(regionController, never()).promote(anyString());
        assertThat(orchestrator.cancel(eventId, "alice").status())
            .isEqualTo(FailoverCancelResult.Status.ALREADY_TERMINAL);
    }

    @Test
    void cancellationDuringDrainResumesWrites() {
        queueRuns = true;
        UUID eventId = orchestrator.trigger(manualRequest(false)).eventId();
        when(regionController.inFlightWrites(PRIMARY)).thenAnswer(inv -> {
            orchestrator.cancel(eventId, "bob");
            return 2;
        });

        queued.poll().run();

        FailoverEvent event = orchestrator.event(eventId);
        assertThat(event.getState()).isEqualTo(FailoverState.ABORTED);
        assertThat(event.getCancelledBy()).isEqualTo("bob");
        verify(regionController).resumeWrites(PRIMARY);
    }

    @Test
    void cancellationAfterPromotionStartedIsRejected() {
        queueRuns = true;
        UUID eventId = orchestrator.trigger(manualRequest(false)).eventId();
        AtomicReference<FailoverCancelResult> lateCancel = new AtomicReference<>();
        doAnswer(inv -> {
            lateCancel.set(orchestrator.cancel(eventId, "carol"));
            return null;
        }).when(regionController).promote(TARGET);

        queued.poll().run();

        assertThat(lateCancel.get().status()).isEqualTo(FailoverCancelResult.Status.PAST_POINT_OF_NO_RETURN);
        assertThat(orchestrator.event(eventId).getState()).isEqualTo(FailoverState.COMPLETED);
    }

    @Test
    void drainTerminatesTransactionsAfterGracePeriod() {
        when(regionController.inFlightWrites(PRIMARY)).thenReturn(3);
        when(regionController.terminateInFlightWrites(PRIMARY)).thenReturn(3);

        FailoverEvent event = triggerManual(false);

        assertThat(event.getState()).isEqualTo(FailoverState.COMPLETED);
        assertThat(event.getTerminatedTransactions()).isEqualTo(3);
    }

    @Test
    void automaticTriggerRespectsApprovalAndAutoFailoverSettings() {
        FailoverTriggerResult disabled = orchestrator.trigger(FailoverRequest.automatic(PRIMARY, TARGET, "test"));
        assertThat(disabled.status()).isEqualTo(FailoverTriggerResult.Status.AUTO_FAILOVER_DISABLED);

        enableAutoFailover(true);
        FailoverTriggerResult approval = orchestrator.trigger(FailoverRequest.automatic(PRIMARY, TARGET, "test"));

        assertThat(approval.status()).isEqualTo(FailoverTriggerResult.Status.APPROVAL_REQUIRED);
        assertThat(orchestrator.events(PRIMARY)).isEmpty();
        ArgumentCaptor<DrEvent> event = ArgumentCaptor.forClass(DrEvent.class);
        verify(notificationChannel).notify(event.capture());
        assertThat(event.getValue().eventType()).isEqualTo(DrEvent.EventType.FAILOVER_APPROVAL_REQUIRED);
    }

    @Test
    void snapshotIsIgnoredWhenTrafficAlreadyMoved() {
        enableAutoFailover(false);
        when(router.currentTarget(PRIMARY)).thenReturn(Optional.of(TARGET));

        orchestrator.onHealthSnapshot(new HealthSnapshotRecordedEvent(criticalSnapshot()));

        assertThat(orchestrator.events(PRIMARY)).isEmpty();
    }

    @Test
    void unreachableRouterDoesNotFailTheSnapshotListener() {
        enableAutoFailover(false);
        when(router.currentTarget(PRIMARY))
            .thenThrow(new ExternalSystemException(ErrorCode.ROUTER_UNAVAILABLE, "router", "down"));

        orchestrator.onHealthSnapshot(new HealthSnapshotRecordedEvent(criticalSnapshot()));

        FailoverEvent event = orchestrator.events(PRIMARY).get(0);
        assertThat(event.getTriggerType()).isEqualTo(TriggerType.AUTOMATIC);
        assertThat(event.getTargetRegion()).isEqualTo(TARGET);
    }

    @Test
    void automaticTriggerErrorIsNotifiedInsteadOfThrown() {
        enableAutoFailover(false);
        when(regions.isKnownRegion(TARGET)).thenReturn(false);

        orchestrator.onHealthSnapshot(new HealthSnapshotRecordedEvent(criticalSnapshot()));

        assertThat(orchestrator.events(PRIMARY)).isEmpty();
        ArgumentCaptor<DrEvent> event = ArgumentCaptor.forClass(DrEvent.class);
        verify(notificationChannel).notify(event.capture());
        assertThat(event.getValue().eventType()).isEqualTo(DrEvent.EventType.FAILOVER_TRIGGER_FAILED);
        assertThat(event.getValue().severity()).isEqualTo(NotificationSeverity.CRITICAL);
        assertThat(event.getValue().context())
            .containsEntry("targetRegion", TARGET)
            .containsEntry("errorCode", ErrorCode.UNKNOWN_REGION.getCode());
    }

    @Test
    void invalidRequestsAreRejected() {
        assertThatThrownBy(() -> orchestrator.trigger(new FailoverRequest(PRIMARY, PRIMARY, TriggerType.MANUAL,
            false, "ops", null, null))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.trigger(new FailoverRequest(PRIMARY, "mars-1", TriggerType.MANUAL,
            false, "ops", null, null)))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_REGION));
    }

    private FailoverEvent triggerManual(boolean override) {
        FailoverTriggerResult result = orchestrator.trigger(manualRequest(override));
        assertThat(result.status()).isEqualTo(FailoverTriggerResult.Status.ACCEPTED);
        return orchestrator.event(result.eventId());
    }

    private FailoverRequest manualRequest(boolean override) {
        return new FailoverRequest(PRIMARY, TARGET, TriggerType.MANUAL, override, "ops", "drill", null);
    }

    private void lag(String replica, Duration lag) {
        when(lagProbe.measureLag(PRIMARY, replica)).thenReturn(lag);
    }

    private void enableAutoFailover(boolean approvalRequired) {
        configurationService.update(DrConfiguration.defaults(DrConfiguration.SYSTEM_SCOPE).toBuilder()
            .autoFailover(true)
            .approvalRequired(approvalRequired)
            .build());
    }

    private HealthSnapshot criticalSnapshot() {
        return new HealthSnapshot(UUID.randomUUID(), PRIMARY, clock.instant(), 100L, Duration.ofMinutes(2), 95.0,
            3, 0,
            List.of(new Indicator(IndicatorType.LAG, Severity.WARNING, "lag 2m"),
                new Indicator(IndicatorType.SATURATION, Severity.CRITICAL, "saturation 95%"),
                new Indicator(IndicatorType.BACKUP, Severity.CRITICAL, "3 failures in 24h")),
            Severity.CRITICAL, true, List.of());
    }
}
