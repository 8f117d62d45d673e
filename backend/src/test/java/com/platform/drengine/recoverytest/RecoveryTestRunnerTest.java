package com.platform.drengine.recoverytest;

import com.platform.drengine.MutableClock;
import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupService;
import com.platform.drengine.backup.BackupType;
import com.platform.drengine.backup.RestoreEstimate;
import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.config.InMemoryDrConfigurationRepository;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.StorageException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverOrchestrator;
import com.platform.drengine.failover.FailoverOutcome;
import com.platform.drengine.failover.FailoverRequest;
import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.failover.FailoverTriggerResult;
import com.platform.drengine.failover.TriggerType;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.LinkStatus;
import com.platform.drengine.replication.RegionDataSources;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationTopologyManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecoveryTestRunnerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
    private final UUID jobId = UUID.randomUUID();
    private final BackupExecution full = BackupExecution.builder()
        .id(UUID.randomUUID())
        .jobId(jobId)
        .effectiveType(BackupType.FULL)
        .startedAt(Instant.parse("2026-02-01T02:00:00Z"))
        .build();

    private InMemoryRecoveryTestRepository repository;
    private BackupService backupService;
    private RestoreVerifier restoreVerifier;
    private FailoverOrchestrator orchestrator;
    private NotificationChannel notificationChannel;
    private DrConfigurationService configurationService;
    private ReplicationTopologyManager topologyManager;
    private DrEngineProperties properties;
    private RecoveryTestRunner runner;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRecoveryTestRepository();
        backupService = mock(BackupService.class);
        restoreVerifier = mock(RestoreVerifier.class);
        orchestrator = mock(FailoverOrchestrator.class);
        notificationChannel = mock(NotificationChannel.class);
        RegionDataSources regions = mock(RegionDataSources.class);
        when(regions.isKnownRegion(anyString())).thenReturn(true);
        topologyManager = mock(ReplicationTopologyManager.class);
        when(topologyManager.allLinks()).thenReturn(List.of());
        configurationService = new DrConfigurationService(new InMemoryDrConfigurationRepository(), clock);

        properties = new DrEngineProperties();
        DrEngineProperties.Environment staging = new DrEngineProperties.Environment();
        staging.setType(EnvironmentType.STAGING);
        staging.setPrimaryRegion("staging-east");
        staging.setReplicaRegion("staging-west");
        DrEngineProperties.Environment production = new DrEngineProperties.Environment();
        production.setType(EnvironmentType.PRODUCTION);
        properties.getEnvironments().put("staging", staging);
        properties.getEnvironments().put("prod", production);

        when(backupService.job(jobId)).thenReturn(BackupJob.builder()
            .id(jobId)
            .configurationScope(DrConfiguration.SYSTEM_SCOPE)
            .build());
        when(backupService.estimateRestore(jobId)).thenReturn(new RestoreEstimate(1, 1024, 512.0, Duration.ofSeconds(2)));
        when(backupService.restoreChain(eq(jobId), any())).thenReturn(List.of(full));
        when(backupService.logArchivesCovering(eq(jobId), any(), any())).thenReturn(List.of());

        runner = new RecoveryTestRunner(repository, backupService, restoreVerifier, orchestrator, regions,
            topologyManager, configurationService, notificationChannel, new MetricsRegistry(new SimpleMeterRegistry()),
            Runnable::run, clock::advance, properties, clock);
    }

    @Test
    void pointInTimeRestoreWithinRpoPasses() {
        Instant target = clock.instant().minus(Duration.ofMinutes(10));
        restoreReturns(target.minus(Duration.ofMinutes(4)), true);
        UUID testId = runner.scheduleTest(pointInTime(target));

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.PASSED);
        assertThat(result.getPassed()).isTrue();
        assertThat(result.getActualRpo()).isEqualTo(Duration.ofMinutes(4));
        assertThat(result.getTargetRpo()).isEqualTo(Duration.ofMinutes(15));
        assertThat(result.getActualRto()).isEqualTo(Duration.ZERO);
        assertThat(result.getEstimatedRestore()).isEqualTo(Duration.ofSeconds(2));
        assertThat(result.isRemediationRequired()).isFalse();
        assertThat(result.getRestoredExecutions()).containsExactly(full.getId());
        verify(backupService).markRecoveryTested(List.of(full.getId()));
        verify(notificationChannel, never()).notify(any());
        assertThat(configurationService.references(DrConfiguration.SYSTEM_SCOPE)).isZero();
    }

    @Test
    void pointInTimeRestoreBeyondRpoFailsAndAsksForRemediation() {
        Instant target = clock.instant().minus(Duration.ofMinutes(10));
        restoreReturns(target.minus(Duration.ofMinutes(20)), true);
        UUID testId = runner.scheduleTest(pointInTime(target));

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getActualRpo()).isEqualTo(Duration.ofMinutes(20));
        assertThat(result.isRemediationRequired()).isTrue();
        assertThat(result.getIssuesFound()).anySatisfy(issue -> assertThat(issue).startsWith("Actual RPO"));
        verify(backupService, never()).markRecoveryTested(anyList());

        ArgumentCaptor<DrEvent> events = ArgumentCaptor.forClass(DrEvent.class);
        verify(notificationChannel, times(2)).notify(events.capture());
        assertThat(events.getAllValues()).extracting(DrEvent::eventType)
            .containsExactly(DrEvent.EventType.RECOVERY_TEST_FAILED, DrEvent.EventType.REMEDIATION_REMINDER);
    }

    @Test
    void failedIntegrityCheckFailsTheTestEvenWithinTargets() {
        restoreReturns(clock.instant().minus(Duration.ofMinutes(1)), false);
        UUID testId = runner.scheduleTest(backupRestore());

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getDataIntegrityVerified()).isFalse();
        assertThat(result.getIssuesFound()).contains("checksum mismatch");
    }

    @Test
    void failoverDrillMeasuresEventDurationAndLagAtPromotion() {
        UUID eventId = UUID.randomUUID();
        when(orchestrator.trigger(any())).thenReturn(FailoverTriggerResult.accepted(eventId));
        when(orchestrator.event(eventId)).thenReturn(FailoverEvent.builder()
            .id(eventId)
            .state(FailoverState.COMPLETED)
            .outcome(FailoverOutcome.SUCCEEDED)
            .startedAt(clock.instant())
            .endedAt(clock.instant().plusSeconds(90))
            .replicaLagAtPromotion(Duration.ofSeconds(2))
            .build());
        UUID testId = runner.scheduleTest(new ScheduleTestRequest(ScenarioType.FAILOVER, "staging", null, null,
            null, null, null, "ops"));

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.PASSED);
        assertThat(result.getActualRto()).isEqualTo(Duration.ofSeconds(90));
        assertThat(result.getActualRpo()).isEqualTo(Duration.ofSeconds(2));
        assertThat(result.getFailoverEventId()).isEqualTo(eventId);

        ArgumentCaptor<FailoverRequest> request = ArgumentCaptor.forClass(FailoverRequest.class);
        verify(orchestrator).trigger(request.capture());
        assertThat(request.getValue().primaryRegion()).isEqualTo("staging-east");
        assertThat(request.getValue().targetRegion()).isEqualTo("staging-west");
        assertThat(request.getValue().triggerType()).isEqualTo(TriggerType.PLANNED);
    }

    @Test
    void rejectedFailoverDrillFailsTheTest() {
        when(orchestrator.trigger(any())).thenReturn(FailoverTriggerResult.inProgress(UUID.randomUUID(), "busy"));
        UUID testId = runner.scheduleTest(new ScheduleTestRequest(ScenarioType.FAILOVER, "staging", null, null,
            null, null, null, "ops"));

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getIssuesFound()).anySatisfy(issue -> assertThat(issue).startsWith("Failover drill not started"));
    }

    @Test
    void drillRegionThatIsAMonitoredPrimaryIsRejected() {
        properties.getHealth().getPrimaryRegions().add("staging-east");

        assertThatThrownBy(() -> runner.scheduleTest(failoverDrill()))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED));
        assertThat(repository.findAll()).isEmpty();
        verify(orchestrator, never()).trigger(any());
    }

    @Test
    void drillIsNotTriggeredWhenTheEnvironmentJoinedAProductionTopologyAfterScheduling() {
        UUID testId = runner.scheduleTest(failoverDrill());
        when(topologyManager.allLinks()).thenReturn(List.of(ReplicationLink.builder()
            .id(UUID.randomUUID())
            .primaryRegion("us-east-1")
            .replicaRegion("staging-west")
            .status(LinkStatus.ACTIVE)
            .build()));

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getIssuesFound()).anySatisfy(issue ->
            assertThat(issue).startsWith(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED.getCode()));
        verify(orchestrator, never()).trigger(any());
    }

    @Test
    void linksInsideTheEnvironmentDoNotBlockTheDrill() {
        when(topologyManager.allLinks()).thenReturn(List.of(ReplicationLink.builder()
            .id(UUID.randomUUID())
            .primaryRegion("staging-east")
            .replicaRegion("staging-west")
            .status(LinkStatus.ACTIVE)
            .build()));

        assertThat(runner.scheduleTest(failoverDrill())).isNotNull();
    }

    @Test
    void fullDisasterCombinesRestoreAndDrill() {
        restoreTakes(Duration.ofSeconds(30), clock.instant().minus(Duration.ofMinutes(4)), true);
        UUID eventId = drillSucceeds(Duration.ofSeconds(2));
        UUID testId = runner.scheduleTest(fullDisaster());

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.PASSED);
        assertThat(result.getActualRto()).isEqualTo(Duration.ofSeconds(30));
        assertThat(result.getActualRpo()).isEqualTo(Duration.ofMinutes(4));
        assertThat(result.getDataIntegrityVerified()).isTrue();
        assertThat(result.getFailoverEventId()).isEqualTo(eventId);
        assertThat(result.getRestoredExecutions()).containsExactly(full.getId());
    }

    @Test
    void fullDisasterWithFailedRestoreFailsDespiteSuccessfulDrill() {
        restoreTakes(Duration.ofSeconds(30), clock.instant().minus(Duration.ofMinutes(1)), false);
        drillSucceeds(Duration.ofMinutes(20));
        UUID testId = runner.scheduleTest(fullDisaster());

        RecoveryTest result = runner.runTest(testId);

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getDataIntegrityVerified()).isFalse();
        assertThat(result.getActualRpo()).isEqualTo(Duration.ofMinutes(20));
        assertThat(result.getIssuesFound())
            .contains("checksum mismatch")
            .anySatisfy(issue -> assertThat(issue).startsWith("Actual RPO"));
        verify(orchestrator).trigger(any());
    }

    @Test
    void fullDisasterSkipsTheDrillWhenStorageIsUnreachable() {
        when(restoreVerifier.restore(anyString(), anyList(), anyList(), any()))
            .thenThrow(new StorageException(ErrorCode.STORAGE_UNAVAILABLE, "backups/x", "bucket unreachable"));
        UUID testId = runner.scheduleTest(fullDisaster());

        assertThatThrownBy(() -> runner.runTest(testId)).isInstanceOf(StorageException.class);

        assertThat(runner.test(testId).getStatus()).isEqualTo(TestStatus.FAILED);
        verify(orchestrator, never()).trigger(any());
    }

    @Test
    void productionAndUnknownEnvironmentsAreRejected() {
        assertThatThrownBy(() -> runner.scheduleTest(new ScheduleTestRequest(ScenarioType.BACKUP_RESTORE, "prod",
            jobId, null, null, null, null, "ops")))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED));
        assertThatThrownBy(() -> runner.scheduleTest(new ScheduleTestRequest(ScenarioType.BACKUP_RESTORE, "qa",
            jobId, null, null, null, null, "ops")))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_ENVIRONMENT));
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void unreachableStorageFinalizesTheTestAndPropagates() {
        when(restoreVerifier.restore(anyString(), anyList(), anyList(), any()))
            .thenThrow(new StorageException(ErrorCode.STORAGE_UNAVAILABLE, "backups/x", "bucket unreachable"));
        UUID testId = runner.scheduleTest(backupRestore());

        assertThatThrownBy(() -> runner.runTest(testId)).isInstanceOf(StorageException.class);

        RecoveryTest stored = runner.test(testId);
        assertThat(stored.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(stored.getIssuesFound()).anySatisfy(issue -> assertThat(issue).contains("bucket unreachable"));
        assertThat(configurationService.references(DrConfiguration.SYSTEM_SCOPE)).isZero();
    }

    @Test
    void finalizedTestIsNotRunAgain() {
        restoreReturns(clock.instant(), true);
        UUID testId = runner.scheduleTest(backupRestore());
        runner.runTest(testId);

        RecoveryTest again = runner.runTest(testId);

        assertThat(again.getStatus()).isEqualTo(TestStatus.PASSED);
        verify(restoreVerifier, times(1)).restore(anyString(), anyList(), anyList(), any());
    }

    @Test
    void recurringTestSchedulesItsNextOccurrence() {
        restoreReturns(clock.instant(), true);
        UUID testId = runner.scheduleTest(new ScheduleTestRequest(ScenarioType.BACKUP_RESTORE, "staging", jobId,
            "0 0 3 * * *", clock.instant(), null, null, "ops"));

        runner.runTest(testId);

        assertThat(repository.findByStatus(TestStatus.SCHEDULED))
            .singleElement()
            .satisfies(next -> {
                assertThat(next.getCadence()).isEqualTo("0 0 3 * * *");
                assertThat(next.getScheduledFor()).isEqualTo(Instant.parse("2026-02-02T03:00:00Z"));
            });
    }

    @Test
    void tickRunsOnlyDueTests() {
        restoreReturns(clock.instant(), true);
        UUID due = runner.scheduleTest(backupRestore());
        UUID later = runner.scheduleTest(new ScheduleTestRequest(ScenarioType.BACKUP_RESTORE, "staging", jobId,
            null, clock.instant().plus(Duration.ofHours(1)), null, null, "ops"));

        runner.tick();

        assertThat(runner.test(due).getStatus()).isEqualTo(TestStatus.PASSED);
        assertThat(runner.test(later).getStatus()).isEqualTo(TestStatus.SCHEDULED);
    }

    private void restoreReturns(Instant latestChange, boolean verified) {
        IntegrityResult integrity = verified
            ? new IntegrityResult(true, true, true, "abc", "abc", 2, List.of())
            : new IntegrityResult(false, true, true, "abc", "abc", 2, List.of("checksum mismatch"));
        when(restoreVerifier.restore(anyString(), anyList(), anyList(), any()))
            .thenReturn(new RestoreVerifier.RestoreOutcome(integrity, latestChange, List.of(full.getId())));
    }

    private void restoreTakes(Duration elapsed, Instant latestChange, boolean verified) {
        IntegrityResult integrity = verified
            ? new IntegrityResult(true, true, true, "abc", "abc", 2, List.of())
            : new IntegrityResult(false, true, true, "abc", "abc", 2, List.of("checksum mismatch"));
        when(restoreVerifier.restore(anyString(), anyList(), anyList(), any())).thenAnswer(invocation -> {
            clock.advance(elapsed);
            return new RestoreVerifier.RestoreOutcome(integrity, latestChange, List.of(full.getId()));
        });
    }

    private UUID drillSucceeds(Duration lagAtPromotion) {
        UUID eventId = UUID.randomUUID();
        when(orchestrator.trigger(any())).thenReturn(FailoverTriggerResult.accepted(eventId));
        when(orchestrator.event(eventId)).thenAnswer(invocation -> FailoverEvent.builder()
            .id(eventId)
            .state(FailoverState.COMPLETED)
            .outcome(FailoverOutcome.SUCCEEDED)
            .startedAt(clock.instant())
            .endedAt(clock.instant())
            .replicaLagAtPromotion(lagAtPromotion)
            .build());
        return eventId;
    }

    private ScheduleTestRequest failoverDrill() {
        return new ScheduleTestRequest(ScenarioType.FAILOVER, "staging", null, null, null, null, null, "ops");
    }

    private ScheduleTestRequest fullDisaster() {
        return new ScheduleTestRequest(ScenarioType.FULL_DISASTER, "staging", jobId, null, null, null, null, "ops");
    }

    private ScheduleTestRequest pointInTime(Instant target) {
        return new ScheduleTestRequest(ScenarioType.POINT_IN_TIME, "staging", jobId, null, null, target, null, "ops");
    }

    private ScheduleTestRequest backupRestore() {
        return new ScheduleTestRequest(ScenarioType.BACKUP_RESTORE, "staging", jobId, null, null, null, null, "ops");
    }
}
