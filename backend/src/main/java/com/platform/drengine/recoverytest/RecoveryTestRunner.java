package com.platform.drengine.recoverytest;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupService;
import com.platform.drengine.backup.RestoreEstimate;
import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import com.platform.drengine.config.DrEngineConfig;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CronSchedules;
import com.platform.drengine.core.Sleeper;
import com.platform.drengine.error.DrEngineException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ResourceNotFoundException;
import com.platform.drengine.error.StorageException;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverOrchestrator;
import com.platform.drengine.failover.FailoverOutcome;
import com.platform.drengine.failover.FailoverRequest;
import com.platform.drengine.failover.FailoverTriggerResult;
import com.platform.drengine.failover.TriggerType;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.LoggingConfig;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.RegionDataSources;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationTopologyManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Recovery Test Runner.
 *
 * Tests run only against configured non-production environments. Each run measures the
 * actual RTO and RPO of its scenario, compares them with the targets of the test's DR
 * configuration and is finalized exactly once as PASSED or FAILED. A failed test never
 * blocks later ones; it is reported with its issues and a remediation reminder.
 */
@Slf4j
@Service
public class RecoveryTestRunner {

    private final RecoveryTestRepository repository;
    private final BackupService backupService;
    private final RestoreVerifier restoreVerifier;
    private final FailoverOrchestrator orchestrator;
    private final RegionDataSources regionDataSources;
    private final ReplicationTopologyManager topologyManager;
    private final DrConfigurationService configurationService;
    private final NotificationChannel notificationChannel;
    private final MetricsRegistry metricsRegistry;
    private final Executor executor;
    private final Sleeper sleeper;
    private final DrEngineProperties properties;
    private final DrEngineProperties.RecoveryTest config;
    private final Clock clock;

    private final Set<UUID> running = ConcurrentHashMap.newKeySet();

    public RecoveryTestRunner(
            RecoveryTestRepository repository,
            BackupService backupService,
            RestoreVerifier restoreVerifier,
            FailoverOrchestrator orchestrator,
            RegionDataSources regionDataSources,
            ReplicationTopologyManager topologyManager,
            DrConfigurationService configurationService,
            NotificationChannel notificationChannel,
            MetricsRegistry metricsRegistry,
            @Qualifier(DrEngineConfig.TASK_EXECUTOR) Executor executor,
            Sleeper sleeper,
            DrEngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.backupService = backupService;
        this.restoreVerifier = restoreVerifier;
        this.orchestrator = orchestrator;
        this.regionDataSources = regionDataSources;
        this.topologyManager = topologyManager;
        this.configurationService = configurationService;
        this.notificationChannel = notificationChannel;
        this.metricsRegistry = metricsRegistry;
        this.executor = executor;
        this.sleeper = sleeper;
        this.properties = properties;
        this.config = properties.getRecoveryTest();
        this.clock = clock;
    }

    /**
     * Schedule a one-off or recurring test. Without an explicit time a one-off test is due
     * now and a recurring one at the next firing of its cadence.
     */
    public UUID scheduleTest(ScheduleTestRequest request) {
        DrEngineProperties.Environment environment = environment(request.environment());

        String configurationScope = request.configurationScope();
        if (request.scenario().needsBackupJob()) {
            if (request.backupJobId() == null) {
                throw new ValidationException("backupJobId", null, request.scenario() + " tests need a backup job");
            }
            BackupJob job = backupService.job(request.backupJobId());
            if (configurationScope == null) {
                configurationScope = job.getConfigurationScope();
            }
        }
        if (request.scenario().needsFailoverTopology()) {
            requireIsolatedTopology(request.environment(), environment);
        }
        if (request.cadence() != null) {
            CronSchedules.validate("cadence", request.cadence());
        }

        Instant now = clock.instant();
        Instant scheduledFor = request.scheduledFor();
        if (scheduledFor == null) {
            scheduledFor = request.cadence() != null ? CronSchedules.nextAfter(request.cadence(), now) : now;
        }

        RecoveryTest test = RecoveryTest.builder()
            .id(UUID.randomUUID())
            .scenario(request.scenario())
            .environment(request.environment())
            .environmentType(environment.getType())
            .backupJobId(request.backupJobId())
            .configurationScope(configurationScope != null ? configurationScope : DrConfiguration.SYSTEM_SCOPE)
            .cadence(request.cadence())
            .scheduledFor(scheduledFor)
            .pointInTime(request.pointInTime())
            .requestedBy(request.requestedBy() != null ? request.requestedBy() : "unknown")
            .status(TestStatus.SCHEDULED)
            .build();
        repository.save(test);

        log.info("[AUDIT] Recovery test {} scheduled by {}: {} in {} at {}{}",
            test.getId(), test.getRequestedBy(), test.getScenario(), test.getEnvironment(), scheduledFor,
            test.isRecurring() ? ", cadence '" + test.getCadence() + "'" : "");
        return test.getId();
    }

    /**
     * Run a scheduled test. Running and finalized tests are returned unchanged.
     *
     * @throws StorageException when backup artifacts cannot be read; the test is finalized FAILED first
     */
    public RecoveryTest runTest(UUID testId) {
        RecoveryTest test = test(testId);
        if (test.getStatus() != TestStatus.SCHEDULED || !running.add(testId)) {
            return test;
        }

        LoggingConfig.setRecoveryTestContext(testId.toString());
        try (DrConfigurationService.Lease lease = configurationService.acquire(test.getConfigurationScope())) {
            RecoveryTest current = test(testId);
            if (current.getStatus() != TestStatus.SCHEDULED) {
                return current;
            }
            DrConfiguration drConfiguration = lease.configuration();
            test = repository.save(current.toBuilder()
                .status(TestStatus.RUNNING)
                .startedAt(clock.instant())
                .targetRto(drConfiguration.rtoTarget())
                .targetRpo(drConfiguration.rpoTarget())
                .build());
            log.info("Recovery test {} started: {} in {}, targets rto={} rpo={}",
                testId, test.getScenario(), test.getEnvironment(), test.getTargetRto(), test.getTargetRpo());

            Measurement measurement = new Measurement();
            try {
                environment(test.getEnvironment());
                measure(test, measurement);
            } catch (StorageException e) {
                measurement.fail("Backup storage unreachable: " + e.getMessage());
                finalizeTest(test, measurement);
                throw e;
            } catch (DrEngineException e) {
                log.warn("Recovery test {} failed: {}", testId, e.getMessage());
                measurement.fail(e.getErrorCode().getCode() + ": " + e.getMessage());
            } catch (RuntimeException e) {
                measurement.fail("Unexpected error: " + e.getMessage());
                finalizeTest(test, measurement);
                throw e;
            }
            return finalizeTest(test, measurement);
        } finally {
            running.remove(testId);
            LoggingConfig.clearRecoveryTestContext();
        }
    }

    public RecoveryTest test(UUID testId) {
        return repository.findById(testId)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.RECOVERY_TEST_NOT_FOUND, "RecoveryTest", testId));
    }

    /**
     * Tests of a configuration scope, all scopes when null, most recently scheduled first.
     */
    public List<RecoveryTest> listTests(String configurationScope) {
        return repository.findAll().stream()
            .filter(t -> configurationScope == null || configurationScope.equals(t.getConfigurationScope()))
            .sorted(Comparator.comparing(RecoveryTest::getScheduledFor, Comparator.nullsLast(Comparator.naturalOrder())).reversed())
            .toList();
    }

    @Scheduled(fixedDelayString = "${drengine.recovery-test.tick-ms:300000}")
    public void tick() {
        Instant now = clock.instant();
        for (RecoveryTest due : repository.findByStatus(TestStatus.SCHEDULED)) {
            if (due.getScheduledFor() != null && due.getScheduledFor().isAfter(now)) {
                continue;
            }
            try {
                executor.execute(() -> runScheduled(due.getId()));
            } catch (RejectedExecutionException e) {
                log.warn("Recovery test {} deferred to the next tick: {}", due.getId(), e.getMessage());
            }
        }
    }

    private void runScheduled(UUID testId) {
        try {
            runTest(testId);
        } catch (RuntimeException e) {
            log.error("Scheduled recovery test {} ended with error: {}", testId, e.getMessage(), e);
        }
    }

    private void measure(RecoveryTest test, Measurement measurement) {
        Instant start = test.getStartedAt();
        if (test.getBackupJobId() != null) {
            RestoreEstimate estimate = backupService.estimateRestore(test.getBackupJobId());
            if (estimate.isKnown()) {
                measurement.estimatedRestore = estimate.estimatedDuration();
                if (estimate.estimatedDuration().compareTo(test.getTargetRto()) > 0) {
                    measurement.issue("Estimated restore time " + estimate.estimatedDuration()
                        + " exceeds RTO target " + test.getTargetRto());
                }
            }
        }

        switch (test.getScenario()) {
            case BACKUP_RESTORE -> {
                restoreLatest(test, start, measurement);
                measurement.rto = Duration.between(start, clock.instant());
            }
            case POINT_IN_TIME -> {
                restorePointInTime(test, start, measurement);
                measurement.rto = Duration.between(start, clock.instant());
            }
            case FAILOVER -> drill(test, measurement);
            case FULL_DISASTER -> {
                restoreLatest(test, start, measurement);
                Duration restoreRpo = measurement.rpo;
                boolean restoreVerified = measurement.integrity;
                drill(test, measurement);
                measurement.rto = Duration.between(start, clock.instant());
                measurement.rpo = longest(restoreRpo, measurement.rpo);
                measurement.integrity = restoreVerified && measurement.integrity;
            }
        }
    }

    private void restoreLatest(RecoveryTest test, Instant start, Measurement measurement) {
        List<BackupExecution> chain = backupService.restoreChain(test.getBackupJobId(), start);
        RestoreVerifier.RestoreOutcome outcome = restoreVerifier.restore(test.getEnvironment(), chain, List.of(), null);
        measurement.record(outcome);
        if (outcome.latestRestoredChange() != null) {
            measurement.rpo = nonNegative(Duration.between(outcome.latestRestoredChange(), start));
        }
    }

    private void restorePointInTime(RecoveryTest test, Instant start, Measurement measurement) {
        Instant target = test.getPointInTime() != null
            ? test.getPointInTime()
            : start.minus(config.getDefaultPointInTimeOffset());
        measurement.pointInTime = target;

        List<BackupExecution> chain = backupService.restoreChain(test.getBackupJobId(), target);
        List<BackupExecution> archives = chain.isEmpty()
            ? List.of()
            : backupService.logArchivesCovering(test.getBackupJobId(), chain.get(chain.size() - 1).getStartedAt(), target);
        RestoreVerifier.RestoreOutcome outcome = restoreVerifier.restore(test.getEnvironment(), chain, archives, target);
        measurement.record(outcome);
        if (outcome.latestRestoredChange() != null) {
            measurement.rpo = nonNegative(Duration.between(outcome.latestRestoredChange(), target));
        }
    }

    /**
     * Planned failover between the environment's own regions, awaited up to the RTO target.
     * The drill's RPO is the replica lag at promotion.
     */
    private void drill(RecoveryTest test, Measurement measurement) {
        DrEngineProperties.Environment environment = environment(test.getEnvironment());
        requireIsolatedTopology(test.getEnvironment(), environment);
        Instant drillStart = clock.instant();
        FailoverTriggerResult result = orchestrator.trigger(new FailoverRequest(
            environment.getPrimaryRegion(),
            environment.getReplicaRegion(),
            TriggerType.PLANNED,
            false,
            "recovery-test:" + test.getId(),
            "Recovery test " + test.getId() + " (" + test.getScenario() + ")",
            test.getConfigurationScope()));
        if (!result.isAccepted()) {
            measurement.integrity = false;
            measurement.issue("Failover drill not started: " + result.status() + " " + result.message());
            return;
        }
        measurement.failoverEventId = result.eventId();

        FailoverEvent event = awaitTerminal(result.eventId(), drillStart.plus(test.getTargetRto()), measurement);
        measurement.rto = event.isTerminal() && event.duration() != null
            ? event.duration()
            : Duration.between(drillStart, clock.instant());
        measurement.rpo = event.getReplicaLagAtPromotion() != null ? event.getReplicaLagAtPromotion() : Duration.ZERO;
        measurement.integrity = event.getOutcome() == FailoverOutcome.SUCCEEDED;
        if (!measurement.integrity) {
            measurement.issue("Failover drill ended " + event.getState()
                + (event.getOutcome() != null ? " (" + event.getOutcome() + ")" : "")
                + (event.getFailureDetail() != null ? ": " + event.getFailureDetail() : ""));
        }
    }

    private FailoverEvent awaitTerminal(UUID eventId, Instant deadline, Measurement measurement) {
        FailoverEvent event = orchestrator.event(eventId);
        while (!event.isTerminal()) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                measurement.issue("Failover drill " + eventId + " did not finish within the RTO target, last state " + event.getState());
                orchestrator.cancel(eventId, "recovery-test-timeout");
                return event;
            }
            try {
                sleeper.sleep(remaining.compareTo(config.getFailoverPollInterval()) < 0 ? remaining : config.getFailoverPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                measurement.issue("Interrupted while waiting for failover drill " + eventId);
                return event;
            }
            event = orchestrator.event(eventId);
        }
        return event;
    }

    private RecoveryTest finalizeTest(RecoveryTest test, Measurement measurement) {
        boolean rtoMet = measurement.rto != null && measurement.rto.compareTo(test.getTargetRto()) <= 0;
        boolean rpoMet = measurement.rpo != null && measurement.rpo.compareTo(test.getTargetRpo()) <= 0;
        if (measurement.rto != null && !rtoMet) {
            measurement.issue("Actual RTO " + measurement.rto + " exceeds target " + test.getTargetRto());
        }
        if (measurement.rpo == null) {
            measurement.issue("Data-loss window could not be measured");
        } else if (!rpoMet) {
            measurement.issue("Actual RPO " + measurement.rpo + " exceeds target " + test.getTargetRpo());
        }
        boolean passed = rtoMet && rpoMet && measurement.integrity;

        Instant now = clock.instant();
        RecoveryTest finalized = repository.save(test.toBuilder()
            .status(passed ? TestStatus.PASSED : TestStatus.FAILED)
            .completedAt(now)
            .pointInTime(measurement.pointInTime != null ? measurement.pointInTime : test.getPointInTime())
            .estimatedRestore(measurement.estimatedRestore)
            .actualRto(measurement.rto)
            .actualRpo(measurement.rpo)
            .dataIntegrityVerified(measurement.integrity)
            .passed(passed)
            .remediationRequired(!passed)
            .issuesFound(new ArrayList<>(measurement.issues))
            .restoredExecutions(new ArrayList<>(measurement.restoredExecutions))
            .failoverEventId(measurement.failoverEventId)
            .build());

        metricsRegistry.recordRecoveryTest(finalized.getScenario().name(), passed);
        log.info("[AUDIT] Recovery test {} {}: {} in {}, rto={} (target {}), rpo={} (target {}), integrity={}, issues={}",
            finalized.getId(), finalized.getStatus(), finalized.getScenario(), finalized.getEnvironment(),
            finalized.getActualRto(), finalized.getTargetRto(), finalized.getActualRpo(), finalized.getTargetRpo(),
            measurement.integrity, finalized.getIssuesFound().size());

        if (passed) {
            if (!finalized.getRestoredExecutions().isEmpty()) {
                backupService.markRecoveryTested(finalized.getRestoredExecutions());
            }
        } else {
            notifyFailure(finalized);
        }
        if (finalized.isRecurring()) {
            scheduleNextOccurrence(finalized, now);
        }
        return finalized;
    }

    private void notifyFailure(RecoveryTest test) {
        Map<String, String> context = new HashMap<>();
        context.put("testId", test.getId().toString());
        context.put("scenario", test.getScenario().name());
        context.put("environment", test.getEnvironment());
        context.put("configurationScope", test.getConfigurationScope());
        context.put("issues", String.join("; ", test.getIssuesFound()));

        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.RECOVERY_TEST_FAILED,
            NotificationSeverity.WARNING,
            "Recovery test " + test.getId() + " (" + test.getScenario() + ") failed in " + test.getEnvironment(),
            context,
            clock.instant()));
        if (test.isRemediationRequired()) {
            notificationChannel.notify(DrEvent.create(
                DrEvent.EventType.REMEDIATION_REMINDER,
                NotificationSeverity.INFO,
                "Remediation required after recovery test " + test.getId() + ": "
                    + test.getIssuesFound().size() + " issue(s) found",
                context,
                clock.instant()));
        }
    }

    private void scheduleNextOccurrence(RecoveryTest finished, Instant now) {
        try {
            RecoveryTest next = RecoveryTest.builder()
                .id(UUID.randomUUID())
                .scenario(finished.getScenario())
                .environment(finished.getEnvironment())
                .environmentType(finished.getEnvironmentType())
                .backupJobId(finished.getBackupJobId())
                .configurationScope(finished.getConfigurationScope())
                .cadence(finished.getCadence())
                .scheduledFor(CronSchedules.nextAfter(finished.getCadence(), now))
                .requestedBy(finished.getRequestedBy())
                .status(TestStatus.SCHEDULED)
                .build();
            repository.save(next);
            log.info("Next occurrence of recurring test {} scheduled as {} at {}",
                finished.getId(), next.getId(), next.getScheduledFor());
        } catch (ValidationException e) {
            log.error("Recurring test {} has an unusable cadence '{}': {}", finished.getId(), finished.getCadence(), e.getMessage());
        }
    }

    private DrEngineProperties.Environment environment(String name) {
        DrEngineProperties.Environment environment = name == null ? null : properties.getEnvironments().get(name);
        if (environment == null) {
            throw new ValidationException(ErrorCode.UNKNOWN_ENVIRONMENT, "Unknown environment: " + name);
        }
        if (environment.getType() == null || environment.getType().isProduction()) {
            throw new ValidationException(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED,
                "Environment " + name + " is not an isolated non-production environment");
        }
        return environment;
    }

    /**
     * The environment's drill regions must be distinct, configured and outside every production
     * topology: neither a monitored primary nor an endpoint of a link to a region outside the environment.
     */
    private void requireIsolatedTopology(String name, DrEngineProperties.Environment environment) {
        requireRegion("primaryRegion", name, environment.getPrimaryRegion());
        requireRegion("replicaRegion", name, environment.getReplicaRegion());
        if (environment.getPrimaryRegion().equals(environment.getReplicaRegion())) {
            throw new ValidationException("replicaRegion", environment.getReplicaRegion(),
                "Environment " + name + " needs distinct primary and replica regions");
        }

        Set<String> own = Set.of(environment.getPrimaryRegion(), environment.getReplicaRegion());
        List<String> monitored = properties.getHealth().getPrimaryRegions();
        for (String region : own) {
            if (monitored.contains(region)) {
                throw new ValidationException(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED,
                    "Environment " + name + " region " + region + " is a monitored production primary");
            }
        }
        for (ReplicationLink link : topologyManager.allLinks()) {
            if (!link.isActive()) {
                continue;
            }
            boolean touches = own.contains(link.getPrimaryRegion()) || own.contains(link.getReplicaRegion());
            boolean leaves = !own.contains(link.getPrimaryRegion()) || !own.contains(link.getReplicaRegion());
            if (touches && leaves) {
                throw new ValidationException(ErrorCode.PRODUCTION_ENVIRONMENT_REJECTED,
                    "Environment " + name + " shares replication link " + link.getPrimaryRegion() + " -> "
                        + link.getReplicaRegion() + " with a region outside the environment");
            }
        }
    }

    private void requireRegion(String field, String environment, String region) {
        if (region == null || !regionDataSources.isKnownRegion(region)) {
            throw new ValidationException(ErrorCode.UNKNOWN_REGION,
                "Environment " + environment + " has no usable " + field + ": " + region);
        }
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static Duration longest(Duration a, Duration b) {
        if (a == null || b == null) {
            return null;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Mutable results of one run, filled in by the scenario steps.
     */
    private static final class Measurement {
        private Duration rto;
        private Duration rpo;
        private boolean integrity = true;
        private Duration estimatedRestore;
        private Instant pointInTime;
        private UUID failoverEventId;
        private final List<String> issues = new ArrayList<>();
        private final List<UUID> restoredExecutions = new ArrayList<>();

        void issue(String issue) {
            issues.add(issue);
        }

        void fail(String issue) {
            integrity = false;
            issues.add(issue);
        }

        void record(RestoreVerifier.RestoreOutcome outcome) {
            integrity = integrity && outcome.integrity().isVerified();
            issues.addAll(outcome.integrity().issues());
            restoredExecutions.addAll(outcome.restoredExecutions());
        }
    }
}
