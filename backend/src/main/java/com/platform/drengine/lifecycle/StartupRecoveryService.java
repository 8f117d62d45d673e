package com.platform.drengine.lifecycle;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupRepository;
import com.platform.drengine.backup.ExecutionStatus;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverEventRepository;
import com.platform.drengine.failover.FailoverOutcome;
import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.failover.FailoverStateMachine;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationChannel;
import com.platform.drengine.notification.NotificationSeverity;
import com.platform.drengine.observability.LoggingConfig;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.recoverytest.RecoveryTest;
import com.platform.drengine.recoverytest.RecoveryTestRepository;
import com.platform.drengine.recoverytest.TestStatus;
import com.platform.drengine.replication.RegionController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reconciles work that was in flight when the engine stopped.
 *
 * Recovery Logic:
 * 1. RUNNING backup executions become FAILED; their artifacts are incomplete
 * 2. Failovers that had not reached promotion become ABORTED, writes are resumed on the primary
 * 3. Failovers past promotion become ROLLED_BACK with rollbackSuccessful=false and a
 *    CRITICAL notification; the engine does not guess at the routing state
 * 4. RUNNING recovery tests become FAILED
 */
@Slf4j
@Component
public class StartupRecoveryService {

    private static final String RESTART = "engine restarted while in flight";

    private final BackupRepository backupRepository;
    private final FailoverEventRepository failoverEventRepository;
    private final FailoverStateMachine stateMachine;
    private final RecoveryTestRepository recoveryTestRepository;
    private final RegionController regionController;
    private final NotificationChannel notificationChannel;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    public StartupRecoveryService(
            BackupRepository backupRepository,
            FailoverEventRepository failoverEventRepository,
            FailoverStateMachine stateMachine,
            RecoveryTestRepository recoveryTestRepository,
            RegionController regionController,
            NotificationChannel notificationChannel,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.backupRepository = backupRepository;
        this.failoverEventRepository = failoverEventRepository;
        this.stateMachine = stateMachine;
        this.recoveryTestRepository = recoveryTestRepository;
        this.regionController = regionController;
        this.notificationChannel = notificationChannel;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE + 100)
    public void onApplicationReady() {
        log.info("=== Reconciling in-flight DR work ===");
        Report report = reconcile();
        log.info("=== Reconciliation complete: executions={}, failoversAborted={}, failoversRolledBack={}, tests={}, errors={} ===",
            report.executions, report.aborted, report.rolledBack, report.tests, report.errors);

        metricsRegistry.setGauge("drengine.startup.reconciled", report.executions, "kind", "backup_execution");
        metricsRegistry.setGauge("drengine.startup.reconciled", report.aborted + report.rolledBack, "kind", "failover_event");
        metricsRegistry.setGauge("drengine.startup.reconciled", report.tests, "kind", "recovery_test");
    }

    public Report reconcile() {
        Report report = new Report();
        Instant now = clock.instant();

        for (BackupExecution execution : backupRepository.findExecutionsByStatus(ExecutionStatus.RUNNING)) {
            try {
                backupRepository.saveExecution(execution.toBuilder()
                    .status(ExecutionStatus.FAILED)
                    .completedAt(now)
                    .errorDetail(RESTART)
                    .build());
                log.info("[AUDIT] Backup execution {} of job {} marked FAILED: {}", execution.getId(), execution.getJobId(), RESTART);
                report.executions++;
            } catch (RuntimeException e) {
                log.error("Failed to reconcile backup execution {}: {}", execution.getId(), e.getMessage(), e);
                report.errors++;
            }
        }

        for (FailoverEvent event : failoverEventRepository.findNonTerminal()) {
            LoggingConfig.setFailoverContext(event.getId().toString(), event.getPrimaryRegion());
            try {
                if (event.getState().isBeforePointOfNoReturn()) {
                    abort(event);
                    report.aborted++;
                } else {
                    markRollbackRequired(event);
                    report.rolledBack++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to reconcile failover {}: {}", event.getId(), e.getMessage(), e);
                report.errors++;
            } finally {
                LoggingConfig.clearFailoverContext();
            }
        }

        for (RecoveryTest test : recoveryTestRepository.findByStatus(TestStatus.RUNNING)) {
            try {
                List<String> issues = new ArrayList<>(test.getIssuesFound());
                issues.add(RESTART);
                recoveryTestRepository.save(test.toBuilder()
                    .status(TestStatus.FAILED)
                    .completedAt(now)
                    .passed(false)
                    .remediationRequired(true)
                    .issuesFound(issues)
                    .build());
                log.info("[AUDIT] Recovery test {} marked FAILED: {}", test.getId(), RESTART);
                report.tests++;
            } catch (RuntimeException e) {
                log.error("Failed to reconcile recovery test {}: {}", test.getId(), e.getMessage(), e);
                report.errors++;
            }
        }
        return report;
    }

    private void abort(FailoverEvent event) {
        if (event.getState() == FailoverState.DRAINING) {
            try {
                regionController.resumeWrites(event.getPrimaryRegion());
            } catch (RuntimeException e) {
                log.error("Could not resume writes on {} for failover {}: {}", event.getPrimaryRegion(), event.getId(), e.getMessage());
            }
        }
        event.setOutcome(FailoverOutcome.ABORTED);
        event.setCompleted(false);
        event.setFailureDetail(RESTART + " in " + event.getState());
        stateMachine.transition(event, FailoverState.ABORTED, RESTART);
        failoverEventRepository.save(event);
    }

    private void markRollbackRequired(FailoverEvent event) {
        FailoverState interrupted = event.getState();
        if (interrupted != FailoverState.ROLLING_BACK) {
            stateMachine.transition(event, FailoverState.ROLLING_BACK, RESTART + " in " + interrupted);
        }
        event.setCompleted(false);
        event.setRollbackSuccessful(false);
        event.setOutcome(FailoverOutcome.ROLLBACK_FAILED);
        event.setFailureDetail(RESTART + " in " + interrupted + "; routing state must be verified manually");
        stateMachine.transition(event, FailoverState.ROLLED_BACK, "not rolled back automatically after restart");
        failoverEventRepository.save(event);

        notificationChannel.notify(DrEvent.create(
            DrEvent.EventType.STARTUP_RECONCILIATION,
            NotificationSeverity.CRITICAL,
            "Failover " + event.getPrimaryRegion() + " -> " + event.getTargetRegion() + " was interrupted in "
                + interrupted + " by an engine restart. Manual intervention required.",
            Map.of("eventId", event.getId().toString(),
                "primaryRegion", event.getPrimaryRegion(),
                "targetRegion", event.getTargetRegion(),
                "interruptedState", interrupted.name()),
            clock.instant()));
    }

    public static final class Report {
        private int executions;
        private int aborted;
        private int rolledBack;
        private int tests;
        private int errors;

        public int executions() {
            return executions;
        }

        public int aborted() {
            return aborted;
        }

        public int rolledBack() {
            return rolledBack;
        }

        public int tests() {
            return tests;
        }

        public int errors() {
            return errors;
        }
    }
}
