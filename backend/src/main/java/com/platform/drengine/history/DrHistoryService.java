package com.platform.drengine.history;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupRepository;
import com.platform.drengine.backup.ExecutionStatus;
import com.platform.drengine.error.ValidationException;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverEventRepository;
import com.platform.drengine.failover.FailoverOutcome;
import com.platform.drengine.recoverytest.RecoveryTest;
import com.platform.drengine.recoverytest.RecoveryTestRepository;
import com.platform.drengine.recoverytest.TestStatus;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only history queries over backup executions, failover events and recovery tests.
 */
@Service
public class DrHistoryService {

    private final BackupRepository backupRepository;
    private final FailoverEventRepository failoverEventRepository;
    private final RecoveryTestRepository recoveryTestRepository;

    public DrHistoryService(BackupRepository backupRepository, FailoverEventRepository failoverEventRepository,
                            RecoveryTestRepository recoveryTestRepository) {
        this.backupRepository = backupRepository;
        this.failoverEventRepository = failoverEventRepository;
        this.recoveryTestRepository = recoveryTestRepository;
    }

    /**
     * @param configurationScope restrict to one DR configuration scope, or null for all
     */
    public HistorySummary summary(String configurationScope, Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new ValidationException("from", from, "History window must have from before to");
        }
        return new HistorySummary(configurationScope, from, to,
            backups(configurationScope, from, to),
            failovers(configurationScope, from, to),
            recoveryTests(configurationScope, from, to));
    }

    public HistorySummary.Backups backups(String configurationScope, Instant from, Instant to) {
        Set<UUID> jobs = backupRepository.findAllJobs().stream()
            .filter(job -> inScope(configurationScope, job.getConfigurationScope()))
            .map(BackupJob::getId)
            .collect(Collectors.toSet());
        List<BackupExecution> executions = backupRepository.findExecutionsStartedBetween(from, to).stream()
            .filter(e -> jobs.contains(e.getJobId()))
            .filter(e -> e.getStatus() != ExecutionStatus.RUNNING)
            .toList();

        long successful = executions.stream().filter(BackupExecution::isSuccessful).count();
        long failed = executions.stream().filter(e -> e.getStatus() == ExecutionStatus.FAILED).count();
        long tested = executions.stream().filter(BackupExecution::isRecoveryTested).count();
        return new HistorySummary.Backups(executions.size(), successful, failed, tested,
            rate(successful, executions.size()));
    }

    public HistorySummary.Failovers failovers(String configurationScope, Instant from, Instant to) {
        List<FailoverEvent> events = failoverEventRepository.findStartedBetween(from, to).stream()
            .filter(e -> inScope(configurationScope, e.getConfigurationScope()))
            .toList();

        Map<FailoverOutcome, Long> outcomes = new EnumMap<>(FailoverOutcome.class);
        for (FailoverOutcome outcome : FailoverOutcome.values()) {
            outcomes.put(outcome, events.stream().filter(e -> e.getOutcome() == outcome).count());
        }
        long inProgress = events.stream().filter(e -> !e.isTerminal()).count();

        List<Duration> durations = events.stream()
            .filter(FailoverEvent::isTerminal)
            .map(FailoverEvent::duration)
            .filter(Objects::nonNull)
            .toList();
        Duration average = durations.isEmpty()
            ? null
            : durations.stream().reduce(Duration.ZERO, Duration::plus).dividedBy(durations.size());
        return new HistorySummary.Failovers(events.size(), outcomes, inProgress, average);
    }

    public HistorySummary.RecoveryTests recoveryTests(String configurationScope, Instant from, Instant to) {
        List<RecoveryTest> tests = recoveryTestRepository.findCompletedBetween(from, to).stream()
            .filter(t -> inScope(configurationScope, t.getConfigurationScope()))
            .toList();
        long passed = tests.stream().filter(t -> t.getStatus() == TestStatus.PASSED).count();
        long failed = tests.stream().filter(t -> t.getStatus() == TestStatus.FAILED).count();
        return new HistorySummary.RecoveryTests(tests.size(), passed, failed, rate(passed, tests.size()));
    }

    private static boolean inScope(String requested, String actual) {
        return requested == null || requested.equals(actual);
    }

    private static Double rate(long part, long total) {
        return total == 0 ? null : (double) part / total;
    }
}
