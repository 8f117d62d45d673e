package com.platform.drengine.recoverytest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecoveryTestRepository implements RecoveryTestRepository {

    private final Map<UUID, RecoveryTest> tests = new ConcurrentHashMap<>();

    @Override
    public RecoveryTest save(RecoveryTest test) {
        RecoveryTest copy = copy(test);
        copy.setVersion(test.getVersion() == null ? 0L : test.getVersion() + 1);
        tests.put(copy.getId(), copy);
        return copy(copy);
    }

    @Override
    public Optional<RecoveryTest> findById(UUID id) {
        return Optional.ofNullable(tests.get(id)).map(InMemoryRecoveryTestRepository::copy);
    }

    @Override
    public List<RecoveryTest> findAll() {
        return tests.values().stream().map(InMemoryRecoveryTestRepository::copy).toList();
    }

    @Override
    public List<RecoveryTest> findByStatus(TestStatus status) {
        return tests.values().stream()
            .filter(t -> t.getStatus() == status)
            .map(InMemoryRecoveryTestRepository::copy)
            .toList();
    }

    @Override
    public List<RecoveryTest> findScheduledBetween(Instant from, Instant to) {
        return tests.values().stream()
            .filter(t -> t.getScheduledFor() != null && !t.getScheduledFor().isBefore(from) && t.getScheduledFor().isBefore(to))
            .sorted(Comparator.comparing(RecoveryTest::getScheduledFor))
            .map(InMemoryRecoveryTestRepository::copy)
            .toList();
    }

    @Override
    public List<RecoveryTest> findCompletedBetween(Instant from, Instant to) {
        return tests.values().stream()
            .filter(t -> t.getStatus().isFinal() && t.getCompletedAt() != null
                && !t.getCompletedAt().isBefore(from) && t.getCompletedAt().isBefore(to))
            .map(InMemoryRecoveryTestRepository::copy)
            .toList();
    }

    private static RecoveryTest copy(RecoveryTest test) {
        return test.toBuilder()
            .issuesFound(new ArrayList<>(test.getIssuesFound()))
            .restoredExecutions(new ArrayList<>(test.getRestoredExecutions()))
            .build();
    }
}
