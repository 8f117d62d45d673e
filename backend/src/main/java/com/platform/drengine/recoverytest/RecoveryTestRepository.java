package com.platform.drengine.recoverytest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecoveryTestRepository {
    
    RecoveryTest save(RecoveryTest test);
    
    Optional<RecoveryTest> findById(UUID id);
    
    List<RecoveryTest> findAll();
    
    List<RecoveryTest> findByStatus(TestStatus status);
    
    /**
     * Tests scheduled for {@code [from, to)}, oldest first.
     */
    List<RecoveryTest> findScheduledBetween(Instant from, Instant to);
    
    /**
     * Finalized tests completed in {@code [from, to)}.
     */
    List<RecoveryTest> findCompletedBetween(Instant from, Instant to);
}
