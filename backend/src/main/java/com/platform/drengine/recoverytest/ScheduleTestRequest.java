package com.platform.drengine.recoverytest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to schedule a recovery test. Without {@code scheduledFor} the test is due immediately.
 */
public record ScheduleTestRequest(
    @NotNull ScenarioType scenario,
    @NotBlank String environment,
    UUID backupJobId,
    String cadence,
    Instant scheduledFor,
    Instant pointInTime,
    String configurationScope,
    String requestedBy
) {
}
