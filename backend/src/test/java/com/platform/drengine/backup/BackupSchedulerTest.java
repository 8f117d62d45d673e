package com.platform.drengine.backup;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class BackupSchedulerTest {

    private final BackupFixture fixture = new BackupFixture();

    @Test
    void dailyFullJobProducesOneCompletedExecutionPerTick() {
        UUID jobId = fixture.service.scheduleJob(fixture.request("nightly", BackupType.FULL, "0 0 2 * * *", true));

        for (int day = 0; day < 3; day++) {
            Instant due = fixture.service.job(jobId).getNextExecution();
            fixture.clock.set(due.plus(Duration.ofSeconds(30)));
            fixture.scheduler.tick();
        }

        List<BackupExecution> executions = fixture.service.listExecutions(jobId);
        assertThat(executions).hasSize(3).allMatch(BackupExecution::isSuccessful);
        assertThat(executions).extracting(BackupExecution::getChecksum).doesNotHaveDuplicates().doesNotContainNull();
        assertThat(fixture.service.job(jobId).getStats().getSuccessfulExecutions()).isEqualTo(3);
    }

    @Test
    void tickBeforeDueTimeDoesNothing() {
        UUID jobId = fixture.service.scheduleJob(fixture.request("nightly", BackupType.FULL, "0 0 2 * * *", true));

        fixture.clock.set(Instant.parse("2026-01-10T01:59:59Z"));
        fixture.scheduler.tick();

        assertThat(fixture.service.listExecutions(jobId)).isEmpty();
    }

    @Test
    void missedTicksFireOnceAndMoveNextExecutionPastNow() {
        UUID jobId = fixture.service.scheduleJob(fixture.request("nightly", BackupType.FULL, "0 0 2 * * *", true));

        fixture.clock.set(Instant.parse("2026-01-15T12:00:00Z"));
        fixture.scheduler.tick();
        fixture.scheduler.tick();

        assertThat(fixture.service.listExecutions(jobId)).hasSize(1);
        assertThat(fixture.service.job(jobId).getNextExecution()).isEqualTo(Instant.parse("2026-01-16T02:00:00Z"));
    }

    @Test
    void deactivatedJobIsNotFired() {
        UUID jobId = fixture.service.scheduleJob(fixture.request("nightly", BackupType.FULL, "0 0 2 * * *", true));
        fixture.service.deactivateJob(jobId);

        fixture.clock.set(Instant.parse("2026-01-11T00:00:00Z"));
        fixture.scheduler.tick();

        assertThat(fixture.service.listExecutions(jobId)).isEmpty();
    }
}
