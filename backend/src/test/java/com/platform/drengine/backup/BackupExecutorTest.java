package com.platform.drengine.backup;

import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.notification.DrEvent;
import com.platform.drengine.notification.NotificationSeverity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class BackupExecutorTest {

    @Test
    void secondStartWhileRunningReturnsTheInFlightExecution() {
        Deque<Runnable> queued = new ArrayDeque<>();
        BackupFixture fixture = new BackupFixture(queued::add);
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.FULL, "0 0 2 * * *", true));

        UUID first = fixture.service.executeNow(jobId, Optional.empty());
        UUID second = fixture.service.executeNow(jobId, Optional.empty());

        assertThat(second).isEqualTo(first);
        assertThat(queued).hasSize(1);
        assertThat(fixture.executor.isRunning(jobId)).isTrue();

        queued.poll().run();

        assertThat(fixture.executor.isRunning(jobId)).isFalse();
        assertThat(fixture.service.executionStatus(first).getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.service.executeNow(jobId, Optional.empty())).isNotEqualTo(first);
    }

    @Test
    void incrementalWithoutFullIsPromotedToFull() {
        BackupFixture fixture = new BackupFixture();
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.INCREMENTAL, "0 0 * * * *", true));

        UUID firstId = fixture.service.executeNow(jobId, Optional.empty());
        fixture.clock.advance(Duration.ofHours(1));
        UUID secondId = fixture.service.executeNow(jobId, Optional.empty());

        BackupExecution first = fixture.service.executionStatus(firstId);
        BackupExecution second = fixture.service.executionStatus(secondId);
        assertThat(first.getRequestedType()).isEqualTo(BackupType.INCREMENTAL);
        assertThat(first.getEffectiveType()).isEqualTo(BackupType.FULL);
        assertThat(first.getBaselineAt()).isNull();
        assertThat(second.getEffectiveType()).isEqualTo(BackupType.INCREMENTAL);
        assertThat(second.getBaselineAt()).isEqualTo(first.getStartedAt());

        RecordingBackupSource.Capture incremental = fixture.source.captures().get(1);
        assertThat(incremental.since()).isEqualTo(first.getStartedAt());
        assertThat(incremental.until()).isEqualTo(second.getStartedAt());
    }

    @Test
    void failedExecutionKeepsItsEffectiveTypeAndBaseline() {
        BackupFixture fixture = new BackupFixture();
        AtomicBoolean regionDown = new AtomicBoolean(true);
        fixture.source.respondWith(capture -> {
            if (regionDown.get()) {
                throw new ExternalSystemException(ErrorCode.REGION_UNREACHABLE, capture.region(), "connection refused");
            }
            return new CaptureResult(List.of("app.orders"), List.of());
        });
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.INCREMENTAL, "0 0 * * * *", true));

        BackupExecution promoted = fixture.service.executionStatus(fixture.service.executeNow(jobId, Optional.empty()));

        assertThat(promoted.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(promoted.getRequestedType()).isEqualTo(BackupType.INCREMENTAL);
        assertThat(promoted.getEffectiveType()).isEqualTo(BackupType.FULL);
        assertThat(promoted.getBaselineAt()).isNull();

        regionDown.set(false);
        UUID fullId = fixture.service.executeNow(jobId, Optional.of(BackupType.FULL));
        fixture.clock.advance(Duration.ofHours(1));
        regionDown.set(true);

        BackupExecution incremental = fixture.service.executionStatus(fixture.service.executeNow(jobId, Optional.empty()));

        assertThat(incremental.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(incremental.getEffectiveType()).isEqualTo(BackupType.INCREMENTAL);
        assertThat(incremental.getBaselineAt()).isEqualTo(fixture.service.executionStatus(fullId).getStartedAt());
    }

    @Test
    void completedExecutionRecordsArtifactDetails() {
        BackupFixture fixture = new BackupFixture();
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.FULL, "0 0 2 * * *", true));

        BackupExecution execution = fixture.service.executionStatus(fixture.service.executeNow(jobId, Optional.empty()));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.getVerification()).isEqualTo(VerificationState.VERIFIED);
        assertThat(execution.getRecordCount()).isEqualTo(1);
        assertThat(execution.getTablesBackedUp()).containsExactly("app.orders");
        assertThat(execution.getStorageKey())
            .startsWith("backups/" + jobId + "/2026/01/10/")
            .endsWith(".full.jsonl.gz");
        assertThat(fixture.storage.exists(execution.getStorageKey())).isTrue();

        BackupArtifact artifact = fixture.codec.decode(execution.getStorageKey(),
            fixture.storage.get(execution.getStorageKey()));
        assertThat(artifact.header().executionId()).isEqualTo(execution.getId());
        assertThat(artifact.records()).hasSize(1);
    }

    @Test
    void checksumMismatchAfterWriteFailsTheExecution() {
        BackupFixture fixture = new BackupFixture();
        fixture.storage.setCorruptReads(true);
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.FULL, "0 0 2 * * *", true));

        BackupExecution execution = fixture.service.executionStatus(fixture.service.executeNow(jobId, Optional.empty()));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getVerification()).isEqualTo(VerificationState.MISMATCH);
        ArgumentCaptor<DrEvent> event = ArgumentCaptor.forClass(DrEvent.class);
        verify(fixture.notificationChannel).notify(event.capture());
        assertThat(event.getValue().eventType()).isEqualTo(DrEvent.EventType.BACKUP_VERIFICATION_FAILED);
    }

    @Test
    void thirdConsecutiveFailureRaisesCriticalAlert() {
        BackupFixture fixture = new BackupFixture();
        fixture.source.respondWith(capture -> {
            throw new ExternalSystemException(ErrorCode.REGION_UNREACHABLE, capture.region(), "connection refused");
        });
        UUID jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.FULL, "0 0 2 * * *", true));

        for (int i = 0; i < 4; i++) {
            fixture.service.executeNow(jobId, Optional.empty());
            fixture.clock.advance(Duration.ofMinutes(5));
        }

        assertThat(fixture.service.listExecutions(jobId))
            .hasSize(4)
            .allMatch(e -> e.getStatus() == ExecutionStatus.FAILED)
            .allMatch(e -> e.getErrorDetail().startsWith(ErrorCode.REGION_UNREACHABLE.getCode()));
        assertThat(fixture.service.job(jobId).getStats().getConsecutiveFailures()).isEqualTo(4);
        ArgumentCaptor<DrEvent> event = ArgumentCaptor.forClass(DrEvent.class);
        verify(fixture.notificationChannel, times(1)).notify(event.capture());
        assertThat(event.getValue().eventType()).isEqualTo(DrEvent.EventType.BACKUP_FAILURE_STREAK);
        assertThat(event.getValue().severity()).isEqualTo(NotificationSeverity.CRITICAL);
    }

    @Test
    void nonParallelJobsShareOneExclusiveSlot() throws Exception {
        BackupFixture fixture = new BackupFixture(command -> new Thread(command).start());
        fixture.properties.getBackup().setExclusiveSlotWait(Duration.ofMillis(100));
        CountDownLatch capturing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fixture.source.respondWith(capture -> {
            capturing.countDown();
            await(release);
            return new CaptureResult(List.of(), List.of());
        });

        UUID slow = fixture.service.scheduleJob(fixture.request("slow", BackupType.FULL, "0 0 2 * * *", false));
        UUID blocked = fixture.service.scheduleJob(fixture.request("blocked", BackupType.FULL, "0 0 3 * * *", false));

        UUID slowExecution = fixture.service.executeNow(slow, Optional.empty());
        assertThat(capturing.await(5, TimeUnit.SECONDS)).isTrue();
        UUID blockedExecution = fixture.service.executeNow(blocked, Optional.empty());

        BackupExecution timedOut = awaitTerminal(fixture, blockedExecution);
        assertThat(timedOut.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(timedOut.getErrorDetail()).contains("exclusive backup slot");

        release.countDown();
        assertThat(awaitTerminal(fixture, slowExecution).getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    private static BackupExecution awaitTerminal(BackupFixture fixture, UUID executionId) throws InterruptedException {
        Instant deadline = Instant.now().plusSeconds(10);
        while (Instant.now().isBefore(deadline)) {
            BackupExecution execution = fixture.service.executionStatus(executionId);
            if (execution.getStatus().isTerminal() && !fixture.executor.isRunning(execution.getJobId())) {
                return execution;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("execution " + executionId + " did not finish");
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
