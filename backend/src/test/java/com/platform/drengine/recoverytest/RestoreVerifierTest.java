package com.platform.drengine.recoverytest;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupFixture;
import com.platform.drengine.backup.BackupRecord;
import com.platform.drengine.backup.BackupType;
import com.platform.drengine.backup.CaptureResult;
import com.platform.drengine.error.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestoreVerifierTest {

    private static final String TABLE = "app.orders";
    private static final String ENV = "staging";

    private BackupFixture fixture;
    private InMemoryRestoreTarget target;
    private RestoreVerifier verifier;
    private UUID jobId;
    private Instant fullStart;

    @BeforeEach
    void setUp() {
        fixture = new BackupFixture();
        target = new InMemoryRestoreTarget();
        verifier = new RestoreVerifier(fixture.storage, fixture.codec, fixture.retryEngine, target);
        jobId = fixture.service.scheduleJob(fixture.request("orders", BackupType.FULL, "0 0 2 * * *", true));

        fullStart = fixture.clock.instant();
        respond(
            BackupRecord.upsert(TABLE, Map.of("id", 1), Map.of("id", 1, "total", "10.00"), fullStart.minus(Duration.ofHours(1))),
            BackupRecord.upsert(TABLE, Map.of("id", 2), Map.of("id", 2, "total", "20.00"), fullStart.minus(Duration.ofMinutes(30))));
        fixture.service.executeNow(jobId, Optional.empty());
        fixture.clock.advance(Duration.ofHours(1));
    }

    @Test
    void restoresFullAndIncrementalsIntoTheEnvironment() {
        respond(
            BackupRecord.upsert(TABLE, Map.of("id", 1), Map.of("id", 1, "total", "15.00"), fullStart.plus(Duration.ofMinutes(30))),
            BackupRecord.delete(TABLE, Map.of("id", 2), fullStart.plus(Duration.ofMinutes(40))),
            BackupRecord.upsert(TABLE, Map.of("id", 3), Map.of("id", 3, "total", "30.00"), fullStart.plus(Duration.ofMinutes(50))));
        fixture.service.executeNow(jobId, Optional.of(BackupType.INCREMENTAL));
        List<BackupExecution> chain = fixture.service.restoreChain(jobId, fixture.clock.instant());

        RestoreVerifier.RestoreOutcome outcome = verifier.restore(ENV, chain, List.of(), null);

        assertThat(outcome.integrity().isVerified()).isTrue();
        assertThat(outcome.integrity().issues()).isEmpty();
        assertThat(outcome.integrity().restoredRecords()).isEqualTo(2);
        assertThat(outcome.latestRestoredChange()).isEqualTo(fullStart.plus(Duration.ofMinutes(50)));
        assertThat(outcome.restoredExecutions()).containsExactlyElementsOf(chain.stream().map(BackupExecution::getId).toList());
        assertThat(target.rows(ENV, TABLE))
            .extracting(row -> row.get("total"))
            .containsExactlyInAnyOrder("15.00", "30.00");
    }

    @Test
    void pointInTimeReplaysArchivedChangesUpToTheTarget() {
        respond(
            BackupRecord.upsert(TABLE, Map.of("id", 1), Map.of("id", 1, "total", "11.00"), fullStart.plus(Duration.ofMinutes(20))),
            BackupRecord.delete(TABLE, Map.of("id", 2), fullStart.plus(Duration.ofMinutes(50))));
        fixture.service.executeNow(jobId, Optional.of(BackupType.LOG_ARCHIVE));
        Instant asOf = fullStart.plus(Duration.ofMinutes(30));
        List<BackupExecution> chain = fixture.service.restoreChain(jobId, asOf);
        List<BackupExecution> archives = fixture.service.logArchivesCovering(jobId, fullStart, asOf);

        RestoreVerifier.RestoreOutcome outcome = verifier.restore(ENV, chain, archives, asOf);

        assertThat(archives).hasSize(1);
        assertThat(outcome.integrity().isVerified()).isTrue();
        assertThat(outcome.latestRestoredChange()).isEqualTo(fullStart.plus(Duration.ofMinutes(20)));
        assertThat(target.rows(ENV, TABLE))
            .extracting(row -> row.get("total"))
            .containsExactlyInAnyOrder("11.00", "20.00");
    }

    @Test
    void tamperedArtifactFailsChecksumVerification() {
        List<BackupExecution> chain = fixture.service.restoreChain(jobId, fixture.clock.instant());
        String key = chain.get(0).getStorageKey();
        fixture.storage.overwrite(key, "tampered".getBytes());

        RestoreVerifier.RestoreOutcome outcome = verifier.restore(ENV, chain, List.of(), null);

        assertThat(outcome.integrity().checksumsMatch()).isFalse();
        assertThat(outcome.integrity().isVerified()).isFalse();
        assertThat(outcome.integrity().issues()).anySatisfy(issue -> assertThat(issue).contains(key).contains("checksum"));
        assertThat(outcome.restoredExecutions()).isEmpty();
    }

    @Test
    void rowsMissingAfterLoadAreReported() {
        target.setDropRowOnRead(true);
        List<BackupExecution> chain = fixture.service.restoreChain(jobId, fixture.clock.instant());

        IntegrityResult integrity = verifier.restore(ENV, chain, List.of(), null).integrity();

        assertThat(integrity.dataComplete()).isFalse();
        assertThat(integrity.expectedDigest()).isNotEqualTo(integrity.actualDigest());
        assertThat(integrity.issues()).anySatisfy(issue -> assertThat(issue).contains("1 rows after restore, expected 2"));
    }

    @Test
    void emptyChainCannotBeRestored() {
        RestoreVerifier.RestoreOutcome outcome = verifier.restore(ENV, List.of(), List.of(), null);

        assertThat(outcome.integrity().isVerified()).isFalse();
        assertThat(outcome.latestRestoredChange()).isNull();
        assertThat(outcome.integrity().issues()).containsExactly("no successful full backup to restore from");
    }

    @Test
    void missingArtifactPropagatesStorageFailure() {
        List<BackupExecution> chain = fixture.service.restoreChain(jobId, fixture.clock.instant());
        BackupExecution missing = chain.get(0).toBuilder().storageKey("backups/missing.bak").build();

        assertThatThrownBy(() -> verifier.restore(ENV, List.of(missing), List.of(), null))
            .isInstanceOf(StorageException.class);
    }

    private void respond(BackupRecord... records) {
        fixture.source.respondWith(capture -> new CaptureResult(List.of(TABLE), List.of(records)));
    }
}
