package com.platform.drengine.recoverytest;

import com.platform.drengine.backup.BackupArtifact;
import com.platform.drengine.backup.BackupArtifactCodec;
import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupRecord;
import com.platform.drengine.backup.RowValues;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.storage.Checksums;
import com.platform.drengine.storage.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Restores a chain of backup artifacts into an environment and verifies the result.
 *
 * Every artifact is fetched, its checksum recomputed and its record count compared with the
 * header before anything is loaded. The records are replayed in memory to the expected
 * dataset, loaded into the environment, read back and compared by digest.
 * Storage that cannot be reached propagates as an exception.
 */
@Slf4j
@Component
public class RestoreVerifier {

    private final StorageBackend storage;
    private final BackupArtifactCodec codec;
    private final RetryEngine retryEngine;
    private final RestoreTarget restoreTarget;

    public RestoreVerifier(StorageBackend storage, BackupArtifactCodec codec, RetryEngine retryEngine,
                           RestoreTarget restoreTarget) {
        this.storage = storage;
        this.codec = codec;
        this.retryEngine = retryEngine;
        this.restoreTarget = restoreTarget;
    }

    /**
     * @param chain       full backup followed by incrementals, oldest first
     * @param logArchives archives replayed after the chain, oldest first
     * @param asOf        changes after this instant are not replayed; null replays everything
     */
    public RestoreOutcome restore(String environment, List<BackupExecution> chain, List<BackupExecution> logArchives,
                                  Instant asOf) {
        List<String> issues = new ArrayList<>();
        boolean checksumsMatch = true;
        boolean countsMatch = true;

        if (chain.isEmpty()) {
            issues.add("no successful full backup to restore from");
            return RestoreOutcome.failed(new IntegrityResult(false, false, false, null, null, 0, issues));
        }

        List<BackupArtifact> chainArtifacts = new ArrayList<>();
        List<BackupArtifact> archiveArtifacts = new ArrayList<>();
        List<UUID> restored = new ArrayList<>();
        for (BackupExecution execution : concat(chain, logArchives)) {
            byte[] bytes = retryEngine.executeWithRetry("get", "storage", () -> storage.get(execution.getStorageKey()));
            String actual = Checksums.sha256Hex(bytes);
            if (!actual.equals(execution.getChecksum())) {
                checksumsMatch = false;
                issues.add("artifact " + execution.getStorageKey() + " checksum " + actual
                    + " does not match recorded " + execution.getChecksum());
                continue;
            }
            BackupArtifact artifact = codec.decode(execution.getStorageKey(), bytes);
            if (artifact.records().size() != artifact.header().recordCount()
                    || artifact.records().size() != execution.getRecordCount()) {
                countsMatch = false;
                issues.add(String.format("artifact %s holds %d records, header says %d, execution says %d",
                    execution.getStorageKey(), artifact.records().size(), artifact.header().recordCount(),
                    execution.getRecordCount()));
            }
            (chain.contains(execution) ? chainArtifacts : archiveArtifacts).add(artifact);
            restored.add(execution.getId());
        }
        boolean dataComplete = checksumsMatch;

        Instant chainEnd = chain.get(chain.size() - 1).getStartedAt();
        Dataset expected = new Dataset();
        Instant latestChange = null;
        for (BackupArtifact artifact : chainArtifacts) {
            artifact.header().tables().forEach(expected::touch);
            for (BackupRecord record : artifact.records()) {
                expected.apply(record);
            }
            latestChange = latest(latestChange, artifact.header().latestChangeAt() != null
                ? artifact.header().latestChangeAt()
                : artifact.header().capturedUntil());
        }
        for (BackupArtifact artifact : archiveArtifacts) {
            for (BackupRecord record : artifact.records()) {
                Instant changedAt = record.changedAt();
                if (changedAt == null || !changedAt.isAfter(chainEnd) || asOf != null && changedAt.isAfter(asOf)) {
                    continue;
                }
                expected.apply(record);
                latestChange = latest(latestChange, changedAt);
            }
        }
        if (asOf != null && !archiveArtifacts.isEmpty()) {
            Instant coveredUntil = archiveArtifacts.get(archiveArtifacts.size() - 1).header().capturedUntil();
            if (coveredUntil != null && coveredUntil.isBefore(asOf)) {
                issues.add("log archives cover changes only up to " + coveredUntil + ", target was " + asOf);
            }
        }

        restoreTarget.clear(environment, expected.tables());
        for (String table : expected.tables()) {
            restoreTarget.load(environment, table, new ArrayList<>(expected.rows(table)));
        }

        Dataset actual = new Dataset();
        for (String table : expected.tables()) {
            actual.touch(table);
            for (Map<String, Object> row : restoreTarget.read(environment, table)) {
                actual.put(table, row);
            }
        }

        String expectedDigest = expected.digest();
        String actualDigest = actual.digest();
        if (expected.size() != actual.size()) {
            dataComplete = false;
            issues.add("environment holds " + actual.size() + " rows after restore, expected " + expected.size());
        }
        if (!expectedDigest.equals(actualDigest)) {
            issues.add("restored dataset digest " + actualDigest + " differs from expected " + expectedDigest);
        }

        IntegrityResult integrity = new IntegrityResult(checksumsMatch, countsMatch, dataComplete,
            expectedDigest, actualDigest, expected.size(), issues);
        log.info("Restore into {} from {} artifacts: verified={}, rows={}, latest change {}",
            environment, restored.size(), integrity.isVerified(), expected.size(), latestChange);
        return new RestoreOutcome(integrity, latestChange, restored);
    }

    private static List<BackupExecution> concat(List<BackupExecution> first, List<BackupExecution> second) {
        List<BackupExecution> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static Instant latest(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    /**
     * Result of a restore. {@code latestRestoredChange} is null when nothing was restored.
     */
    public record RestoreOutcome(IntegrityResult integrity, Instant latestRestoredChange, List<UUID> restoredExecutions) {

        static RestoreOutcome failed(IntegrityResult integrity) {
            return new RestoreOutcome(integrity, null, List.of());
        }
    }

    /**
     * Rows per table keyed by canonical primary key. The row maps keep the values as loaded,
     * the digest uses their canonical string forms.
     */
    private static final class Dataset {

        private final Map<String, Map<String, Map<String, Object>>> tables = new TreeMap<>();

        void touch(String table) {
            tables.computeIfAbsent(table, t -> new TreeMap<>());
        }

        void apply(BackupRecord record) {
            Map<String, Map<String, Object>> rows = tables.computeIfAbsent(record.table(), t -> new TreeMap<>());
            String key = RowValues.canonical(record.key()).toString();
            if (record.operation() == BackupRecord.Operation.DELETE) {
                rows.remove(key);
            } else {
                rows.put(key, new LinkedHashMap<>(record.row()));
            }
        }

        /**
         * Rows read back carry no key; they are keyed by their full canonical form.
         */
        void put(String table, Map<String, Object> row) {
            tables.computeIfAbsent(table, t -> new TreeMap<>()).put(RowValues.canonical(row).toString(), row);
        }

        Set<String> tables() {
            return new LinkedHashSet<>(tables.keySet());
        }

        java.util.Collection<Map<String, Object>> rows(String table) {
            return tables.getOrDefault(table, Map.of()).values();
        }

        long size() {
            return tables.values().stream().mapToLong(Map::size).sum();
        }

        String digest() {
            MessageDigest digest = Checksums.newDigest();
            for (Map.Entry<String, Map<String, Map<String, Object>>> table : tables.entrySet()) {
                List<String> rows = new ArrayList<>();
                for (Map<String, Object> row : table.getValue().values()) {
                    rows.add(RowValues.canonical(row).toString());
                }
                rows.sort(null);
                digest.update(table.getKey().getBytes(StandardCharsets.UTF_8));
                for (String row : rows) {
                    digest.update(row.getBytes(StandardCharsets.UTF_8));
                    digest.update((byte) '\n');
                }
            }
            return HexFormat.of().formatHex(digest.digest());
        }
    }
}
