package com.platform.drengine.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupJobStats;
import com.platform.drengine.backup.BackupScope;
import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.StateTransition;
import com.platform.drengine.health.HealthSnapshot;
import com.platform.drengine.health.Indicator;
import com.platform.drengine.persistence.entity.BackupExecutionEntity;
import com.platform.drengine.persistence.entity.BackupJobEntity;
import com.platform.drengine.persistence.entity.DrConfigurationEntity;
import com.platform.drengine.persistence.entity.FailoverEventEntity;
import com.platform.drengine.persistence.entity.HealthSnapshotEntity;
import com.platform.drengine.persistence.entity.RecoveryTestEntity;
import com.platform.drengine.persistence.entity.ReplicationLinkEntity;
import com.platform.drengine.recoverytest.RecoveryTest;
import com.platform.drengine.replication.ReplicationLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 * Nested values (scopes, statistics, indicators, transitions, lists) are stored as JSON.
 */
@Slf4j
@Component
public class EntityMappers {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() { };
    private static final TypeReference<List<Indicator>> INDICATORS = new TypeReference<>() { };
    private static final TypeReference<List<StateTransition>> TRANSITIONS = new TypeReference<>() { };
    private static final TypeReference<List<UUID>> UUIDS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ==================== DrConfiguration ====================

    public DrConfigurationEntity toEntity(DrConfiguration domain) {
        return DrConfigurationEntity.builder()
            .scopeKey(domain.getScopeKey())
            .rtoMinutes(domain.getRtoMinutes())
            .rpoMinutes(domain.getRpoMinutes())
            .backupSchedule(domain.getBackupSchedule())
            .retentionDays(domain.getRetentionDays())
            .replicationMode(domain.getReplicationMode())
            .crossRegion(domain.isCrossRegion())
            .autoFailover(domain.isAutoFailover())
            .approvalRequired(domain.isApprovalRequired())
            .updatedAt(domain.getUpdatedAt())
            .version(domain.getVersion())
            .build();
    }

    public DrConfiguration toDomain(DrConfigurationEntity entity) {
        return DrConfiguration.builder()
            .scopeKey(entity.getScopeKey())
            .rtoMinutes(entity.getRtoMinutes())
            .rpoMinutes(entity.getRpoMinutes())
            .backupSchedule(entity.getBackupSchedule())
            .retentionDays(entity.getRetentionDays())
            .replicationMode(entity.getReplicationMode())
            .crossRegion(entity.isCrossRegion())
            .autoFailover(entity.isAutoFailover())
            .approvalRequired(entity.isApprovalRequired())
            .updatedAt(entity.getUpdatedAt())
            .version(entity.getVersion())
            .build();
    }

    // ==================== BackupJob ====================

    public BackupJobEntity toEntity(BackupJob domain) {
        return BackupJobEntity.builder()
            .id(domain.getId().toString())
            .name(domain.getName())
            .type(domain.getType())
            .schedule(domain.getSchedule())
            .sourceRegion(domain.getSourceRegion())
            .scopeJson(toJson(domain.getScope()))
            .storagePrefix(domain.getStoragePrefix())
            .retentionDays(domain.getRetentionDays())
            .allowParallel(domain.isAllowParallel())
            .priority(domain.getPriority())
            .compression(domain.getCompression())
            .verifyAfterWrite(domain.isVerifyAfterWrite())
            .active(domain.isActive())
            .configurationScope(domain.getConfigurationScope())
            .nextExecution(domain.getNextExecution())
            .createdAt(domain.getCreatedAt())
            .statsJson(toJson(domain.getStats()))
            .build();
    }

    public BackupJob toDomain(BackupJobEntity entity) {
        BackupJobStats stats = entity.getStatsJson() != null
            ? fromJson(entity.getStatsJson(), BackupJobStats.class)
            : BackupJobStats.empty();
        return BackupJob.builder()
            .id(UUID.fromString(entity.getId()))
            .name(entity.getName())
            .type(entity.getType())
            .schedule(entity.getSchedule())
            .sourceRegion(entity.getSourceRegion())
            .scope(fromJson(entity.getScopeJson(), BackupScope.class))
            .storagePrefix(entity.getStoragePrefix())
            .retentionDays(entity.getRetentionDays())
            .allowParallel(entity.isAllowParallel())
            .priority(entity.getPriority())
            .compression(entity.getCompression())
            .verifyAfterWrite(entity.isVerifyAfterWrite())
            .active(entity.isActive())
            .configurationScope(entity.getConfigurationScope())
            .nextExecution(entity.getNextExecution())
            .createdAt(entity.getCreatedAt())
            .stats(stats)
            .build();
    }

    public String toJson(BackupJobStats stats) {
        return toJson((Object) stats);
    }

    // ==================== BackupExecution ====================

    public BackupExecutionEntity toEntity(BackupExecution domain) {
        return BackupExecutionEntity.builder()
            .id(domain.getId().toString())
            .jobId(domain.getJobId().toString())
            .requestedType(domain.getRequestedType())
            .effectiveType(domain.getEffectiveType())
            .status(domain.getStatus())
            .startedAt(domain.getStartedAt())
            .completedAt(domain.getCompletedAt())
            .baselineAt(domain.getBaselineAt())
            .rawSizeBytes(domain.getRawSizeBytes())
            .storedSizeBytes(domain.getStoredSizeBytes())
            .recordCount(domain.getRecordCount())
            .tablesJson(domain.getTablesBackedUp() != null ? toJson(domain.getTablesBackedUp()) : null)
            .latestChangeAt(domain.getLatestChangeAt())
            .storageKey(domain.getStorageKey())
            .checksum(domain.getChecksum())
            .verification(domain.getVerification())
            .recoveryTested(domain.isRecoveryTested())
            .errorDetail(domain.getErrorDetail())
            .build();
    }

    public BackupExecution toDomain(BackupExecutionEntity entity) {
        return BackupExecution.builder()
            .id(UUID.fromString(entity.getId()))
            .jobId(UUID.fromString(entity.getJobId()))
            .requestedType(entity.getRequestedType())
            .effectiveType(entity.getEffectiveType())
            .status(entity.getStatus())
            .startedAt(entity.getStartedAt())
            .completedAt(entity.getCompletedAt())
            .baselineAt(entity.getBaselineAt())
            .rawSizeBytes(entity.getRawSizeBytes())
            .storedSizeBytes(entity.getStoredSizeBytes())
            .recordCount(entity.getRecordCount())
            .tablesBackedUp(entity.getTablesJson() != null ? fromJson(entity.getTablesJson(), STRINGS) : List.of())
            .latestChangeAt(entity.getLatestChangeAt())
            .storageKey(entity.getStorageKey())
            .checksum(entity.getChecksum())
            .verification(entity.getVerification())
            .recoveryTested(entity.isRecoveryTested())
            .errorDetail(entity.getErrorDetail())
            .build();
    }

    // ==================== ReplicationLink ====================

    public ReplicationLinkEntity toEntity(ReplicationLink domain) {
        return ReplicationLinkEntity.builder()
            .id(domain.getId().toString())
            .primaryRegion(domain.getPrimaryRegion())
            .replicaRegion(domain.getReplicaRegion())
            .slotId(domain.getSlotId())
            .mode(domain.getMode())
            .crossRegion(domain.isCrossRegion())
            .status(domain.getStatus())
            .lastLagNanos(nanos(domain.getLastLag()))
            .lastMeasuredAt(domain.getLastMeasuredAt())
            .consecutiveProbeErrors(domain.getConsecutiveProbeErrors())
            .createdAt(domain.getCreatedAt())
            .version(domain.getVersion())
            .build();
    }

    public ReplicationLink toDomain(ReplicationLinkEntity entity) {
        return ReplicationLink.builder()
            .id(UUID.fromString(entity.getId()))
            .primaryRegion(entity.getPrimaryRegion())
            .replicaRegion(entity.getReplicaRegion())
            .slotId(entity.getSlotId())
            .mode(entity.getMode())
            .crossRegion(entity.isCrossRegion())
            .status(entity.getStatus())
            .lastLag(duration(entity.getLastLagNanos()))
            .lastMeasuredAt(entity.getLastMeasuredAt())
            .consecutiveProbeErrors(entity.getConsecutiveProbeErrors())
            .createdAt(entity.getCreatedAt())
            .version(entity.getVersion())
            .build();
    }

    // ==================== HealthSnapshot ====================

    public HealthSnapshotEntity toEntity(HealthSnapshot domain) {
        return HealthSnapshotEntity.builder()
            .id(domain.id().toString())
            .primaryRegion(domain.primaryRegion())
            .capturedAt(domain.capturedAt())
            .activeConnections(domain.activeConnections())
            .maxReplicationLagNanos(nanos(domain.maxReplicationLag()))
            .saturationPercent(domain.saturationPercent())
            .failedBackupsLast24h(domain.failedBackupsLast24h())
            .consecutiveBackupFailures(domain.consecutiveBackupFailures())
            .indicatorsJson(toJson(domain.indicators()))
            .severity(domain.severity())
            .failoverRecommended(domain.failoverRecommended())
            .notesJson(toJson(domain.notes()))
            .build();
    }

    public HealthSnapshot toDomain(HealthSnapshotEntity entity) {
        return new HealthSnapshot(
            UUID.fromString(entity.getId()),
            entity.getPrimaryRegion(),
            entity.getCapturedAt(),
            entity.getActiveConnections(),
            duration(entity.getMaxReplicationLagNanos()),
            entity.getSaturationPercent(),
            entity.getFailedBackupsLast24h(),
            entity.getConsecutiveBackupFailures(),
            fromJson(entity.getIndicatorsJson(), INDICATORS),
            entity.getSeverity(),
            entity.isFailoverRecommended(),
            entity.getNotesJson() != null ? fromJson(entity.getNotesJson(), STRINGS) : List.of());
    }

    // ==================== FailoverEvent ====================

    public FailoverEventEntity toEntity(FailoverEvent domain) {
        return FailoverEventEntity.builder()
            .id(domain.getId().toString())
            .primaryRegion(domain.getPrimaryRegion())
            .targetRegion(domain.getTargetRegion())
            .triggerType(domain.getTriggerType())
            .requestedBy(domain.getRequestedBy())
            .reason(domain.getReason())
            .overrideSafetyChecks(domain.isOverrideSafetyChecks())
            .configurationScope(domain.getConfigurationScope())
            .state(domain.getState())
            .outcome(domain.getOutcome())
            .completed(domain.getCompleted())
            .rollbackSuccessful(domain.getRollbackSuccessful())
            .startedAt(domain.getStartedAt())
            .endedAt(domain.getEndedAt())
            .replicaLagAtPromotionNanos(nanos(domain.getReplicaLagAtPromotion()))
            .terminatedTransactions(domain.getTerminatedTransactions())
            .failureDetail(domain.getFailureDetail())
            .cancelledBy(domain.getCancelledBy())
            .transitionsJson(toJson(domain.getTransitions()))
            .version(domain.getVersion())
            .build();
    }

    public FailoverEvent toDomain(FailoverEventEntity entity) {
        return FailoverEvent.builder()
            .id(UUID.fromString(entity.getId()))
            .primaryRegion(entity.getPrimaryRegion())
            .targetRegion(entity.getTargetRegion())
            .triggerType(entity.getTriggerType())
            .requestedBy(entity.getRequestedBy())
            .reason(entity.getReason())
            .overrideSafetyChecks(entity.isOverrideSafetyChecks())
            .configurationScope(entity.getConfigurationScope())
            .state(entity.getState())
            .outcome(entity.getOutcome())
            .completed(entity.getCompleted())
            .rollbackSuccessful(entity.getRollbackSuccessful())
            .startedAt(entity.getStartedAt())
            .endedAt(entity.getEndedAt())
            .replicaLagAtPromotion(duration(entity.getReplicaLagAtPromotionNanos()))
            .terminatedTransactions(entity.getTerminatedTransactions())
            .failureDetail(entity.getFailureDetail())
            .cancelledBy(entity.getCancelledBy())
            .transitions(new ArrayList<>(fromJson(entity.getTransitionsJson(), TRANSITIONS)))
            .version(entity.getVersion())
            .build();
    }

    // ==================== RecoveryTest ====================

    public RecoveryTestEntity toEntity(RecoveryTest domain) {
        return RecoveryTestEntity.builder()
            .id(domain.getId().toString())
            .scenario(domain.getScenario())
            .environment(domain.getEnvironment())
            .environmentType(domain.getEnvironmentType())
            .backupJobId(domain.getBackupJobId() != null ? domain.getBackupJobId().toString() : null)
            .configurationScope(domain.getConfigurationScope())
            .cadence(domain.getCadence())
            .scheduledFor(domain.getScheduledFor())
            .pointInTime(domain.getPointInTime())
            .requestedBy(domain.getRequestedBy())
            .status(domain.getStatus())
            .targetRtoNanos(nanos(domain.getTargetRto()))
            .targetRpoNanos(nanos(domain.getTargetRpo()))
            .estimatedRestoreNanos(nanos(domain.getEstimatedRestore()))
            .startedAt(domain.getStartedAt())
            .completedAt(domain.getCompletedAt())
            .actualRtoNanos(nanos(domain.getActualRto()))
            .actualRpoNanos(nanos(domain.getActualRpo()))
            .dataIntegrityVerified(domain.getDataIntegrityVerified())
            .passed(domain.getPassed())
            .remediationRequired(domain.isRemediationRequired())
            .issuesJson(toJson(domain.getIssuesFound()))
            .restoredExecutionsJson(toJson(domain.getRestoredExecutions()))
            .failoverEventId(domain.getFailoverEventId() != null ? domain.getFailoverEventId().toString() : null)
            .version(domain.getVersion())
            .build();
    }

    public RecoveryTest toDomain(RecoveryTestEntity entity) {
        return RecoveryTest.builder()
            .id(UUID.fromString(entity.getId()))
            .scenario(entity.getScenario())
            .environment(entity.getEnvironment())
            .environmentType(entity.getEnvironmentType())
            .backupJobId(entity.getBackupJobId() != null ? UUID.fromString(entity.getBackupJobId()) : null)
            .configurationScope(entity.getConfigurationScope())
            .cadence(entity.getCadence())
            .scheduledFor(entity.getScheduledFor())
            .pointInTime(entity.getPointInTime())
            .requestedBy(entity.getRequestedBy())
            .status(entity.getStatus())
            .targetRto(duration(entity.getTargetRtoNanos()))
            .targetRpo(duration(entity.getTargetRpoNanos()))
            .estimatedRestore(duration(entity.getEstimatedRestoreNanos()))
            .startedAt(entity.getStartedAt())
            .completedAt(entity.getCompletedAt())
            .actualRto(duration(entity.getActualRtoNanos()))
            .actualRpo(duration(entity.getActualRpoNanos()))
            .dataIntegrityVerified(entity.getDataIntegrityVerified())
            .passed(entity.getPassed())
            .remediationRequired(entity.isRemediationRequired())
            .issuesFound(entity.getIssuesJson() != null ? new ArrayList<>(fromJson(entity.getIssuesJson(), STRINGS)) : new ArrayList<>())
            .restoredExecutions(entity.getRestoredExecutionsJson() != null
                ? new ArrayList<>(fromJson(entity.getRestoredExecutionsJson(), UUIDS))
                : new ArrayList<>())
            .failoverEventId(entity.getFailoverEventId() != null ? UUID.fromString(entity.getFailoverEventId()) : null)
            .version(entity.getVersion())
            .build();
    }

    // ==================== helpers ====================

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            throw new ExternalSystemException(ErrorCode.SERIALIZATION_ERROR, "database",
                "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {}: {}", type.getSimpleName(), json, e);
            throw new ExternalSystemException(ErrorCode.SERIALIZATION_ERROR, "database",
                "Failed to deserialize " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {}: {}", type.getType(), json, e);
            throw new ExternalSystemException(ErrorCode.SERIALIZATION_ERROR, "database",
                "Failed to deserialize " + type.getType() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Long nanos(Duration duration) {
        return duration == null ? null : duration.toNanos();
    }

    private static Duration duration(Long nanos) {
        return nanos == null ? null : Duration.ofNanos(nanos);
    }
}
