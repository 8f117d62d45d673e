package com.platform.drengine.config;

import com.platform.drengine.error.ConfigurationLockedException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and edits DR configurations and tracks which ones in-flight operations reference.
 * 
 * Backups, failovers and recovery tests hold a {@link Lease} for their duration; an update
 * to a leased scope is rejected with {@link ConfigurationLockedException}.
 */
@Slf4j
@Service
public class DrConfigurationService {
    
    private final DrConfigurationRepository repository;
    private final Clock clock;
    private final Map<String, Integer> inFlightReferences = new HashMap<>();
    
    public DrConfigurationService(DrConfigurationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }
    
    /**
     * Effective configuration for a scope. Tenant scopes without their own configuration
     * inherit the system one; the system scope falls back to the built-in defaults.
     */
    public DrConfiguration get(String scopeKey) {
        String scope = scopeKey == null || scopeKey.isBlank() ? DrConfiguration.SYSTEM_SCOPE : scopeKey;
        return repository.findByScope(scope)
            .or(() -> repository.findByScope(DrConfiguration.SYSTEM_SCOPE))
            .orElseGet(() -> DrConfiguration.defaults(DrConfiguration.SYSTEM_SCOPE));
    }
    
    public List<DrConfiguration> list() {
        return repository.findAll();
    }
    
    /**
     * Create or replace the configuration of a scope.
     */
    public synchronized DrConfiguration update(DrConfiguration configuration) {
        validate(configuration);
        
        String scope = configuration.getScopeKey();
        int references = inFlightReferences.getOrDefault(scope, 0);
        if (references > 0) {
            throw new ConfigurationLockedException(scope, references);
        }
        
        DrConfiguration toSave = configuration.toBuilder()
            .updatedAt(Instant.now(clock))
            .version(repository.findByScope(scope).map(DrConfiguration::getVersion).orElse(null))
            .build();
        DrConfiguration saved = repository.save(toSave);
        log.info("[AUDIT] DR configuration {} updated: rto={}m rpo={}m autoFailover={} approvalRequired={}",
            scope, saved.getRtoMinutes(), saved.getRpoMinutes(), saved.isAutoFailover(), saved.isApprovalRequired());
        return saved;
    }
    
    /**
     * Pin the effective configuration of a scope for the duration of an operation.
     */
    public synchronized Lease acquire(String scopeKey) {
        DrConfiguration configuration = get(scopeKey);
        String scope = configuration.getScopeKey();
        inFlightReferences.merge(scope, 1, Integer::sum);
        return new Lease(scope, configuration);
    }
    
    public synchronized int references(String scopeKey) {
        return inFlightReferences.getOrDefault(scopeKey, 0);
    }
    
    private synchronized void release(String scope) {
        inFlightReferences.computeIfPresent(scope, (k, count) -> count <= 1 ? null : count - 1);
    }
    
    private void validate(DrConfiguration configuration) {
        if (configuration == null || configuration.getScopeKey() == null || configuration.getScopeKey().isBlank()) {
            throw new ValidationException("scopeKey", null, "Scope key is required");
        }
        if (configuration.getRtoMinutes() <= 0) {
            throw new ValidationException("rtoMinutes", configuration.getRtoMinutes(), "RTO must be positive");
        }
        if (configuration.getRpoMinutes() <= 0) {
            throw new ValidationException("rpoMinutes", configuration.getRpoMinutes(), "RPO must be positive");
        }
        if (configuration.getRetentionDays() <= 0) {
            throw new ValidationException("retentionDays", configuration.getRetentionDays(), "Retention must be positive");
        }
        if (configuration.getReplicationMode() == null) {
            throw new ValidationException("replicationMode", null, "Replication mode is required");
        }
        if (configuration.getBackupSchedule() != null && !CronExpression.isValidExpression(configuration.getBackupSchedule())) {
            throw new ValidationException(ErrorCode.INVALID_SCHEDULE, "Invalid backup schedule: " + configuration.getBackupSchedule());
        }
    }
    
    /**
     * Reference to a configuration held by an in-flight operation.
     */
    public final class Lease implements AutoCloseable {
        
        private final String scope;
        private final DrConfiguration configuration;
        private boolean released;
        
        private Lease(String scope, DrConfiguration configuration) {
            this.scope = scope;
            this.configuration = configuration;
        }
        
        public DrConfiguration configuration() {
            return configuration;
        }
        
        @Override
        public void close() {
            synchronized (DrConfigurationService.this) {
                if (!released) {
                    released = true;
                    release(scope);
                }
            }
        }
    }
}
