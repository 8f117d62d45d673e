package com.platform.drengine.api;

import com.platform.drengine.backup.BackupExecution;
import com.platform.drengine.backup.BackupJob;
import com.platform.drengine.backup.BackupJobRequest;
import com.platform.drengine.backup.BackupService;
import com.platform.drengine.backup.BackupType;
import com.platform.drengine.backup.RestoreEstimate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for backup jobs and executions.
 */
@Slf4j
@RestController
@RequestMapping("/api/backups")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class BackupController {
    
    private final BackupService backupService;
    
    @PostMapping("/jobs")
    public ResponseEntity<Map<String, UUID>> scheduleJob(@Valid @RequestBody BackupJobRequest request) {
        log.info("API: Schedule backup job '{}' on {}", request.name(), request.sourceRegion());
        UUID jobId = backupService.scheduleJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("jobId", jobId));
    }
    
    @GetMapping("/jobs")
    public List<BackupJob> listJobs() {
        return backupService.listJobs();
    }
    
    @GetMapping("/jobs/{jobId}")
    public BackupJob getJob(@PathVariable UUID jobId) {
        return backupService.job(jobId);
    }
    
    /**
     * Deactivate a job. Its executions and artifacts stay until retention removes them.
     */
    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> deactivateJob(@PathVariable UUID jobId) {
        backupService.deactivateJob(jobId);
        return ResponseEntity.noContent().build();
    }
    
    /**
     * Run the job now. Repeated calls while it runs return the same execution.
     */
    @PostMapping("/jobs/{jobId}/execute")
    public ResponseEntity<Map<String, UUID>> executeNow(
            @PathVariable UUID jobId,
            @RequestParam(required = false) BackupType type) {
        log.info("API: Execute backup job {} now (type override: {})", jobId, type);
        UUID executionId = backupService.executeNow(jobId, Optional.ofNullable(type));
        return ResponseEntity.accepted().body(Map.of("executionId", executionId));
    }
    
    @GetMapping("/jobs/{jobId}/executions")
    public List<BackupExecution> listExecutions(@PathVariable UUID jobId) {
        return backupService.listExecutions(jobId);
    }
    
    @GetMapping("/jobs/{jobId}/restore-estimate")
    public RestoreEstimate estimateRestore(@PathVariable UUID jobId) {
        return backupService.estimateRestore(jobId);
    }
    
    @GetMapping("/executions/{executionId}")
    public BackupExecution getExecution(@PathVariable UUID executionId) {
        return backupService.executionStatus(executionId);
    }
}
