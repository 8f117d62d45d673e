package com.platform.drengine.api;

import com.platform.drengine.failover.FailoverCancelResult;
import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverOrchestrator;
import com.platform.drengine.failover.FailoverRequest;
import com.platform.drengine.failover.FailoverTriggerResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for failover triggers, cancellation and event lookup.
 */
@Slf4j
@RestController
@RequestMapping("/api/failovers")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class FailoverController {
    
    private final FailoverOrchestrator orchestrator;
    
    /**
     * Trigger a failover. 202 when a run started, 409 when another failover of the
     * region is active, 200 for approval and auto-failover answers.
     */
    @PostMapping
    public ResponseEntity<FailoverTriggerResult> trigger(@Valid @RequestBody FailoverRequest request) {
        log.info("API: {} failover {} -> {} requested by {}",
            request.triggerType(), request.primaryRegion(), request.targetRegion(), request.requestedBy());
        FailoverTriggerResult result = orchestrator.trigger(request);
        HttpStatus status = switch (result.status()) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case REJECTED_IN_PROGRESS -> HttpStatus.CONFLICT;
            case APPROVAL_REQUIRED, AUTO_FAILOVER_DISABLED -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(result);
    }
    
    @PostMapping("/{eventId}/cancel")
    public ResponseEntity<FailoverCancelResult> cancel(
            @PathVariable UUID eventId,
            @RequestHeader(value = "X-Requested-By", defaultValue = "unknown") String requestedBy) {
        log.info("API: Cancel failover {} requested by {}", eventId, requestedBy);
        FailoverCancelResult result = orchestrator.cancel(eventId, requestedBy);
        return result.isAccepted()
            ? ResponseEntity.accepted().body(result)
            : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }
    
    @GetMapping("/{eventId}")
    public FailoverEvent getEvent(@PathVariable UUID eventId) {
        return orchestrator.event(eventId);
    }
    
    @GetMapping
    public List<FailoverEvent> listEvents(@RequestParam String primaryRegion) {
        return orchestrator.events(primaryRegion);
    }
    
    @GetMapping("/active")
    public ResponseEntity<FailoverEvent> activeEvent(@RequestParam String primaryRegion) {
        return orchestrator.activeEvent(primaryRegion)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
