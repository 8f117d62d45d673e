package com.platform.drengine.api;

import com.platform.drengine.replication.ReconfigureResult;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationMode;
import com.platform.drengine.replication.ReplicationTopologyManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for replication links.
 */
@Slf4j
@RestController
@RequestMapping("/api/replication/links")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class ReplicationController {
    
    private final ReplicationTopologyManager topologyManager;
    
    @PostMapping
    public ResponseEntity<Map<String, UUID>> establishLink(@Valid @RequestBody EstablishLinkRequest request) {
        log.info("API: Establish replication link {} -> {} ({})",
            request.primaryRegion(), request.replicaRegion(), request.mode());
        UUID linkId = topologyManager.establishLink(
            request.primaryRegion(), request.replicaRegion(), request.mode(), request.crossRegion());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("linkId", linkId));
    }
    
    @GetMapping
    public List<ReplicationLink> listLinks(@RequestParam(required = false) String primaryRegion) {
        return primaryRegion != null ? topologyManager.linksForPrimary(primaryRegion) : topologyManager.allLinks();
    }
    
    @GetMapping("/{linkId}")
    public ReplicationLink getLink(@PathVariable UUID linkId) {
        return topologyManager.link(linkId);
    }
    
    @GetMapping("/{linkId}/lag")
    public Map<String, Object> currentLag(@PathVariable UUID linkId) {
        Duration lag = topologyManager.currentLag(linkId);
        return Map.of("linkId", linkId, "lag", lag, "lagMicros", lag.toNanos() / 1_000);
    }
    
    /**
     * Change the replication mode. A lag rejection answers 409 with the measured lag.
     */
    @PutMapping("/{linkId}/mode")
    public ResponseEntity<ReconfigureResult> reconfigure(@PathVariable UUID linkId, @Valid @RequestBody ModeRequest request) {
        log.info("API: Reconfigure link {} to {}", linkId, request.mode());
        ReconfigureResult result = topologyManager.reconfigure(linkId, request.mode());
        return result.isApplied()
            ? ResponseEntity.ok(result)
            : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }
    
    @DeleteMapping("/{linkId}")
    public ResponseEntity<Void> dropLink(@PathVariable UUID linkId) {
        log.info("API: Drop replication link {}", linkId);
        topologyManager.dropLink(linkId);
        return ResponseEntity.noContent().build();
    }
    
    public record EstablishLinkRequest(
        @NotBlank String primaryRegion,
        @NotBlank String replicaRegion,
        @NotNull ReplicationMode mode,
        boolean crossRegion
    ) {}
    
    public record ModeRequest(@NotNull ReplicationMode mode) {}
}
