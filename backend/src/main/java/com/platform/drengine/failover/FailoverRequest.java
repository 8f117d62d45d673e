package com.platform.drengine.failover;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to fail a primary region over to one of its replicas.
 */
public record FailoverRequest(
    @NotBlank String primaryRegion,
    @NotBlank String targetRegion,
    @NotNull TriggerType triggerType,
    boolean overrideSafetyChecks,
    String requestedBy,
    String reason,
    String configurationScope
) {
    public static FailoverRequest automatic(String primaryRegion, String targetRegion, String reason) {
        return new FailoverRequest(primaryRegion, targetRegion, TriggerType.AUTOMATIC, false,
            "health-monitor", reason, null);
    }
}
