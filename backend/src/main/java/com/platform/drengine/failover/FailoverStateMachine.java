package com.platform.drengine.failover;

import com.platform.drengine.error.InvalidStateTransitionException;
import com.platform.drengine.observability.MetricsRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates and applies failover state transitions.
 * Every applied transition is appended to the event's history with its timestamp.
 */
@Slf4j
@Component
public class FailoverStateMachine {
    
    static final String MACHINE = "failover";
    
    private static final Map<FailoverState, Set<FailoverState>> ALLOWED_TRANSITIONS = Map.of(
        FailoverState.IDLE, EnumSet.of(FailoverState.SAFETY_CHECK, FailoverState.ABORTED),
        FailoverState.SAFETY_CHECK, EnumSet.of(FailoverState.DRAINING, FailoverState.ABORTED),
        FailoverState.DRAINING, EnumSet.of(FailoverState.PROMOTING, FailoverState.ABORTED),
        FailoverState.PROMOTING, EnumSet.of(FailoverState.REROUTING, FailoverState.ROLLING_BACK),
        FailoverState.REROUTING, EnumSet.of(FailoverState.VERIFYING, FailoverState.ROLLING_BACK),
        FailoverState.VERIFYING, EnumSet.of(FailoverState.COMPLETED, FailoverState.ROLLING_BACK),
        FailoverState.ROLLING_BACK, EnumSet.of(FailoverState.ROLLED_BACK)
    );
    
    private static final AttributeKey<String> FROM = AttributeKey.stringKey("failover.from");
    private static final AttributeKey<String> TO = AttributeKey.stringKey("failover.to");
    
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public FailoverStateMachine(MetricsRegistry metricsRegistry, Clock clock) {
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    /**
     * Move the event to {@code target}. Terminal targets also stamp the end time.
     *
     * @throws InvalidStateTransitionException when the edge is not allowed
     */
    public FailoverEvent transition(FailoverEvent event, FailoverState target, String reason) {
        FailoverState current = event.getState();
        if (!isTransitionAllowed(current, target)) {
            log.warn("Invalid failover transition rejected: {} -> {} for event {}", current, target, event.getId());
            metricsRegistry.incrementInvalidTransitions(MACHINE);
            throw new InvalidStateTransitionException(event.getId(), current, target);
        }
        
        Instant now = clock.instant();
        event.getTransitions().add(new StateTransition(current, target, now, reason));
        event.setState(target);
        if (target.isTerminal()) {
            event.setEndedAt(now);
        }
        
        log.info("[AUDIT] Failover {} ({} -> {}): {} -> {} ({})",
            event.getId(), event.getPrimaryRegion(), event.getTargetRegion(), current, target, reason);
        metricsRegistry.recordStateTransition(MACHINE, current, target);
        Span.current().addEvent("failover.transition",
            Attributes.of(FROM, current.name(), TO, target.name()));
        return event;
    }
    
    public static boolean isTransitionAllowed(FailoverState from, FailoverState to) {
        if (from == null || to == null || from == to) {
            return false;
        }
        Set<FailoverState> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }
}
