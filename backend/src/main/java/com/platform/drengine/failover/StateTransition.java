package com.platform.drengine.failover;

import java.time.Instant;

public record StateTransition(FailoverState from, FailoverState to, Instant at, String reason) {
}
