package com.autonomous.swarm.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CoordinationDecision {
    Instant timestamp;
    String event;        // blocked | turn_complete | idle_watchdog
    String promptText;
    DecisionKind decision;
    String response;
    String reasoning;
}
