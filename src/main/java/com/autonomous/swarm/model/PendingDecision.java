package com.autonomous.swarm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingDecision {
    private String sessionId;
    private String promptText;
    private String recentOutput;
    private CoordinationResponse suggestion;
    private Instant createdAt;
}
