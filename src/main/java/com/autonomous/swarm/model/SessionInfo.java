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
public class SessionInfo {
    private String id;
    private String name;
    private String agentType;
    private String workdir;
    private SessionStatus status;
    private Instant createdAt;
    private Instant lastActivityAt;
}
