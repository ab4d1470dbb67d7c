package com.autonomous.swarm.model;

import lombok.Value;

@Value
public class SessionExitEvent {
    SessionStatus status;
    Integer exitCode;
    String reason;
}
