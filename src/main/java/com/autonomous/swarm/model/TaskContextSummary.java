package com.autonomous.swarm.model;

import lombok.Value;

/**
 * The slice of a task context handed to the decision oracle.
 */
@Value
public class TaskContextSummary {
    String sessionId;
    String agentType;
    String label;
    String originalTask;
    String workdir;
}
