package com.autonomous.swarm.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decision-level view of one supervised session. Mutated in place by the decision loop only.
 */
@Data
public class TaskContext {
    private String sessionId;
    private String agentType;
    private String label;
    private String originalTask;
    private String workdir;
    private volatile TaskStatus status = TaskStatus.ACTIVE;
    private final List<CoordinationDecision> decisions = Collections.synchronizedList(new ArrayList<>());
    private volatile int autoResolvedCount;
    private Instant registeredAt;
    private volatile Instant lastActivityAt;
    private volatile int idleCheckCount;

    public void recordDecision(CoordinationDecision decision) {
        decisions.add(decision);
    }

    public List<CoordinationDecision> getDecisions() {
        synchronized (decisions) {
            return List.copyOf(decisions);
        }
    }

    public TaskContextSummary toSummary() {
        return new TaskContextSummary(sessionId, agentType, label, originalTask, workdir);
    }
}
