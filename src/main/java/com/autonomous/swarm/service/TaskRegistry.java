package com.autonomous.swarm.service;

import com.autonomous.swarm.model.PendingDecision;
import com.autonomous.swarm.model.TaskContext;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory map of session id to {@link TaskContext}, plus the per-session bookkeeping the
 * decision loop needs: the in-flight guard, decisions awaiting confirmation and throttling state.
 * <p>
 * Contexts are handed out by reference and mutated in place.
 */
@Service
public class TaskRegistry {

    private final Map<String, TaskContext> tasks = new ConcurrentHashMap<>();
    private final Set<String> inFlightDecisions = ConcurrentHashMap.newKeySet();
    private final Set<String> queuedArbitrations = ConcurrentHashMap.newKeySet();
    private final Map<String, PendingDecision> pendingDecisions = new ConcurrentHashMap<>();
    private final Map<String, String> lastSeenOutput = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastToolNotification = new ConcurrentHashMap<>();

    public TaskContext register(String sessionId, String agentType, String label,
                                String originalTask, String workdir) {
        Instant now = Instant.now();
        TaskContext ctx = new TaskContext();
        ctx.setSessionId(sessionId);
        ctx.setAgentType(agentType);
        ctx.setLabel(label != null ? label : sessionId);
        ctx.setOriginalTask(originalTask != null ? originalTask : "");
        ctx.setWorkdir(workdir);
        ctx.setRegisteredAt(now);
        ctx.setLastActivityAt(now);
        tasks.put(sessionId, ctx);
        return ctx;
    }

    public Optional<TaskContext> get(String sessionId) {
        return Optional.ofNullable(tasks.get(sessionId));
    }

    public boolean isRegistered(String sessionId) {
        return tasks.containsKey(sessionId);
    }

    public List<TaskContext> getAll() {
        return new ArrayList<>(tasks.values());
    }

    /**
     * Drops the task and everything tracked for it. The in-flight guard is left to its owner.
     */
    public void remove(String sessionId) {
        tasks.remove(sessionId);
        pendingDecisions.remove(sessionId);
        lastSeenOutput.remove(sessionId);
        lastToolNotification.remove(sessionId);
    }

    // In-flight guard

    /**
     * Atomically claims the session for one arbitration.
     *
     * @return false if another arbitration already holds it
     */
    public boolean tryBeginDecision(String sessionId) {
        return inFlightDecisions.add(sessionId);
    }

    public void endDecision(String sessionId) {
        inFlightDecisions.remove(sessionId);
    }

    public boolean isInFlight(String sessionId) {
        return inFlightDecisions.contains(sessionId);
    }

    /**
     * Reserves the session for an arbitration that has been accepted but not started yet, so
     * events arriving in between do not queue a second one for the same output.
     *
     * @return false if an arbitration is already queued or running
     */
    public boolean tryReserveArbitration(String sessionId) {
        return !inFlightDecisions.contains(sessionId) && queuedArbitrations.add(sessionId);
    }

    public void releaseArbitration(String sessionId) {
        queuedArbitrations.remove(sessionId);
    }

    public boolean isArbitrationQueued(String sessionId) {
        return queuedArbitrations.contains(sessionId);
    }

    // Pending confirmations

    public void putPending(PendingDecision pending) {
        pendingDecisions.put(pending.getSessionId(), pending);
    }

    public Optional<PendingDecision> removePending(String sessionId) {
        return Optional.ofNullable(pendingDecisions.remove(sessionId));
    }

    public Optional<PendingDecision> getPending(String sessionId) {
        return Optional.ofNullable(pendingDecisions.get(sessionId));
    }

    public List<PendingDecision> getAllPending() {
        return new ArrayList<>(pendingDecisions.values());
    }

    // Throttling

    /**
     * Records the latest output seen for the session.
     *
     * @return true if it differs from what was recorded before; nothing recorded counts as empty
     */
    public boolean updateLastSeenOutput(String sessionId, String output) {
        String previous = lastSeenOutput.put(sessionId, output);
        return !output.equals(previous != null ? previous : "");
    }

    public Optional<Instant> getLastToolNotification(String sessionId) {
        return Optional.ofNullable(lastToolNotification.get(sessionId));
    }

    public void setLastToolNotification(String sessionId, Instant at) {
        lastToolNotification.put(sessionId, at);
    }
}
