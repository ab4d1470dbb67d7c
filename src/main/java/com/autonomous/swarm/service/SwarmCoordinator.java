package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.SessionException;
import com.autonomous.swarm.model.BlockedEvent;
import com.autonomous.swarm.model.CoordinationResponse;
import com.autonomous.swarm.model.LoginRequiredEvent;
import com.autonomous.swarm.model.PendingDecision;
import com.autonomous.swarm.model.SessionEventType;
import com.autonomous.swarm.model.SessionExitEvent;
import com.autonomous.swarm.model.SessionInfo;
import com.autonomous.swarm.model.SpawnOptions;
import com.autonomous.swarm.model.SupervisionLevel;
import com.autonomous.swarm.model.SwarmEvent;
import com.autonomous.swarm.model.TaskContext;
import com.autonomous.swarm.model.TaskStatus;
import com.autonomous.swarm.model.ToolRunningEvent;
import com.autonomous.swarm.model.TurnCompleteEvent;
import com.autonomous.swarm.terminal.OutputSanitizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static com.autonomous.swarm.model.SwarmEvent.data;

/**
 * Entry point for callers: spawns and registers tasks, routes session events into the
 * {@link DecisionLoop} and exposes the confirmation queue and supervision level.
 * <p>
 * Events are handled off the session's output thread, one at a time per session, in delivery order.
 */
@Slf4j
@Service
public class SwarmCoordinator implements SessionEventListener {

    private static final Set<SessionEventType> BUFFERED_TYPES =
        EnumSet.of(SessionEventType.BLOCKED, SessionEventType.TURN_COMPLETE, SessionEventType.ERROR);

    private final SessionManager sessionManager;
    private final TaskRegistry registry;
    private final DecisionLoop decisionLoop;
    private final SwarmEventBroadcaster broadcaster;
    private final ChatNotifier chat;
    private final SwarmProperties properties;

    private final Map<String, CompletableFuture<Void>> sessionQueues = new ConcurrentHashMap<>();
    private final Map<String, List<BufferedEvent>> unregisteredBuffer = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher = Executors.newCachedThreadPool();
    private final ScheduledExecutorService bufferExpiry = Executors.newSingleThreadScheduledExecutor();

    private Runnable unsubscribeFromSessions;

    public SwarmCoordinator(SessionManager sessionManager,
                            TaskRegistry registry,
                            DecisionLoop decisionLoop,
                            SwarmEventBroadcaster broadcaster,
                            ChatNotifier chat,
                            SwarmProperties properties) {
        this.sessionManager = sessionManager;
        this.registry = registry;
        this.decisionLoop = decisionLoop;
        this.broadcaster = broadcaster;
        this.chat = chat;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        unsubscribeFromSessions = sessionManager.addListener(this);
        log.info("Swarm coordinator started, supervision level {}", decisionLoop.getSupervisionLevel());
    }

    @PreDestroy
    public void stop() {
        if (unsubscribeFromSessions != null) {
            unsubscribeFromSessions.run();
            unsubscribeFromSessions = null;
        }
        dispatcher.shutdownNow();
        bufferExpiry.shutdownNow();
        unregisteredBuffer.clear();
        sessionQueues.clear();
        log.info("Swarm coordinator stopped");
    }

    // Task registration

    /**
     * Spawns a session and registers its task in one step.
     *
     * @return the new session id
     */
    public String spawnTask(SpawnOptions options, String label) {
        String sessionId = sessionManager.spawn(options);
        SessionInfo info = sessionManager.getSession(sessionId).orElse(null);
        String agentType = info != null ? info.getAgentType() : options.getAgentType();
        String workdir = info != null ? info.getWorkdir() : options.getWorkdir();
        registerTask(sessionId, agentType, label != null ? label : options.getName(),
            options.getInitialTask(), workdir);
        return sessionId;
    }

    public TaskContext registerTask(String sessionId, String agentType, String label,
                                    String originalTask, String workdir) {
        TaskContext ctx = registry.register(sessionId, agentType, label, originalTask, workdir);
        log.info("Registered task \"{}\" for {}", ctx.getLabel(), sessionId);
        broadcaster.broadcast("task_registered", sessionId, data(
            "agentType", agentType,
            "label", ctx.getLabel(),
            "originalTask", ctx.getOriginalTask()));

        List<BufferedEvent> buffered = unregisteredBuffer.remove(sessionId);
        if (buffered != null) {
            log.debug("Replaying {} buffered events for {}", buffered.size(), sessionId);
            buffered.forEach(event -> enqueue(sessionId, () -> route(sessionId, event.type, event.handler)));
        }
        return ctx;
    }

    public Optional<TaskContext> getTaskContext(String sessionId) {
        return registry.get(sessionId);
    }

    public List<TaskContext> getAllTaskContexts() {
        return registry.getAll();
    }

    // Observers

    /**
     * Subscribes to coordinator events. The subscriber first receives a {@code snapshot} of the
     * current tasks.
     *
     * @return a handle that removes the subscriber
     */
    public Runnable subscribe(Consumer<SwarmEvent> subscriber) {
        Runnable unsubscribe = broadcaster.subscribe(subscriber);
        broadcaster.send(subscriber, SwarmEvent.of("snapshot", SwarmEvent.ALL_SESSIONS, data(
            "tasks", registry.getAll().stream().map(SwarmCoordinator::describe).collect(Collectors.toList()),
            "supervisionLevel", wireName(decisionLoop.getSupervisionLevel()),
            "pendingCount", registry.getAllPending().size())));
        return unsubscribe;
    }

    // Supervision

    public SupervisionLevel getSupervisionLevel() {
        return decisionLoop.getSupervisionLevel();
    }

    public void setSupervisionLevel(SupervisionLevel level) {
        decisionLoop.setSupervisionLevel(level);
        broadcaster.broadcast("supervision_changed", SwarmEvent.ALL_SESSIONS, data("level", wireName(level)));
        log.info("Supervision level set to {}", level);
    }

    public List<PendingDecision> getPendingConfirmations() {
        return registry.getAllPending();
    }

    /**
     * @param override operator-supplied response used instead of the suggestion, may be null
     * @throws IllegalStateException if nothing is pending for the session
     */
    public void confirmDecision(String sessionId, boolean approved, CoordinationResponse override) {
        decisionLoop.confirmDecision(sessionId, approved, override);
    }

    // Session events

    @Override
    public void onReady(String sessionId) {
        dispatch(sessionId, SessionEventType.READY, ctx ->
            broadcaster.broadcast(SessionEventType.READY.wireName(), sessionId, data()));
    }

    @Override
    public void onBlocked(String sessionId, BlockedEvent event) {
        if (event.isAutoResponded()) {
            dispatch(sessionId, SessionEventType.BLOCKED, ctx -> decisionLoop.handleBlocked(sessionId, ctx, event));
            return;
        }
        if (!registry.tryReserveArbitration(sessionId)) {
            log.debug("Ignoring blocked event for {}: decision in flight", sessionId);
            return;
        }
        dispatchArbitration(sessionId, SessionEventType.BLOCKED,
            ctx -> decisionLoop.handleBlocked(sessionId, ctx, event));
    }

    @Override
    public void onTurnComplete(String sessionId, TurnCompleteEvent event) {
        if (!registry.tryReserveArbitration(sessionId)) {
            log.debug("Ignoring turn completion for {}: decision in flight", sessionId);
            return;
        }
        dispatchArbitration(sessionId, SessionEventType.TURN_COMPLETE, ctx -> {
            broadcaster.broadcast(SessionEventType.TURN_COMPLETE.wireName(), sessionId,
                data("response", event.getResponse()));
            decisionLoop.handleTurnComplete(sessionId, ctx, event);
        });
    }

    @Override
    public void onLoginRequired(String sessionId, LoginRequiredEvent event) {
        dispatch(sessionId, SessionEventType.LOGIN_REQUIRED, ctx -> {
            broadcaster.broadcast(SessionEventType.LOGIN_REQUIRED.wireName(), sessionId,
                data("instructions", event.getInstructions()));
            chat.postLoginRequired(ctx.getLabel(), event.getInstructions());
        });
    }

    @Override
    public void onToolRunning(String sessionId, ToolRunningEvent event) {
        dispatch(sessionId, SessionEventType.TOOL_RUNNING, ctx -> handleToolRunning(sessionId, ctx, event));
    }

    @Override
    public void onError(String sessionId, String message) {
        dispatch(sessionId, SessionEventType.ERROR, ctx -> {
            ctx.setStatus(TaskStatus.ERROR);
            broadcaster.broadcast(SessionEventType.ERROR.wireName(), sessionId, data("message", message));
            chat.postError(ctx.getLabel(), message);
        });
    }

    /**
     * Handled even when the task is already gone, e.g. after a {@code complete} decision stopped it.
     */
    @Override
    public void onExit(String sessionId, SessionExitEvent event) {
        CompletableFuture<Void> exitHandled = enqueue(sessionId, () -> {
            registry.get(sessionId).ifPresent(ctx -> {
                if (ctx.getStatus() == TaskStatus.ACTIVE) {
                    ctx.setStatus(TaskStatus.STOPPED);
                }
            });
            registry.remove(sessionId);
            broadcaster.broadcast(SessionEventType.STOPPED.wireName(), sessionId, data(
                "status", event.getStatus() != null ? event.getStatus().name().toLowerCase(Locale.ROOT) : null,
                "exitCode", event.getExitCode(),
                "reason", event.getReason()));
        });
        // remove(key, value) leaves events queued behind the exit in place
        exitHandled.whenComplete((ignored, error) -> sessionQueues.remove(sessionId, exitHandled));
    }

    private void handleToolRunning(String sessionId, TaskContext ctx, ToolRunningEvent event) {
        String description = event.getDescription() != null ? event.getDescription() : "an external tool";
        broadcaster.broadcast(SessionEventType.TOOL_RUNNING.wireName(), sessionId, data("description", description));

        Instant now = Instant.now();
        Duration interval = properties.getToolNotificationInterval();
        boolean due = registry.getLastToolNotification(sessionId)
            .map(last -> Duration.between(last, now).compareTo(interval) > 0)
            .orElse(true);
        if (!due) {
            return;
        }
        registry.setLastToolNotification(sessionId, now);

        String devServerUrl = null;
        try {
            devServerUrl = OutputSanitizer.extractDevServerUrl(sessionManager.getOutput(sessionId));
        } catch (SessionException e) {
            log.debug("No output to scan for a dev server on {}: {}", sessionId, e.getMessage());
        }
        chat.postToolRunning(ctx.getLabel(), description, devServerUrl);
    }

    // Dispatch

    private void dispatch(String sessionId, SessionEventType type, Consumer<TaskContext> handler) {
        enqueue(sessionId, () -> route(sessionId, type, handler));
    }

    /**
     * Runs an arbitration reserved with {@link TaskRegistry#tryReserveArbitration}, releasing the
     * reservation once the handler is done.
     */
    private void dispatchArbitration(String sessionId, SessionEventType type, Consumer<TaskContext> handler) {
        enqueue(sessionId, () -> {
            try {
                route(sessionId, type, handler);
            } finally {
                registry.releaseArbitration(sessionId);
            }
        });
    }

    private void route(String sessionId, SessionEventType type, Consumer<TaskContext> handler) {
        Optional<TaskContext> task = registry.get(sessionId);
        if (task.isEmpty()) {
            if (BUFFERED_TYPES.contains(type)) {
                bufferUnregistered(sessionId, type, handler);
            } else {
                log.debug("Dropping {} event for unregistered session {}", type.wireName(), sessionId);
            }
            return;
        }

        TaskContext ctx = task.get();
        ctx.setLastActivityAt(Instant.now());
        ctx.setIdleCheckCount(0);
        handler.accept(ctx);
    }

    private CompletableFuture<Void> enqueue(String sessionId, Runnable work) {
        return sessionQueues.compute(sessionId, (id, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> runSafely(sessionId, work), dispatcher);
        });
    }

    private void runSafely(String sessionId, Runnable work) {
        try {
            work.run();
        } catch (SessionException e) {
            log.warn("Session {} failed while handling an event: {}", sessionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error handling event for {}", sessionId, e);
        }
    }

    private void bufferUnregistered(String sessionId, SessionEventType type, Consumer<TaskContext> handler) {
        unregisteredBuffer.computeIfAbsent(sessionId, id -> {
            bufferExpiry.schedule(() -> expireBuffer(id),
                properties.getUnregisteredBufferWindow().toMillis(), TimeUnit.MILLISECONDS);
            return new CopyOnWriteArrayList<>();
        }).add(new BufferedEvent(type, handler));
        log.debug("Buffered {} event for unregistered session {}", type.wireName(), sessionId);
    }

    private void expireBuffer(String sessionId) {
        List<BufferedEvent> stale = unregisteredBuffer.remove(sessionId);
        if (stale == null || stale.isEmpty()) {
            return;
        }
        if (registry.isRegistered(sessionId)) {
            stale.forEach(event -> enqueue(sessionId, () -> route(sessionId, event.type, event.handler)));
        } else {
            log.warn("Discarding {} buffered events for unregistered session {}", stale.size(), sessionId);
        }
    }

    private static Map<String, Object> describe(TaskContext ctx) {
        return data(
            "sessionId", ctx.getSessionId(),
            "agentType", ctx.getAgentType(),
            "label", ctx.getLabel(),
            "originalTask", ctx.getOriginalTask(),
            "status", ctx.getStatus().name().toLowerCase(Locale.ROOT),
            "autoResolvedCount", ctx.getAutoResolvedCount(),
            "decisionCount", ctx.getDecisions().size(),
            "registeredAt", ctx.getRegisteredAt());
    }

    private static String wireName(SupervisionLevel level) {
        return level.name().toLowerCase(Locale.ROOT);
    }

    private static final class BufferedEvent {
        private final SessionEventType type;
        private final Consumer<TaskContext> handler;

        private BufferedEvent(SessionEventType type, Consumer<TaskContext> handler) {
            this.type = type;
            this.handler = handler;
        }
    }
}
