package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.InactiveSessionException;
import com.autonomous.swarm.exception.SessionException;
import com.autonomous.swarm.exception.SpawnException;
import com.autonomous.swarm.exception.UnknownSessionException;
import com.autonomous.swarm.model.AgentAdapterConfig;
import com.autonomous.swarm.model.BlockedEvent;
import com.autonomous.swarm.model.LoginRequiredEvent;
import com.autonomous.swarm.model.PromptInfo;
import com.autonomous.swarm.model.PromptRule;
import com.autonomous.swarm.model.SessionExitEvent;
import com.autonomous.swarm.model.SessionInfo;
import com.autonomous.swarm.model.SessionStatus;
import com.autonomous.swarm.model.SpawnOptions;
import com.autonomous.swarm.model.ToolRunningEvent;
import com.autonomous.swarm.model.TurnCompleteEvent;
import com.autonomous.swarm.process.AgentProcess;
import com.autonomous.swarm.process.AgentProcessFactory;
import com.autonomous.swarm.terminal.Classification;
import com.autonomous.swarm.terminal.OutputClassifier;
import com.autonomous.swarm.terminal.OutputSanitizer;
import com.autonomous.swarm.terminal.PatternOutputClassifier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns one agent process per session: spawns it, writes to it, buffers and classifies its output,
 * and reports lifecycle events to {@link SessionEventListener}s.
 */
@Slf4j
@Service
public class SessionManager {

    private static final int CLASSIFY_WINDOW_LINES = 40;

    private final SwarmProperties properties;
    private final AdapterConfigLoaderService adapters;
    private final AgentProcessFactory processFactory;
    private final AgentMetricsService metrics;

    private final Map<String, ManagedSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<String>> outputBuffers = new ConcurrentHashMap<>();
    private final Map<String, Integer> turnMarkers = new ConcurrentHashMap<>();
    private final Set<String> terminatedSessions = ConcurrentHashMap.newKeySet();
    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    public SessionManager(SwarmProperties properties,
                          AdapterConfigLoaderService adapters,
                          AgentProcessFactory processFactory,
                          AgentMetricsService metrics) {
        this.properties = properties;
        this.adapters = adapters;
        this.processFactory = processFactory;
        this.metrics = metrics;
    }

    /**
     * Starts an agent process and returns its session id.
     *
     * @throws SpawnException if the agent type has no adapter, the working directory is missing
     *                        or the binary cannot be started
     */
    public String spawn(SpawnOptions options) {
        String agentType = adapters.normalizeAgentType(options.getAgentType());
        AgentAdapterConfig config = adapters.getConfig(agentType)
            .orElseThrow(() -> new SpawnException("No adapter configured for agent type " + agentType));

        String workdirValue = options.getWorkdir() != null ? options.getWorkdir() : properties.getDefaultWorkdir();
        Path workdir = Paths.get(workdirValue);
        if (!Files.isDirectory(workdir)) {
            throw new SpawnException("Working directory does not exist: " + workdirValue);
        }

        String id = "session-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
        ManagedSession session = new ManagedSession(id,
            options.getName() != null ? options.getName() : agentType + "-" + id.substring(id.length() - 8),
            agentType, workdir.toString(), new PatternOutputClassifier(config));
        session.pendingInitialTask = options.getInitialTask();

        // registered before the process starts so early output has somewhere to go
        outputBuffers.put(id, new ArrayList<>());
        sessions.put(id, session);

        Map<String, String> env = new HashMap<>(config.getEnv());
        if (options.getEnv() != null) {
            env.putAll(options.getEnv());
        }

        try {
            session.process = processFactory.spawn(config.getCommand(), workdir, env,
                chunk -> handleOutput(session, chunk),
                exitCode -> handleExit(session, exitCode));
        } catch (IOException e) {
            sessions.remove(id);
            outputBuffers.remove(id);
            throw new SpawnException("Failed to start " + String.join(" ", config.getCommand())
                + ": " + e.getMessage(), e);
        }

        metrics.recordSpawn(agentType);
        log.info("Spawned {} session {} in {}", agentType, id, workdir);

        if (config.getReadyPatterns().isEmpty()) {
            List<Runnable> events = new ArrayList<>();
            synchronized (session) {
                if (!session.readyEmitted) {
                    markReady(session, events);
                }
            }
            events.forEach(Runnable::run);
        }
        return id;
    }

    /**
     * Writes a line of input. Starts a new turn unless one is already running.
     */
    public void send(String sessionId, String text) {
        ManagedSession session = requireActive(sessionId);
        synchronized (session) {
            if (!session.busy) {
                turnMarkers.put(sessionId, bufferSize(sessionId));
                session.turnStartedAt = Instant.now();
                session.busy = true;
            }
            session.scanFrom = bufferSize(sessionId);
            session.lastBlockedPrompt = null;
            session.status = SessionStatus.ACTIVE;
            session.lastActivityAt = Instant.now();
        }
        try {
            session.process.write(text + "\n");
        } catch (IOException e) {
            throw new SessionException(sessionId, "Failed to write to session " + sessionId, e);
        }
    }

    /**
     * Writes named keys or literal key strings, for menus that do not take line input.
     */
    public void sendKeys(String sessionId, List<String> keys) {
        ManagedSession session = requireActive(sessionId);
        synchronized (session) {
            session.scanFrom = bufferSize(sessionId);
            session.lastBlockedPrompt = null;
            session.status = SessionStatus.ACTIVE;
            session.lastActivityAt = Instant.now();
        }
        try {
            session.process.writeKeys(keys);
        } catch (IOException e) {
            throw new SessionException(sessionId, "Failed to send keys to session " + sessionId, e);
        }
    }

    /**
     * Kills the process and drops its buffers. Stopping a session that already ended is a no-op.
     *
     * @throws UnknownSessionException if the id was never issued
     */
    public void stop(String sessionId) {
        ManagedSession session = sessions.get(sessionId);
        if (session == null) {
            if (terminatedSessions.contains(sessionId)) {
                log.debug("Session {} already terminated", sessionId);
                return;
            }
            throw new UnknownSessionException(sessionId);
        }
        if (!terminatedSessions.add(sessionId)) {
            return;
        }
        sessions.remove(sessionId);

        synchronized (session) {
            session.status = SessionStatus.STOPPED;
        }
        if (session.process != null) {
            session.process.kill();
        }
        flushBuffers(sessionId);
        log.info("Stopped session {}", sessionId);
        emit(listener -> listener.onExit(sessionId,
            new SessionExitEvent(SessionStatus.STOPPED, null, "Stopped")));
    }

    public String getOutput(String sessionId) {
        return getOutput(sessionId, properties.getRecentOutputLines());
    }

    /**
     * Last {@code lines} lines of output with control sequences removed. Empty once the
     * session has terminated.
     */
    public String getOutput(String sessionId, int lines) {
        if (terminatedSessions.contains(sessionId)) {
            return "";
        }
        List<String> buffer = outputBuffers.get(sessionId);
        if (buffer == null) {
            throw new UnknownSessionException(sessionId);
        }
        String tail;
        synchronized (buffer) {
            int from = Math.max(0, buffer.size() - lines);
            tail = String.join("\n", buffer.subList(from, buffer.size()));
        }
        return OutputSanitizer.stripControlSequences(tail);
    }

    public List<SessionInfo> listSessions() {
        return sessions.values().stream()
            .map(ManagedSession::toInfo)
            .collect(Collectors.toList());
    }

    public Optional<SessionInfo> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(ManagedSession::toInfo);
    }

    public boolean isActive(String sessionId) {
        ManagedSession session = sessions.get(sessionId);
        return session != null && !session.status.isTerminal();
    }

    /**
     * @return a handle that removes the listener
     */
    public Runnable addListener(SessionEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @PreDestroy
    public void shutdown() {
        for (String sessionId : List.copyOf(sessions.keySet())) {
            try {
                stop(sessionId);
            } catch (SessionException e) {
                log.warn("Failed to stop session {} on shutdown: {}", sessionId, e.getMessage());
            }
        }
        scheduler.shutdownNow();
    }

    // Output handling

    private void handleOutput(ManagedSession session, String chunk) {
        List<Runnable> events = new ArrayList<>();
        synchronized (session) {
            List<String> buffer = outputBuffers.get(session.id);
            if (buffer == null || session.status.isTerminal()) {
                return;
            }
            session.lastActivityAt = Instant.now();

            String window;
            int size;
            synchronized (buffer) {
                for (String line : chunk.split("\n")) {
                    buffer.add(line);
                }
                int excess = buffer.size() - properties.getMaxLogLines();
                if (excess > 0) {
                    buffer.subList(0, excess).clear();
                    session.scanFrom = Math.max(0, session.scanFrom - excess);
                    turnMarkers.computeIfPresent(session.id, (id, marker) -> Math.max(0, marker - excess));
                }
                size = buffer.size();
                int from = Math.min(size, Math.max(session.scanFrom, size - CLASSIFY_WINDOW_LINES));
                window = String.join("\n", buffer.subList(from, size));
            }

            Classification classification = session.classifier.classify(OutputSanitizer.stripControlSequences(window));
            switch (classification.getKind()) {
                case LOGIN_REQUIRED -> {
                    session.scanFrom = size;
                    events.add(() -> emit(listener -> listener.onLoginRequired(session.id,
                        new LoginRequiredEvent(classification.getDetail()))));
                }
                case BLOCKED -> handleBlockedPrompt(session, classification, size, events);
                case TURN_COMPLETE, READY -> handleIdlePrompt(session, size, events);
                case TOOL_RUNNING -> {
                    session.scanFrom = size;
                    session.lastBlockedPrompt = null;
                    events.add(() -> emit(listener -> listener.onToolRunning(session.id,
                        new ToolRunningEvent(classification.getDetail()))));
                }
                default -> {
                }
            }
        }
        events.forEach(Runnable::run);
    }

    private void handleBlockedPrompt(ManagedSession session, Classification classification,
                                     int size, List<Runnable> events) {
        PromptInfo info = classification.getPromptInfo();
        PromptRule rule = classification.getRule();
        session.scanFrom = size;

        // TUIs redraw the same prompt many times
        if (info.getPrompt().equals(session.lastBlockedPrompt)) {
            log.debug("Suppressing repeated prompt on {}", session.id);
            return;
        }
        session.lastBlockedPrompt = info.getPrompt();

        boolean autoRespond = rule != null && rule.isAutoRespond()
            && (!rule.isOnce() || session.firedOnceRules.add(rule.getPattern()));
        if (autoRespond) {
            events.add(() -> {
                boolean responded = writeAutoResponse(session, rule);
                if (!responded) {
                    session.status = SessionStatus.BLOCKED;
                }
                emit(listener -> listener.onBlocked(session.id, new BlockedEvent(info, responded)));
            });
        } else {
            session.status = SessionStatus.BLOCKED;
            events.add(() -> emit(listener -> listener.onBlocked(session.id, new BlockedEvent(info, false))));
        }
    }

    private void handleIdlePrompt(ManagedSession session, int size, List<Runnable> events) {
        session.scanFrom = size;
        session.lastBlockedPrompt = null;
        if (!session.readyEmitted) {
            markReady(session, events);
            return;
        }
        if (!session.busy) {
            return;
        }

        session.busy = false;
        session.status = SessionStatus.ACTIVE;
        long durationMs = session.turnStartedAt != null
            ? Duration.between(session.turnStartedAt, Instant.now()).toMillis()
            : 0;
        String response = OutputSanitizer.captureSinceMarker(session.id, outputBuffers, turnMarkers);
        events.add(() -> {
            metrics.recordCompletion(session.agentType, durationMs);
            emit(listener -> listener.onTurnComplete(session.id, new TurnCompleteEvent(response)));
        });
    }

    private void markReady(ManagedSession session, List<Runnable> events) {
        session.readyEmitted = true;
        if (session.status == SessionStatus.STARTING) {
            session.status = SessionStatus.ACTIVE;
        }
        String initialTask = session.pendingInitialTask;
        session.pendingInitialTask = null;
        events.add(() -> {
            emit(listener -> listener.onReady(session.id));
            if (initialTask != null) {
                scheduleInitialTask(session.id, initialTask);
            }
        });
    }

    private void scheduleInitialTask(String sessionId, String task) {
        scheduler.schedule(() -> {
            try {
                send(sessionId, task);
                log.info("Sent initial task to {}", sessionId);
            } catch (SessionException e) {
                log.warn("Could not send initial task to {}: {}", sessionId, e.getMessage());
            }
        }, properties.getInitialTaskSettleDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return whether the rule's answer reached the process
     */
    private boolean writeAutoResponse(ManagedSession session, PromptRule rule) {
        AgentProcess process = session.process;
        if (process == null) {
            log.debug("Process for {} not attached yet, leaving prompt for arbitration", session.id);
            return false;
        }
        try {
            if (rule.getKeys() != null && !rule.getKeys().isEmpty()) {
                process.writeKeys(rule.getKeys());
            } else {
                process.write((rule.getResponse() != null ? rule.getResponse() : "") + "\n");
            }
            log.info("Auto-responded on {}: {}", session.id, rule.getDescription());
            return true;
        } catch (IOException e) {
            log.warn("Auto-response failed on {}: {}", session.id, e.getMessage());
            emit(listener -> listener.onError(session.id, "Auto-response failed: " + e.getMessage()));
            return false;
        }
    }

    private void handleExit(ManagedSession session, int exitCode) {
        if (!terminatedSessions.add(session.id)) {
            return;
        }
        sessions.remove(session.id);
        SessionStatus status = exitCode == 0 ? SessionStatus.COMPLETED : SessionStatus.FAILED;
        synchronized (session) {
            session.status = status;
        }
        flushBuffers(session.id);
        log.info("Session {} exited with code {}", session.id, exitCode);

        if (exitCode != 0) {
            emit(listener -> listener.onError(session.id, "Process exited with code " + exitCode));
        }
        emit(listener -> listener.onExit(session.id,
            new SessionExitEvent(status, exitCode, "Process exited")));
    }

    private ManagedSession requireActive(String sessionId) {
        ManagedSession session = sessions.get(sessionId);
        if (session == null) {
            if (terminatedSessions.contains(sessionId)) {
                throw new InactiveSessionException(sessionId);
            }
            throw new UnknownSessionException(sessionId);
        }
        if (session.status.isTerminal() || session.process == null) {
            throw new InactiveSessionException(sessionId);
        }
        return session;
    }

    private int bufferSize(String sessionId) {
        List<String> buffer = outputBuffers.get(sessionId);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    private void flushBuffers(String sessionId) {
        outputBuffers.remove(sessionId);
        turnMarkers.remove(sessionId);
    }

    private void emit(Consumer<SessionEventListener> event) {
        for (SessionEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Session listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Mutable per-session state. Guarded by the instance monitor, except the volatile fields
     * read by queries.
     */
    private static final class ManagedSession {
        private final String id;
        private final String name;
        private final String agentType;
        private final String workdir;
        private final OutputClassifier classifier;
        private final Instant createdAt = Instant.now();
        private final Set<String> firedOnceRules = new HashSet<>();

        private volatile AgentProcess process;
        private volatile SessionStatus status = SessionStatus.STARTING;
        private volatile Instant lastActivityAt = createdAt;

        private boolean readyEmitted;
        private boolean busy;
        private String pendingInitialTask;
        private String lastBlockedPrompt;
        private int scanFrom;
        private Instant turnStartedAt;

        private ManagedSession(String id, String name, String agentType, String workdir,
                               OutputClassifier classifier) {
            this.id = id;
            this.name = name;
            this.agentType = agentType;
            this.workdir = workdir;
            this.classifier = classifier;
        }

        private SessionInfo toInfo() {
            return SessionInfo.builder()
                .id(id)
                .name(name)
                .agentType(agentType)
                .workdir(workdir)
                .status(status)
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .build();
        }
    }
}
