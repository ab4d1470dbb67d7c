package com.autonomous.swarm.service;

import com.autonomous.swarm.model.BlockedEvent;
import com.autonomous.swarm.model.LoginRequiredEvent;
import com.autonomous.swarm.model.SessionExitEvent;
import com.autonomous.swarm.model.ToolRunningEvent;
import com.autonomous.swarm.model.TurnCompleteEvent;

/**
 * Lifecycle hooks raised by {@link SessionManager}. Called on the session's output thread,
 * so implementations should hand off anything slow.
 */
public interface SessionEventListener {

    default void onReady(String sessionId) {
    }

    default void onBlocked(String sessionId, BlockedEvent event) {
    }

    default void onTurnComplete(String sessionId, TurnCompleteEvent event) {
    }

    default void onLoginRequired(String sessionId, LoginRequiredEvent event) {
    }

    default void onToolRunning(String sessionId, ToolRunningEvent event) {
    }

    default void onError(String sessionId, String message) {
    }

    default void onExit(String sessionId, SessionExitEvent event) {
    }
}
