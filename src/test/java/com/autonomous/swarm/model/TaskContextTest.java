package com.autonomous.swarm.model;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class TaskContextTest {

    @Test
    void shouldKeepCountersShareableAcrossThreads() throws Exception {
        // the idle scanner, the event dispatcher and confirmation callers all touch these
        for (String field : List.of("status", "autoResolvedCount", "lastActivityAt", "idleCheckCount")) {
            assertTrue(Modifier.isVolatile(TaskContext.class.getDeclaredField(field).getModifiers()), field);
        }
    }

    @Test
    void shouldSeeIdleResetFromAnotherThread() {
        TaskContext ctx = new TaskContext();
        ctx.setIdleCheckCount(3);

        CompletableFuture.runAsync(() -> ctx.setIdleCheckCount(0)).join();

        assertEquals(0, ctx.getIdleCheckCount());
    }

    @Test
    void shouldReturnDecisionSnapshot() {
        TaskContext ctx = new TaskContext();
        ctx.recordDecision(CoordinationDecision.builder()
            .timestamp(Instant.now())
            .event("blocked")
            .decision(DecisionKind.AUTO_RESOLVED)
            .build());

        List<CoordinationDecision> snapshot = ctx.getDecisions();
        ctx.recordDecision(CoordinationDecision.builder()
            .timestamp(Instant.now())
            .event("turn_complete")
            .decision(DecisionKind.COMPLETE)
            .build());

        assertEquals(1, snapshot.size());
        assertEquals(2, ctx.getDecisions().size());
    }
}
