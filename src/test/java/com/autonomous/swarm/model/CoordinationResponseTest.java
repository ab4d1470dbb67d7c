package com.autonomous.swarm.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationResponseTest {

    @Test
    void shouldDescribeTextAndKeyResponses() {
        CoordinationResponse text = CoordinationResponse.builder()
            .action(CoordinationAction.RESPOND)
            .response("y")
            .build();
        CoordinationResponse keys = CoordinationResponse.builder()
            .action(CoordinationAction.RESPOND)
            .useKeys(true)
            .keys(List.of("down", "enter"))
            .build();

        assertEquals("y", text.describeResponse());
        assertEquals("keys:down,enter", keys.describeResponse());
        assertNull(CoordinationResponse.of(CoordinationAction.ESCALATE, "unsure").describeResponse());
    }

    @Test
    void shouldMapWireNames() {
        assertEquals(CoordinationAction.IGNORE, CoordinationAction.fromWireName("ignore").orElseThrow());
        assertTrue(CoordinationAction.fromWireName("RESPOND").isEmpty());
        assertTrue(CoordinationAction.fromWireName(null).isEmpty());
        assertEquals(DecisionKind.COMPLETE, DecisionKind.of(CoordinationAction.COMPLETE));
        assertEquals("auto_resolved", DecisionKind.AUTO_RESOLVED.wireName());
    }

    @Test
    void shouldHandOutDecisionSnapshots() {
        TaskContext ctx = new TaskContext();
        ctx.setSessionId("s1");
        ctx.recordDecision(CoordinationDecision.builder().event("blocked").decision(DecisionKind.RESPOND).build());

        List<CoordinationDecision> snapshot = ctx.getDecisions();
        ctx.recordDecision(CoordinationDecision.builder().event("blocked").decision(DecisionKind.ESCALATE).build());

        assertEquals(1, snapshot.size());
        assertEquals(2, ctx.getDecisions().size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
    }
}
