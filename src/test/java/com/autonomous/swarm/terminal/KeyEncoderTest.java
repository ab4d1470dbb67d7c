package com.autonomous.swarm.terminal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyEncoderTest {

    @Test
    void shouldEncodeNamedKeys() {
        assertEquals("\r", KeyEncoder.encode("enter"));
        assertEquals("\u001b[B", KeyEncoder.encode("DOWN"));
        assertEquals("\u001b", KeyEncoder.encode("esc"));
        assertEquals("\u0003", KeyEncoder.encode("ctrl+c"));
    }

    @Test
    void shouldSendUnknownKeysLiterally() {
        assertEquals("y", KeyEncoder.encode("y"));
        assertEquals("2", KeyEncoder.encode("2"));
        assertEquals("", KeyEncoder.encode(null));
    }

    @Test
    void shouldEncodeSequencesInOrder() {
        assertEquals("\u001b[B\u001b[B\r", KeyEncoder.encodeAll(List.of("down", "down", "enter")));
    }
}
