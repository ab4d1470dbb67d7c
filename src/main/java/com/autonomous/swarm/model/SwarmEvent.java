package com.autonomous.swarm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwarmEvent {
    public static final String ALL_SESSIONS = "*";

    private String type;
    private String sessionId;
    private Instant timestamp;
    private Map<String, Object> data;

    public static SwarmEvent of(String type, String sessionId, Map<String, Object> data) {
        return new SwarmEvent(type, sessionId, Instant.now(), data);
    }

    /**
     * Builds an event payload from alternating keys and values. Null values are left out.
     */
    public static Map<String, Object> data(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return data;
    }
}
