package com.autonomous.swarm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A structured decision: {action, response?, useKeys?, keys?, reasoning}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinationResponse {
    private CoordinationAction action;
    private String response;
    private boolean useKeys;
    private List<String> keys;
    private String reasoning;

    public static CoordinationResponse of(CoordinationAction action, String reasoning) {
        return CoordinationResponse.builder().action(action).reasoning(reasoning).build();
    }

    /**
     * How the response is written into the audit trail, e.g. {@code "y"} or {@code "keys:down,enter"}.
     */
    public String describeResponse() {
        if (action != CoordinationAction.RESPOND) {
            return null;
        }
        if (useKeys && keys != null) {
            return "keys:" + String.join(",", keys);
        }
        return response;
    }
}
