package com.autonomous.swarm.service;

import com.autonomous.swarm.exception.OracleParseException;
import com.autonomous.swarm.model.CoordinationAction;
import com.autonomous.swarm.model.CoordinationResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link CoordinationResponse} out of free-form oracle text. The first {@code '{'} to the
 * last {@code '}'} is parsed as JSON, so surrounding prose or code fences are tolerated.
 */
public class CoordinationResponseParser {

    static final String DEFAULT_REASONING = "No reasoning provided";

    private final ObjectMapper mapper;

    public CoordinationResponseParser() {
        this(new ObjectMapper());
    }

    public CoordinationResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public CoordinationResponse parse(String raw) {
        if (raw == null) {
            throw new OracleParseException("invalid oracle output: empty");
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new OracleParseException("invalid oracle output: no JSON object found");
        }

        JsonNode node;
        try {
            node = mapper.readTree(raw.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new OracleParseException("invalid oracle output: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new OracleParseException("invalid oracle output: not a JSON object");
        }

        String actionName = node.path("action").asText(null);
        CoordinationAction action = CoordinationAction.fromWireName(actionName)
            .orElseThrow(() -> new OracleParseException("invalid action: " + actionName));

        String reasoning = node.path("reasoning").asText("");
        CoordinationResponse response = CoordinationResponse.of(action,
            reasoning.isBlank() ? DEFAULT_REASONING : reasoning);

        if (action == CoordinationAction.RESPOND) {
            JsonNode keys = node.get("keys");
            if (node.path("useKeys").asBoolean(false) && keys != null && keys.isArray()) {
                List<String> keyList = new ArrayList<>();
                keys.forEach(key -> keyList.add(key.asText()));
                response.setUseKeys(true);
                response.setKeys(keyList);
            } else if (node.path("response").isTextual()) {
                response.setResponse(node.get("response").asText());
            } else {
                throw new OracleParseException("invalid respond decision: no response or keys");
            }
        }
        return response;
    }
}
