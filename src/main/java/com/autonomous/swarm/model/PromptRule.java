package com.autonomous.swarm.model;

import lombok.Data;

import java.util.List;

@Data
public class PromptRule {
    private String pattern;
    private String type = "unknown";
    private String response;
    private List<String> keys;
    private boolean autoRespond = false;
    private boolean once = false;
    private String description;
}
