package com.autonomous.swarm.model;

import lombok.Value;

@Value
public class ToolRunningEvent {
    String description;
}
