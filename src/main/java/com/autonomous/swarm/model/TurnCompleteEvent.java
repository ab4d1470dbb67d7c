package com.autonomous.swarm.model;

import lombok.Value;

@Value
public class TurnCompleteEvent {
    String response;
}
