package com.autonomous.swarm.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PromptInfo {
    String type;          // permission | config | question | unknown
    String prompt;
    String instructions;
    boolean canAutoRespond;
}
