package com.autonomous.swarm.service;

import com.autonomous.swarm.model.TaskContextSummary;

/**
 * The model-backed decision maker. Takes a fully built prompt and returns the raw reply text.
 */
public interface DecisionOracle {

    String decide(TaskContextSummary task, String prompt) throws Exception;
}
