package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.tool.Observation;

/**
 * A domain-specific judge of one action's outcome.
 *
 * Evaluators are Spring beans ordered with {@code @Order}; the first one that
 * {@link #supports} an observation evaluates it.
 */
public interface OutcomeEvaluator {

    String name();

    boolean supports(String toolName, Observation observation);

    EvaluationResult evaluate(Task task, String action, Observation observation);
}
