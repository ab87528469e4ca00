package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.model.ReflexionRecord;

/**
 * Everything one evaluation produced.
 *
 * @param assessment classification of the failure; null when the outcome succeeded
 * @param record     the EVALUATION record appended to episodic memory
 */
public record Reflection(EvaluationResult result, FailureAssessment assessment, ReflexionRecord record) {

    public boolean succeeded() {
        return result.succeeded();
    }
}
