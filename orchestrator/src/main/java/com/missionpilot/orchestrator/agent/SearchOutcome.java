package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.evaluation.FailureAssessment;

import java.util.List;

/**
 * Result of one Tree-of-Thoughts search.
 *
 * @param winningPath    root-to-leaf nodes ending in the node that completed the task;
 *                       empty when the search did not succeed
 * @param nodesEvaluated candidates scored, never more than W × D
 * @param nodesExecuted  nodes whose action actually ran
 * @param lastStep       the last executed step, null if nothing ran
 */
public record SearchOutcome(
        boolean           succeeded,
        List<ThoughtNode> winningPath,
        int               nodesEvaluated,
        int               nodesExecuted,
        StepResult        lastStep) {

    public SearchOutcome {
        winningPath = List.copyOf(winningPath);
    }

    /** Classification of the last failed execution; null if nothing failed. */
    public FailureAssessment lastAssessment() {
        return lastStep == null ? null : lastStep.assessment();
    }
}
