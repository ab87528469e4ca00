package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.model.Task;
import org.springframework.stereotype.Component;

/**
 * Decides when linear ReAct reasoning is not enough and Tree-of-Thoughts takes over.
 *
 * Pure and deterministic: the answer depends only on the arguments.
 */
@Component
public class EscalationController {

    /**
     * @param lastFailure the latest failure of this attempt, or null before any action
     * @return true if the failure is ambiguous (no single identifiable root cause),
     *         or if no action has been attempted yet and the task is tagged high-complexity
     */
    public boolean shouldEscalateToToT(Task task, FailureAssessment lastFailure) {
        if (lastFailure == null) {
            // attempts counts dispatches; the first dispatch has not acted yet
            return task.isHighComplexity() && task.getAttempts() <= 1;
        }
        return lastFailure.ambiguous();
    }
}
