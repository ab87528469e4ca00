package com.missionpilot.orchestrator.protocol;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.evaluation.ErrorCategory;
import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationTier;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.service.Plan;
import com.missionpilot.orchestrator.service.PlanManager;
import org.springframework.stereotype.Component;

/**
 * Tier 1: self-correction of transient, classifiable failures.
 *
 * <pre>
 *   DETECTED → CATEGORIZED → HYPOTHESIS_FORMED → CORRECTIVE_TASK_INJECTED → RETRYING
 *                                                      → RESOLVED | CIRCUIT_BREAKER_TRIPPED
 * </pre>
 * Each failure injects exactly one corrective task as a prerequisite of the
 * failed one and increments its retry count. Once the count has reached
 * {@code max-retries} the next failure trips the breaker instead. Corrective
 * tasks get no corrective tasks of their own: a corrective that fails means the
 * hypothesis was wrong, so it trips immediately.
 */
@Component
public class ReflexionTier {

    private final PlanManager         plans;
    private final EpisodicMemory      memory;
    private final ProtocolTransitions transitions;
    private final int                 maxRetries;

    public ReflexionTier(PlanManager plans, EpisodicMemory memory, ProtocolTransitions transitions,
                         OrchestratorProperties properties) {
        this.plans       = plans;
        this.memory      = memory;
        this.transitions = transitions;
        this.maxRetries  = properties.getMaxRetries();
    }

    /** Worker half: categorize and hypothesize. */
    public ProtocolDecision diagnose(Task task, FailureAssessment failure) {
        transitions.enter(task, ProtocolPhase.DETECTED, failure.evidence());
        ErrorCategory category = failure.category().orElseThrow(
                () -> new IllegalArgumentException("Tier 1 needs a classifiable failure: " + failure.summary()));
        transitions.enter(task, ProtocolPhase.CATEGORIZED, category.name());

        String hypothesis = hypothesis(category, failure);
        transitions.enter(task, ProtocolPhase.HYPOTHESIS_FORMED, hypothesis);
        return ProtocolDecision.transientFailure(task.getId(), failure, hypothesis,
                correctiveTask(task, category, failure));
    }

    /**
     * Owner half: inject the corrective task, or report that the breaker tripped.
     *
     * @return false if the circuit breaker tripped and nothing was injected
     */
    public boolean apply(Plan plan, Task task, ProtocolDecision decision) {
        int budget = task.getOrigin() == TaskOrigin.CORRECTIVE ? 0 : maxRetries;
        if (task.getRetryCount() >= budget) {
            transitions.enter(task, ProtocolPhase.CIRCUIT_BREAKER_TRIPPED,
                    "retry count %d reached limit %d".formatted(task.getRetryCount(), budget));
            return false;
        }
        task.incrementRetryCount();
        task.setEscalationTier(EscalationTier.REFLEXION);
        Task corrective = plans.injectTask(plan, decision.corrective(), TaskOrigin.CORRECTIVE, task);
        plans.recordOutcome(plan, task, TaskState.FAILED, decision.failure().summary());

        memory.append(task, RecordCategory.CORRECTIVE,
                "inject task #" + corrective.getNumber() + ": " + decision.corrective(),
                decision.failure().evidence(), 0.0, decision.hypothesis());
        transitions.enter(task, ProtocolPhase.CORRECTIVE_TASK_INJECTED,
                "task #%d, retry %d/%d".formatted(corrective.getNumber(), task.getRetryCount(), budget));
        return true;
    }

    // ------------------------------------------------------------------
    // Hypotheses
    // ------------------------------------------------------------------

    static String hypothesis(ErrorCategory category, FailureAssessment failure) {
        String subject = failure.subject();
        return switch (category) {
            case MISSING_DEPENDENCY -> subject != null
                    ? "The action failed because '" + subject + "' is not installed in the workspace."
                    : "The action failed because a required dependency is not installed.";
            case PERMISSION_ERROR -> "The action failed because the process lacks permission on a file or directory it needs.";
            case SYNTAX_ERROR     -> "The action failed because a file it executes or compiles contains a syntax error.";
            case TIMEOUT          -> "The action failed because it did not finish within the tool timeout.";
            default               -> throw new IllegalArgumentException("Not a transient category: " + category);
        };
    }

    static String correctiveTask(Task task, ErrorCategory category, FailureAssessment failure) {
        String forTask = " so that task #" + task.getNumber() + " (" + task.getDescription() + ") can succeed. Error: "
                + failure.evidence();
        return switch (category) {
            case MISSING_DEPENDENCY -> (failure.subject() != null
                    ? "Install the missing dependency '" + failure.subject() + "'"
                    : "Identify and install the missing dependency") + forTask;
            case PERMISSION_ERROR -> "Fix the permissions of the files or directories involved" + forTask;
            case SYNTAX_ERROR     -> "Fix the syntax error in the affected file" + forTask;
            case TIMEOUT          -> "Make the slow operation finish faster or split it into smaller steps" + forTask;
            default               -> throw new IllegalArgumentException("Not a transient category: " + category);
        };
    }
}
