package com.missionpilot.orchestrator.reasoning;

import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.research.Finding;
import com.missionpilot.orchestrator.tool.Observation;

import java.util.List;
import java.util.Optional;

/**
 * The opaque thought generator behind planning, ReAct, Tree-of-Thoughts and
 * self-critique. Implementations must be safe to call from several threads.
 *
 * All methods may throw {@link ReasoningException} when the backend fails.
 */
public interface ReasoningModel {

    /** Break a prime directive into a task graph. Validation is the caller's job. */
    PlanDraft decompose(String primeDirective);

    /**
     * Next ReAct thought.
     *
     * @param transcript this attempt's previous steps, oldest first
     */
    Thought think(Task task, CognitiveContext context, List<String> transcript);

    /**
     * Propose up to {@code count} distinct strategies continuing {@code path}.
     *
     * @param path thoughts from the search root to the node being expanded (empty at the root)
     */
    List<Thought> propose(Task task, CognitiveContext context, String failureContext,
                          List<Thought> path, int count);

    /** Self-evaluation of a candidate, in [0, 10]. Must have no side effects. */
    double scoreThought(Task task, String failureContext, Thought candidate);

    /** Fallback judgement of an outcome no structured evaluator understood. */
    Critique critique(Task task, String action, Observation observation);

    /**
     * Turn research findings into a reusable heuristic for the missing capability.
     *
     * @return empty when the findings contain nothing usable
     */
    Optional<String> synthesizeHeuristic(String capabilityGap, List<Finding> findings);
}
