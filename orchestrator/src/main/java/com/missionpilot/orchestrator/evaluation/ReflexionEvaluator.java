package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.tool.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Post-hoc judge of every executed action.
 *
 * For each (task, action, observation):
 * <ol>
 *   <li>The first {@link OutcomeEvaluator} that supports the observation scores it.</li>
 *   <li>Exactly one EVALUATION record is appended to {@link EpisodicMemory}.</li>
 *   <li>The tool's confidence is reinforced on success. A failure with a recognised
 *       cause penalizes it without taking it out of service; only a failure with no
 *       recognisable cause demotes it, possibly below the minimum confidence.
 *       Refusals (UNAUTHORIZED) and absent tools leave confidence untouched.</li>
 *   <li>Failures are classified by the {@link FailureClassifier}; the assessment
 *       drives ToT escalation and protocol tier selection.</li>
 * </ol>
 */
@Component
public class ReflexionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReflexionEvaluator.class);

    private static final int OBSERVATION_LIMIT = 4_000;

    private final List<OutcomeEvaluator> evaluators;
    private final FailureClassifier      classifier;
    private final EpisodicMemory         memory;
    private final CapabilityRegistry     registry;

    public ReflexionEvaluator(List<OutcomeEvaluator> evaluators,
                              FailureClassifier classifier,
                              EpisodicMemory memory,
                              CapabilityRegistry registry) {
        this.evaluators = evaluators;
        this.classifier = classifier;
        this.memory     = memory;
        this.registry   = registry;
    }

    /**
     * @param toolName the tool that produced the observation, or null for a final answer
     */
    public Reflection evaluate(Task task, String toolName, String action, Observation observation) {
        OutcomeEvaluator evaluator = evaluators.stream()
                .filter(e -> e.supports(toolName, observation))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No outcome evaluator configured"));

        EvaluationResult result = runEvaluator(evaluator, task, action, observation);

        ReflexionRecord record = memory.append(task, RecordCategory.EVALUATION, action,
                truncate(observation.toText()), result.score(), result.reflectionText());

        FailureAssessment assessment = null;
        if (result.succeeded()) {
            if (toolName != null) registry.reinforce(toolName);
        } else {
            assessment = classifier.assess(observation);
            if (toolName != null) adjustAfterFailure(toolName, assessment);
        }

        log.info("Evaluated {} via {}: {} (score {})", task, evaluator.name(), result.verdict(),
                "%.2f".formatted(result.score()));
        return new Reflection(result, assessment, record);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void adjustAfterFailure(String toolName, FailureAssessment assessment) {
        if (assessment.isUnauthorized() || assessment.isCapabilityGap()) {
            return;
        }
        if (assessment.categories().isEmpty()) {
            registry.demote(toolName);
        } else {
            registry.penalize(toolName);
        }
    }

    private EvaluationResult runEvaluator(OutcomeEvaluator evaluator, Task task, String action,
                                          Observation observation) {
        try {
            return evaluator.evaluate(task, action, observation);
        } catch (ReasoningException e) {
            // Critique backend down: judge by the observation alone
            log.warn("{} evaluator unavailable for {}: {}", evaluator.name(), task, e.getMessage());
            return observation.success()
                    ? EvaluationResult.success(0.5, "Outcome accepted without critique: " + e.getMessage())
                    : EvaluationResult.failure(0.0, "Outcome rejected without critique: " + e.getMessage());
        }
    }

    private static String truncate(String s) {
        return s.length() <= OBSERVATION_LIMIT ? s : s.substring(0, OBSERVATION_LIMIT) + "\n...(truncated)";
    }
}
