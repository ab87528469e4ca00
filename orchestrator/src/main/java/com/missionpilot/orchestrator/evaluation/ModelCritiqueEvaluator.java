package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.reasoning.Critique;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.tool.Observation;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fallback: asks the reasoning model to critique outcomes no structured
 * evaluator recognises (file reads, search results, final answers).
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class ModelCritiqueEvaluator implements OutcomeEvaluator {

    private final ReasoningModel model;

    public ModelCritiqueEvaluator(ReasoningModel model) {
        this.model = model;
    }

    @Override
    public String name() { return "model-critique"; }

    @Override
    public boolean supports(String toolName, Observation observation) {
        return true;
    }

    @Override
    public EvaluationResult evaluate(Task task, String action, Observation observation) {
        Critique c = model.critique(task, action, observation);
        double score = Math.max(0.0, Math.min(1.0, c.score()));
        return c.succeeded()
                ? EvaluationResult.success(score, c.reflection())
                : EvaluationResult.failure(score, c.reflection());
    }
}
