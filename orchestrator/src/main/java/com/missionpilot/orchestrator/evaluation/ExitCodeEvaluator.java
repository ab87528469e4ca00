package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.tool.Observation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Judges process-style outcomes by exit code, and gateway errors by kind.
 */
@Component
@Order(2)
public class ExitCodeEvaluator implements OutcomeEvaluator {

    private static final int STDERR_EXCERPT = 300;

    @Override
    public String name() { return "exit-code"; }

    @Override
    public boolean supports(String toolName, Observation observation) {
        return observation.hasToolError() || observation.exitCode() != null;
    }

    @Override
    public EvaluationResult evaluate(Task task, String action, Observation observation) {
        if (observation.hasToolError()) {
            return EvaluationResult.failure(0.0, "Tool call was rejected (%s): %s"
                    .formatted(observation.toolError().kind(), observation.toolError().message()));
        }
        if (observation.exitCode() == 0) {
            return EvaluationResult.success(1.0, "Command completed with exit code 0.");
        }
        return EvaluationResult.failure(0.0, "Command exited with code %d: %s"
                .formatted(observation.exitCode(), firstLines(observation.stderr())));
    }

    private static String firstLines(String stderr) {
        if (stderr == null || stderr.isBlank()) return "(no stderr)";
        String s = stderr.strip();
        return s.length() <= STDERR_EXCERPT ? s : s.substring(0, STDERR_EXCERPT) + "...";
    }
}
