package com.missionpilot.orchestrator.evaluation;

/**
 * Output of one {@link OutcomeEvaluator}.
 *
 * @param score          in [0, 1]
 * @param reflectionText the verbal lesson stored in episodic memory
 */
public record EvaluationResult(Verdict verdict, double score, String reflectionText) {

    public static EvaluationResult success(double score, String reflection) {
        return new EvaluationResult(Verdict.SUCCESS, score, reflection);
    }

    public static EvaluationResult failure(double score, String reflection) {
        return new EvaluationResult(Verdict.FAILURE, score, reflection);
    }

    public boolean succeeded() {
        return verdict == Verdict.SUCCESS;
    }
}
