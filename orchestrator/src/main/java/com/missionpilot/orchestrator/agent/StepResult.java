package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.evaluation.Reflection;
import com.missionpilot.orchestrator.reasoning.Thought;
import com.missionpilot.orchestrator.tool.Observation;

/**
 * One Thought → Action → Observation triple.
 *
 * @param toolName   tool that was called, null for a final answer or a stalled thought
 * @param action     description stored in the reflexion record
 * @param terminal   the task completed, or the tool call failed unrecoverably
 * @param reflection evaluation of the observation; null when no action was taken
 */
public record StepResult(
        Thought     thought,
        String      toolName,
        String      action,
        Observation observation,
        boolean     terminal,
        Reflection  reflection) {

    /** The task is done. */
    public boolean completed() {
        return terminal && reflection != null && reflection.succeeded();
    }

    public boolean failed() {
        return reflection != null && !reflection.succeeded();
    }

    public FailureAssessment assessment() {
        return reflection == null ? null : reflection.assessment();
    }

    /** Result text stored on the task when this step completes it. */
    public String resultText() {
        if (thought.isFinal()) return thought.finalAnswer();
        return observation.toText();
    }

    /** How this step is shown to the model on the next turn. */
    public String transcriptEntry() {
        return "Thought: " + thought.text()
                + "\nAction: " + (action == null ? "(none)" : action)
                + "\nObservation: " + observation.toText()
                + (reflection == null ? "" : "\nReflection: " + reflection.result().reflectionText());
    }
}
