package com.missionpilot.orchestrator.reasoning;

/**
 * One reasoning step proposed by the model.
 *
 * Exactly one of these holds:
 * <ul>
 *   <li>{@code action != null}: the step wants a tool call. If the call succeeds
 *       and {@code completesTask} is true the task is done.</li>
 *   <li>{@code finalAnswer != null}: the task is done without a further call.</li>
 * </ul>
 * A thought with neither is a stall; the loop treats it as an ambiguous step.
 */
public record Thought(String text, ToolCall action, boolean completesTask, String finalAnswer) {

    public static Thought act(String text, ToolCall action, boolean completesTask) {
        return new Thought(text, action, completesTask, null);
    }

    public static Thought answer(String text, String finalAnswer) {
        return new Thought(text, null, true, finalAnswer);
    }

    public boolean hasAction()  { return action != null; }
    public boolean isFinal()    { return action == null && finalAnswer != null; }

    /** Text used when the thought is recorded or shown back to the model. */
    public String describe() {
        if (hasAction()) {
            return text + " -> " + action.describe();
        }
        return isFinal() ? text + " -> answer: " + finalAnswer : text;
    }
}
