package com.missionpilot.orchestrator.reasoning;

/**
 * The reasoning backend failed or replied with something unusable.
 */
public class ReasoningException extends RuntimeException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
