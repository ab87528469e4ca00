package com.missionpilot.orchestrator.tool;

/**
 * Structured failure returned by the Tool Gateway in place of an observation.
 */
public record ToolError(ToolInvocationException.Kind kind, String message) {

    /** Timeout and runtime errors are safe to retry; the other kinds are not. */
    public boolean retryable() {
        return kind == ToolInvocationException.Kind.TIMEOUT
            || kind == ToolInvocationException.Kind.RUNTIME_ERROR;
    }
}
