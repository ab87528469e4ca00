package com.missionpilot.orchestrator.tool;

/**
 * Thrown when a tool cannot produce an observation.
 *
 * Unchecked so callers only catch it where they turn it into an
 * observation; everything else lets it propagate to the task worker.
 */
public class ToolInvocationException extends RuntimeException {

    public enum Kind { NOT_FOUND, UNAUTHORIZED, TIMEOUT, RUNTIME_ERROR }

    private final Kind kind;

    public ToolInvocationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ToolInvocationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public ToolError toToolError() {
        return new ToolError(kind, getMessage());
    }
}
