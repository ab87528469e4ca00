package com.missionpilot.orchestrator.tool;

/**
 * What the agent sees after an action.
 *
 * Either the tool ran (exitCode/stdout/stderr, exitCode null for tools with
 * no process semantics) or the gateway refused or aborted the call
 * ({@code toolError} set).
 */
public record Observation(
        String    toolName,
        Integer   exitCode,
        String    stdout,
        String    stderr,
        ToolError toolError) {

    public static Observation of(String toolName, int exitCode, String stdout, String stderr) {
        return new Observation(toolName, exitCode, stdout, stderr, null);
    }

    public static Observation text(String toolName, String text) {
        return new Observation(toolName, null, text, null, null);
    }

    public static Observation failure(String toolName, String stderr) {
        return new Observation(toolName, 1, null, stderr, null);
    }

    public static Observation error(String toolName, ToolError error) {
        return new Observation(toolName, null, null, null, error);
    }

    /** True if the tool ran and reported success. */
    public boolean success() {
        return toolError == null && (exitCode == null || exitCode == 0);
    }

    public boolean hasToolError() {
        return toolError != null;
    }

    /**
     * Format as the observation string the reasoning model reads on its next turn.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        if (toolError != null) {
            return sb.append("tool_error: ").append(toolError.kind())
                     .append("\nmessage: ").append(toolError.message()).toString();
        }
        if (stdout != null && !stdout.isBlank()) {
            sb.append("stdout:\n").append(stdout.stripTrailing());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append("stderr:\n").append(stderr.stripTrailing());
        }
        if (sb.isEmpty()) sb.append("(no output)");
        if (exitCode != null) {
            sb.append("\n\nexit_code: ").append(exitCode);
        }
        return sb.toString();
    }
}
