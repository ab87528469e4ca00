package com.missionpilot.orchestrator.tool;

/**
 * Identity and documentation contract for a tool.
 *
 * @param name            Unique identifier used for dispatch and shown to the
 *                        reasoning model (e.g. "run_command").
 * @param version         Semantic version of the tool implementation.
 * @param invocationSchema Signature shown to the model, e.g.
 *                        "run_command(command: str, timeout_sec: int = 60)".
 * @param description     One-sentence docstring injected into the context.
 * @param readOnly        True when invoking the tool has no side effects.
 */
public record ToolManifest(
        String  name,
        String  version,
        String  invocationSchema,
        String  description,
        boolean readOnly) {}
