package com.missionpilot.orchestrator.tool;

import java.util.Map;

/**
 * Every external effectful operation available to agents is a Tool.
 *
 * Tools are dispatched by name through the {@link ToolGateway}, which enforces
 * the capability-registry precondition, the caller's timeout and metrics
 * uniformly. A Tool never needs to know who is calling it.
 */
public interface Tool {

    /** Identity, documentation and invocation schema. */
    ToolManifest manifest();

    /**
     * Run the tool.
     *
     * Implementations return an observation for failures the tool itself can
     * describe (non-zero exit, missing file) and throw
     * {@link ToolInvocationException} when no observation is possible.
     */
    Observation invoke(Map<String, Object> args, ToolContext ctx);

    /**
     * Cheap, read-only check that the tool is usable right now.
     * Used by the capability registry before a low-confidence tool is trusted.
     */
    boolean selfCheck();
}
