package com.missionpilot.orchestrator.reasoning;

import java.util.Map;

/**
 * A proposed tool invocation: registry name plus JSON-style arguments.
 */
public record ToolCall(String tool, Map<String, Object> args) {

    public ToolCall {
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    /** Compact form stored as the "action" of a reflexion record. */
    public String describe() {
        return tool + " " + args;
    }
}
