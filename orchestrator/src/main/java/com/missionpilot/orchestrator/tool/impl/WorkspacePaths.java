package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.tool.ToolContext;
import com.missionpilot.orchestrator.tool.ToolInvocationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Path confinement and argument helpers shared by the workspace tools.
 */
final class WorkspacePaths {

    private WorkspacePaths() {}

    /** Resolve a relative path inside the mission workspace; escaping it is UNAUTHORIZED. */
    static Path resolve(ToolContext ctx, String relative) {
        Path root = workspaceRoot(ctx);
        Path resolved = root.resolve(relative == null || relative.isBlank() ? "." : relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new ToolInvocationException(ToolInvocationException.Kind.UNAUTHORIZED,
                    "Path '" + relative + "' escapes the workspace");
        }
        return resolved;
    }

    static Path workspaceRoot(ToolContext ctx) {
        Path root = ctx.workspace().toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace " + root, e);
        }
        return root;
    }

    static String requiredString(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (v == null || v.toString().isBlank()) {
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR,
                    "Missing required argument '" + key + "'");
        }
        return v.toString();
    }

    static String optionalString(Map<String, Object> args, String key, String fallback) {
        Object v = args.get(key);
        return v == null ? fallback : v.toString();
    }
}
