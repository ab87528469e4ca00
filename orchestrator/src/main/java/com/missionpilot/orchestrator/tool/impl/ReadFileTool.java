package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * read_file(path): returns the file's content relative to the workspace root.
 */
@Component
public class ReadFileTool implements Tool {

    private static final int MAX_CHARS = 20_000;

    private static final ToolManifest MANIFEST = new ToolManifest(
            "read_file", "1.0.0",
            "read_file(path: str) -> str",
            "Read a text file relative to the mission workspace root.",
            true);

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Observation invoke(Map<String, Object> args, ToolContext ctx) {
        Path file = WorkspacePaths.resolve(ctx, WorkspacePaths.requiredString(args, "path"));
        if (!Files.isRegularFile(file)) {
            return Observation.failure(MANIFEST.name(), "No such file: " + args.get("path"));
        }
        try {
            String content = Files.readString(file);
            if (content.length() > MAX_CHARS) {
                content = content.substring(0, MAX_CHARS) + "\n... (truncated)";
            }
            return Observation.text(MANIFEST.name(), content);
        } catch (IOException e) {
            return Observation.failure(MANIFEST.name(), "Cannot read " + args.get("path") + ": " + e.getMessage());
        }
    }

    @Override
    public boolean selfCheck() {
        return true;
    }
}
