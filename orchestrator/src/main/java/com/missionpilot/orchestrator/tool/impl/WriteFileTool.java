package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * write_file(path, content): creates or replaces a file inside the workspace.
 */
@Component
public class WriteFileTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "write_file", "1.0.0",
            "write_file(path: str, content: str) -> None",
            "Create or overwrite a text file relative to the mission workspace root.",
            false);

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Observation invoke(Map<String, Object> args, ToolContext ctx) {
        Path file = WorkspacePaths.resolve(ctx, WorkspacePaths.requiredString(args, "path"));
        String content = WorkspacePaths.optionalString(args, "content", "");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content);
            return Observation.text(MANIFEST.name(),
                    "Wrote " + content.length() + " chars to " + args.get("path"));
        } catch (AccessDeniedException e) {
            return Observation.failure(MANIFEST.name(), "Permission denied: " + e.getFile());
        } catch (IOException e) {
            return Observation.failure(MANIFEST.name(), "Cannot write " + args.get("path") + ": " + e.getMessage());
        }
    }

    @Override
    public boolean selfCheck() {
        return true;
    }
}
