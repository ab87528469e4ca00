package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * list_files(path, depth): lists files under a workspace directory.
 */
@Component
public class ListFilesTool implements Tool {

    private static final int MAX_ENTRIES = 500;

    private static final ToolManifest MANIFEST = new ToolManifest(
            "list_files", "1.0.0",
            "list_files(path: str = \".\", depth: int = 3) -> list[str]",
            "List files and directories under a path of the mission workspace.",
            true);

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Observation invoke(Map<String, Object> args, ToolContext ctx) {
        Path root = WorkspacePaths.resolve(ctx, WorkspacePaths.optionalString(args, "path", "."));
        int depth = Integer.parseInt(WorkspacePaths.optionalString(args, "depth", "3"));
        if (!Files.isDirectory(root)) {
            return Observation.failure(MANIFEST.name(), "No such directory: " + args.get("path"));
        }
        try (Stream<Path> paths = Files.walk(root, depth)) {
            String listing = paths
                    .filter(p -> !p.equals(root))
                    .limit(MAX_ENTRIES)
                    .map(p -> root.relativize(p) + (Files.isDirectory(p) ? "/" : ""))
                    .sorted()
                    .collect(Collectors.joining("\n"));
            return Observation.text(MANIFEST.name(), listing.isEmpty() ? "(empty)" : listing);
        } catch (IOException e) {
            return Observation.failure(MANIFEST.name(), "Cannot list " + args.get("path") + ": " + e.getMessage());
        }
    }

    @Override
    public boolean selfCheck() {
        return true;
    }
}
