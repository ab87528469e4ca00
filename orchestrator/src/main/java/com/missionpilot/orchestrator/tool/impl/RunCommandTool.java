package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.tool.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * run_command(command): runs a shell command inside the mission workspace.
 *
 * Commands matching a denied pattern (exact, or prefix when the pattern ends
 * with '*') are refused with UNAUTHORIZED before a process is started.
 * The process is killed if the invoking thread is interrupted, which is how
 * the gateway's timeout and mission cancellation reach it.
 */
@Component
public class RunCommandTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(RunCommandTool.class);

    private static final int MAX_OUTPUT_CHARS = 20_000;

    private static final ToolManifest MANIFEST = new ToolManifest(
            "run_command", "1.0.0",
            "run_command(command: str) -> {exit_code, stdout, stderr}",
            "Run a shell command in the mission workspace and return its exit code and output.",
            false);

    private final List<String> deniedCommands;

    public RunCommandTool(OrchestratorProperties properties) {
        this.deniedCommands = properties.getTool().getDeniedCommands();
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Observation invoke(Map<String, Object> args, ToolContext ctx) {
        String command = WorkspacePaths.requiredString(args, "command").strip();
        for (String pattern : deniedCommands) {
            if (matches(pattern, command)) {
                throw new ToolInvocationException(ToolInvocationException.Kind.UNAUTHORIZED,
                        "Command denied by policy: " + command);
            }
        }

        Path workdir = WorkspacePaths.workspaceRoot(ctx);
        log.debug("run_command in {}: {}", workdir, command);
        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command).directory(workdir.toFile()).start();
        } catch (IOException e) {
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR,
                    "Cannot start process: " + e.getMessage(), e);
        }

        // Drain both streams concurrently so a full pipe never blocks the process.
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            int exit = process.waitFor();
            return Observation.of(MANIFEST.name(), exit,
                    stdout.get(5, TimeUnit.SECONDS), stderr.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(ToolInvocationException.Kind.TIMEOUT,
                    "Command interrupted: " + command, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR,
                    "Cannot read process output: " + e.getMessage(), e);
        }
    }

    /** The shell must exist; nothing is executed. */
    @Override
    public boolean selfCheck() {
        return Files.isExecutable(Path.of("/bin/sh"));
    }

    private static boolean matches(String pattern, String command) {
        if (pattern.endsWith("*")) {
            return command.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(command);
    }

    private static String drain(InputStream in) {
        try (in) {
            String s = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return s.length() > MAX_OUTPUT_CHARS ? s.substring(s.length() - MAX_OUTPUT_CHARS) : s;
        } catch (IOException e) {
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }
}
