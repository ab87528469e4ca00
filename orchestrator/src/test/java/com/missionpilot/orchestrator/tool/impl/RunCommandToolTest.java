package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.tool.Observation;
import com.missionpilot.orchestrator.tool.ToolContext;
import com.missionpilot.orchestrator.tool.ToolInvocationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class RunCommandToolTest {

    @TempDir Path workspace;

    RunCommandTool tool;
    ToolContext    ctx;

    @BeforeEach
    void setUp() {
        tool = new RunCommandTool(new OrchestratorProperties());
        ctx  = new ToolContext(workspace, UUID.randomUUID(), UUID.randomUUID());
    }

    @Test
    void runsInsideTheWorkspace() throws Exception {
        Files.writeString(workspace.resolve("marker.txt"), "present");

        Observation o = tool.invoke(Map.of("command", "cat marker.txt"), ctx);

        assertThat(o.exitCode()).isZero();
        assertThat(o.stdout()).isEqualTo("present");
    }

    @Test
    void capturesExitCodeAndStderr() {
        Observation o = tool.invoke(Map.of("command", "echo oops >&2; exit 4"), ctx);

        assertThat(o.success()).isFalse();
        assertThat(o.exitCode()).isEqualTo(4);
        assertThat(o.stderr()).contains("oops");
    }

    @Test
    void deniedCommands_areRefusedBeforeStarting() {
        assertThatThrownBy(() -> tool.invoke(Map.of("command", "sudo rm -rf build"), ctx))
                .isInstanceOf(ToolInvocationException.class)
                .extracting(e -> ((ToolInvocationException) e).getKind())
                .isEqualTo(ToolInvocationException.Kind.UNAUTHORIZED);
        assertThatThrownBy(() -> tool.invoke(Map.of("command", "  rm -rf /  "), ctx))
                .isInstanceOf(ToolInvocationException.class);
    }

    @Test
    void missingCommand_isRuntimeError() {
        assertThatThrownBy(() -> tool.invoke(Map.of(), ctx))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("command");
    }
}
