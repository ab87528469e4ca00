package com.missionpilot.orchestrator.tool;

import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Gateway dispatch against small in-test tools and a real tool executor.
 */
class ToolGatewayTest {

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    ExecutorService     toolExecutor;
    SimpleMeterRegistry meters;
    CapabilityRegistry  registry;
    ToolGateway         gateway;
    ToolContext         ctx;
    FakeTool            checked;

    @BeforeEach
    void setUp() {
        toolExecutor = Executors.newCachedThreadPool();
        meters   = new SimpleMeterRegistry();
        registry = new CapabilityRegistry(new OrchestratorProperties());
        checked   = new FakeTool("flaky", args -> Observation.text("flaky", "ok"));
        gateway  = new ToolGateway(List.of(
                new FakeTool("echo", args -> Observation.text("echo", String.valueOf(args.get("text")))),
                new FakeTool("fail", args -> Observation.of("fail", 3, "", "boom")),
                new FakeTool("slow", args -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Observation.text("slow", "late");
                }),
                new FakeTool("guarded", args -> {
                    throw new ToolInvocationException(ToolInvocationException.Kind.UNAUTHORIZED, "denied");
                }),
                new FakeTool("crash", args -> {
                    throw new IllegalStateException("bug");
                }),
                checked), registry, meters, toolExecutor);
        ctx = new ToolContext(Path.of("target/ws"), UUID.randomUUID(), UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    @Test
    void everyToolIsRegisteredWithInitialConfidence() {
        assertThat(gateway.toolNames()).containsExactly("crash", "echo", "fail", "flaky", "guarded", "slow");
        assertThat(registry.find("echo").orElseThrow().confidenceScore()).isEqualTo(0.7);
    }

    @Test
    void success_returnsObservationAndCountsIt() {
        Observation o = gateway.invoke("echo", Map.of("text", "hi"), TIMEOUT, ctx);

        assertThat(o.success()).isTrue();
        assertThat(o.stdout()).isEqualTo("hi");
        assertThat(calls("echo", "success")).isEqualTo(1.0);
        assertThat(meters.get("missionpilot.tool.duration").tag("tool", "echo").timer().count()).isEqualTo(1);
    }

    @Test
    void nonZeroExit_isAnObservationNotAnException() {
        Observation o = gateway.invoke("fail", null, TIMEOUT, ctx);

        assertThat(o.success()).isFalse();
        assertThat(o.exitCode()).isEqualTo(3);
        assertThat(calls("fail", "failure")).isEqualTo(1.0);
    }

    @Test
    void unregisteredTool_isNotFound() {
        assertThatThrownBy(() -> gateway.invoke("deploy", Map.of(), TIMEOUT, ctx))
                .isInstanceOf(ToolInvocationException.class)
                .extracting(e -> ((ToolInvocationException) e).getKind())
                .isEqualTo(ToolInvocationException.Kind.NOT_FOUND);
        assertThat(calls("deploy", "not_found")).isEqualTo(1.0);
    }

    @Test
    void registeredWithoutImplementation_isNotFound() {
        registry.register(new CapabilityManifestEntry("ghost", "no impl", "ghost()", 0.9, null));

        assertThatThrownBy(() -> gateway.invoke("ghost", Map.of(), TIMEOUT, ctx))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("no implementation");
    }

    @Test
    void slowTool_timesOutAndIsInterrupted() {
        assertThatThrownBy(() -> gateway.invoke("slow", Map.of(), Duration.ofMillis(100), ctx))
                .isInstanceOf(ToolInvocationException.class)
                .extracting(e -> ((ToolInvocationException) e).getKind())
                .isEqualTo(ToolInvocationException.Kind.TIMEOUT);
        assertThat(calls("slow", "timeout")).isEqualTo(1.0);
    }

    @Test
    void toolRefusal_propagatesUnchanged() {
        assertThatThrownBy(() -> gateway.invoke("guarded", Map.of(), TIMEOUT, ctx))
                .isInstanceOf(ToolInvocationException.class)
                .extracting(e -> ((ToolInvocationException) e).getKind())
                .isEqualTo(ToolInvocationException.Kind.UNAUTHORIZED);
        assertThat(calls("guarded", "unauthorized")).isEqualTo(1.0);
    }

    @Test
    void crashingTool_isRuntimeError() {
        assertThatThrownBy(() -> gateway.invoke("crash", Map.of(), TIMEOUT, ctx))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("bug")
                .extracting(e -> ((ToolInvocationException) e).getKind())
                .isEqualTo(ToolInvocationException.Kind.RUNTIME_ERROR);
    }

    @Test
    void lowConfidenceTool_isCheckedBeforeUse() {
        registry.adjustConfidence("flaky", -0.4);

        checked.checkResult.set(false);
        assertThatThrownBy(() -> gateway.invoke("flaky", Map.of(), TIMEOUT, ctx))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("verification check");

        checked.checkResult.set(true);
        assertThat(gateway.invoke("flaky", Map.of(), TIMEOUT, ctx).success()).isTrue();
        assertThat(registry.find("flaky").orElseThrow().verifiedAt()).isNotNull();
    }

    private double calls(String tool, String status) {
        return meters.get("missionpilot.tool.calls").tag("tool", tool).tag("status", status).counter().count();
    }

    interface Behaviour {
        Observation run(Map<String, Object> args);
    }

    static final class FakeTool implements Tool {
        final String name;
        final Behaviour behaviour;
        final AtomicBoolean checkResult = new AtomicBoolean(true);

        FakeTool(String name, Behaviour behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public ToolManifest manifest() {
            return new ToolManifest(name, "1.0.0", name + "()", "test tool " + name, true);
        }

        @Override
        public Observation invoke(Map<String, Object> args, ToolContext ctx) {
            return behaviour.run(args);
        }

        @Override
        public boolean selfCheck() {
            return checkResult.get();
        }
    }
}
