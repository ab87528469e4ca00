package com.missionpilot.orchestrator.tool;

import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uniform synchronous entry point for every effectful operation.
 *
 * All {@link Tool} beans are collected at startup and registered in the
 * {@link CapabilityRegistry} with their check. Dispatch is by name:
 * <ol>
 *   <li>Registry membership is checked first; unknown names fail with NOT_FOUND.</li>
 *   <li>Tools below the verify threshold are checked before being trusted.</li>
 *   <li>The call runs on the tool executor and is bounded by the caller's timeout;
 *       on expiry the call is cancelled and TIMEOUT is reported.</li>
 * </ol>
 * Every call is timed and counted:
 * <pre>
 *   missionpilot.tool.calls{tool, status="success|failure|not_found|unauthorized|timeout|runtime_error"}
 *   missionpilot.tool.duration{tool}
 * </pre>
 */
@Component
public class ToolGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolGateway.class);

    private final Map<String, Tool>  tools = new ConcurrentHashMap<>();
    private final CapabilityRegistry registry;
    private final MeterRegistry      meterRegistry;
    private final ExecutorService    toolExecutor;

    public ToolGateway(List<Tool> allTools,
                       CapabilityRegistry registry,
                       MeterRegistry meterRegistry,
                       @Qualifier("toolExecutor") ExecutorService toolExecutor) {
        this.registry      = registry;
        this.meterRegistry = meterRegistry;
        this.toolExecutor  = toolExecutor;
        for (Tool tool : allTools) {
            ToolManifest m = tool.manifest();
            tools.put(m.name(), tool);
            registry.register(new CapabilityManifestEntry(
                    m.name(), m.description(), m.invocationSchema(),
                    registry.initialConfidence(), null), tool::selfCheck);
        }
    }

    /**
     * Invoke a tool by name.
     *
     * @throws ToolInvocationException NOT_FOUND if the tool is absent from the registry,
     *         RUNTIME_ERROR if a required check fails or the tool crashes,
     *         TIMEOUT if the call outlives {@code timeout}, UNAUTHORIZED if the tool refuses
     * @throws CancellationException if the calling worker is interrupted (mission cancelled)
     */
    public Observation invoke(String toolName, Map<String, Object> args, Duration timeout, ToolContext ctx) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            Tool tool = resolve(toolName);
            Observation observation = runWithTimeout(tool, args == null ? Map.of() : args, timeout, ctx);
            if (!observation.success()) {
                status = "failure";
            }
            return observation;
        } catch (ToolInvocationException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("missionpilot.tool.duration", "tool", String.valueOf(toolName)));
            meterRegistry.counter("missionpilot.tool.calls",
                    "tool", String.valueOf(toolName), "status", status).increment();
        }
    }

    /** Names of the tools that have an implementation behind them (sorted). */
    public List<String> toolNames() {
        return tools.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Tool resolve(String toolName) {
        if (registry.find(toolName).isEmpty()) {
            throw new ToolInvocationException(ToolInvocationException.Kind.NOT_FOUND,
                    "Tool '" + toolName + "' is not in the capability registry");
        }
        Tool tool = tools.get(toolName);
        if (tool == null) {
            throw new ToolInvocationException(ToolInvocationException.Kind.NOT_FOUND,
                    "Tool '" + toolName + "' is registered but has no implementation");
        }
        if (registry.needsVerification(toolName) && !registry.verify(toolName)) {
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR,
                    "Tool '" + toolName + "' failed its verification check");
        }
        return tool;
    }

    private Observation runWithTimeout(Tool tool, Map<String, Object> args, Duration timeout, ToolContext ctx) {
        String name = tool.manifest().name();
        Future<Observation> future = toolExecutor.submit(() -> tool.invoke(args, ctx));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool '{}' timed out after {}", name, timeout);
            throw new ToolInvocationException(ToolInvocationException.Kind.TIMEOUT,
                    "Tool '" + name + "' timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Tool '" + name + "' interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolInvocationException tie) {
                throw tie;
            }
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR,
                    "Unexpected error in tool '" + name + "': " + cause.getMessage(), cause);
        }
    }
}
