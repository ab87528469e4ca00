package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.evaluation.Reflection;
import com.missionpilot.orchestrator.evaluation.ReflexionEvaluator;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.reasoning.Thought;
import com.missionpilot.orchestrator.reasoning.ToolCall;
import com.missionpilot.orchestrator.tool.Observation;
import com.missionpilot.orchestrator.tool.ToolContext;
import com.missionpilot.orchestrator.tool.ToolError;
import com.missionpilot.orchestrator.tool.ToolGateway;
import com.missionpilot.orchestrator.tool.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * The ReAct step: one Thought → Action → Observation per call.
 *
 * The executor is not a loop; the {@link TaskWorker} decides whether to call
 * {@link #step} again. {@link #execute} runs an already-chosen thought and is
 * shared with the Tree-of-Thoughts engine so both paths dispatch and evaluate
 * actions identically.
 *
 * A thought naming a tool that is unregistered or below the minimum confidence
 * is not dispatched: the observation is a NOT_FOUND tool error, which the
 * failure classifier reports as a capability gap.
 */
@Component
public class CognitiveLoopExecutor {

    private static final Logger log = LoggerFactory.getLogger(CognitiveLoopExecutor.class);

    static final String FINAL_ANSWER = "final_answer";

    private final ReasoningModel          model;
    private final ToolGateway             gateway;
    private final CapabilityRegistry      registry;
    private final ReflexionEvaluator      evaluator;
    private final OrchestratorProperties.Tool toolConfig;

    public CognitiveLoopExecutor(ReasoningModel model,
                                 ToolGateway gateway,
                                 CapabilityRegistry registry,
                                 ReflexionEvaluator evaluator,
                                 OrchestratorProperties properties) {
        this.model      = model;
        this.gateway    = gateway;
        this.registry   = registry;
        this.evaluator  = evaluator;
        this.toolConfig = properties.getTool();
    }

    /**
     * @param transcript this attempt's earlier steps, oldest first
     */
    public StepResult step(Task task, CognitiveContext context, List<String> transcript, CancellationToken token) {
        token.throwIfCancelled();
        Thought thought = model.think(task, context, transcript);
        log.debug("{} thought: {}", task, thought.describe());
        return execute(task, thought, token);
    }

    /** Act on a thought and evaluate the outcome. */
    public StepResult execute(Task task, Thought thought, CancellationToken token) {
        if (thought.isFinal()) {
            Observation answer = Observation.text(FINAL_ANSWER, thought.finalAnswer());
            Reflection reflection = evaluator.evaluate(task, null, FINAL_ANSWER, answer);
            return new StepResult(thought, null, FINAL_ANSWER, answer, reflection.succeeded(), reflection);
        }
        if (!thought.hasAction()) {
            // nothing to do and nothing to judge
            Observation stall = Observation.text("(none)", "No action was proposed.");
            return new StepResult(thought, null, null, stall, false, null);
        }

        ToolCall call = thought.action();
        String action = call.describe();
        Observation observation = invoke(task, call, token);
        Reflection reflection = evaluator.evaluate(task, call.tool(), action, observation);

        boolean terminal = (reflection.succeeded() && thought.completesTask()) || observation.hasToolError();
        return new StepResult(thought, call.tool(), action, observation, terminal, reflection);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Observation invoke(Task task, ToolCall call, CancellationToken token) {
        if (!registry.isUsable(call.tool())) {
            String why = registry.find(call.tool()).isPresent()
                    ? "Tool '%s' is below the minimum confidence".formatted(call.tool())
                    : "Tool '%s' is not in the capability registry".formatted(call.tool());
            log.info("{}: capability gap: {}", task, why);
            return Observation.error(call.tool(), new ToolError(ToolInvocationException.Kind.NOT_FOUND, why));
        }
        token.throwIfCancelled();
        try {
            return gateway.invoke(call.tool(), call.args(), toolConfig.getDefaultTimeout(), toolContext(task));
        } catch (ToolInvocationException e) {
            log.info("{}: {} failed: {}", task, call.tool(), e.getMessage());
            return Observation.error(call.tool(), e.toToolError());
        }
    }

    private ToolContext toolContext(Task task) {
        Path workspace = Paths.get(toolConfig.getWorkspace()).resolve(task.getMissionId().toString());
        return new ToolContext(workspace, task.getMissionId(), task.getId());
    }
}
