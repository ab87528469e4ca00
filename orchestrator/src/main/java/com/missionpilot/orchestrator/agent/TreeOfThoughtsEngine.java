package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.reasoning.Thought;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Beam search over candidate strategies for a task.
 *
 * Per level, starting from an anchor node (the root at first):
 * <ol>
 *   <li><b>Expand</b>: the model proposes up to W children of the anchor.</li>
 *   <li><b>Evaluate</b>: each child is scored in [0, 10]; scoring calls for one
 *       level run concurrently on the ToT executor and are joined before pruning.</li>
 *   <li><b>Prune</b>: children scoring below S are dropped; the best W are kept,
 *       ties in proposal order.</li>
 *   <li><b>Execute lazily</b>: the best node's action runs. On failure the search
 *       backtracks to the next-best sibling. A success that does not complete the
 *       task becomes the next anchor; otherwise the best failed node does.</li>
 * </ol>
 * The search stops on completion, after D levels, when every candidate is pruned,
 * or when W × D candidates have been evaluated. Each node's action runs at most once.
 */
@Component
public class TreeOfThoughtsEngine {

    private static final Logger log = LoggerFactory.getLogger(TreeOfThoughtsEngine.class);

    private final ReasoningModel         model;
    private final CognitiveLoopExecutor  executor;
    private final ExecutorService        evaluationPool;
    private final OrchestratorProperties.Tot config;

    public TreeOfThoughtsEngine(ReasoningModel model,
                                CognitiveLoopExecutor executor,
                                @Qualifier("totExecutor") ExecutorService evaluationPool,
                                OrchestratorProperties properties) {
        this.model          = model;
        this.executor       = executor;
        this.evaluationPool = evaluationPool;
        this.config         = properties.getTot();
    }

    public SearchOutcome search(Task task, CognitiveContext context, String failureContext, CancellationToken token) {
        return search(task, context, failureContext,
                config.getBeamWidth(), config.getMaxDepth(), config.getScoreThreshold(), token);
    }

    /**
     * @param failureContext what went wrong so far; null when the task was routed here
     *                       before any attempt
     */
    public SearchOutcome search(Task task, CognitiveContext context, String failureContext,
                                int beamWidth, int maxDepth, double scoreThreshold, CancellationToken token) {
        int budget    = beamWidth * maxDepth;
        int evaluated = 0;
        int executed  = 0;
        int nextId    = 1;
        ThoughtNode anchor = ThoughtNode.root();
        StepResult last = null;
        String failure  = failureContext;

        log.info("ToT search for {}: W={} D={} S={}", task, beamWidth, maxDepth, scoreThreshold);

        for (int level = 1; level <= maxDepth && evaluated < budget; level++) {
            token.throwIfCancelled();
            int room = Math.min(beamWidth, budget - evaluated);
            List<Thought> proposals = model.propose(task, context, failure, anchor.thoughtPath(), room);
            if (proposals.size() > room) {
                proposals = proposals.subList(0, room);
            }
            if (proposals.isEmpty()) {
                log.info("ToT level {}: no candidates proposed", level);
                break;
            }

            double[] scores = scoreConcurrently(task, failure, proposals);
            evaluated += proposals.size();

            List<ThoughtNode> frontier = new ArrayList<>();
            for (int i = 0; i < proposals.size(); i++) {
                ThoughtNode node = anchor.child(nextId++, proposals.get(i), scores[i]);
                if (node.score() >= scoreThreshold) frontier.add(node);
            }
            // List.sort is stable: equal scores keep proposal order
            frontier.sort(Comparator.comparingDouble(ThoughtNode::score).reversed());
            if (frontier.size() > beamWidth) frontier = frontier.subList(0, beamWidth);
            log.info("ToT level {}: {} proposed, {} kept", level, proposals.size(), frontier.size());
            if (frontier.isEmpty()) break;

            ThoughtNode progress = null;
            for (ThoughtNode node : frontier) {
                if (!node.markExecuted()) continue;
                token.throwIfCancelled();
                StepResult result = executor.execute(task, node.thought(), token);
                node.recordOutcome(result);
                executed++;
                last = result;
                if (result.completed()) {
                    log.info("ToT solved {} at {} after {} evaluations, {} executions",
                            task, node, evaluated, executed);
                    return new SearchOutcome(true, node.path(), evaluated, executed, result);
                }
                if (!result.failed() && result.thought().hasAction()) {
                    progress = node;
                    break;
                }
                log.info("ToT {} failed; backtracking", node);
            }
            anchor = progress != null ? progress : frontier.get(0);
            if (last != null) {
                failure = describe(last);
            }
        }
        log.info("ToT exhausted for {}: {} evaluations, {} executions", task, evaluated, executed);
        return new SearchOutcome(false, List.of(), evaluated, executed, last);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private double[] scoreConcurrently(Task task, String failure, List<Thought> proposals) {
        List<Future<Double>> futures = new ArrayList<>(proposals.size());
        for (Thought t : proposals) {
            futures.add(evaluationPool.submit(() -> model.scoreThought(task, failure, t)));
        }
        double[] scores = new double[proposals.size()];
        for (int i = 0; i < futures.size(); i++) {
            try {
                scores[i] = futures.get(i).get();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("ToT evaluation interrupted");
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof ReasoningException)) {
                    throw new IllegalStateException("Thought scoring failed", e.getCause());
                }
                log.warn("Scoring candidate {} failed: {}", i, e.getCause().getMessage());
                scores[i] = 0.0;
            }
        }
        return scores;
    }

    private static String describe(StepResult step) {
        String cause = step.assessment() == null ? "" : step.assessment().summary() + "\n";
        return cause + "Last action: " + step.action() + "\n" + step.observation().toText();
    }
}
