package com.missionpilot.orchestrator.context;

import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.goal.GoalStateManager;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseStore;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a bounded {@link CognitiveContext} for one task.
 *
 * Selection: goal recitation, top-K relevant reflexion records, capabilities
 * relevant to the task description (all of them if nothing matches), and the
 * configured persona documents.
 *
 * When the rendered context exceeds the budget, content is shed in this order
 * until it fits:
 * <ol>
 *   <li>persona content is replaced by {@code persona:<name>@v<version>} references;</li>
 *   <li>file contents in reflexion records are replaced by {@code file:<path>} references;</li>
 *   <li>the oldest reflexion records are dropped;</li>
 *   <li>the least relevant capabilities are dropped.</li>
 * </ol>
 * The goal recitation is never dropped.
 */
@Component
public class ContextCurator {

    private static final Logger log = LoggerFactory.getLogger(ContextCurator.class);

    private final GoalStateManager   goals;
    private final EpisodicMemory     memory;
    private final CapabilityRegistry registry;
    private final KnowledgeBaseStore knowledge;
    private final OrchestratorProperties properties;

    public ContextCurator(GoalStateManager goals, EpisodicMemory memory, CapabilityRegistry registry,
                          KnowledgeBaseStore knowledge, OrchestratorProperties properties) {
        this.goals      = goals;
        this.memory     = memory;
        this.registry   = registry;
        this.knowledge  = knowledge;
        this.properties = properties;
    }

    public CognitiveContext buildContext(Task task) {
        return buildContext(task, properties.getContext().getBudgetChars());
    }

    public CognitiveContext buildContext(Task task, int budget) {
        String goal = goals.recitation(task.getMissionId());
        List<ReflexionRecord> reflections =
                new ArrayList<>(memory.relevant(task, properties.getContext().getTopK()));
        List<CapabilityManifestEntry> capabilities = new ArrayList<>(registry.lookup(task.getDescription()));
        if (capabilities.isEmpty()) {
            capabilities.addAll(registry.all());
        }
        List<PersonaSnippet> personas = new ArrayList<>();
        for (String name : properties.getKnowledge().getPersonas()) {
            KnowledgeBaseDocument doc = knowledge.read(name);
            if (doc.exists()) personas.add(new PersonaSnippet(doc, false));
        }

        CognitiveContext ctx = new CognitiveContext(goal, reflections, capabilities, personas);
        if (ctx.size() <= budget) {
            return ctx;
        }

        personas.replaceAll(PersonaSnippet::asReference);
        ctx = new CognitiveContext(goal, reflections, capabilities, personas);
        if (ctx.size() > budget) {
            ctx = ctx.withFilePathsOnly();
        }

        while (ctx.size() > budget && !reflections.isEmpty()) {
            reflections.remove(0);
            ctx = new CognitiveContext(goal, reflections, capabilities, personas, true);
        }
        while (ctx.size() > budget && !capabilities.isEmpty()) {
            capabilities.remove(capabilities.size() - 1);
            ctx = new CognitiveContext(goal, reflections, capabilities, personas, true);
        }
        if (ctx.size() > budget) {
            log.warn("Context for {} is {} chars, over the {} budget with only the goal left",
                    task, ctx.size(), budget);
        }
        return ctx;
    }
}
