package com.missionpilot.orchestrator.context;

import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.goal.GoalStateManager;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseStore;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.repository.GoalStateRepository;
import com.missionpilot.orchestrator.repository.ReflexionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Curator over real goal, memory and registry components; only the
 * repositories and the knowledge base are mocked.
 */
@ExtendWith(MockitoExtension.class)
class ContextCuratorTest {

    @Mock GoalStateRepository       goalRepo;
    @Mock ReflexionRecordRepository recordRepo;
    @Mock KnowledgeBaseStore        knowledge;

    CapabilityRegistry registry;
    EpisodicMemory     memory;
    ContextCurator     curator;
    Mission            mission;
    Task               task;
    List<ReflexionRecord> reflections;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        GoalStateManager goals = new GoalStateManager(goalRepo);
        memory   = new EpisodicMemory(recordRepo);
        registry = new CapabilityRegistry(props);
        registry.register(new CapabilityManifestEntry("run_command", "Run shell command", "run_command(command)", 0.7, null));
        registry.register(new CapabilityManifestEntry("read_file", "Read text file", "read_file(path)", 0.7, null));
        curator  = new ContextCurator(goals, memory, registry, knowledge, props);

        mission = new Mission("Build the parser");
        task    = new Task(mission.getId(), 1, "compile parser module", Set.of(), Set.of(), TaskOrigin.PLANNED);
        goals.initialize(mission, List.of(task));
        reflections = List.of(
                memory.append(task, RecordCategory.EVALUATION, "run_command {command=make}", "exit 2", 0.0, "first: missing header"),
                memory.append(task, RecordCategory.EVALUATION, "run_command {command=make}", "exit 2", 0.0, "second: wrong include path"),
                memory.append(task, RecordCategory.EVALUATION, "run_command {command=make}", "exit 0", 1.0, "third: compiled"));
    }

    @Test
    void withinBudget_everythingIsIncludedInFull() {
        givenOperatorPersona();

        CognitiveContext ctx = curator.buildContext(task, Integer.MAX_VALUE);

        assertThat(ctx.goal()).contains("Build the parser");
        assertThat(ctx.reflections()).containsExactlyElementsOf(reflections);
        assertThat(ctx.capabilities()).as("no description matches, so all tools")
                .extracting(CapabilityManifestEntry::toolName)
                .containsExactly("read_file", "run_command");
        assertThat(ctx.personas()).singleElement().satisfies(p -> assertThat(p.referenceOnly()).isFalse());
        assertThat(ctx.render()).contains("always run the linter");
    }

    @Test
    void overBudget_personasBecomeReferencesFirst() {
        givenOperatorPersona();
        int full = curator.buildContext(task, Integer.MAX_VALUE).size();

        CognitiveContext ctx = curator.buildContext(task, full - 1);

        assertThat(ctx.personas()).singleElement().satisfies(p -> assertThat(p.referenceOnly()).isTrue());
        assertThat(ctx.render()).contains("persona:operator@v3").doesNotContain("always run the linter");
        assertThat(ctx.reflections()).hasSize(3);
        assertThat(ctx.size()).isLessThanOrEqualTo(full - 1);
    }

    @Test
    void stillOverBudget_dropsTheOldestReflectionNext() {
        givenOperatorPersona();
        CognitiveContext full = curator.buildContext(task, Integer.MAX_VALUE);
        int referencesOnly = new CognitiveContext(full.goal(), full.reflections(), full.capabilities(),
                full.personas().stream().map(PersonaSnippet::asReference).toList()).size();

        CognitiveContext ctx = curator.buildContext(task, referencesOnly - 1);

        assertThat(ctx.reflections()).containsExactly(reflections.get(1), reflections.get(2));
        assertThat(ctx.capabilities()).hasSize(2);
    }

    @Test
    void fileContentsBecomePathReferencesBeforeAnyReflectionIsDropped() {
        givenOperatorPersona();
        String source = "public class App {}\n".repeat(150);
        ReflexionRecord read = memory.append(task, RecordCategory.EVALUATION, "read_file {path=src/App.java}",
                source, 0.9, "The file declares App.\n" + source);
        ReflexionRecord write = memory.append(task, RecordCategory.EVALUATION,
                "write_file {path=src/Main.java, content=" + source + "}", "ok", 1.0, "Wrote Main.");
        CognitiveContext full = curator.buildContext(task, Integer.MAX_VALUE);
        int referencesOnly = new CognitiveContext(full.goal(), full.reflections(), full.capabilities(),
                full.personas().stream().map(PersonaSnippet::asReference).toList()).size();

        CognitiveContext ctx = curator.buildContext(task, referencesOnly - 1);

        assertThat(ctx.filePathsOnly()).isTrue();
        assertThat(ctx.reflections()).contains(reflections.get(0), read, write);
        assertThat(ctx.render())
                .contains("read_file file:src/App.java => The file declares App.")
                .contains("write_file file:src/Main.java => Wrote Main.")
                .contains("run_command {command=make} => first: missing header")
                .doesNotContain("public class App {}");
        assertThat(ctx.size()).isLessThan(referencesOnly / 4);
    }

    @Test
    void tinyBudget_keepsOnlyTheGoal() {
        givenOperatorPersona();

        CognitiveContext ctx = curator.buildContext(task, 1);

        assertThat(ctx.goal()).contains("compile parser module");
        assertThat(ctx.reflections()).isEmpty();
        assertThat(ctx.capabilities()).isEmpty();
        assertThat(ctx.personas()).allSatisfy(p -> assertThat(p.referenceOnly()).isTrue());
    }

    @Test
    void missingPersonaDocument_isLeftOut() {
        when(knowledge.read("operator")).thenReturn(KnowledgeBaseDocument.empty("operator"));

        CognitiveContext ctx = curator.buildContext(task, Integer.MAX_VALUE);

        assertThat(ctx.personas()).isEmpty();
    }

    @Test
    void relevantCapabilities_areSelectedByTaskDescription() {
        givenOperatorPersona();
        Task reader = new Task(mission.getId(), 2, "read config file", Set.of(), Set.of(), TaskOrigin.PLANNED);

        CognitiveContext ctx = curator.buildContext(reader, Integer.MAX_VALUE);

        assertThat(ctx.capabilities()).extracting(CapabilityManifestEntry::toolName).containsExactly("read_file");
    }

    private void givenOperatorPersona() {
        String content = "# Operator\n" + "- always run the linter before committing\n".repeat(40);
        when(knowledge.read("operator")).thenReturn(new KnowledgeBaseDocument("operator", 3, content, Instant.now()));
    }
}
