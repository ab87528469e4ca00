package com.missionpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the orchestration core, bound from {@code missionpilot.*}.
 *
 * Every bound is explicit: retry budgets, search budgets and context size
 * all have finite defaults so no self-correction loop can run unbounded.
 */
@Component
@ConfigurationProperties(prefix = "missionpilot")
public class OrchestratorProperties {

    /** Tier 1 circuit breaker: corrective re-attempts allowed per task. */
    private int maxRetries = 3;

    /** Concurrent task workers (one task's cognitive loop per worker). */
    private int workerCount = 4;

    private Scheduler scheduler = new Scheduler();
    private React react = new React();
    private Tot tot = new Tot();
    private Context context = new Context();
    private Capability capability = new Capability();
    private Tool tool = new Tool();
    private Knowledge knowledge = new Knowledge();

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public React getReact() { return react; }
    public void setReact(React react) { this.react = react; }
    public Tot getTot() { return tot; }
    public void setTot(Tot tot) { this.tot = tot; }
    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }
    public Capability getCapability() { return capability; }
    public void setCapability(Capability capability) { this.capability = capability; }
    public Tool getTool() { return tool; }
    public void setTool(Tool tool) { this.tool = tool; }
    public Knowledge getKnowledge() { return knowledge; }
    public void setKnowledge(Knowledge knowledge) { this.knowledge = knowledge; }

    public static class Scheduler {
        /** Delay between scheduling rounds, in milliseconds. */
        private long tickMs = 1000;

        public long getTickMs() { return tickMs; }
        public void setTickMs(long tickMs) { this.tickMs = tickMs; }
    }

    public static class React {
        /** ReAct steps per attempt before linear reasoning is declared insufficient. */
        private int maxSteps = 8;

        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    }

    public static class Tot {
        private int beamWidth = 3;
        private int maxDepth = 3;
        private double scoreThreshold = 5.0;

        public int getBeamWidth() { return beamWidth; }
        public void setBeamWidth(int beamWidth) { this.beamWidth = beamWidth; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public double getScoreThreshold() { return scoreThreshold; }
        public void setScoreThreshold(double scoreThreshold) { this.scoreThreshold = scoreThreshold; }
    }

    public static class Context {
        /** Serialized context size limit, in characters. */
        private int budgetChars = 12_000;
        /** Reflexion records included per context. */
        private int topK = 5;

        public int getBudgetChars() { return budgetChars; }
        public void setBudgetChars(int budgetChars) { this.budgetChars = budgetChars; }
        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
    }

    public static class Capability {
        /** Tools below this confidence are checked before every invocation. */
        private double verifyThreshold = 0.5;
        /** Tools below this confidence count as absent (capability gap). */
        private double minConfidence = 0.2;
        private double initialConfidence = 0.7;
        private double successDelta = 0.05;
        private double failureDelta = 0.1;

        public double getVerifyThreshold() { return verifyThreshold; }
        public void setVerifyThreshold(double verifyThreshold) { this.verifyThreshold = verifyThreshold; }
        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
        public double getInitialConfidence() { return initialConfidence; }
        public void setInitialConfidence(double initialConfidence) { this.initialConfidence = initialConfidence; }
        public double getSuccessDelta() { return successDelta; }
        public void setSuccessDelta(double successDelta) { this.successDelta = successDelta; }
        public double getFailureDelta() { return failureDelta; }
        public void setFailureDelta(double failureDelta) { this.failureDelta = failureDelta; }
    }

    public static class Tool {
        private Duration defaultTimeout = Duration.ofSeconds(60);
        /** Root directory the file and shell tools are confined to. */
        private String workspace = "./workspace";
        /** Shell commands refused with UNAUTHORIZED; a trailing '*' matches by prefix. */
        private List<String> deniedCommands = new ArrayList<>(List.of("sudo *", "rm -rf /", "shutdown*", "reboot*"));

        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public String getWorkspace() { return workspace; }
        public void setWorkspace(String workspace) { this.workspace = workspace; }
        public List<String> getDeniedCommands() { return deniedCommands; }
        public void setDeniedCommands(List<String> deniedCommands) { this.deniedCommands = deniedCommands; }
    }

    public static class Knowledge {
        private String directory = "./data/personas";
        /** Persona documents injected into every context. */
        private List<String> personas = new ArrayList<>(List.of("operator"));
        /** Persona that receives heuristics learned from capability gaps. */
        private String gapPersona = "operator";
        private int maxWriteRetries = 3;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public List<String> getPersonas() { return personas; }
        public void setPersonas(List<String> personas) { this.personas = personas; }
        public String getGapPersona() { return gapPersona; }
        public void setGapPersona(String gapPersona) { this.gapPersona = gapPersona; }
        public int getMaxWriteRetries() { return maxWriteRetries; }
        public void setMaxWriteRetries(int maxWriteRetries) { this.maxWriteRetries = maxWriteRetries; }
    }
}
