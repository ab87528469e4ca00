package com.missionpilot.orchestrator.context;

import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;
import com.missionpilot.orchestrator.model.ReflexionRecord;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Everything the reasoning model sees about a task besides the task itself.
 *
 * @param filePathsOnly when set, reflections about file tools show the file's
 *                      path instead of the content carried in the action and
 *                      the first line of the reflection only
 */
public record CognitiveContext(
        String                        goal,
        List<ReflexionRecord>         reflections,
        List<CapabilityManifestEntry> capabilities,
        List<PersonaSnippet>          personas,
        boolean                       filePathsOnly) {

    // read_file {path=src/App.java}   write_file {path=out.txt, content=...}
    private static final Pattern FILE_ACTION =
            Pattern.compile("^(read_file|write_file)\\s+\\{(?:.*?[ ,])?path=([^,}]+)", Pattern.DOTALL);

    private static final int FILE_REFLECTION_LIMIT = 160;

    public CognitiveContext {
        reflections  = List.copyOf(reflections);
        capabilities = List.copyOf(capabilities);
        personas     = List.copyOf(personas);
    }

    public CognitiveContext(String goal, List<ReflexionRecord> reflections,
                            List<CapabilityManifestEntry> capabilities, List<PersonaSnippet> personas) {
        this(goal, reflections, capabilities, personas, false);
    }

    public CognitiveContext withFilePathsOnly() {
        return new CognitiveContext(goal, reflections, capabilities, personas, true);
    }

    /** Serialized form sent to the model; its length is what the budget bounds. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("== GOAL ==\n").append(goal.strip()).append("\n\n");

        sb.append("== AVAILABLE TOOLS ==\n");
        if (capabilities.isEmpty()) sb.append("(none)\n");
        for (CapabilityManifestEntry e : capabilities) {
            sb.append("  ").append(e.describe()).append('\n');
        }

        if (!reflections.isEmpty()) {
            sb.append("\n== LESSONS FROM EARLIER ATTEMPTS ==\n");
            for (ReflexionRecord r : reflections) {
                sb.append("  [").append(r.getCategory()).append("] ").append(renderReflection(r)).append('\n');
            }
        }

        if (!personas.isEmpty()) {
            sb.append("\n== PERSONA ==\n");
            for (PersonaSnippet p : personas) {
                sb.append(p.render()).append('\n');
            }
        }
        return sb.toString();
    }

    private String renderReflection(ReflexionRecord r) {
        String action = r.getAction();
        Matcher file = filePathsOnly && action != null ? FILE_ACTION.matcher(action) : null;
        if (file == null || !file.find()) {
            return (action == null ? "" : action + " => ") + r.getReflectionText();
        }
        return file.group(1) + " file:" + file.group(2).strip() + " => " + firstLine(r.getReflectionText());
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        String line = text.strip().lines().findFirst().orElse("");
        return line.length() <= FILE_REFLECTION_LIMIT ? line : line.substring(0, FILE_REFLECTION_LIMIT) + "...";
    }

    public int size() {
        return render().length();
    }
}
