package com.missionpilot.orchestrator.tool.impl;

import com.missionpilot.orchestrator.research.Finding;
import com.missionpilot.orchestrator.research.ResearchCollaborator;
import com.missionpilot.orchestrator.research.ResearchException;
import com.missionpilot.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * web_search(query): returns search findings from the research collaborator.
 */
@Component
public class WebSearchTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "web_search", "1.0.0",
            "web_search(query: str) -> list[{title, url, snippet}]",
            "Search the web and return the top findings for a query.",
            true);

    private final ResearchCollaborator research;

    public WebSearchTool(ResearchCollaborator research) {
        this.research = research;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Observation invoke(Map<String, Object> args, ToolContext ctx) {
        String query = WorkspacePaths.requiredString(args, "query");
        try {
            List<Finding> findings = research.research(query);
            if (findings.isEmpty()) {
                return Observation.text(MANIFEST.name(), "(no results)");
            }
            return Observation.text(MANIFEST.name(),
                    findings.stream().map(Finding::toText).collect(Collectors.joining("\n")));
        } catch (ResearchException e) {
            throw new ToolInvocationException(ToolInvocationException.Kind.RUNTIME_ERROR, e.getMessage(), e);
        }
    }

    @Override
    public boolean selfCheck() {
        return true;
    }
}
