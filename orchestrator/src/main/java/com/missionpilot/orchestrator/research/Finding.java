package com.missionpilot.orchestrator.research;

/**
 * One search result returned by the research collaborator.
 */
public record Finding(String title, String url, String snippet) {

    public String toText() {
        return "- " + title + " (" + url + ")\n  " + (snippet == null ? "" : snippet.strip());
    }
}
