package com.missionpilot.orchestrator.research;

import java.util.List;

/**
 * External search capability used by capability-gap research and the web_search tool.
 */
public interface ResearchCollaborator {

    /**
     * @return findings for the query, best first; empty when nothing relevant exists
     * @throws ResearchException when the search backend is unreachable or answers with an error
     */
    List<Finding> research(String query);
}
