package com.missionpilot.orchestrator.knowledge;

import java.time.Instant;

/**
 * One version of a persona document. Version 0 means the document does not exist yet.
 */
public record KnowledgeBaseDocument(String name, long version, String content, Instant updatedAt) {

    public static KnowledgeBaseDocument empty(String name) {
        return new KnowledgeBaseDocument(name, 0, "", null);
    }

    public boolean exists() {
        return version > 0;
    }

    /** Stand-in used when the context budget has no room for the content. */
    public String reference() {
        return "persona:" + name + "@v" + version;
    }
}
