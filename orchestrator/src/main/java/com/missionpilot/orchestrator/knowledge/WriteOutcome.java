package com.missionpilot.orchestrator.knowledge;

/**
 * Result of a versioned write.
 *
 * @param document       the new version when committed, otherwise the current latest version
 */
public record WriteOutcome(boolean committed, KnowledgeBaseDocument document) {

    public static WriteOutcome ok(KnowledgeBaseDocument written) {
        return new WriteOutcome(true, written);
    }

    public static WriteOutcome versionConflict(KnowledgeBaseDocument current) {
        return new WriteOutcome(false, current);
    }
}
