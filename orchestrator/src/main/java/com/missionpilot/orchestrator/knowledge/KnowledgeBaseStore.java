package com.missionpilot.orchestrator.knowledge;

import java.util.List;

/**
 * Versioned persona documents with optimistic concurrency.
 *
 * Writes are all-or-nothing and never overwrite: a successful write creates
 * version {@code expectedVersion + 1} and keeps every earlier version.
 */
public interface KnowledgeBaseStore {

    /** Latest version, or {@link KnowledgeBaseDocument#empty} if the document was never written. */
    KnowledgeBaseDocument read(String name);

    /**
     * Commit new content if the latest version is still {@code expectedVersion}.
     * Of two writers racing with the same expected version exactly one commits.
     */
    WriteOutcome write(String name, String newContent, long expectedVersion);

    /** Every version of the document, oldest first. */
    List<KnowledgeBaseDocument> history(String name);
}
