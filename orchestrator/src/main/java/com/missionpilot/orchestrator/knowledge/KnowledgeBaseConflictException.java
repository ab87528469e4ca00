package com.missionpilot.orchestrator.knowledge;

/**
 * A document kept changing underneath every write attempt.
 */
public class KnowledgeBaseConflictException extends RuntimeException {

    private final String document;
    private final int    attempts;

    public KnowledgeBaseConflictException(String document, int attempts) {
        super("Gave up updating '%s' after %d conflicting writes".formatted(document, attempts));
        this.document = document;
        this.attempts = attempts;
    }

    public String getDocument() { return document; }
    public int    getAttempts() { return attempts; }
}
