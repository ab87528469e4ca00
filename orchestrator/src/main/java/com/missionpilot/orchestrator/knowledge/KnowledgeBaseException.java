package com.missionpilot.orchestrator.knowledge;

/**
 * Storage-level failure of the knowledge base (I/O, corrupt version file).
 */
public class KnowledgeBaseException extends RuntimeException {

    public KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
