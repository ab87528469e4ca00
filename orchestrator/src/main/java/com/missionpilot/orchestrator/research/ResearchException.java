package com.missionpilot.orchestrator.research;

/**
 * Thrown when the search backend returns an error or is unreachable.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
