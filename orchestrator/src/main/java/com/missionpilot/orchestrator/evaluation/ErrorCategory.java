package com.missionpilot.orchestrator.evaluation;

/**
 * Recognisable failure causes.
 *
 * The first four are transient: a known tool broke for an environmental reason
 * and a corrective task can plausibly fix it. {@link #CAPABILITY_GAP} means the
 * needed tool does not exist (or is not trusted), {@link #UNAUTHORIZED} means
 * policy refused the action.
 */
public enum ErrorCategory {
    MISSING_DEPENDENCY,
    PERMISSION_ERROR,
    SYNTAX_ERROR,
    TIMEOUT,
    CAPABILITY_GAP,
    UNAUTHORIZED;

    public boolean isTransient() {
        return this == MISSING_DEPENDENCY || this == PERMISSION_ERROR
            || this == SYNTAX_ERROR || this == TIMEOUT;
    }
}
