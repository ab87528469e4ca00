package com.missionpilot.orchestrator.reasoning;

/**
 * Model self-critique of one action's outcome.
 *
 * @param score      in [0, 1]
 * @param succeeded  whether the observation shows the action achieved its intent
 * @param reflection one or two sentences: what happened and what to do differently
 */
public record Critique(double score, boolean succeeded, String reflection) {}
