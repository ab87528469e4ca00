package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;

import java.time.Instant;
import java.util.List;

/**
 * Response body for GET /personas/{name}: the latest version plus the
 * version numbers that exist.
 */
public record PersonaResponse(
        String     name,
        long       version,
        String     content,
        Instant    updatedAt,
        List<Long> versions
) {
    public static PersonaResponse from(KnowledgeBaseDocument latest, List<KnowledgeBaseDocument> history) {
        return new PersonaResponse(
                latest.name(),
                latest.version(),
                latest.content(),
                latest.updatedAt(),
                history.stream().map(KnowledgeBaseDocument::version).toList()
        );
    }
}
