package com.missionpilot.orchestrator.knowledge;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link PersonaDiff} with optimistic concurrency:
 * read version v, apply the diff, write expecting v; on conflict reload and
 * re-apply against the newer content. Bounded by
 * {@code missionpilot.knowledge.max-write-retries}.
 */
@Component
public class PersonaEditor {

    private static final Logger log = LoggerFactory.getLogger(PersonaEditor.class);

    private final KnowledgeBaseStore store;
    private final int                maxRetries;

    public PersonaEditor(KnowledgeBaseStore store, OrchestratorProperties properties) {
        this.store      = store;
        this.maxRetries = properties.getKnowledge().getMaxWriteRetries();
    }

    /**
     * @return the committed version
     * @throws KnowledgeBaseConflictException if every attempt lost the race
     */
    public KnowledgeBaseDocument apply(String persona, PersonaDiff diff) {
        int attempts = 0;
        KnowledgeBaseDocument base = store.read(persona);
        while (attempts <= maxRetries) {
            attempts++;
            WriteOutcome outcome = store.write(persona, diff.applyTo(base.content()), base.version());
            if (outcome.committed()) {
                return outcome.document();
            }
            log.info("Persona '{}' moved to v{} while editing section '{}'; recomputing (attempt {})",
                    persona, outcome.document().version(), diff.section(), attempts);
            base = outcome.document();
        }
        throw new KnowledgeBaseConflictException(persona, attempts);
    }
}
