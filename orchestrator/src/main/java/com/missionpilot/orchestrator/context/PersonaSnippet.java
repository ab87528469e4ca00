package com.missionpilot.orchestrator.context;

import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;

/**
 * A persona document as included in a context: full content, or only a
 * {@code persona:<name>@v<version>} reference when the budget is tight.
 */
public record PersonaSnippet(KnowledgeBaseDocument document, boolean referenceOnly) {

    public PersonaSnippet asReference() {
        return new PersonaSnippet(document, true);
    }

    public String render() {
        return referenceOnly
                ? document.reference()
                : "### " + document.reference() + "\n" + document.content().strip();
    }
}
