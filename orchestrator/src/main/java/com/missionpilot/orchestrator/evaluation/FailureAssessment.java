package com.missionpilot.orchestrator.evaluation;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classification of one failed observation.
 *
 * A failure is <em>ambiguous</em> when its root cause cannot be pinned down:
 * no recognisable category, several categories at once, or errors reported
 * against several files.
 *
 * @param categories every category whose signature matched
 * @param subject    the thing the error names, e.g. a missing module; may be null
 * @param files      distinct source files the error output points at
 * @param evidence   the line that matched first, or a short excerpt
 */
public record FailureAssessment(Set<ErrorCategory> categories, String subject,
                                List<String> files, String evidence) {

    public FailureAssessment {
        categories = Set.copyOf(categories);
        files      = List.copyOf(files);
    }

    public static FailureAssessment of(ErrorCategory category, String subject, String evidence) {
        return new FailureAssessment(Set.of(category), subject, List.of(), evidence);
    }

    /** A failure with no recognisable cause, e.g. the step budget ran out. */
    public static FailureAssessment unclassified(String evidence) {
        return new FailureAssessment(Set.of(), null, List.of(), evidence);
    }

    public boolean ambiguous() {
        return categories.size() != 1 || files.size() > 1;
    }

    /** The single category, if the failure is not ambiguous. */
    public Optional<ErrorCategory> category() {
        return ambiguous() ? Optional.empty() : Optional.of(categories.iterator().next());
    }

    public boolean isTransient() {
        return category().map(ErrorCategory::isTransient).orElse(false);
    }

    public boolean isCapabilityGap() {
        return category().filter(c -> c == ErrorCategory.CAPABILITY_GAP).isPresent();
    }

    public boolean isUnauthorized() {
        return category().filter(c -> c == ErrorCategory.UNAUTHORIZED).isPresent();
    }

    public String summary() {
        String kind = ambiguous()
                ? "AMBIGUOUS" + (categories.isEmpty() ? "" : categories.toString())
                : categories.iterator().next().name();
        StringBuilder sb = new StringBuilder(kind);
        if (subject != null)    sb.append(" subject=").append(subject);
        if (files.size() > 1)   sb.append(" files=").append(files);
        if (evidence != null)   sb.append(": ").append(evidence);
        return sb.toString();
    }
}
