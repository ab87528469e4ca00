package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.tool.Observation;
import com.missionpilot.orchestrator.tool.ToolError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signature-based classifier for failed observations.
 *
 * Gateway errors map directly (NOT_FOUND is a capability gap, UNAUTHORIZED is
 * a policy refusal, TIMEOUT is transient). Otherwise stdout and stderr are
 * scanned for the signatures below. The first capture group of a matching
 * pattern, when present, becomes the assessment's subject.
 */
@Component
public class FailureClassifier {

    private static final Map<ErrorCategory, List<Pattern>> SIGNATURES = new LinkedHashMap<>();

    static {
        SIGNATURES.put(ErrorCategory.MISSING_DEPENDENCY, List.of(
                Pattern.compile("No module named '?([\\w.\\-]+)'?"),
                Pattern.compile("Cannot find module '([^']+)'"),
                Pattern.compile("package ([\\w.]+) does not exist"),
                Pattern.compile("(?m)^(?:sh: (?:\\d+: )?)?([\\w.\\-]+): (?:command )?not found"),
                Pattern.compile("Could not resolve dependencies"),
                Pattern.compile("cannot find -l([\\w\\-]+)")));
        SIGNATURES.put(ErrorCategory.PERMISSION_ERROR, List.of(
                Pattern.compile("(?i)permission denied"),
                Pattern.compile("EACCES"),
                Pattern.compile("Operation not permitted"),
                Pattern.compile("AccessDeniedException")));
        SIGNATURES.put(ErrorCategory.SYNTAX_ERROR, List.of(
                Pattern.compile("SyntaxError"),
                Pattern.compile("(?i)syntax error"),
                Pattern.compile("error: '.' expected"),
                Pattern.compile("(?i)unexpected token"),
                Pattern.compile("ParseException")));
        SIGNATURES.put(ErrorCategory.TIMEOUT, List.of(
                Pattern.compile("(?i)timed out"),
                Pattern.compile("TimeoutException"),
                Pattern.compile("(?i)deadline exceeded")));
    }

    // path/to/File.ext:LINE  (compiler and linter style locations)
    private static final Pattern FILE_LOCATION = Pattern.compile(
            "([\\w./\\-]+\\.(?:java|py|js|ts|go|rs|c|cc|cpp|h|kt|rb|sh)):\\d+");

    private static final int EVIDENCE_LIMIT = 200;

    public FailureAssessment assess(Observation observation) {
        if (observation.hasToolError()) {
            FailureAssessment direct = fromToolError(observation.toolName(), observation.toolError());
            if (direct != null) {
                return direct;
            }
        }
        return scan(textOf(observation));
    }

    /** Classify raw error text, e.g. a model-reported failure. */
    public FailureAssessment scan(String text) {
        Set<ErrorCategory> categories = EnumSet.noneOf(ErrorCategory.class);
        String subject  = null;
        String evidence = null;
        for (Map.Entry<ErrorCategory, List<Pattern>> entry : SIGNATURES.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher m = pattern.matcher(text);
                if (m.find()) {
                    categories.add(entry.getKey());
                    if (evidence == null) {
                        evidence = lineAround(text, m.start());
                        subject  = m.groupCount() > 0 ? m.group(1) : null;
                    }
                    break;
                }
            }
        }
        if (evidence == null) {
            evidence = excerpt(text);
        }
        return new FailureAssessment(categories, subject, filesIn(text), evidence);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static FailureAssessment fromToolError(String toolName, ToolError error) {
        return switch (error.kind()) {
            case NOT_FOUND    -> FailureAssessment.of(ErrorCategory.CAPABILITY_GAP, toolName, error.message());
            case UNAUTHORIZED -> FailureAssessment.of(ErrorCategory.UNAUTHORIZED, null, error.message());
            case TIMEOUT      -> FailureAssessment.of(ErrorCategory.TIMEOUT, null, error.message());
            case RUNTIME_ERROR -> null;   // fall through to the text scan
        };
    }

    private static String textOf(Observation o) {
        StringBuilder sb = new StringBuilder();
        if (o.toolError() != null) sb.append(o.toolError().message()).append('\n');
        if (o.stderr() != null)    sb.append(o.stderr()).append('\n');
        if (o.stdout() != null)    sb.append(o.stdout());
        return sb.toString();
    }

    private static List<String> filesIn(String text) {
        Set<String> files = new LinkedHashSet<>();
        Matcher m = FILE_LOCATION.matcher(text);
        while (m.find()) {
            files.add(m.group(1));
        }
        return new ArrayList<>(files);
    }

    private static String lineAround(String text, int index) {
        int start = text.lastIndexOf('\n', index - 1) + 1;
        int end   = text.indexOf('\n', index);
        return excerpt(text.substring(start, end < 0 ? text.length() : end));
    }

    private static String excerpt(String text) {
        String s = text.strip();
        return s.length() <= EVIDENCE_LIMIT ? s : s.substring(0, EVIDENCE_LIMIT) + "...";
    }
}
