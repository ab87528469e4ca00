package com.missionpilot.orchestrator.claude;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured payloads from Claude's text replies:
 *   1. JSON, either in a ```json fenced block or as the outermost {...} / [...] span
 *   2. <result> tags, which the model may use instead of JSON for a final answer
 */
public final class ResponseParser {

    // ```json ... ``` or ``` ... ```
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * The JSON payload of a reply, if it has one.
     *
     * A fenced block wins; otherwise the span from the first '{' or '[' to the
     * matching last '}' or ']' is taken. Validity is left to the JSON parser.
     */
    public static Optional<String> extractJson(String response) {
        Matcher m = JSON_BLOCK.matcher(response);
        if (m.find()) {
            return Optional.of(m.group(1).strip());
        }
        int obj = response.indexOf('{');
        int arr = response.indexOf('[');
        int start;
        char close;
        if (obj >= 0 && (arr < 0 || obj < arr)) {
            start = obj;
            close = '}';
        } else if (arr >= 0) {
            start = arr;
            close = ']';
        } else {
            return Optional.empty();
        }
        int end = response.lastIndexOf(close);
        return end > start ? Optional.of(response.substring(start, end + 1)) : Optional.empty();
    }

    /** Content of the first <result>...</result> tag. */
    public static Optional<String> extractResult(String response) {
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
