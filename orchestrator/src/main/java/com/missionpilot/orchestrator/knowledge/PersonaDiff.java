package com.missionpilot.orchestrator.knowledge;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A section-level edit of a persona document: the body under
 * {@code ## <section>} is replaced, or the section is appended if absent.
 *
 * Applying the same diff to newer content recomputes the edit against that
 * content, so concurrent edits of different sections never clobber each other.
 *
 * Body lines that start with {@code #} are escaped as {@code \#}, so a
 * synthesized body can never open a section of its own.
 */
public record PersonaDiff(String section, String body) {

    private static final Pattern HEADING_LINE = Pattern.compile("(?m)^([ \\t]*)#");

    public String applyTo(String content) {
        String heading = "## " + section.replaceAll("\\s+", " ").strip();
        String block   = heading + "\n" + escapeHeadings(body.strip()) + "\n";
        String base    = content == null ? "" : content;

        Pattern existing = Pattern.compile("(?m)^" + Pattern.quote(heading) + "\\s*$");
        Matcher m = existing.matcher(base);
        if (!m.find()) {
            if (base.isBlank()) return block;
            return base.stripTrailing() + "\n\n" + block;
        }
        int start = m.start();
        Matcher next = Pattern.compile("(?m)^## ").matcher(base);
        int end = next.find(m.end()) ? next.start() : base.length();
        String tail = base.substring(end);
        return base.substring(0, start) + block + (tail.isEmpty() ? "" : "\n" + tail);
    }

    static String escapeHeadings(String text) {
        return HEADING_LINE.matcher(text).replaceAll("$1\\\\#");
    }
}
