package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.domain.enums.Severity;

/**
 * One issue reported by an analyzer on a changed line.
 */
public record Finding(String path, int line, Severity severity, String ruleId,
                      String message, String analyzer, String snippet) {

    static final int MAX_SNIPPET_LENGTH = 160;

    public Finding {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path required");
        if (line <= 0) throw new IllegalArgumentException("line must be positive: " + line);
        if (severity == null) throw new IllegalArgumentException("severity required");
        if (snippet == null) snippet = "";
    }

    /**
     * Creates a finding for {@code changedLine}, deriving the snippet from its content.
     */
    public static Finding at(String path, ChangedLine changedLine, Severity severity, String ruleId,
                             String message, String analyzer) {
        return new Finding(path, changedLine.number(), severity, ruleId, message, analyzer,
                snippetOf(changedLine.content()));
    }

    static String snippetOf(String content) {
        String stripped = content == null ? "" : content.strip();
        if (stripped.isEmpty()) return "<empty line>";
        return stripped.length() > MAX_SNIPPET_LENGTH ? stripped.substring(0, MAX_SNIPPET_LENGTH) : stripped;
    }
}
