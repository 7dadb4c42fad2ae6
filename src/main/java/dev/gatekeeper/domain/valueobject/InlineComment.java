package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.domain.enums.Severity;

/**
 * A review comment anchored to a line of the new file version.
 */
public record InlineComment(String path, int line, String message, Severity severity,
                            String ruleId, String snippet) {

    /** GitHub rejects comment bodies above 65536 characters. */
    static final int MAX_BODY_LENGTH = 64_000;

    public static InlineComment from(Finding finding) {
        return new InlineComment(finding.path(), finding.line(), finding.message(),
                finding.severity(), finding.ruleId(), finding.snippet());
    }

    public String body() {
        String body = "[%s] %s\n\n`%s`".formatted(severity, message, snippet);
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) : body;
    }
}
