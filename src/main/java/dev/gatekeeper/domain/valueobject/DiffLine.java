package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.domain.enums.LineKind;

/**
 * One physical line of a hunk. {@code newLineNumber} is null for removed lines.
 */
public record DiffLine(LineKind kind, String content, Integer newLineNumber) {
    public DiffLine {
        if (kind == null) throw new IllegalArgumentException("kind required");
        if (content == null) content = "";
        if (kind == LineKind.REMOVED && newLineNumber != null)
            throw new IllegalArgumentException("removed lines have no new-file line number");
        if (kind != LineKind.REMOVED && newLineNumber == null)
            throw new IllegalArgumentException(kind + " line requires a new-file line number");
    }

    public boolean isAdded() {
        return kind == LineKind.ADDED;
    }
}
