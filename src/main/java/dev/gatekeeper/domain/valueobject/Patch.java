package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.domain.enums.ChangeKind;

/**
 * Immutable representation of one file in a PR diff.
 * {@code text} is null or blank for binary files and for renames without content changes.
 */
public record Patch(String path, String text, ChangeKind changeKind) {
    public Patch {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path required");
        if (changeKind == null) changeKind = ChangeKind.MODIFIED;
    }

    public boolean hasTextualDiff() {
        return text != null && !text.isBlank();
    }
}
