package dev.gatekeeper.domain.valueobject;

import java.util.List;

/**
 * A contiguous region of a unified diff, as declared by its {@code @@} header.
 */
public record Hunk(int oldStart, int oldCount, int newStart, int newCount, String heading,
                   List<DiffLine> lines) {
    public Hunk {
        heading = heading == null ? "" : heading;
        lines = List.copyOf(lines);
    }

    public List<ChangedLine> addedLines() {
        return lines.stream()
                .filter(DiffLine::isAdded)
                .map(l -> new ChangedLine(l.newLineNumber(), l.content()))
                .toList();
    }
}
