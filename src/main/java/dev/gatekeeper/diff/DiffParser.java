package dev.gatekeeper.diff;

import dev.gatekeeper.domain.enums.LineKind;
import dev.gatekeeper.domain.valueobject.ChangedLine;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.DiffLine;
import dev.gatekeeper.domain.valueobject.Hunk;
import dev.gatekeeper.exception.PatchParseException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the unified diff of a single file into hunks and extracts the added lines.
 *
 * <p>Everything before the first {@code @@} header ({@code diff --git}, {@code index},
 * {@code ---}/{@code +++}, {@code Binary files ... differ}) is file header and skipped.
 * A hunk stays open until its declared old and new line counts are consumed. A body
 * line after that is an error unless a new file header ({@code diff --git}, or a
 * {@code ---}/{@code +++} pair) has started. New-file line numbers start at the
 * declared new start and advance on context and added lines only.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class DiffParser {

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@(.*)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final String NO_NEWLINE_MARKER = "\\";

    public List<Hunk> parse(String patchText) {
        if (patchText == null || patchText.isBlank()) {
            return List.of();
        }

        List<Hunk> hunks = new ArrayList<>();
        HunkBuilder current = null;
        boolean inFileHeader = false;
        int lastNumbered = 0;
        String[] rawLines = LINE_BREAK.split(patchText);

        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            int physicalLine = i + 1;

            if (raw.startsWith("@@")) {
                if (current != null) {
                    hunks.add(current.build());
                    lastNumbered = Math.max(lastNumbered, current.lastNumbered);
                }
                current = openHunk(raw, physicalLine, lastNumbered);
                inFileHeader = false;
                continue;
            }

            if (current == null || inFileHeader || raw.startsWith(NO_NEWLINE_MARKER)) {
                continue;
            }
            if (current.isOpen()) {
                current.accept(raw, physicalLine);
            } else if (startsFileHeader(raw, i + 1 < rawLines.length ? rawLines[i + 1] : null)) {
                inFileHeader = true;
            } else if (isBodyLine(raw)) {
                throw new PatchParseException("Hunk body exceeds declared counts", physicalLine);
            }
        }

        if (current != null) {
            hunks.add(current.build());
        }
        return List.copyOf(hunks);
    }

    public ChangedLineSet changedLines(String patchText) {
        List<ChangedLine> added = new ArrayList<>();
        for (Hunk hunk : parse(patchText)) {
            added.addAll(hunk.addedLines());
        }
        return ChangedLineSet.of(added);
    }

    private static boolean startsFileHeader(String raw, String next) {
        return raw.startsWith("diff --git ")
                || (raw.startsWith("--- ") && next != null && next.startsWith("+++ "));
    }

    private static boolean isBodyLine(String raw) {
        return raw.startsWith("+") || raw.startsWith("-") || raw.startsWith(" ");
    }

    private static HunkBuilder openHunk(String header, int physicalLine, int lastNumbered) {
        Matcher m = HUNK_HEADER.matcher(header);
        if (!m.matches()) {
            throw new PatchParseException("Malformed hunk header: " + header, physicalLine);
        }
        int oldStart = parseCount(m.group(1), header, physicalLine);
        int oldCount = m.group(2) == null ? 1 : parseCount(m.group(2), header, physicalLine);
        int newStart = parseCount(m.group(3), header, physicalLine);
        int newCount = m.group(4) == null ? 1 : parseCount(m.group(4), header, physicalLine);

        if (newCount > 0 && newStart < 1) {
            throw new PatchParseException("Hunk numbers new lines from " + newStart, physicalLine);
        }
        // A pure deletion anchors at the last surviving line, which may already be numbered.
        int minimumStart = newCount == 0 ? lastNumbered : lastNumbered + 1;
        if (newStart < minimumStart) {
            throw new PatchParseException("Hunk starts at new line %d but line %d was already assigned"
                    .formatted(newStart, lastNumbered), physicalLine);
        }
        return new HunkBuilder(oldStart, oldCount, newStart, newCount, m.group(5).strip());
    }

    private static int parseCount(String digits, String header, int physicalLine) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new PatchParseException("Hunk header value out of range: " + header, physicalLine);
        }
    }

    private static final class HunkBuilder {
        private final int oldStart;
        private final int oldCount;
        private final int newStart;
        private final int newCount;
        private final String heading;
        private final List<DiffLine> lines = new ArrayList<>();

        private int oldRemaining;
        private int newRemaining;
        private int nextNumber;
        private int lastNumbered;

        HunkBuilder(int oldStart, int oldCount, int newStart, int newCount, String heading) {
            this.oldStart = oldStart;
            this.oldCount = oldCount;
            this.newStart = newStart;
            this.newCount = newCount;
            this.heading = heading;
            this.oldRemaining = oldCount;
            this.newRemaining = newCount;
            this.nextNumber = newStart;
        }

        boolean isOpen() {
            return oldRemaining > 0 || newRemaining > 0;
        }

        void accept(String raw, int physicalLine) {
            if (raw.startsWith("-")) {
                lines.add(new DiffLine(LineKind.REMOVED, raw.substring(1), null));
                oldRemaining = Math.max(0, oldRemaining - 1);
                return;
            }
            if (nextNumber <= 0) {
                throw new PatchParseException("Line numbered before the start of the file", physicalLine);
            }
            if (raw.startsWith("+")) {
                lines.add(new DiffLine(LineKind.ADDED, raw.substring(1), nextNumber));
            } else {
                // An empty physical line is a context line whose leading space was stripped.
                String content = raw.startsWith(" ") ? raw.substring(1) : raw;
                lines.add(new DiffLine(LineKind.CONTEXT, content, nextNumber));
                oldRemaining = Math.max(0, oldRemaining - 1);
            }
            newRemaining = Math.max(0, newRemaining - 1);
            lastNumbered = nextNumber;
            nextNumber++;
        }

        Hunk build() {
            return new Hunk(oldStart, oldCount, newStart, newCount, heading, lines);
        }
    }
}
