package dev.gatekeeper.domain.valueobject;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Added lines of one file, ascending by line number with at most one entry per line.
 * This is the only input analyzers ever see.
 */
public final class ChangedLineSet {

    private static final ChangedLineSet EMPTY = new ChangedLineSet(List.of());

    private final List<ChangedLine> lines;

    private ChangedLineSet(List<ChangedLine> lines) {
        this.lines = lines;
    }

    public static ChangedLineSet empty() {
        return EMPTY;
    }

    /**
     * Sorts by line number; the first entry wins when a line number repeats.
     */
    public static ChangedLineSet of(Collection<ChangedLine> lines) {
        if (lines.isEmpty()) return EMPTY;
        Map<Integer, ChangedLine> byNumber = new TreeMap<>();
        for (ChangedLine line : lines) {
            byNumber.putIfAbsent(line.number(), line);
        }
        return new ChangedLineSet(List.copyOf(byNumber.values()));
    }

    public List<ChangedLine> lines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public Optional<ChangedLine> line(int number) {
        return lines.stream().filter(l -> l.number() == number).findFirst();
    }

    public boolean contains(int number) {
        return line(number).isPresent();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChangedLineSet other && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return "ChangedLineSet" + lines;
    }
}
