package dev.gatekeeper.domain.valueobject;

public record ChangedLine(int number, String content) {
    public ChangedLine {
        if (number <= 0) throw new IllegalArgumentException("line number must be positive: " + number);
        if (content == null) content = "";
    }
}
