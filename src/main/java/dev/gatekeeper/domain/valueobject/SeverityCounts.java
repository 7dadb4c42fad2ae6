package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.domain.enums.Severity;

import java.util.Collection;

public record SeverityCounts(int error, int warning, int info) {

    public static SeverityCounts zero() {
        return new SeverityCounts(0, 0, 0);
    }

    public static SeverityCounts of(Collection<Finding> findings) {
        int error = 0, warning = 0, info = 0;
        for (Finding f : findings) {
            switch (f.severity()) {
                case ERROR -> error++;
                case WARNING -> warning++;
                case INFO -> info++;
            }
        }
        return new SeverityCounts(error, warning, info);
    }

    public int count(Severity severity) {
        return switch (severity) {
            case ERROR -> error;
            case WARNING -> warning;
            case INFO -> info;
        };
    }

    public int total() {
        return error + warning + info;
    }
}
