package dev.gatekeeper.analyzer;

import dev.gatekeeper.domain.enums.AnalyzerType;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;

import java.util.List;

/**
 * Strategy contract for line-level checks over the added lines of one file.
 * Implementations are stateless: they may run in any order and in parallel.
 */
public interface Analyzer {
    AnalyzerType getType();

    /**
     * Whether this analyzer applies to {@code filePath}. Unsupported files are skipped silently.
     */
    default boolean supports(String filePath) {
        return true;
    }

    /**
     * Every returned finding references a line present in {@code lines}.
     */
    List<Finding> analyze(String filePath, ChangedLineSet lines, ReviewConfig config);

    default String name() {
        return getType().analyzerName();
    }
}
