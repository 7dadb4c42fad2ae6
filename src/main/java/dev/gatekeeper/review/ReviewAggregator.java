package dev.gatekeeper.review;

import dev.gatekeeper.domain.valueobject.FileSummary;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.InlineComment;
import dev.gatekeeper.domain.valueobject.Review;
import dev.gatekeeper.domain.valueobject.ReviewScope;
import dev.gatekeeper.domain.valueobject.SeverityCounts;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the findings of a whole pull request into one {@link Review}.
 *
 * <p>Inline comments are the first {@code maxInlineComments} findings ordered by severity
 * (error first), then path, then line. The sort is stable, so findings that tie keep the
 * order they arrived in, which is analyzer-registration order. Findings beyond the cap
 * still count in the severity totals and the per-file table.
 */
@Component
public class ReviewAggregator {

    static final Comparator<Finding> INLINE_ORDER = Comparator
            .comparingInt((Finding f) -> f.severity().rank()).reversed()
            .thenComparing(Finding::path)
            .thenComparingInt(Finding::line);

    private final ReviewSummaryRenderer renderer = new ReviewSummaryRenderer();

    public Review build(List<Finding> findings, int maxInlineComments) {
        return build(null, findings, null, maxInlineComments);
    }

    /**
     * @param scope may be null when the caller does not track what was analyzed
     */
    public Review build(String pullRequestId, List<Finding> findings, ReviewScope scope, int maxInlineComments) {
        if (maxInlineComments < 0) {
            throw new IllegalArgumentException("maxInlineComments must be >= 0, was " + maxInlineComments);
        }

        List<Finding> ordered = findings.stream().sorted(INLINE_ORDER).toList();
        SeverityCounts counts = SeverityCounts.of(findings);
        List<FileSummary> files = summarizeByFile(findings);
        List<InlineComment> inlineComments = ordered.stream()
                .limit(maxInlineComments)
                .map(InlineComment::from)
                .toList();

        String summary = renderer.render(counts, files, ordered, inlineComments.size(), maxInlineComments, scope);
        return new Review(pullRequestId, summary, counts, files, inlineComments, scope);
    }

    private static List<FileSummary> summarizeByFile(List<Finding> findings) {
        Map<String, List<Finding>> byPath = new TreeMap<>();
        for (Finding f : findings) {
            byPath.computeIfAbsent(f.path(), p -> new ArrayList<>()).add(f);
        }
        return byPath.entrySet().stream()
                .map(e -> new FileSummary(e.getKey(), SeverityCounts.of(e.getValue())))
                .toList();
    }
}
