package dev.gatekeeper.domain.valueobject;

import java.util.List;

/**
 * The single review artifact produced per triggering event.
 * {@code totalFindings} always equals {@code severityCounts.total()}, even when inline comments are capped.
 */
public record Review(
        String pullRequestId,
        String summaryMarkdown,
        SeverityCounts severityCounts,
        List<FileSummary> files,
        List<InlineComment> inlineComments,
        ReviewScope scope
) {
    public Review {
        files = List.copyOf(files);
        inlineComments = List.copyOf(inlineComments);
    }

    public int totalFindings() {
        return severityCounts.total();
    }

    public boolean hasFindings() {
        return totalFindings() > 0;
    }
}
