package dev.gatekeeper.review;

import dev.gatekeeper.domain.enums.Severity;
import dev.gatekeeper.domain.valueobject.FileSummary;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewScope;
import dev.gatekeeper.domain.valueobject.SeverityCounts;

import java.util.List;

/**
 * Renders the markdown body of a review.
 */
class ReviewSummaryRenderer {

    static final String TITLE = "## Gatekeeper Review";
    static final String NO_ISSUES = "No issues found on changed lines.";
    static final int MAX_DETAIL_ROWS = 40;

    private static final List<Severity> SEVERITIES_DESCENDING =
            List.of(Severity.ERROR, Severity.WARNING, Severity.INFO);

    String render(SeverityCounts counts, List<FileSummary> files, List<Finding> ordered,
                  int inlineCount, int maxInlineComments, ReviewScope scope) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append("\n\n");

        if (scope != null) {
            sb.append("### Scope\n");
            sb.append("- Files analyzed: %d\n".formatted(scope.filesAnalyzed()));
            sb.append("- Changed lines analyzed: %d\n".formatted(scope.changedLinesAnalyzed()));
            if (scope.filesSkipped() > 0) {
                sb.append("- Files skipped (unparseable diff): %d\n".formatted(scope.filesSkipped()));
            }
            sb.append("- Findings: %d\n\n".formatted(counts.total()));
        }

        sb.append("### Severity Breakdown\n");
        sb.append("| Severity | Count |\n");
        sb.append("| --- | ---: |\n");
        for (Severity severity : SEVERITIES_DESCENDING) {
            sb.append("| %s | %d |\n".formatted(severity, counts.count(severity)));
        }

        if (counts.total() == 0) {
            sb.append("\n### Result\n").append(NO_ISSUES);
            return sb.toString();
        }

        sb.append("\n### Findings by File\n");
        sb.append("| File | Error | Warning | Info |\n");
        sb.append("| --- | ---: | ---: | ---: |\n");
        for (FileSummary file : files) {
            SeverityCounts c = file.counts();
            sb.append("| `%s` | %d | %d | %d |\n".formatted(escapeCell(file.path()), c.error(), c.warning(), c.info()));
        }

        sb.append("\n### Findings (Changed Lines Only)\n");
        sb.append("| File | Line | Severity | Rule | Message |\n");
        sb.append("| --- | ---: | --- | --- | --- |\n");
        ordered.stream().limit(MAX_DETAIL_ROWS).forEach(f -> sb.append("| `%s` | %d | %s | `%s` | %s |\n"
                .formatted(escapeCell(f.path()), f.line(), f.severity(), escapeCell(f.ruleId()),
                        escapeCell(f.message()))));
        if (ordered.size() > MAX_DETAIL_ROWS) {
            sb.append("\n_Table truncated to first %d findings; %d additional finding(s) included in counts only._\n"
                    .formatted(MAX_DETAIL_ROWS, ordered.size() - MAX_DETAIL_ROWS));
        }

        if (inlineCount < ordered.size()) {
            sb.append("\n_Inline comments limited to %d of %d findings (max-inline-comments=%d)._\n"
                    .formatted(inlineCount, ordered.size(), maxInlineComments));
        }
        return sb.toString().stripTrailing();
    }

    static String escapeCell(String value) {
        if (value == null) return "";
        return value.replace("|", "\\|").replace("\n", " ");
    }
}
