package dev.gatekeeper.analyzer.complexity;

import dev.gatekeeper.analyzer.Analyzer;
import dev.gatekeeper.analyzer.LineRule;
import dev.gatekeeper.domain.enums.AnalyzerType;
import dev.gatekeeper.domain.enums.SourceLanguage;
import dev.gatekeeper.domain.valueobject.ChangedLine;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

import static dev.gatekeeper.domain.enums.Severity.INFO;
import static dev.gatekeeper.domain.enums.Severity.WARNING;
import static dev.gatekeeper.domain.enums.SourceLanguage.CSHARP;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVA;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVASCRIPT;
import static dev.gatekeeper.domain.enums.SourceLanguage.PHP;
import static dev.gatekeeper.domain.enums.SourceLanguage.PYTHON;
import static dev.gatekeeper.domain.enums.SourceLanguage.TYPESCRIPT;

/**
 * Lightweight complexity heuristics over added lines. Not a control-flow analysis:
 * false positives and negatives are expected.
 *
 * <p>Nesting is estimated per window of consecutive changed lines. Each line opening a
 * branch, loop or exception block is pushed with its indentation; a later line at the
 * same or lower indentation closes it. The line where the open-block depth first exceeds
 * {@link #MAX_NESTING} is flagged. Gaps in line numbering reset the estimate.
 */
public class ComplexityAnalyzer implements Analyzer {

    public static final String EXCESSIVE_NESTING = "EXCESSIVE_NESTING";
    static final int MAX_NESTING = 4;
    public static final String DEEP_INDENTATION = "DEEP_INDENTATION";
    static final int DEEP_INDENT_COLUMNS = 16;
    private static final int TAB_WIDTH = 4;

    private static final Pattern NESTING_KEYWORD = Pattern.compile(
            "^(?:}\\s*)?(?:if|elif|else|for|foreach|while|do|switch|case|try|catch|except|finally|with)\\b");

    static final List<LineRule> RULES = List.of(
            LineRule.of("COMPLEX_BOOLEAN_EXPRESSION", "(?:(?:&&|\\|\\|).*){3}", WARNING,
                    "Changed line has a dense boolean expression; consider extracting named sub-expressions."),
            LineRule.of("COMPLEX_BOOLEAN_EXPRESSION", "(?:\\b(?:and|or)\\b.*){3}", WARNING,
                    "Changed line has a dense boolean expression; consider extracting named sub-expressions.",
                    PYTHON),
            LineRule.of("NESTED_TERNARY", "\\?.*:.*\\?.*:", WARNING,
                    "Nested ternary detected on changed line; consider clearer control flow.",
                    JAVASCRIPT, TYPESCRIPT, JAVA, CSHARP, PHP));

    private static final Pattern CONTROL_FLOW = Pattern.compile("^(?:if|for|while|try|with|switch)\\b");

    @Override
    public AnalyzerType getType() {
        return AnalyzerType.COMPLEXITY;
    }

    @Override
    public boolean supports(String filePath) {
        return SourceLanguage.detect(filePath).isRecognizedSource();
    }

    @Override
    public List<Finding> analyze(String filePath, ChangedLineSet lines, ReviewConfig config) {
        List<Finding> findings = new ArrayList<>(nestingFindings(filePath, lines));
        findings.addAll(LineRule.evaluate(RULES, filePath, lines, name()));
        findings.addAll(deepIndentationFindings(filePath, lines));
        findings.sort(Comparator.comparingInt(Finding::line));
        return findings;
    }

    private List<Finding> nestingFindings(String filePath, ChangedLineSet lines) {
        List<Finding> findings = new ArrayList<>();
        Deque<Integer> openBlocks = new ArrayDeque<>();
        int previousNumber = -1;
        int previousDepth = 0;

        for (ChangedLine line : lines.lines()) {
            if (line.number() != previousNumber + 1) {
                openBlocks.clear();
                previousDepth = 0;
            }
            previousNumber = line.number();

            String text = line.content();
            String stripped = text.strip();
            if (stripped.isEmpty()) continue;

            int indent = indentation(text);
            while (!openBlocks.isEmpty() && openBlocks.peek() >= indent) {
                openBlocks.pop();
            }
            if (NESTING_KEYWORD.matcher(stripped).find()) {
                openBlocks.push(indent);
            }

            int depth = openBlocks.size();
            if (depth > MAX_NESTING && previousDepth <= MAX_NESTING) {
                findings.add(Finding.at(filePath, line, WARNING, EXCESSIVE_NESTING,
                        "Changed code nests control flow %d levels deep (threshold %d); consider extracting a method."
                                .formatted(depth, MAX_NESTING), name()));
            }
            previousDepth = depth;
        }
        return findings;
    }

    // Measured in columns, so two-space and mixed indentation are caught too.
    private List<Finding> deepIndentationFindings(String filePath, ChangedLineSet lines) {
        List<Finding> findings = new ArrayList<>();
        for (ChangedLine line : lines.lines()) {
            String text = line.content();
            if (indentation(text) >= DEEP_INDENT_COLUMNS && CONTROL_FLOW.matcher(text.strip()).find()) {
                findings.add(Finding.at(filePath, line, INFO, DEEP_INDENTATION,
                        "Changed control-flow line appears deeply nested; consider refactoring.", name()));
            }
        }
        return findings;
    }

    static int indentation(String text) {
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') width++;
            else if (c == '\t') width += TAB_WIDTH;
            else break;
        }
        return width;
    }
}
