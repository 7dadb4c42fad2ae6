package dev.gatekeeper.analyzer.lint;

import dev.gatekeeper.analyzer.Analyzer;
import dev.gatekeeper.analyzer.LineRule;
import dev.gatekeeper.domain.enums.AnalyzerType;
import dev.gatekeeper.domain.valueobject.ChangedLine;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static dev.gatekeeper.domain.enums.Severity.INFO;
import static dev.gatekeeper.domain.enums.Severity.WARNING;
import static dev.gatekeeper.domain.enums.SourceLanguage.CSHARP;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVA;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVASCRIPT;
import static dev.gatekeeper.domain.enums.SourceLanguage.KOTLIN;
import static dev.gatekeeper.domain.enums.SourceLanguage.PYTHON;
import static dev.gatekeeper.domain.enums.SourceLanguage.TYPESCRIPT;

/**
 * Style and hygiene checks on added lines. Applies to every file; some rules are language-specific.
 * Line length is driven by {@link ReviewConfig#maxLineLength()}; everything else is the rule table.
 */
public class LintAnalyzer implements Analyzer {

    public static final String LINE_TOO_LONG = "LINE_TOO_LONG";

    static final List<LineRule> RULES = List.of(
            LineRule.of("TRAILING_WHITESPACE", "[ \\t]+$", INFO,
                    "Line has trailing whitespace."),
            LineRule.of("TODO_COMMENT", "(?i)\\b(?:TODO|FIXME|XXX)\\b", INFO,
                    "TODO/FIXME marker found in changed line."),
            LineRule.of("DEBUG_PRINT", "^\\s*print\\s*\\(", WARNING,
                    "Debug print statement found in changed line.", PYTHON),
            LineRule.of("DEBUG_PRINT", "\\bconsole\\.(?:log|debug)\\s*\\(", WARNING,
                    "Debug console.log statement found in changed line.", JAVASCRIPT, TYPESCRIPT),
            LineRule.of("DEBUG_PRINT", "\\bSystem\\.(?:out|err)\\.print(?:ln|f)?\\s*\\(|\\.printStackTrace\\s*\\(\\s*\\)",
                    WARNING, "Console output left in code; use a logger.", JAVA, KOTLIN),
            LineRule.of("BROAD_EXCEPTION_CATCH",
                    "^\\s*except(?:\\s+\\(?\\s*(?:Base)?Exception\\s*\\)?(?:\\s+as\\s+\\w+)?)?\\s*:", WARNING,
                    "Bare or broad exception handler; catch the specific exceptions you expect.", PYTHON),
            LineRule.of("BROAD_EXCEPTION_CATCH",
                    "\\bcatch\\s*\\(\\s*(?:final\\s+)?(?:java\\.lang\\.|System\\.)?(?:Exception|Throwable)\\b"
                            + "|\\bcatch\\s*\\(\\s*\\w+\\s*:\\s*(?:Exception|Throwable)\\b", WARNING,
                    "Broad exception catch; catch the specific exceptions you expect.", JAVA, KOTLIN, CSHARP),
            LineRule.of("TAB_INDENT", "^[ ]*\\t", WARNING,
                    "Tab character used for indentation in Python code.", PYTHON));

    @Override
    public AnalyzerType getType() {
        return AnalyzerType.LINT;
    }

    @Override
    public List<Finding> analyze(String filePath, ChangedLineSet lines, ReviewConfig config) {
        List<Finding> findings = new ArrayList<>();
        int limit = config.maxLineLength();
        for (ChangedLine line : lines.lines()) {
            int length = line.content().length();
            if (length > limit) {
                findings.add(Finding.at(filePath, line, WARNING, LINE_TOO_LONG,
                        "Line length is %d characters (limit: %d).".formatted(length, limit), name()));
            }
        }
        findings.addAll(LineRule.evaluate(RULES, filePath, lines, name()));
        findings.sort(Comparator.comparingInt(Finding::line));
        return findings;
    }
}
