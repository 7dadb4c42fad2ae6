package dev.gatekeeper.analyzer.lint;

import dev.gatekeeper.domain.enums.Severity;
import dev.gatekeeper.domain.valueobject.ChangedLine;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class LintAnalyzerTest {

    private final LintAnalyzer analyzer = new LintAnalyzer();
    private final ReviewConfig config = new ReviewConfig(20, 10);

    @Nested
    @DisplayName("line length")
    class LineLength {

        @Test
        void flagsLinesOverTheLimit() {
            List<Finding> findings = analyzer.analyze("src/App.java", lines("x".repeat(21)), config);

            assertThat(findings).singleElement().satisfies(f -> {
                assertThat(f.ruleId()).isEqualTo(LintAnalyzer.LINE_TOO_LONG);
                assertThat(f.severity()).isEqualTo(Severity.WARNING);
                assertThat(f.line()).isEqualTo(1);
                assertThat(f.message()).isEqualTo("Line length is 21 characters (limit: 20).");
            });
        }

        @Test
        void lineAtTheLimitIsFine() {
            assertThat(analyzer.analyze("src/App.java", lines("x".repeat(20)), config)).isEmpty();
        }

        @Test
        @DisplayName("applies to files that are not source code")
        void appliesToAnyFile() {
            assertThat(analyzer.analyze("docs/README.md", lines("word ".repeat(10).strip()), config))
                    .extracting(Finding::ruleId)
                    .containsExactly(LintAnalyzer.LINE_TOO_LONG);
        }
    }

    @Nested
    @DisplayName("rule table")
    class Rules {

        @Test
        void trailingWhitespaceAndTodo() {
            List<Finding> findings = analyzer.analyze("notes.txt", lines("x = 1  ", "# TODO: fix"), config);

            assertThat(findings).extracting(Finding::ruleId, Finding::line, Finding::severity)
                    .containsExactly(
                            tuple("TRAILING_WHITESPACE", 1, Severity.INFO),
                            tuple("TODO_COMMENT", 2, Severity.INFO));
        }

        @Test
        void debugPrintIsLanguageSpecific() {
            assertThat(ruleIds("app/main.py", "print('hi')")).containsExactly("DEBUG_PRINT");
            assertThat(ruleIds("web/app.ts", "console.log(x)")).containsExactly("DEBUG_PRINT");
            assertThat(ruleIds("src/A.java", "System.out.println(x);")).containsExactly("DEBUG_PRINT");
            assertThat(ruleIds("src/A.java", "e.printStackTrace();")).containsExactly("DEBUG_PRINT");
            assertThat(ruleIds("web/app.js", "print(x)")).isEmpty();
            assertThat(ruleIds("app/main.py", "console.log(x)")).isEmpty();
        }

        @Test
        void broadExceptionHandlers() {
            assertThat(ruleIds("app/main.py", "except:")).containsExactly("BROAD_EXCEPTION_CATCH");
            assertThat(ruleIds("app/main.py", "except Exception as e:")).containsExactly("BROAD_EXCEPTION_CATCH");
            assertThat(ruleIds("app/main.py", "except ValueError:")).isEmpty();
            assertThat(ruleIds("src/A.java", "} catch (Exception e) {")).containsExactly("BROAD_EXCEPTION_CATCH");
            assertThat(ruleIds("src/A.java", "} catch (IOException e) {")).isEmpty();
        }

        @Test
        void tabIndentationInPython() {
            assertThat(ruleIds("app/main.py", "\tx = 1")).containsExactly("TAB_INDENT");
            assertThat(ruleIds("Makefile", "\tgo build")).isEmpty();
        }
    }

    @Test
    @DisplayName("findings are ordered by line and reference only changed lines")
    void orderedByLine() {
        ChangedLineSet lines = ChangedLineSet.of(List.of(
                new ChangedLine(7, "print('debug') # TODO"),
                new ChangedLine(3, "x".repeat(30))));

        List<Finding> findings = analyzer.analyze("app/main.py", lines, config);

        assertThat(findings).extracting(Finding::line).containsExactly(3, 7, 7, 7);
        assertThat(findings).extracting(Finding::ruleId)
                .containsExactly("LINE_TOO_LONG", "LINE_TOO_LONG", "TODO_COMMENT", "DEBUG_PRINT");
        assertThat(findings).allMatch(f -> lines.contains(f.line()));
    }

    @Test
    void cleanLinesProduceNothing() {
        assertThat(analyzer.analyze("app/main.py", lines("import os", "x = compute()"), config)).isEmpty();
    }

    private List<String> ruleIds(String path, String content) {
        return analyzer.analyze(path, lines(content), new ReviewConfig(200, 10)).stream()
                .map(Finding::ruleId)
                .toList();
    }

    static ChangedLineSet lines(String... contents) {
        List<ChangedLine> lines = new ArrayList<>();
        for (int i = 0; i < contents.length; i++) {
            lines.add(new ChangedLine(i + 1, contents[i]));
        }
        return ChangedLineSet.of(lines);
    }
}
