package dev.gatekeeper.analyzer.security;

import dev.gatekeeper.analyzer.Analyzer;
import dev.gatekeeper.analyzer.LineRule;
import dev.gatekeeper.domain.enums.AnalyzerType;
import dev.gatekeeper.domain.enums.SourceLanguage;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;

import java.util.List;

import static dev.gatekeeper.domain.enums.Severity.ERROR;
import static dev.gatekeeper.domain.enums.Severity.WARNING;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVA;
import static dev.gatekeeper.domain.enums.SourceLanguage.JAVASCRIPT;
import static dev.gatekeeper.domain.enums.SourceLanguage.KOTLIN;
import static dev.gatekeeper.domain.enums.SourceLanguage.PHP;
import static dev.gatekeeper.domain.enums.SourceLanguage.PYTHON;
import static dev.gatekeeper.domain.enums.SourceLanguage.RUBY;
import static dev.gatekeeper.domain.enums.SourceLanguage.TYPESCRIPT;

/**
 * Dangerous-call scanning: dynamic code execution, shell injection, unsafe deserialization,
 * hard-coded secrets. Only recognized source files are scanned.
 */
public class SecurityPatternAnalyzer implements Analyzer {

    /** String concatenation next to a quoted literal, or template interpolation. */
    private static final String CONCATENATED = "(?:[\"'`]\\s*\\+|\\+\\s*[\"'`]|\\$\\{)";

    static final List<LineRule> RULES = List.of(
            LineRule.of("EVAL_USAGE", "(?<![\\w.])eval\\s*\\(", ERROR,
                    "Avoid `eval()` on changed lines; it executes arbitrary code.",
                    PYTHON, JAVASCRIPT, TYPESCRIPT, PHP, RUBY),
            LineRule.of("EXEC_USAGE", "(?<![\\w.])exec\\s*\\(", ERROR,
                    "Avoid `exec()` on changed lines.", PYTHON),
            LineRule.of("SUBPROCESS_SHELL_TRUE", "\\bsubprocess\\.\\w+\\(.*shell\\s*=\\s*True", ERROR,
                    "subprocess with shell=True on changed line may enable command injection.", PYTHON),
            LineRule.of("OS_SYSTEM_CONCAT",
                    "\\bos\\.(?:system|popen)\\s*\\(.*(?:\\+|\\bf[\"']|\\.format\\s*\\(|%\\s*[\\w(])", ERROR,
                    "Shell command built from dynamic strings; use subprocess with an argument list.", PYTHON),
            LineRule.of("RUNTIME_EXEC_CONCAT",
                    "(?:\\.exec|\\bProcessBuilder)\\s*\\(.*" + CONCATENATED, ERROR,
                    "Process command built by string concatenation may enable command injection.", JAVA, KOTLIN),
            LineRule.of("CHILD_PROCESS_EXEC", "\\b(?:exec|execSync)\\s*\\(.*" + CONCATENATED, WARNING,
                    "child_process exec with an interpolated command; prefer execFile with arguments.",
                    JAVASCRIPT, TYPESCRIPT),
            LineRule.of("UNSAFE_DESERIALIZATION", "\\bpickle\\.loads?\\s*\\(", WARNING,
                    "pickle.loads/load can execute arbitrary code on untrusted input.", PYTHON),
            LineRule.of("UNSAFE_DESERIALIZATION", "\\byaml\\.load\\s*\\(", WARNING,
                    "Use yaml.safe_load instead of yaml.load.", PYTHON).unless("SafeLoader"),
            LineRule.of("UNSAFE_DESERIALIZATION", "\\bnew\\s+ObjectInputStream\\s*\\(", WARNING,
                    "Java deserialization of untrusted data can execute arbitrary code.", JAVA, KOTLIN),
            LineRule.of("UNSAFE_DESERIALIZATION", "\\bMarshal\\.load\\b", WARNING,
                    "Marshal.load on untrusted data can instantiate arbitrary objects.", RUBY),
            LineRule.of("UNSAFE_DESERIALIZATION", "(?<![\\w>])unserialize\\s*\\(", WARNING,
                    "unserialize() on untrusted data enables object injection.", PHP),
            LineRule.of("HARDCODED_SECRET",
                    "(?i)\\b\\w*(?:password|passwd|secret|api[_-]?key|access[_-]?key|auth[_-]?token|token)\\w*"
                            + "\\s*[:=]\\s*[\"'][^\"'\\s]{8,}[\"']", ERROR,
                    "Possible hard-coded secret; load it from configuration or a secret store.")
                    .unless("(?i)[\"'](?:\\$\\{[^}]*}|<[^>]*>|changeme|placeholder|x{8,}|\\*+)[\"']"),
            LineRule.of("HARDCODED_SECRET", "\\bAKIA[0-9A-Z]{16}\\b", ERROR,
                    "AWS access key id committed in code."),
            LineRule.of("HARDCODED_SECRET", "-----BEGIN (?:RSA |EC |DSA |OPENSSH )?PRIVATE KEY-----", ERROR,
                    "Private key material committed in code."));

    @Override
    public AnalyzerType getType() {
        return AnalyzerType.SECURITY_PATTERN;
    }

    @Override
    public boolean supports(String filePath) {
        return SourceLanguage.detect(filePath).isRecognizedSource();
    }

    @Override
    public List<Finding> analyze(String filePath, ChangedLineSet lines, ReviewConfig config) {
        return LineRule.evaluate(RULES, filePath, lines, name());
    }
}
