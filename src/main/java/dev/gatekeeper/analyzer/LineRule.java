package dev.gatekeeper.analyzer;

import dev.gatekeeper.domain.enums.Severity;
import dev.gatekeeper.domain.enums.SourceLanguage;
import dev.gatekeeper.domain.valueobject.ChangedLine;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of an analyzer's rule table: a line matching {@code pattern} (and not {@code unless})
 * in one of {@code languages} yields a finding. An empty language set means every language.
 */
public record LineRule(String id, Pattern pattern, Pattern unless, Severity severity, String message,
                       Set<SourceLanguage> languages) {

    public LineRule {
        languages = languages.isEmpty() ? Set.of() : Set.copyOf(languages);
    }

    public static LineRule of(String id, String regex, Severity severity, String message,
                              SourceLanguage... languages) {
        Set<SourceLanguage> langs = languages.length == 0
                ? Set.of()
                : EnumSet.copyOf(List.of(languages));
        return new LineRule(id, Pattern.compile(regex), null, severity, message, langs);
    }

    public LineRule unless(String regex) {
        return new LineRule(id, pattern, Pattern.compile(regex), severity, message, languages);
    }

    public boolean appliesTo(SourceLanguage language) {
        return languages.isEmpty() || languages.contains(language);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find() && (unless == null || !unless.matcher(text).find());
    }

    /**
     * Applies {@code rules} line by line, in table order within a line.
     */
    public static List<Finding> evaluate(List<LineRule> rules, String filePath, ChangedLineSet lines,
                                         String analyzer) {
        SourceLanguage language = SourceLanguage.detect(filePath);
        List<LineRule> applicable = rules.stream().filter(r -> r.appliesTo(language)).toList();
        if (applicable.isEmpty()) return List.of();

        List<Finding> findings = new ArrayList<>();
        for (ChangedLine line : lines.lines()) {
            for (LineRule rule : applicable) {
                if (rule.matches(line.content())) {
                    findings.add(Finding.at(filePath, line, rule.severity(), rule.id(), rule.message(), analyzer));
                }
            }
        }
        return findings;
    }
}
