package dev.gatekeeper.domain.enums;

/**
 * Built-in analyzers, in registration order.
 */
public enum AnalyzerType {
    LINT("lint"),
    SECURITY_PATTERN("security-pattern"),
    COMPLEXITY("complexity");

    private final String analyzerName;
    AnalyzerType(String analyzerName) { this.analyzerName = analyzerName; }

    public String analyzerName() {
        return analyzerName;
    }
}
