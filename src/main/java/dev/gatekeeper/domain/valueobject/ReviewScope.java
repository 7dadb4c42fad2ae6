package dev.gatekeeper.domain.valueobject;

/**
 * What a review run looked at. {@code filesSkipped} counts patches that failed to parse.
 */
public record ReviewScope(int filesAnalyzed, int changedLinesAnalyzed, int filesSkipped) {}
