package dev.gatekeeper.domain.valueobject;

/**
 * Summary-table row: one file with at least one finding.
 */
public record FileSummary(String path, SeverityCounts counts) {}
