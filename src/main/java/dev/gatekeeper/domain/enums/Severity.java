package dev.gatekeeper.domain.enums;

/**
 * Finding severity. Rank order: ERROR > WARNING > INFO.
 */
public enum Severity {
    INFO(0), WARNING(1), ERROR(2);

    private final int rank;
    Severity(int rank) { this.rank = rank; }

    public int rank() {
        return rank;
    }
}
