package dev.gatekeeper.domain.enums;

/**
 * How a file changed in a pull request.
 */
public enum ChangeKind {
    ADDED, MODIFIED, REMOVED, RENAMED;

    /**
     * Maps a GitHub {@code status} value from the PR files API.
     * {@code copied}, {@code changed} and {@code unchanged} are treated as modifications.
     */
    public static ChangeKind fromGitHubStatus(String status) {
        if (status == null) return MODIFIED;
        return switch (status.toLowerCase()) {
            case "added" -> ADDED;
            case "removed" -> REMOVED;
            case "renamed" -> RENAMED;
            default -> MODIFIED;
        };
    }
}
