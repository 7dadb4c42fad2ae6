package dev.gatekeeper.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.gatekeeper.domain.enums.ChangeKind;
import dev.gatekeeper.domain.valueobject.Patch;

/**
 * One entry of {@code GET /repos/{repo}/pulls/{number}/files}.
 * {@code patch} is absent for binary files and for diffs GitHub considers too large.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record GitHubPullRequestFile(String filename, String status, String patch) {
    Patch toPatch() {
        return new Patch(filename, patch, ChangeKind.fromGitHubStatus(status));
    }
}
