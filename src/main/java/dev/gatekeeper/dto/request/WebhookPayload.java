package dev.gatekeeper.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        Repository repository,
        Installation installation
) {
    private static final Set<String> REVIEW_ACTIONS = Set.of("opened", "reopened", "synchronize", "ready_for_review");

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(int number, boolean draft, Head head) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(long id) {}

    public boolean isTrackedAction() {
        return action != null && REVIEW_ACTIONS.contains(action);
    }

    public boolean isDraft() {
        return pullRequest != null && pullRequest.draft();
    }

    /** Everything needed to fetch the files and post a review is present. */
    public boolean hasReviewMetadata() {
        return pullRequest != null && pullRequest.number() > 0
                && pullRequest.head() != null && notBlank(pullRequest.head().sha())
                && repository != null && notBlank(repository.fullName()) && repository.fullName().contains("/")
                && installation != null && installation.id() > 0;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
