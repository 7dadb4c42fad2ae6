package dev.gatekeeper.domain.valueobject;

import java.util.List;

/**
 * Everything the review pipeline needs for one pull request event.
 * {@code pullRequestId} is opaque to the pipeline and only carried into the review.
 */
public record ReviewInput(String pullRequestId, List<Patch> patches) {
    public ReviewInput {
        patches = patches == null ? List.of() : List.copyOf(patches);
    }
}
