package dev.gatekeeper.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an actionable pull request webhook is accepted.
 * Consumed asynchronously by the review task listener.
 */
public record ReviewRequestedEvent(
        UUID reviewId,
        String deliveryId,
        String repositoryFullName,
        int pullRequestNumber,
        String headSha,
        long installationId,
        Instant occurredAt
) {
    public ReviewRequestedEvent {
        if (reviewId == null) throw new IllegalArgumentException("reviewId required");
        if (occurredAt == null) occurredAt = Instant.now();
    }

    public String pullRequestId() {
        return repositoryFullName + "#" + pullRequestNumber;
    }
}
