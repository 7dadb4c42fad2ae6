package dev.gatekeeper.service;

import dev.gatekeeper.domain.event.ReviewRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Accepts review requests from the web layer and hands them off as events.
 */
@Service
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);
    private final ApplicationEventPublisher eventPublisher;

    public ReviewService(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public UUID requestReview(String deliveryId, String repoFullName, int prNumber,
                              String headSha, long installationId) {
        UUID reviewId = UUID.randomUUID();
        eventPublisher.publishEvent(new ReviewRequestedEvent(
                reviewId, deliveryId, repoFullName, prNumber, headSha, installationId, Instant.now()));
        log.info("Queued review {} for {}/pull/{} (delivery={})", reviewId, repoFullName, prNumber, deliveryId);
        return reviewId;
    }
}
