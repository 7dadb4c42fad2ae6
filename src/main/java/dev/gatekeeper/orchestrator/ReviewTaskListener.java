package dev.gatekeeper.orchestrator;

import dev.gatekeeper.domain.event.ReviewRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Consumes review requests off the request thread.
 *
 * <pre>
 * Webhook → ReviewService → ApplicationEvent → THIS (reviewExecutor) → Orchestrator
 * </pre>
 *
 * Exceptions propagate to the async uncaught-exception handler after the orchestrator logs them.
 */
@Component
public class ReviewTaskListener {

    private static final Logger log = LoggerFactory.getLogger(ReviewTaskListener.class);

    private final ReviewOrchestrator orchestrator;

    public ReviewTaskListener(ReviewOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Async("reviewExecutor")
    @EventListener
    public void onReviewRequested(ReviewRequestedEvent event) {
        log.info("Processing review task {} for {}", event.reviewId(), event.pullRequestId());
        orchestrator.executeReview(event);
    }
}
