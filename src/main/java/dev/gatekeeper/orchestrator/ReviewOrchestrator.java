package dev.gatekeeper.orchestrator;

import dev.gatekeeper.domain.event.ReviewRequestedEvent;
import dev.gatekeeper.domain.valueobject.Patch;
import dev.gatekeeper.domain.valueobject.Review;
import dev.gatekeeper.domain.valueobject.ReviewConfig;
import dev.gatekeeper.domain.valueobject.ReviewInput;
import dev.gatekeeper.infrastructure.github.GitHubApiClient;
import dev.gatekeeper.review.ReviewPipeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drives one pull request review end to end.
 *
 * <pre>
 *  1. Fetch the changed files from GitHub
 *  2. Run the review pipeline over them
 *  3. Post the summary and inline comments as a single COMMENT review
 * </pre>
 *
 * <p>A review with no findings is still posted, so authors see that the change was checked.
 */
@Component
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    private final GitHubApiClient gitHubClient;
    private final ReviewPipeline pipeline;
    private final ReviewConfig reviewConfig;
    private final Timer reviewTimer;
    private final Counter failureCounter;

    public ReviewOrchestrator(GitHubApiClient gitHubClient,
                              ReviewPipeline pipeline,
                              ReviewConfig reviewConfig,
                              MeterRegistry meterRegistry) {
        this.gitHubClient = gitHubClient;
        this.pipeline = pipeline;
        this.reviewConfig = reviewConfig;
        this.reviewTimer = Timer.builder("gatekeeper.review.duration")
                .description("End-to-end review time including GitHub calls")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("gatekeeper.review.failures")
                .description("Reviews that could not be completed")
                .register(meterRegistry);
    }

    public Review executeReview(ReviewRequestedEvent request) {
        MDC.put("reviewId", request.reviewId().toString());
        MDC.put("pullRequest", request.pullRequestId());
        Timer.Sample sample = Timer.start();
        try {
            List<Patch> patches = gitHubClient.getPullRequestFiles(
                    request.repositoryFullName(), request.pullRequestNumber(), request.installationId());
            log.info("Fetched {} files for review {}", patches.size(), request.reviewId());

            Review review = pipeline.review(new ReviewInput(request.pullRequestId(), patches), reviewConfig);

            gitHubClient.createReview(request.repositoryFullName(), request.pullRequestNumber(),
                    request.installationId(), request.headSha(), review);
            log.info("Review {} completed: {} findings ({} error, {} warning, {} info)",
                    request.reviewId(), review.totalFindings(),
                    review.severityCounts().error(), review.severityCounts().warning(),
                    review.severityCounts().info());
            return review;
        } catch (RuntimeException e) {
            failureCounter.increment();
            log.error("Review {} failed: {}", request.reviewId(), e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(reviewTimer);
            MDC.remove("reviewId");
            MDC.remove("pullRequest");
        }
    }
}
