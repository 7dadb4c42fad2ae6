package dev.gatekeeper.review;

import dev.gatekeeper.analyzer.AnalyzerRunner;
import dev.gatekeeper.diff.DiffParser;
import dev.gatekeeper.domain.enums.ChangeKind;
import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.Patch;
import dev.gatekeeper.domain.valueobject.Review;
import dev.gatekeeper.domain.valueobject.ReviewConfig;
import dev.gatekeeper.domain.valueobject.ReviewInput;
import dev.gatekeeper.domain.valueobject.ReviewScope;
import dev.gatekeeper.exception.InvalidReviewConfigException;
import dev.gatekeeper.exception.PatchParseException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Diff-to-findings-to-review pipeline for one pull request event.
 *
 * <pre>
 *  1. Validate the review limits (fails the whole run)
 *  2. Parse every patch into its changed lines (a bad patch skips only that file)
 *  3. Fan out one analysis unit per file on the analyzer executor
 *  4. Await all units, merge findings in input file order
 *  5. Aggregate into a single Review
 * </pre>
 *
 * <p>Holds no state between runs. A unit that fails or exceeds the per-file timeout
 * contributes no findings; the rest of the review is still produced.
 */
@Component
public class ReviewPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipeline.class);

    private final DiffParser diffParser;
    private final AnalyzerRunner analyzerRunner;
    private final ReviewAggregator aggregator;
    private final Executor analyzerExecutor;
    private final Duration fileTimeout;
    private final Timer pipelineTimer;
    private final Counter parseFailures;
    private final Counter analysisTimeouts;

    public ReviewPipeline(DiffParser diffParser,
                          AnalyzerRunner analyzerRunner,
                          ReviewAggregator aggregator,
                          @Qualifier("analyzerExecutorService") Executor analyzerExecutor,
                          MeterRegistry meterRegistry,
                          @Value("${gatekeeper.review.file-timeout-seconds:30}") long fileTimeoutSeconds) {
        this.diffParser = diffParser;
        this.analyzerRunner = analyzerRunner;
        this.aggregator = aggregator;
        this.analyzerExecutor = analyzerExecutor;
        this.fileTimeout = Duration.ofSeconds(fileTimeoutSeconds);
        this.pipelineTimer = Timer.builder("gatekeeper.pipeline.duration")
                .description("Parse, analyze and aggregate time per pull request")
                .register(meterRegistry);
        this.parseFailures = Counter.builder("gatekeeper.parse.failures")
                .description("Patches skipped because their diff could not be parsed")
                .register(meterRegistry);
        this.analysisTimeouts = Counter.builder("gatekeeper.analysis.incomplete")
                .description("Per-file analysis units that failed or timed out")
                .register(meterRegistry);
    }

    public Review review(ReviewInput input, ReviewConfig config) {
        if (config == null) {
            throw new InvalidReviewConfigException("review config is required");
        }
        return pipelineTimer.record(() -> execute(input, config));
    }

    private Review execute(ReviewInput input, ReviewConfig config) {
        List<ParsedFile> parsed = new ArrayList<>();
        int skipped = 0;

        for (Patch patch : input.patches()) {
            if (patch.changeKind() == ChangeKind.REMOVED || !patch.hasTextualDiff()) {
                log.debug("No added lines to analyze in {} ({})", patch.path(), patch.changeKind());
                continue;
            }
            ChangedLineSet lines;
            try {
                lines = diffParser.changedLines(patch.text());
            } catch (PatchParseException e) {
                skipped++;
                parseFailures.increment();
                log.warn("Skipping {} in {}: {}", patch.path(), input.pullRequestId(), e.getMessage());
                continue;
            }
            if (!lines.isEmpty()) {
                parsed.add(new ParsedFile(patch.path(), lines));
            }
        }

        log.info("Analyzing {} files ({} skipped) for {}", parsed.size(), skipped, input.pullRequestId());

        List<CompletableFuture<List<Finding>>> futures = parsed.stream()
                .map(file -> CompletableFuture.supplyAsync(
                                () -> analyzerRunner.run(file.path(), file.lines(), config), analyzerExecutor)
                        .orTimeout(fileTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> {
                            analysisTimeouts.increment();
                            log.warn("Analysis of {} did not complete, no findings recorded for it: {}",
                                    file.path(), ex.toString());
                            return List.<Finding>of();
                        }))
                .toList();

        List<Finding> findings = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(List::stream)
                .toList();

        int changedLines = parsed.stream().mapToInt(f -> f.lines().size()).sum();
        ReviewScope scope = new ReviewScope(parsed.size(), changedLines, skipped);
        Review review = aggregator.build(input.pullRequestId(), findings, scope, config.maxInlineComments());

        log.info("Review for {} built: {} findings ({} error, {} warning, {} info), {} inline comments",
                input.pullRequestId(), review.totalFindings(), review.severityCounts().error(),
                review.severityCounts().warning(), review.severityCounts().info(),
                review.inlineComments().size());
        return review;
    }

    private record ParsedFile(String path, ChangedLineSet lines) {}
}
