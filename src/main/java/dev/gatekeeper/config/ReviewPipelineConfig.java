package dev.gatekeeper.config;

import dev.gatekeeper.analyzer.AnalyzerRunner;
import dev.gatekeeper.analyzer.complexity.ComplexityAnalyzer;
import dev.gatekeeper.analyzer.lint.LintAnalyzer;
import dev.gatekeeper.analyzer.security.SecurityPatternAnalyzer;
import dev.gatekeeper.domain.valueobject.ReviewConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the analyzer set and the validated review limits.
 *
 * <p>Analyzers are registered here in a fixed order rather than discovered by component
 * scanning: registration order is part of the finding order of every review.
 */
@Configuration
public class ReviewPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipelineConfig.class);

    @Bean
    public AnalyzerRunner analyzerRunner(MeterRegistry meterRegistry) {
        return new AnalyzerRunner(List.of(
                new LintAnalyzer(),
                new SecurityPatternAnalyzer(),
                new ComplexityAnalyzer()), meterRegistry);
    }

    /**
     * Fails startup when the review limits are missing or invalid.
     */
    @Bean
    public ReviewConfig reviewConfig(ReviewProperties properties) {
        ReviewConfig config = properties.toReviewConfig();
        log.info("Review limits: max-line-length={}, max-inline-comments={}",
                config.maxLineLength(), config.maxInlineComments());
        return config;
    }
}
