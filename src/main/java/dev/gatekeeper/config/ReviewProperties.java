package dev.gatekeeper.config;

import dev.gatekeeper.domain.valueobject.ReviewConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Review limits and worker sizing. {@code maxLineLength} and {@code maxInlineComments} have
 * no defaults: a missing value fails startup through {@link #toReviewConfig()}.
 */
@ConfigurationProperties(prefix = "gatekeeper.review")
public record ReviewProperties(Integer maxLineLength, Integer maxInlineComments,
                               int analyzerThreads, int reviewThreads) {
    public ReviewProperties {
        if (analyzerThreads <= 0) analyzerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        if (reviewThreads <= 0) reviewThreads = 4;
    }

    public ReviewConfig toReviewConfig() {
        return ReviewConfig.of(maxLineLength, maxInlineComments);
    }
}
