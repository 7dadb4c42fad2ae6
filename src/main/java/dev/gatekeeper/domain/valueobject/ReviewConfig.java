package dev.gatekeeper.domain.valueobject;

import dev.gatekeeper.exception.InvalidReviewConfigException;

/**
 * Limits applied to one review run. Both values are required; there are no defaults.
 */
public record ReviewConfig(int maxLineLength, int maxInlineComments) {
    public ReviewConfig {
        if (maxLineLength <= 0)
            throw new InvalidReviewConfigException("maxLineLength must be > 0, was " + maxLineLength);
        if (maxInlineComments < 0)
            throw new InvalidReviewConfigException("maxInlineComments must be >= 0, was " + maxInlineComments);
    }

    public static ReviewConfig of(Integer maxLineLength, Integer maxInlineComments) {
        if (maxLineLength == null) throw new InvalidReviewConfigException("maxLineLength is required");
        if (maxInlineComments == null) throw new InvalidReviewConfigException("maxInlineComments is required");
        return new ReviewConfig(maxLineLength, maxInlineComments);
    }
}
