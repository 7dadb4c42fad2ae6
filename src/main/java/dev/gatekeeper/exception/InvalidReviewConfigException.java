package dev.gatekeeper.exception;

/**
 * Review limits are missing or out of range. Fatal to a run: no bounded review can be built.
 */
public class InvalidReviewConfigException extends IllegalArgumentException {
    public InvalidReviewConfigException(String message) {
        super(message);
    }
}
