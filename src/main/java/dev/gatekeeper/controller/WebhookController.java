package dev.gatekeeper.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.gatekeeper.dto.request.WebhookPayload;
import dev.gatekeeper.infrastructure.github.WebhookSignatureVerifier;
import dev.gatekeeper.service.ReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * GitHub webhook receiver. Validates the HMAC signature, filters pull request events
 * and returns 202 Accepted; the review itself runs asynchronously.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    private final WebhookSignatureVerifier signatureVerifier;
    private final ReviewService reviewService;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookSignatureVerifier signatureVerifier,
                             ReviewService reviewService,
                             ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.reviewService = reviewService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader("X-GitHub-Event") String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody String rawBody) {

        // Verify against raw bytes before any deserialization
        if (!signatureVerifier.isValid(rawBody.getBytes(StandardCharsets.UTF_8), signature)) {
            log.warn("Webhook signature verification failed for delivery={}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", "invalid signature"));
        }

        WebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, WebhookPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize webhook payload for delivery={}: {}", deliveryId, e.getOriginalMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("status", "error", "reason", "invalid payload"));
        }

        if (!"pull_request".equals(eventType))
            return ResponseEntity.ok(Map.of("status", "ignored", "reason", "not a PR event"));

        log.info("Webhook: event={}, delivery={}, action={}", eventType, deliveryId, payload.action());

        if (!payload.isTrackedAction())
            return ResponseEntity.ok(Map.of("status", "ignored", "reason", "action not tracked"));
        if (payload.isDraft())
            return ResponseEntity.ok(Map.of("status", "ignored", "reason", "draft pull request"));
        if (!payload.hasReviewMetadata())
            return ResponseEntity.badRequest()
                    .body(Map.of("status", "error", "reason", "missing pull request or installation metadata"));

        UUID reviewId = reviewService.requestReview(deliveryId,
                payload.repository().fullName(), payload.pullRequest().number(),
                payload.pullRequest().head().sha(), payload.installation().id());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "queued", "reviewId", reviewId.toString()));
    }
}
