package dev.gatekeeper.controller;

import dev.gatekeeper.config.SecurityConfig;
import dev.gatekeeper.infrastructure.github.WebhookSignatureVerifier;
import dev.gatekeeper.service.ReviewService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web slice tests for the webhook receiver: routing, status codes, signature
 * handling and event filtering. Collaborators are mocked.
 */
@WebMvcTest({WebhookController.class, HealthController.class})
@Import(SecurityConfig.class)
class WebhookControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private WebhookSignatureVerifier signatureVerifier;

  @MockitoBean
  private ReviewService reviewService;

  private static final String WEBHOOK_URL = "/webhooks/github";

  @Nested
  @DisplayName("POST /webhooks/github")
  class HandleWebhook {

    @Test
    @DisplayName("should queue a review for an opened PR and return 202")
    void shouldAcceptValidPrEvent() throws Exception {
      UUID reviewId = UUID.randomUUID();
      when(signatureVerifier.isValid(any(byte[].class), eq("sha256=abc"))).thenReturn(true);
      when(reviewService.requestReview(anyString(), anyString(), anyInt(), anyString(), anyLong()))
          .thenReturn(reviewId);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .header("X-GitHub-Delivery", "delivery-123")
          .header("X-Hub-Signature-256", "sha256=abc")
          .content(prPayload("opened", false)))
          .andExpect(status().isAccepted())
          .andExpect(jsonPath("$.status").value("queued"))
          .andExpect(jsonPath("$.reviewId").value(reviewId.toString()));

      verify(reviewService).requestReview("delivery-123", "octocat/hello-world", 42,
          "abc123def456abc123def456abc123def4560000", 12345L);
    }

    @Test
    @DisplayName("should queue reviews for ready_for_review and reopened actions")
    void shouldAcceptOtherTrackedActions() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);
      when(reviewService.requestReview(any(), anyString(), anyInt(), anyString(), anyLong()))
          .thenReturn(UUID.randomUUID());

      for (String action : new String[] {"reopened", "synchronize", "ready_for_review"}) {
        mockMvc.perform(post(WEBHOOK_URL)
            .contentType(MediaType.APPLICATION_JSON)
            .header("X-GitHub-Event", "pull_request")
            .header("X-Hub-Signature-256", "sha256=abc")
            .content(prPayload(action, false)))
            .andExpect(status().isAccepted());
      }
    }

    @Test
    @DisplayName("should reject request with invalid HMAC signature")
    void shouldRejectInvalidSignature() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), eq("sha256=invalid"))).thenReturn(false);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .header("X-GitHub-Delivery", "delivery-bad")
          .header("X-Hub-Signature-256", "sha256=invalid")
          .content(prPayload("opened", false)))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.status").value("rejected"))
          .andExpect(jsonPath("$.reason").value("invalid signature"));

      verify(reviewService, never()).requestReview(any(), any(), anyInt(), any(), anyLong());
    }

    @Test
    @DisplayName("should reject request with missing signature")
    void shouldRejectMissingSignature() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), isNull())).thenReturn(false);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .header("X-GitHub-Delivery", "delivery-nosig")
          .content(prPayload("opened", false)))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.status").value("rejected"));

      verify(reviewService, never()).requestReview(any(), any(), anyInt(), any(), anyLong());
    }

    @Test
    @DisplayName("should ignore non-PR events with 200")
    void shouldIgnoreNonPrEvents() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "push")
          .header("X-GitHub-Delivery", "delivery-456")
          .content("{}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("ignored"))
          .andExpect(jsonPath("$.reason").value("not a PR event"));
    }

    @Test
    @DisplayName("should ignore untracked PR actions (closed, labeled, etc.)")
    void shouldIgnoreUntrackedActions() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .header("X-GitHub-Delivery", "delivery-789")
          .content(prPayload("closed", false)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.reason").value("action not tracked"));
    }

    @Test
    @DisplayName("should ignore draft pull requests")
    void shouldIgnoreDrafts() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .content(prPayload("opened", true)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("ignored"))
          .andExpect(jsonPath("$.reason").value("draft pull request"));

      verify(reviewService, never()).requestReview(any(), any(), anyInt(), any(), anyLong());
    }

    @Test
    @DisplayName("should return 400 for a body that is not JSON")
    void shouldRejectMalformedJson() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .content("{not json"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.reason").value("invalid payload"));
    }

    @Test
    @DisplayName("should return 400 when installation metadata is missing")
    void shouldRejectMissingMetadata() throws Exception {
      when(signatureVerifier.isValid(any(byte[].class), any())).thenReturn(true);

      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .header("X-GitHub-Event", "pull_request")
          .content("""
              {
                "action": "opened",
                "pull_request": { "number": 42, "head": { "sha": "abc123" } },
                "repository": { "full_name": "octocat/hello-world" }
              }
              """))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.status").value("error"));

      verify(reviewService, never()).requestReview(any(), any(), anyInt(), any(), anyLong());
    }

    @Test
    @DisplayName("should return a problem detail when the event header is missing")
    void shouldRejectMissingEventHeader() throws Exception {
      mockMvc.perform(post(WEBHOOK_URL)
          .contentType(MediaType.APPLICATION_JSON)
          .content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Invalid Request"));
    }
  }

  @Test
  @DisplayName("GET /healthz should report ok without authentication")
  void healthz() throws Exception {
    mockMvc.perform(get("/healthz"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Nested
  @DisplayName("access rules")
  class AccessRules {

    @Test
    @DisplayName("actuator endpoints other than health and info are denied")
    void actuatorMetricsDenied() throws Exception {
      mockMvc.perform(get("/actuator/metrics"))
          .andExpect(status().isForbidden());
      mockMvc.perform(get("/actuator/env"))
          .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("paths outside the webhook and health checks are denied")
    void unknownPathsDenied() throws Exception {
      mockMvc.perform(post("/webhooks/gitlab").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isForbidden());
      mockMvc.perform(get("/webhooks/github"))
          .andExpect(status().isForbidden());
    }
  }

  // ── Test Fixtures ──────────────────────────────────────────────

  private String prPayload(String action, boolean draft) {
    return """
        {
          "action": "%s",
          "pull_request": {
            "number": 42,
            "draft": %s,
            "head": { "sha": "abc123def456abc123def456abc123def4560000", "ref": "feature/cool" },
            "base": { "ref": "main" },
            "title": "Add cool feature"
          },
          "repository": {
            "full_name": "octocat/hello-world",
            "private": false
          },
          "installation": { "id": 12345 }
        }
        """.formatted(action, draft);
  }
}
