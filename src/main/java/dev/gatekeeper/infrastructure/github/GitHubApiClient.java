package dev.gatekeeper.infrastructure.github;

import dev.gatekeeper.config.GitHubProperties;
import dev.gatekeeper.domain.valueobject.InlineComment;
import dev.gatekeeper.domain.valueobject.Patch;
import dev.gatekeeper.domain.valueobject.Review;
import dev.gatekeeper.exception.GitHubApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub REST API client with circuit breaker and rate limiting.
 * Uses WebClient with .block(); callers run on review worker threads, never on request threads.
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private static final int FILES_PER_PAGE = 100;
    private static final int MAX_PAGES = 10;
    private static final int MAX_ERROR_BODY = 500;

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(WebClient.Builder builder, GitHubTokenProvider tokenProvider,
                           GitHubProperties properties) {
        this.tokenProvider = tokenProvider;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.baseUrl(properties.apiUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public List<Patch> getPullRequestFiles(String repo, int pr, long installationId) {
        String token = tokenProvider.getInstallationToken(installationId);
        List<Patch> patches = new ArrayList<>();

        for (int page = 1; page <= MAX_PAGES; page++) {
            String uri = "/repos/" + repo + "/pulls/" + pr + "/files?per_page=" + FILES_PER_PAGE + "&page=" + page;
            List<GitHubPullRequestFile> files = webClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toException("GET", uri, response))
                    .bodyToMono(new ParameterizedTypeReference<List<GitHubPullRequestFile>>() {})
                    .block();

            if (files == null || files.isEmpty()) break;
            files.stream()
                    .filter(f -> f.filename() != null && !f.filename().isBlank())
                    .map(GitHubPullRequestFile::toPatch)
                    .forEach(patches::add);
            if (files.size() < FILES_PER_PAGE) break;
        }

        if (patches.size() >= FILES_PER_PAGE * MAX_PAGES) {
            log.warn("PR {}/pull/{} has {}+ files, review may be incomplete", repo, pr, patches.size());
        }
        return patches;
    }

    /**
     * Posts {@code review} as a single COMMENT review on {@code headSha}.
     */
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public void createReview(String repo, int pr, long installationId, String headSha, Review review) {
        String token = tokenProvider.getInstallationToken(installationId);
        String uri = "/repos/" + repo + "/pulls/" + pr + "/reviews";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("commit_id", headSha);
        payload.put("event", "COMMENT");
        payload.put("body", review.summaryMarkdown());
        if (!review.inlineComments().isEmpty()) {
            payload.put("comments", review.inlineComments().stream().map(GitHubApiClient::toComment).toList());
        }

        webClient.post().uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException("POST", uri, response))
                .toBodilessEntity()
                .block();
        log.info("Review posted on {}/pull/{} with {} inline comments", repo, pr, review.inlineComments().size());
    }

    private static Map<String, Object> toComment(InlineComment comment) {
        return Map.of(
                "path", comment.path(),
                "line", comment.line(),
                "side", "RIGHT",
                "body", comment.body());
    }

    private static Mono<GitHubApiException> toException(String method, String uri, ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String details = body.strip();
                    if (details.length() > MAX_ERROR_BODY) details = details.substring(0, MAX_ERROR_BODY) + "...";
                    return new GitHubApiException("GitHub API error for %s %s: status=%d, body=%s"
                            .formatted(method, uri, response.statusCode().value(), details));
                });
    }
}
