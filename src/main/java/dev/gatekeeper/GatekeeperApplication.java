package dev.gatekeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Gatekeeper: diff-scoped static review bot for GitHub pull requests.
 *
 * <pre>
 * GitHub Webhook → WebhookController → ReviewService → ApplicationEvent
 *   → ReviewTaskListener (async) → ReviewOrchestrator
 *   → ReviewPipeline [DiffParser → AnalyzerRunner → ReviewAggregator]
 *   → GitHubApiClient (post review)
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class GatekeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatekeeperApplication.class, args);
    }
}
