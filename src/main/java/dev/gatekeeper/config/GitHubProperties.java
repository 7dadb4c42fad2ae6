package dev.gatekeeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * GitHub App credentials. {@code privateKey} is PEM text; escaped {@code \n} sequences
 * (as found in single-line environment variables) are expanded.
 */
@ConfigurationProperties(prefix = "gatekeeper.github")
public record GitHubProperties(long appId, String privateKey, String webhookSecret, String apiUrl) {
    public GitHubProperties {
        if (apiUrl == null || apiUrl.isBlank()) apiUrl = "https://api.github.com";
        apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        if (privateKey != null) privateKey = privateKey.replace("\\n", "\n");
    }
}
