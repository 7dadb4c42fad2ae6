package dev.gatekeeper.infrastructure.github;

import dev.gatekeeper.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification of the {@code X-Hub-Signature-256} header.
 * Uses constant-time comparison to prevent timing attacks.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) { this.properties = properties; }

    public boolean isValid(byte[] payload, String signature) {
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("Webhook secret not configured; rejecting delivery");
            return false;
        }
        if (signature == null || !signature.startsWith(PREFIX)) return false;

        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            String expected = PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    signature.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            return false;
        }
    }
}
