package dev.gatekeeper.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import dev.gatekeeper.config.GitHubProperties;
import dev.gatekeeper.exception.GitHubApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GitHub App authentication. Signs a short-lived app JWT with the App's private key,
 * exchanges it for an installation token and caches that token per installation.
 */
@Component
public class GitHubTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(GitHubTokenProvider.class);

    private static final Duration JWT_BACKDATE = Duration.ofSeconds(60);
    private static final Duration JWT_LIFETIME = Duration.ofMinutes(9);
    private static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final GitHubProperties properties;
    private final WebClient webClient;
    private final Map<Long, InstallationToken> cache = new ConcurrentHashMap<>();
    private volatile RSAPrivateKey signingKey;

    public GitHubTokenProvider(GitHubProperties properties, WebClient.Builder builder) {
        this.properties = properties;
        this.webClient = builder.baseUrl(properties.apiUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
        if (properties.privateKey() == null || properties.privateKey().isBlank()) {
            log.warn("GitHub App private key not configured; installation tokens cannot be issued");
        }
    }

    public String getInstallationToken(long installationId) {
        InstallationToken cached = cache.get(installationId);
        if (cached != null && cached.validAt(Instant.now().plus(REFRESH_MARGIN))) {
            return cached.token();
        }

        String uri = "/app/installations/" + installationId + "/access_tokens";
        InstallationToken issued = webClient.post()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new GitHubApiException("Token exchange failed for installation %d: status=%d"
                                .formatted(installationId, response.statusCode().value()))))
                .bodyToMono(InstallationToken.class)
                .block();

        if (issued == null || issued.token() == null || issued.expiresAt() == null) {
            throw new GitHubApiException("GitHub returned no installation token for installation " + installationId);
        }
        cache.put(installationId, issued);
        log.info("Obtained installation token for installation {} (expires {})", installationId, issued.expiresAt());
        return issued.token();
    }

    String appJwt() {
        Instant now = Instant.now();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(String.valueOf(properties.appId()))
                .issueTime(Date.from(now.minus(JWT_BACKDATE)))
                .expirationTime(Date.from(now.plus(JWT_LIFETIME)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        try {
            jwt.sign(new RSASSASigner(signingKey()));
        } catch (JOSEException e) {
            throw new GitHubApiException("Failed to sign GitHub App JWT", e);
        }
        return jwt.serialize();
    }

    private RSAPrivateKey signingKey() {
        RSAPrivateKey key = signingKey;
        if (key == null) {
            key = readPem(properties.privateKey());
            signingKey = key;
        }
        return key;
    }

    static RSAPrivateKey readPem(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new GitHubApiException("GitHub App private key is not configured");
        }
        boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
        String base64 = pem.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "").replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            KeySpec spec = pkcs1 ? new Pkcs1Reader(der).read() : new PKCS8EncodedKeySpec(der);
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (GeneralSecurityException | IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            throw new GitHubApiException("Failed to parse GitHub App private key", e);
        }
    }

    /**
     * Minimal DER reader for PKCS#1 keys, the format GitHub issues App keys in.
     * RSAPrivateKey ::= SEQUENCE { version, n, e, d, p, q, dP, dQ, qInv }
     */
    private static final class Pkcs1Reader {
        private final byte[] der;
        private int pos;

        Pkcs1Reader(byte[] der) { this.der = der; }

        RSAPrivateCrtKeySpec read() {
            pos++;
            length();
            integer();
            return new RSAPrivateCrtKeySpec(integer(), integer(), integer(), integer(),
                    integer(), integer(), integer(), integer());
        }

        private int length() {
            int first = der[pos++] & 0xFF;
            if (first < 0x80) return first;
            int value = 0;
            for (int i = 0; i < (first & 0x7F); i++) {
                value = (value << 8) | (der[pos++] & 0xFF);
            }
            return value;
        }

        private BigInteger integer() {
            pos++;
            int len = length();
            byte[] bytes = new byte[len];
            System.arraycopy(der, pos, bytes, 0, len);
            pos += len;
            return new BigInteger(bytes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InstallationToken(String token, @JsonProperty("expires_at") Instant expiresAt) {
        boolean validAt(Instant instant) { return expiresAt.isAfter(instant); }
    }
}
