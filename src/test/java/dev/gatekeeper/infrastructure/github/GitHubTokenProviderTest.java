package dev.gatekeeper.infrastructure.github;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.SignedJWT;
import dev.gatekeeper.config.GitHubProperties;
import dev.gatekeeper.exception.GitHubApiException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;
import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class GitHubTokenProviderTest {

    private static KeyPair keyPair;

    @BeforeAll
    static void generateKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
    }

    @Test
    @DisplayName("exchanges an app JWT for an installation token and caches it")
    void exchangesAndCaches(WireMockRuntimeInfo wmInfo) throws Exception {
        stubFor(post(urlPathEqualTo("/app/installations/77/access_tokens"))
                .willReturn(okJson("{\"token\": \"ghs_abc\", \"expires_at\": \"2099-01-01T00:00:00Z\"}")));
        GitHubTokenProvider provider = provider(wmInfo, pem("PRIVATE KEY", keyPair.getPrivate().getEncoded()));

        assertThat(provider.getInstallationToken(77)).isEqualTo("ghs_abc");
        assertThat(provider.getInstallationToken(77)).isEqualTo("ghs_abc");

        verify(1, postRequestedFor(urlPathEqualTo("/app/installations/77/access_tokens"))
                .withHeader("Authorization", matching("Bearer .+\\..+\\..+")));
    }

    @Test
    @DisplayName("refreshes a token that expires within the refresh margin")
    void refreshesNearExpiry(WireMockRuntimeInfo wmInfo) {
        stubFor(post(urlPathEqualTo("/app/installations/77/access_tokens"))
                .willReturn(okJson("{\"token\": \"ghs_short\", \"expires_at\": \"2000-01-01T00:00:00Z\"}")));
        GitHubTokenProvider provider = provider(wmInfo, pem("PRIVATE KEY", keyPair.getPrivate().getEncoded()));

        provider.getInstallationToken(77);
        provider.getInstallationToken(77);

        verify(2, postRequestedFor(urlPathEqualTo("/app/installations/77/access_tokens")));
    }

    @Test
    @DisplayName("app JWT is RS256-signed with the app id as issuer")
    void signsAppJwt(WireMockRuntimeInfo wmInfo) throws Exception {
        GitHubTokenProvider provider = provider(wmInfo, pem("PRIVATE KEY", keyPair.getPrivate().getEncoded()));

        SignedJWT jwt = SignedJWT.parse(provider.appJwt());

        assertThat(jwt.verify(new RSASSAVerifier((RSAPublicKey) keyPair.getPublic()))).isTrue();
        assertThat(jwt.getJWTClaimsSet().getIssuer()).isEqualTo("42");
        assertThat(jwt.getJWTClaimsSet().getExpirationTime()).isAfter(jwt.getJWTClaimsSet().getIssueTime());
    }

    @Test
    @DisplayName("reads PKCS#1 keys as issued by GitHub")
    void readsPkcs1() {
        byte[] pkcs8 = keyPair.getPrivate().getEncoded();
        // 2048-bit PKCS#8 wraps the PKCS#1 structure after a fixed 26-byte header
        byte[] pkcs1 = Arrays.copyOfRange(pkcs8, 26, pkcs8.length);

        RSAPrivateKey key = GitHubTokenProvider.readPem(pem("RSA PRIVATE KEY", pkcs1));

        assertThat(key.getModulus()).isEqualTo(((RSAPrivateKey) keyPair.getPrivate()).getModulus());
        assertThat(key.getPrivateExponent()).isEqualTo(((RSAPrivateKey) keyPair.getPrivate()).getPrivateExponent());
    }

    @Test
    void failsWithoutConfiguredKey(WireMockRuntimeInfo wmInfo) {
        GitHubTokenProvider provider = provider(wmInfo, "");

        assertThatThrownBy(() -> provider.getInstallationToken(77))
                .isInstanceOf(GitHubApiException.class)
                .hasMessageContaining("not configured");
    }

    @Test
    void wrapsTokenExchangeFailures(WireMockRuntimeInfo wmInfo) {
        stubFor(post(urlPathEqualTo("/app/installations/77/access_tokens"))
                .willReturn(aResponse().withStatus(401)));
        GitHubTokenProvider provider = provider(wmInfo, pem("PRIVATE KEY", keyPair.getPrivate().getEncoded()));

        assertThatThrownBy(() -> provider.getInstallationToken(77))
                .isInstanceOf(GitHubApiException.class)
                .hasMessageContaining("status=401");
    }

    private static GitHubTokenProvider provider(WireMockRuntimeInfo wmInfo, String pem) {
        return new GitHubTokenProvider(new GitHubProperties(42L, pem, "secret", wmInfo.getHttpBaseUrl()),
                WebClient.builder());
    }

    private static String pem(String type, byte[] der) {
        return "-----BEGIN " + type + "-----\n"
                + Base64.getMimeEncoder(64, "\n".getBytes()).encodeToString(der)
                + "\n-----END " + type + "-----\n";
    }
}
