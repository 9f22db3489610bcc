package com.riskscan.connect.service;

import com.google.api.client.json.gson.GsonFactory;
import com.riskscan.connect.config.OAuthClientSettings;
import com.riskscan.connect.dto.Profile;
import com.riskscan.connect.dto.TokenSet;
import com.riskscan.connect.exception.ConfigurationException;
import com.riskscan.connect.exception.ExchangeException;
import com.riskscan.connect.support.RecordingHttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenExchangeClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private RecordingHttpTransport transport;
    private TokenExchangeClient client;

    static OAuthClientSettings settings(String clientKey) {
        return new OAuthClientSettings(clientKey, "secret-xyz", "https://app.example.com/api/connect/callback",
                "user.info.basic,video.list",
                "https://www.tiktok.com/v2/auth/authorize/",
                "https://open.tiktokapis.com/v2/oauth/token/",
                "https://open.tiktokapis.com/v2/user/info/",
                "https://open.tiktokapis.com/v2/video/list/",
                5);
    }

    @BeforeEach
    void setUp() {
        transport = new RecordingHttpTransport();
        client = new TokenExchangeClient(settings("awkey123456"), transport, GsonFactory.getDefaultInstance(), CLOCK);
    }

    @Test
    void exchangePostsFormAndComputesExpiry() {
        transport.respond(200, "{\"access_token\":\"act.1\",\"refresh_token\":\"rft.1\",\"expires_in\":86400,"
                + "\"open_id\":\"open-1\",\"scope\":\"user.info.basic\"}");

        TokenSet tokens = client.exchange("code-abc", "verifier-123");

        assertThat(tokens.getAccessToken()).isEqualTo("act.1");
        assertThat(tokens.getRefreshToken()).isEqualTo("rft.1");
        assertThat(tokens.getOpenId()).isEqualTo("open-1");
        assertThat(tokens.getExpiresAt()).isEqualTo(LocalDateTime.of(2024, 5, 2, 10, 0));

        RecordingHttpTransport.RecordedRequest request = transport.lastRequest();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.url()).isEqualTo("https://open.tiktokapis.com/v2/oauth/token/");
        assertThat(request.body())
                .contains("client_key=awkey123456")
                .contains("client_secret=secret-xyz")
                .contains("code=code-abc")
                .contains("grant_type=authorization_code")
                .contains("code_verifier=verifier-123")
                .contains("redirect_uri=");
    }

    @Test
    void exchangeFailsWithUpstreamStatusAndBody() {
        String body = "{\"error\":\"invalid_grant\",\"error_description\":\"Authorization code is expired.\"}";
        transport.respond(400, body);

        assertThatThrownBy(() -> client.exchange("stale", "verifier"))
                .isInstanceOfSatisfying(ExchangeException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(AuthorizationStage.TOKEN_EXCHANGE);
                    assertThat(e.getUpstreamStatus()).isEqualTo(400);
                    assertThat(e.getUpstreamBody()).isEqualTo(body);
                });
        assertThat(transport.getRequests()).hasSize(1);
    }

    @Test
    void errorFieldInSuccessfulResponseIsAFailure() {
        transport.respond(200, "{\"error\":\"invalid_request\",\"error_description\":\"bad verifier\"}");

        assertThatThrownBy(() -> client.exchange("code", "verifier"))
                .isInstanceOf(ExchangeException.class)
                .hasMessage("Token request failed: invalid_request (bad verifier)");
    }

    @Test
    void responseWithoutAccessTokenIsAFailure() {
        transport.respond(200, "{\"expires_in\":86400}");

        assertThatThrownBy(() -> client.exchange("code", "verifier"))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("access_token");
    }

    @Test
    void truncatedBodyIsAFailure() {
        transport.respond(200, "{\"access_token\":");

        assertThatThrownBy(() -> client.exchange("code", "verifier"))
                .isInstanceOfSatisfying(ExchangeException.class,
                        e -> assertThat(e.getUpstreamStatus()).isEqualTo(200));
    }

    @Test
    void networkFailureHasNoUpstreamStatus() {
        transport.fail(new SocketTimeoutException("Read timed out"));

        assertThatThrownBy(() -> client.exchange("code", "verifier"))
                .isInstanceOfSatisfying(ExchangeException.class, e -> {
                    assertThat(e.getUpstreamStatus()).isEqualTo(-1);
                    assertThat(e.getCause()).isInstanceOf(SocketTimeoutException.class);
                });
    }

    @Test
    void unconfiguredClientMakesNoCall() {
        TokenExchangeClient unconfigured = new TokenExchangeClient(settings("<your-client-key>"), transport,
                GsonFactory.getDefaultInstance(), CLOCK);

        assertThatThrownBy(() -> unconfigured.exchange("code", "verifier"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("TIKTOK_CLIENT_KEY");
        assertThat(transport.getRequests()).isEmpty();
    }

    @Test
    void refreshKeepsStoredRefreshTokenWhenNotRotated() {
        transport.respond(200, "{\"access_token\":\"act.2\",\"expires_in\":3600}");

        TokenSet tokens = client.refresh("rft.1");

        assertThat(tokens.getAccessToken()).isEqualTo("act.2");
        assertThat(tokens.getRefreshToken()).isEqualTo("rft.1");
        assertThat(tokens.getExpiresAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 11, 0));
        assertThat(transport.lastRequest().body())
                .contains("grant_type=refresh_token")
                .contains("refresh_token=rft.1");
    }

    @Test
    void refreshFailureReportsRefreshStage() {
        transport.respond(401, "{\"error\":\"invalid_grant\"}");

        assertThatThrownBy(() -> client.refresh("rft.revoked"))
                .isInstanceOfSatisfying(ExchangeException.class,
                        e -> assertThat(e.getStage()).isEqualTo(AuthorizationStage.TOKEN_REFRESH));
    }

    @Test
    void fetchProfileSendsBearerTokenAndReadsUser() {
        transport.respond(200, "{\"data\":{\"user\":{\"open_id\":\"open-1\",\"union_id\":\"union-1\","
                + "\"display_name\":\"Casey\",\"avatar_url\":\"https://cdn.example.com/a.jpg\"}},"
                + "\"error\":{\"code\":\"ok\",\"message\":\"\",\"log_id\":\"20240501\"}}");

        Profile profile = client.fetchProfile("act.1");

        assertThat(profile.getExternalId()).isEqualTo("open-1");
        assertThat(profile.getDisplayName()).isEqualTo("Casey");
        assertThat(profile.getAvatarUrl()).isEqualTo("https://cdn.example.com/a.jpg");

        RecordingHttpTransport.RecordedRequest request = transport.lastRequest();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.authorization()).isEqualTo("Bearer act.1");
        assertThat(request.url()).startsWith("https://open.tiktokapis.com/v2/user/info/?fields=")
                .contains("display_name");
    }

    @Test
    void fetchProfileRejectsProviderErrorCode() {
        transport.respond(401, "{\"error\":{\"code\":\"access_token_invalid\",\"message\":\"expired\"}}");

        assertThatThrownBy(() -> client.fetchProfile("act.old"))
                .isInstanceOfSatisfying(ExchangeException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(AuthorizationStage.PROFILE_FETCH);
                    assertThat(e.getUpstreamStatus()).isEqualTo(401);
                });
    }

    @Test
    void fetchProfileRequiresOpenId() {
        transport.respond(200, "{\"data\":{\"user\":{\"display_name\":\"Casey\"}},\"error\":{\"code\":\"ok\"}}");

        assertThatThrownBy(() -> client.fetchProfile("act.1"))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("open_id");
    }
}
