package com.riskscan.connect.service;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.UrlEncodedContent;
import com.google.api.client.json.JsonFactory;
import com.riskscan.connect.config.OAuthClientSettings;
import com.riskscan.connect.dto.Profile;
import com.riskscan.connect.dto.TokenSet;
import com.riskscan.connect.dto.tiktok.TokenResponse;
import com.riskscan.connect.dto.tiktok.UserInfoResponse;
import com.riskscan.connect.exception.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-to-server calls against the provider's OAuth endpoints.
 *
 * Authorization codes are single-use, so nothing here is retried: a failed exchange
 * means the user has to start the login again.
 */
@Component
public class TokenExchangeClient {

    private static final Logger logger = LoggerFactory.getLogger(TokenExchangeClient.class);

    static final String PROFILE_FIELDS = "open_id,union_id,avatar_url,display_name";

    private final OAuthClientSettings settings;
    private final HttpRequestFactory requestFactory;
    private final JsonFactory jsonFactory;
    private final Clock clock;

    public TokenExchangeClient(OAuthClientSettings settings,
                               HttpTransport providerHttpTransport,
                               JsonFactory providerJsonFactory,
                               Clock clock) {
        this.settings = settings;
        this.requestFactory = ProviderHttp.requestFactory(providerHttpTransport, settings.getTimeoutSeconds());
        this.jsonFactory = providerJsonFactory;
        this.clock = clock;
    }

    /**
     * Trades an authorization code and its PKCE verifier for tokens.
     */
    public TokenSet exchange(String code, String codeVerifier) {
        settings.requireConfigured();
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_key", settings.getClientKey());
        form.put("client_secret", settings.getClientSecret());
        form.put("code", code);
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", settings.getRedirectUri());
        form.put("code_verifier", codeVerifier);
        return requestTokens(form, AuthorizationStage.TOKEN_EXCHANGE, null);
    }

    /**
     * Renews expired credentials. The stored refresh token is kept when the provider does not rotate it.
     */
    public TokenSet refresh(String refreshToken) {
        settings.requireConfigured();
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ExchangeException(AuthorizationStage.TOKEN_REFRESH, "No refresh token stored", -1, null);
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_key", settings.getClientKey());
        form.put("client_secret", settings.getClientSecret());
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        return requestTokens(form, AuthorizationStage.TOKEN_REFRESH, refreshToken);
    }

    public Profile fetchProfile(String accessToken) {
        AuthorizationStage stage = AuthorizationStage.PROFILE_FETCH;
        ProviderHttp.ProviderResponse response;
        try {
            GenericUrl url = new GenericUrl(settings.getUserInfoUrl());
            url.set("fields", PROFILE_FIELDS);
            HttpRequest request = requestFactory.buildGetRequest(url);
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            response = ProviderHttp.execute(request);
        } catch (IOException e) {
            logger.warn("Profile request failed: {}", e.getMessage());
            throw new ExchangeException(stage, "Profile endpoint unreachable: " + e.getMessage(), e);
        }
        if (!response.isSuccess()) {
            logger.warn("Profile request rejected with status {}", response.status());
            throw new ExchangeException(stage, "Profile request rejected (" + response.status() + ")",
                    response.status(), response.body());
        }

        UserInfoResponse info = parse(response, UserInfoResponse.class, stage);
        if (info.getError() != null && !info.getError().isOk()) {
            throw new ExchangeException(stage, "Profile request failed: " + info.getError().getCode(),
                    response.status(), response.body());
        }
        UserInfoResponse.User user = info.getData() == null ? null : info.getData().getUser();
        if (user == null || user.getOpenId() == null || user.getOpenId().isBlank()) {
            throw new ExchangeException(stage, "Profile response has no open_id", response.status(), response.body());
        }
        return new Profile(user.getOpenId(), user.getDisplayName(), user.getAvatarUrl());
    }

    private TokenSet requestTokens(Map<String, String> form, AuthorizationStage stage, String previousRefreshToken) {
        ProviderHttp.ProviderResponse response;
        try {
            HttpRequest request = requestFactory.buildPostRequest(
                    new GenericUrl(settings.getTokenUrl()), new UrlEncodedContent(form));
            request.getHeaders().setCacheControl("no-cache");
            response = ProviderHttp.execute(request);
        } catch (IOException e) {
            logger.warn("Token request ({}) failed: {}", stage, e.getMessage());
            throw new ExchangeException(stage, "Token endpoint unreachable: " + e.getMessage(), e);
        }
        if (!response.isSuccess()) {
            logger.warn("Token request ({}) rejected with status {}", stage, response.status());
            throw new ExchangeException(stage, "Token request rejected (" + response.status() + ")",
                    response.status(), response.body());
        }

        TokenResponse token = parse(response, TokenResponse.class, stage);
        if (token.getError() != null && !token.getError().isBlank()) {
            String detail = token.getErrorDescription() == null || token.getErrorDescription().isBlank()
                    ? token.getError()
                    : token.getError() + " (" + token.getErrorDescription() + ")";
            throw new ExchangeException(stage, "Token request failed: " + detail,
                    response.status(), response.body());
        }
        if (token.getAccessToken() == null || token.getAccessToken().isBlank() || token.getExpiresIn() == null) {
            throw new ExchangeException(stage, "Token response is missing access_token or expires_in",
                    response.status(), response.body());
        }

        LocalDateTime expiresAt = LocalDateTime.now(clock).plusSeconds(token.getExpiresIn());
        String refreshToken = token.getRefreshToken() != null ? token.getRefreshToken() : previousRefreshToken;
        return new TokenSet(token.getAccessToken(), refreshToken, expiresAt, token.getOpenId(), token.getScope());
    }

    private <T> T parse(ProviderHttp.ProviderResponse response, Class<T> type, AuthorizationStage stage) {
        try {
            T parsed = jsonFactory.fromString(response.body(), type);
            if (parsed == null) {
                throw new ExchangeException(stage, "Empty response body", response.status(), response.body());
            }
            return parsed;
        } catch (IOException | IllegalArgumentException e) {
            throw new ExchangeException(stage, "Malformed response body", response.status(), response.body());
        }
    }
}
