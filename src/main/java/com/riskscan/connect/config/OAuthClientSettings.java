package com.riskscan.connect.config;

import com.riskscan.connect.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Client credentials and endpoints for the TikTok Login Kit integration.
 */
@Component
public class OAuthClientSettings {

    private static final Logger logger = LoggerFactory.getLogger(OAuthClientSettings.class);

    @Value("${tiktok.client-key:}")
    private String clientKey;

    @Value("${tiktok.client-secret:}")
    private String clientSecret;

    @Value("${tiktok.redirect-uri:}")
    private String redirectUri;

    @Value("${tiktok.scopes:user.info.basic,video.list}")
    private String scopes;

    @Value("${tiktok.authorize-url:https://www.tiktok.com/v2/auth/authorize/}")
    private String authorizeUrl;

    @Value("${tiktok.token-url:https://open.tiktokapis.com/v2/oauth/token/}")
    private String tokenUrl;

    @Value("${tiktok.user-info-url:https://open.tiktokapis.com/v2/user/info/}")
    private String userInfoUrl;

    @Value("${tiktok.video-list-url:https://open.tiktokapis.com/v2/video/list/}")
    private String videoListUrl;

    @Value("${tiktok.http.timeout-seconds:30}")
    private int timeoutSeconds;

    public OAuthClientSettings() {
    }

    public OAuthClientSettings(String clientKey, String clientSecret, String redirectUri, String scopes,
                               String authorizeUrl, String tokenUrl, String userInfoUrl, String videoListUrl,
                               int timeoutSeconds) {
        this.clientKey = clientKey;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
        this.scopes = scopes;
        this.authorizeUrl = authorizeUrl;
        this.tokenUrl = tokenUrl;
        this.userInfoUrl = userInfoUrl;
        this.videoListUrl = videoListUrl;
        this.timeoutSeconds = timeoutSeconds;
    }

    @PostConstruct
    public void init() {
        List<String> missing = missingKeys();
        if (missing.isEmpty()) {
            logger.info("TikTok OAuth initialized with client key: {}...",
                    clientKey.substring(0, Math.min(6, clientKey.length())));
        } else {
            logger.warn("TikTok OAuth not configured ({}). Login and ingestion will be refused.",
                    String.join(", ", missing));
        }
    }

    /**
     * Fails fast before any provider call when a credential is absent or still a placeholder
     * such as {@code <your-client-key>}.
     */
    public void requireConfigured() {
        List<String> missing = missingKeys();
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing or placeholder OAuth config: " + String.join(", ", missing));
        }
    }

    public boolean isConfigured() {
        return missingKeys().isEmpty();
    }

    static boolean isPlaceholder(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String trimmed = value.trim();
        return trimmed.startsWith("<") && trimmed.endsWith(">");
    }

    private List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (isPlaceholder(clientKey)) {
            missing.add("TIKTOK_CLIENT_KEY");
        }
        if (isPlaceholder(clientSecret)) {
            missing.add("TIKTOK_CLIENT_SECRET");
        }
        if (isPlaceholder(redirectUri)) {
            missing.add("TIKTOK_REDIRECT_URI");
        }
        return missing;
    }

    public String getClientKey() { return clientKey; }
    public String getClientSecret() { return clientSecret; }
    public String getRedirectUri() { return redirectUri; }
    public String getScopes() { return scopes; }
    public String getAuthorizeUrl() { return authorizeUrl; }
    public String getTokenUrl() { return tokenUrl; }
    public String getUserInfoUrl() { return userInfoUrl; }
    public String getVideoListUrl() { return videoListUrl; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
}
