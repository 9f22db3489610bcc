package com.riskscan.connect.service;

import com.riskscan.connect.config.OAuthClientSettings;
import com.riskscan.connect.dto.Profile;
import com.riskscan.connect.dto.TokenSet;
import com.riskscan.connect.entity.Identity;
import com.riskscan.connect.exception.BadRequestException;
import com.riskscan.connect.exception.ExchangeException;
import com.riskscan.connect.exception.OAuthAuthenticationException;
import com.riskscan.connect.exception.SessionNotFoundException;
import com.riskscan.connect.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Drives the authorization-code flow with PKCE against the provider.
 *
 * <ol>
 *   <li>{@link #beginLogin()} creates a session and returns the provider's authorize URL.</li>
 *   <li>{@link #handleCallback} consumes the session, exchanges the code, fetches the profile
 *       and stores the identity.</li>
 * </ol>
 *
 * The returned session token identifies the connected account on later requests.
 */
@Service
public class AuthorizationFlowService {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationFlowService.class);

    private final OAuthClientSettings settings;
    private final PkceSessionStore sessionStore;
    private final TokenExchangeClient tokenExchangeClient;
    private final IdentityService identityService;
    private final JwtTokenProvider tokenProvider;

    public AuthorizationFlowService(OAuthClientSettings settings,
                                    PkceSessionStore sessionStore,
                                    TokenExchangeClient tokenExchangeClient,
                                    IdentityService identityService,
                                    JwtTokenProvider tokenProvider) {
        this.settings = settings;
        this.sessionStore = sessionStore;
        this.tokenExchangeClient = tokenExchangeClient;
        this.identityService = identityService;
        this.tokenProvider = tokenProvider;
    }

    /**
     * Outcome of a completed callback: the stored identity and a session token naming it.
     */
    public static class ConnectResult {
        private final Identity identity;
        private final String sessionToken;

        public ConnectResult(Identity identity, String sessionToken) {
            this.identity = identity;
            this.sessionToken = sessionToken;
        }

        public Identity getIdentity() { return identity; }
        public String getSessionToken() { return sessionToken; }
    }

    /**
     * Starts a login.
     *
     * @return the authorize URL to redirect the browser to
     */
    public String beginLogin() {
        settings.requireConfigured();
        PkceSessionStore.PkceSession session = sessionStore.create();
        logger.info("Authorization stage {}: redirecting to provider", AuthorizationStage.SESSION_CREATED);

        return UriComponentsBuilder.fromHttpUrl(settings.getAuthorizeUrl())
                .queryParam("client_key", settings.getClientKey())
                .queryParam("response_type", "code")
                .queryParam("scope", settings.getScopes())
                .queryParam("redirect_uri", settings.getRedirectUri())
                .queryParam("state", session.state())
                .queryParam("code_challenge", session.codeChallenge())
                .queryParam("code_challenge_method", "S256")
                .encode()
                .build()
                .toUriString();
    }

    /**
     * Completes a login from the provider's redirect.
     *
     * @param code             Authorization code, absent when the user denied consent
     * @param state            State issued by {@link #beginLogin()}
     * @param error            Provider error code, if any
     * @param errorDescription Provider error text, if any
     * @throws SessionNotFoundException     if the state is unknown, used or expired
     * @throws ExchangeException            if a provider call fails
     * @throws OAuthAuthenticationException if the provider reported an error
     */
    public ConnectResult handleCallback(String code, String state, String error, String errorDescription) {
        settings.requireConfigured();

        if (error != null && !error.isBlank()) {
            if (state != null && !state.isBlank()) {
                discardSession(state);
            }
            logger.warn("Provider denied authorization: {}", error);
            String detail = errorDescription != null && !errorDescription.isBlank() ? errorDescription : error;
            throw new OAuthAuthenticationException("Authorization denied: " + detail);
        }
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            throw new BadRequestException("Missing code or state");
        }

        String codeVerifier;
        try {
            codeVerifier = sessionStore.consume(state);
        } catch (SessionNotFoundException e) {
            logger.warn("Authorization stage {}: {}", AuthorizationStage.SESSION_EXPIRED, e.getMessage());
            throw e;
        }
        logger.debug("Authorization stage {}", AuthorizationStage.CODE_RECEIVED);

        try {
            TokenSet tokens = tokenExchangeClient.exchange(code, codeVerifier);
            logger.debug("Authorization stage {} complete", AuthorizationStage.TOKEN_EXCHANGE);

            Profile profile = tokenExchangeClient.fetchProfile(tokens.getAccessToken());
            logger.debug("Authorization stage {} complete", AuthorizationStage.PROFILE_FETCH);

            String externalId = profile.getExternalId() != null ? profile.getExternalId() : tokens.getOpenId();
            Identity identity = identityService.upsert(externalId, tokens, profile);
            logger.info("Authorization stage {}: identity {} connected",
                    AuthorizationStage.IDENTITY_UPSERTED, identity.getId());

            return new ConnectResult(identity, tokenProvider.generateToken(identity));
        } catch (ExchangeException e) {
            logger.warn("Authorization stage {} at {}: {}",
                    AuthorizationStage.EXCHANGE_FAILED, e.getStage(), e.getMessage());
            throw e;
        }
    }

    private void discardSession(String state) {
        try {
            sessionStore.consume(state);
        } catch (SessionNotFoundException e) {
            logger.debug("No session to discard for denied callback: {}", e.getMessage());
        }
    }
}
