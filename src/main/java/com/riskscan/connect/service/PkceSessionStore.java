package com.riskscan.connect.service;

import com.riskscan.connect.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds PKCE code verifiers between the login redirect and the provider callback.
 *
 * Entries live in process memory only; a restart invalidates every in-flight login.
 * Each state can be consumed once: {@link ConcurrentHashMap#remove(Object)} hands the entry
 * to exactly one caller, and expiry is checked after removal so stale entries are discarded too.
 */
@Component
public class PkceSessionStore {

    private static final Logger logger = LoggerFactory.getLogger(PkceSessionStore.class);

    private static final int STATE_BYTES = 32;
    private static final int VERIFIER_BYTES = 64;
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final Map<String, AuthorizationSession> sessions = new ConcurrentHashMap<>();
    private final SecureRandom secureRandom = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;

    public PkceSessionStore(Clock clock, @Value("${app.pkce.session-ttl-minutes:10}") long ttlMinutes) {
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    /**
     * Starts a new authorization session.
     */
    public PkceSession create() {
        String state = randomToken(STATE_BYTES);
        String codeVerifier = randomToken(VERIFIER_BYTES);
        String codeChallenge = challengeFor(codeVerifier);

        sessions.put(state, new AuthorizationSession(codeVerifier, clock.instant()));
        logger.debug("Created PKCE session, {} in flight", sessions.size());
        return new PkceSession(state, codeVerifier, codeChallenge);
    }

    /**
     * Removes the session for {@code state} and returns its code verifier.
     *
     * @throws SessionNotFoundException if the state is unknown, already consumed or expired
     */
    public String consume(String state) {
        if (state == null || state.isBlank()) {
            throw new SessionNotFoundException("Missing authorization state");
        }
        AuthorizationSession session = sessions.remove(state);
        if (session == null) {
            throw new SessionNotFoundException("Invalid or already used authorization state");
        }
        if (isExpired(session, clock.instant())) {
            throw new SessionNotFoundException("Authorization state expired, start the login again");
        }
        return session.codeVerifier();
    }

    /**
     * Drops sessions older than the TTL.
     *
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, AuthorizationSession> entry : sessions.entrySet()) {
            // remove(key, value) loses to a concurrent consume of the same state
            if (isExpired(entry.getValue(), now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * S256 code challenge: base64url without padding of SHA-256 over the ASCII verifier.
     */
    public static String challengeFor(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return URL_ENCODER.encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private boolean isExpired(AuthorizationSession session, Instant now) {
        return Duration.between(session.createdAt(), now).compareTo(ttl) > 0;
    }

    private String randomToken(int bytes) {
        byte[] buffer = new byte[bytes];
        secureRandom.nextBytes(buffer);
        return URL_ENCODER.encodeToString(buffer);
    }

    private record AuthorizationSession(String codeVerifier, Instant createdAt) {}

    public record PkceSession(String state, String codeVerifier, String codeChallenge) {}
}
