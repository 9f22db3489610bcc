package com.riskscan.connect.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically drops abandoned PKCE sessions so the in-memory map does not grow with logins
 * that never come back. Expiry on consume does not depend on this sweep.
 */
@Service
public class AuthorizationSessionCleanupService {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationSessionCleanupService.class);

    private final PkceSessionStore sessionStore;

    public AuthorizationSessionCleanupService(PkceSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${app.pkce.cleanup-interval-ms:60000}")
    public void cleanupExpiredSessions() {
        int removed = sessionStore.evictExpired();
        if (removed > 0) {
            logger.info("Evicted {} expired PKCE sessions, {} still pending", removed, sessionStore.size());
        }
    }
}
