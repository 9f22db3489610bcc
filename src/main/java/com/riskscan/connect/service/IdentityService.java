package com.riskscan.connect.service;

import com.riskscan.connect.dto.Profile;
import com.riskscan.connect.dto.TokenSet;
import com.riskscan.connect.entity.Identity;
import com.riskscan.connect.exception.NoIdentityException;
import com.riskscan.connect.repository.IdentityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Persists connected identities. One row per external id; re-authorization updates it in place.
 */
@Service
public class IdentityService {

    private static final Logger logger = LoggerFactory.getLogger(IdentityService.class);

    private final IdentityRepository identityRepository;
    private final TransactionTemplate transactionTemplate;

    public IdentityService(IdentityRepository identityRepository,
                           PlatformTransactionManager transactionManager) {
        this.identityRepository = identityRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Inserts or updates the identity for {@code externalId}.
     * Credentials are always replaced; display name and avatar only when the new profile has them.
     * A concurrent first insert for the same id loses on the unique constraint and is retried as an update.
     *
     * @param externalId The platform user id
     * @param tokenSet   Freshly granted credentials
     * @param profile    Profile metadata, may be null
     * @return the stored identity
     */
    public Identity upsert(String externalId, TokenSet tokenSet, Profile profile) {
        try {
            return transactionTemplate.execute(status -> upsertInTransaction(externalId, tokenSet, profile));
        } catch (DataIntegrityViolationException e) {
            logger.info("Concurrent insert for identity {}, retrying as update", externalId);
            return transactionTemplate.execute(status -> upsertInTransaction(externalId, tokenSet, profile));
        }
    }

    /**
     * Stores refreshed credentials for an existing identity.
     */
    public Identity updateCredentials(Long identityId, TokenSet tokenSet) {
        return transactionTemplate.execute(status -> {
            Identity identity = identityRepository.findById(identityId)
                    .orElseThrow(() -> new NoIdentityException("Identity " + identityId + " no longer exists"));
            applyCredentials(identity, tokenSet);
            return identityRepository.save(identity);
        });
    }

    @Transactional(readOnly = true)
    public Optional<Identity> mostRecentlyConnected() {
        return identityRepository.findFirstByOrderByIdDesc();
    }

    @Transactional(readOnly = true)
    public Optional<Identity> findById(Long identityId) {
        return identityRepository.findById(identityId);
    }

    private Identity upsertInTransaction(String externalId, TokenSet tokenSet, Profile profile) {
        Optional<Identity> existing = identityRepository.findByExternalIdForUpdate(externalId);

        Identity identity = existing.orElseGet(() -> {
            Identity created = new Identity();
            created.setExternalId(externalId);
            return created;
        });
        applyCredentials(identity, tokenSet);
        if (profile != null) {
            if (hasText(profile.getDisplayName())) {
                identity.setDisplayName(profile.getDisplayName());
            }
            if (hasText(profile.getAvatarUrl())) {
                identity.setAvatarUrl(profile.getAvatarUrl());
            }
        }

        Identity saved = identityRepository.saveAndFlush(identity);
        if (existing.isPresent()) {
            logger.info("Updated credentials for identity {} ({})", saved.getId(), externalId);
        } else {
            logger.info("Connected new identity {} ({})", saved.getId(), externalId);
        }
        return saved;
    }

    private static void applyCredentials(Identity identity, TokenSet tokenSet) {
        identity.setAccessToken(tokenSet.getAccessToken());
        identity.setRefreshToken(tokenSet.getRefreshToken());
        identity.setExpiresAt(tokenSet.getExpiresAt());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
