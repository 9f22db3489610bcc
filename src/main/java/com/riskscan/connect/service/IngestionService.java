package com.riskscan.connect.service;

import com.riskscan.connect.dto.IngestionResult;
import com.riskscan.connect.dto.RemoteContentItem;
import com.riskscan.connect.dto.TokenSet;
import com.riskscan.connect.entity.ContentItem;
import com.riskscan.connect.entity.Identity;
import com.riskscan.connect.exception.BadRequestException;
import com.riskscan.connect.exception.NoIdentityException;
import com.riskscan.connect.repository.ContentItemRepository;
import com.riskscan.connect.scoring.CaptionRiskEngine;
import com.riskscan.connect.scoring.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls recent posts for a connected identity, scores the new ones and stores them.
 *
 * Items are never re-scored: an id that is already stored counts as a duplicate.
 * Concurrent runs are settled by the unique constraint on {@code external_item_id}.
 */
@Service
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    public static final int MAX_LIMIT = 100;

    private final IdentityService identityService;
    private final TokenExchangeClient tokenExchangeClient;
    private final ContentListClient contentListClient;
    private final ContentItemRepository contentItemRepository;
    private final CaptionRiskEngine riskEngine;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final boolean latestIdentityFallback;

    public IngestionService(IdentityService identityService,
                            TokenExchangeClient tokenExchangeClient,
                            ContentListClient contentListClient,
                            ContentItemRepository contentItemRepository,
                            CaptionRiskEngine riskEngine,
                            PlatformTransactionManager transactionManager,
                            Clock clock,
                            @Value("${app.ingestion.latest-identity-fallback:true}") boolean latestIdentityFallback) {
        this.identityService = identityService;
        this.tokenExchangeClient = tokenExchangeClient;
        this.contentListClient = contentListClient;
        this.contentItemRepository = contentItemRepository;
        this.riskEngine = riskEngine;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.latestIdentityFallback = latestIdentityFallback;
    }

    /**
     * Runs one ingestion pass.
     *
     * @param identityId The caller's identity, or null to use the most recently connected one
     * @param limit      Maximum number of items to request, 1..100
     * @return counts for the run
     */
    public IngestionResult ingest(Long identityId, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BadRequestException("limit must be between 1 and " + MAX_LIMIT);
        }

        Identity identity = resolveIdentity(identityId);
        String accessToken = currentAccessToken(identity);

        List<RemoteContentItem> remoteItems = contentListClient.listRecent(accessToken,
                Math.min(limit, ContentListClient.MAX_PAGE_SIZE));

        IngestionResult result = new IngestionResult();
        result.setFetchedCount(remoteItems.size());

        Set<String> candidateIds = new HashSet<>();
        for (RemoteContentItem remote : remoteItems) {
            if (!remote.isMalformed() && hasText(remote.getExternalItemId())) {
                candidateIds.add(remote.getExternalItemId());
            }
        }
        Set<String> stored = candidateIds.isEmpty()
                ? Collections.emptySet()
                : contentItemRepository.findExistingExternalItemIds(candidateIds);

        LocalDateTime scannedAt = LocalDateTime.now(clock);
        Set<String> seen = new HashSet<>();
        List<ContentItem> staged = new ArrayList<>();
        for (RemoteContentItem remote : remoteItems) {
            String externalItemId = remote.getExternalItemId();
            if (remote.isMalformed()) {
                logger.warn("Rejected malformed remote item {} for identity {}", externalItemId, identity.getId());
                result.setRejectedCount(result.getRejectedCount() + 1);
                continue;
            }
            if (!hasText(externalItemId)) {
                logger.warn("Rejected remote item without id for identity {}", identity.getId());
                result.setRejectedCount(result.getRejectedCount() + 1);
                continue;
            }
            if (stored.contains(externalItemId) || !seen.add(externalItemId)) {
                logger.debug("Skipping already ingested item {}", externalItemId);
                result.setDuplicateCount(result.getDuplicateCount() + 1);
                continue;
            }
            staged.add(toContentItem(identity, remote, scannedAt));
        }

        int saved = persist(staged);
        result.setIngestedCount(saved);
        result.setDuplicateCount(result.getDuplicateCount() + staged.size() - saved);

        logger.info("Ingestion for identity {}: fetched={}, ingested={}, duplicates={}, rejected={}",
                identity.getId(), result.getFetchedCount(), result.getIngestedCount(),
                result.getDuplicateCount(), result.getRejectedCount());
        return result;
    }

    private Identity resolveIdentity(Long identityId) {
        if (identityId != null) {
            return identityService.findById(identityId)
                    .orElseThrow(() -> new NoIdentityException("Connected identity " + identityId + " not found"));
        }
        if (!latestIdentityFallback) {
            throw new NoIdentityException("No session. Connect an account first.");
        }
        return identityService.mostRecentlyConnected()
                .orElseThrow(() -> new NoIdentityException("No connected account. Connect an account first."));
    }

    private String currentAccessToken(Identity identity) {
        LocalDateTime expiresAt = identity.getExpiresAt();
        if (expiresAt == null || expiresAt.isAfter(LocalDateTime.now(clock))) {
            return identity.getAccessToken();
        }
        if (!hasText(identity.getRefreshToken())) {
            logger.warn("Credentials for identity {} expired at {} and no refresh token is stored",
                    identity.getId(), expiresAt);
            return identity.getAccessToken();
        }

        logger.info("Refreshing expired credentials for identity {}", identity.getId());
        TokenSet refreshed = tokenExchangeClient.refresh(identity.getRefreshToken());
        return identityService.updateCredentials(identity.getId(), refreshed).getAccessToken();
    }

    private ContentItem toContentItem(Identity identity, RemoteContentItem remote, LocalDateTime scannedAt) {
        RiskAssessment assessment = riskEngine.assess(remote.getCaption());

        ContentItem item = new ContentItem();
        item.setExternalItemId(remote.getExternalItemId());
        item.setIdentity(identity);
        item.setCaption(remote.getCaption());
        item.setCoverUrl(remote.getCoverUrl());
        item.setCreatedAtRemote(remote.getCreatedAt());
        item.setShareUrl(remote.getShareUrl());
        item.setScannedAt(scannedAt);
        item.setScore(assessment.getScore());
        item.setBand(assessment.getBand());
        item.setFactors(assessment.getFactors());
        item.setDetections(assessment.getDetections());
        item.setRecommendations(assessment.getRecommendations());
        logger.debug("Scored item {}: {} ({})", item.getExternalItemId(), item.getScore(), item.getBand());
        return item;
    }

    /**
     * Saves the staged items in one batch. If another run inserted some of them in the meantime,
     * falls back to one transaction per item and treats constraint violations as duplicates.
     *
     * @return number of rows actually inserted
     */
    private int persist(List<ContentItem> staged) {
        if (staged.isEmpty()) {
            return 0;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> contentItemRepository.saveAllAndFlush(staged));
            return staged.size();
        } catch (DataIntegrityViolationException e) {
            logger.warn("Batch insert hit an existing item, saving {} items one by one", staged.size());
        }

        int saved = 0;
        for (ContentItem item : staged) {
            // ids assigned by the rolled back batch are stale
            item.setId(null);
            try {
                transactionTemplate.executeWithoutResult(status -> contentItemRepository.saveAndFlush(item));
                saved++;
            } catch (DataIntegrityViolationException e) {
                logger.debug("Item {} was ingested concurrently", item.getExternalItemId());
            }
        }
        return saved;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
