package com.riskscan.connect.service;

import com.riskscan.connect.dto.ContentItemView;
import com.riskscan.connect.dto.ContentPageResponse;
import com.riskscan.connect.exception.BadRequestException;
import com.riskscan.connect.exception.ContentNotFoundException;
import com.riskscan.connect.repository.ContentItemRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read access to ingested content, newest first.
 */
@Service
@Transactional(readOnly = true)
public class ContentQueryService {

    public static final int MAX_PAGE_SIZE = 100;

    private final ContentItemRepository contentItemRepository;

    public ContentQueryService(ContentItemRepository contentItemRepository) {
        this.contentItemRepository = contentItemRepository;
    }

    /**
     * @param page     1-based page number
     * @param pageSize items per page, 1..100
     */
    public ContentPageResponse list(int page, int pageSize) {
        if (page < 1) {
            throw new BadRequestException("page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BadRequestException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }

        Page<ContentItemView> result = contentItemRepository
                .findAll(PageRequest.of(page - 1, pageSize, Sort.by(Sort.Direction.DESC, "id")))
                .map(ContentItemView::from);
        List<ContentItemView> items = result.getContent();
        return new ContentPageResponse(items, page, pageSize, result.getTotalElements());
    }

    public ContentItemView get(String externalItemId) {
        return contentItemRepository.findByExternalItemId(externalItemId)
                .map(ContentItemView::from)
                .orElseThrow(() -> new ContentNotFoundException("Content item " + externalItemId + " not found"));
    }
}
