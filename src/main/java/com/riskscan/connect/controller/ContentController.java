package com.riskscan.connect.controller;

import com.riskscan.connect.dto.ContentItemView;
import com.riskscan.connect.dto.ContentPageResponse;
import com.riskscan.connect.service.ContentQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/content")
public class ContentController {

    private final ContentQueryService contentQueryService;

    public ContentController(ContentQueryService contentQueryService) {
        this.contentQueryService = contentQueryService;
    }

    @GetMapping
    public ResponseEntity<ContentPageResponse> list(
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "pageSize", defaultValue = "20") int pageSize) {
        return ResponseEntity.ok(contentQueryService.list(page, pageSize));
    }

    @GetMapping("/{externalItemId}")
    public ResponseEntity<ContentItemView> get(@PathVariable String externalItemId) {
        return ResponseEntity.ok(contentQueryService.get(externalItemId));
    }
}
