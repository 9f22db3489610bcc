package com.riskscan.connect.controller;

import com.riskscan.connect.dto.IngestionResult;
import com.riskscan.connect.security.CurrentIdentity;
import com.riskscan.connect.service.IngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ingestion")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Ingests recent posts for the caller's identity, or the latest connected one when there is no session.
     */
    @PostMapping("/run")
    public ResponseEntity<IngestionResult> run(@RequestParam(value = "limit", defaultValue = "25") int limit) {
        return ResponseEntity.ok(ingestionService.ingest(CurrentIdentity.id(), limit));
    }
}
