package com.riskscan.connect.controller;

import com.riskscan.connect.dto.ScanRequest;
import com.riskscan.connect.exception.BadRequestException;
import com.riskscan.connect.scoring.CaptionRiskEngine;
import com.riskscan.connect.scoring.RiskAssessment;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scores a caption without storing anything.
 */
@RestController
@RequestMapping("/api/scan")
public class ScanController {

    private final CaptionRiskEngine riskEngine;

    public ScanController(CaptionRiskEngine riskEngine) {
        this.riskEngine = riskEngine;
    }

    @PostMapping
    public ResponseEntity<RiskAssessment> scan(@Valid @RequestBody ScanRequest request) {
        if (!"upload".equals(request.getMode())) {
            return ResponseEntity.ok(riskEngine.assess(request.getCaption()));
        }

        CaptionRiskEngine.GpsCoordinate gps = null;
        if (request.getGpsLatitude() != null || request.getGpsLongitude() != null) {
            if (request.getGpsLatitude() == null || request.getGpsLongitude() == null) {
                throw new BadRequestException("gpsLatitude and gpsLongitude must be given together");
            }
            gps = new CaptionRiskEngine.GpsCoordinate(request.getGpsLatitude(), request.getGpsLongitude());
        }
        return ResponseEntity.ok(riskEngine.assessUpload(request.getCaption(), gps));
    }
}
