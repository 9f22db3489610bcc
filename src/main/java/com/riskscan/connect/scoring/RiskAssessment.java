package com.riskscan.connect.scoring;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one caption.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    private String policy;
    private int score;
    private RiskBand band;
    private Map<String, Object> factors; // captionLength, ocrCoverText (reserved, always null)
    private List<String> detections;
    private List<String> recommendations;
    private List<String> reasons;
}
