package com.riskscan.connect.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detection and scoring of caption text. Stateless and deterministic: the same caption always
 * produces the same assessment.
 */
@Component
public class CaptionRiskEngine {

    public static final String GPS = "gps";

    private final SignalDetector signalDetector;
    private final CaptionPiiScanner piiScanner;
    private final RecommendationBuilder recommendationBuilder;
    private final ScoringPolicy platformPolicy = WeightedScoringPolicy.platform();
    private final ScoringPolicy uploadPolicy = WeightedScoringPolicy.directUpload();

    public CaptionRiskEngine(SignalDetector signalDetector,
                             CaptionPiiScanner piiScanner,
                             RecommendationBuilder recommendationBuilder) {
        this.signalDetector = signalDetector;
        this.piiScanner = piiScanner;
        this.recommendationBuilder = recommendationBuilder;
    }

    /**
     * Scores a caption pulled from the connected platform.
     */
    public RiskAssessment assess(String caption) {
        Set<RiskSignal> signals = signalDetector.detect(caption);

        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> detections = new ArrayList<>();
        for (RiskSignal signal : signals) {
            counts.put(signal.getTag(), 1);
            detections.add(signal.getTag());
        }

        ScoringPolicy.PolicyScore result = platformPolicy.score(counts);
        return new RiskAssessment(platformPolicy.getName(), result.score(), result.band(), factors(caption),
                detections, recommendationBuilder.forSignals(signals), result.reasons());
    }

    /**
     * Scores a directly uploaded caption. {@code gps} is the coordinate read from the image, or null.
     */
    public RiskAssessment assessUpload(String caption, GpsCoordinate gps) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CaptionPiiScanner.PiiDetection detection : piiScanner.scan(caption)) {
            counts.merge(detection.type(), 1, Integer::sum);
        }
        if (gps != null) {
            counts.put(GPS, 1);
        }

        ScoringPolicy.PolicyScore result = uploadPolicy.score(counts);
        return new RiskAssessment(uploadPolicy.getName(), result.score(), result.band(), factors(caption),
                new ArrayList<>(counts.keySet()), recommendationBuilder.forBand(result.band()), result.reasons());
    }

    private static Map<String, Object> factors(String caption) {
        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("captionLength", caption == null ? 0 : caption.codePointCount(0, caption.length()));
        factors.put("ocrCoverText", null);
        return factors;
    }

    public record GpsCoordinate(double latitude, double longitude) {}
}
