package com.riskscan.connect.scoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weight-table policy: each signal adds {@code weight * min(count, perSignalCap)}, and the
 * total is banded against the medium and high thresholds. The total itself is never capped.
 */
public class WeightedScoringPolicy implements ScoringPolicy {

    public static final String PLATFORM = "platform";
    public static final String DIRECT_UPLOAD = "upload";

    private final String name;
    private final Map<String, Integer> weights;
    private final int perSignalCap;
    private final int mediumThreshold;
    private final int highThreshold;

    public WeightedScoringPolicy(String name, Map<String, Integer> weights, int perSignalCap,
                                 int mediumThreshold, int highThreshold) {
        if (perSignalCap < 1) {
            throw new IllegalArgumentException("perSignalCap must be at least 1");
        }
        if (mediumThreshold > highThreshold) {
            throw new IllegalArgumentException("mediumThreshold must not exceed highThreshold");
        }
        this.name = name;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.perSignalCap = perSignalCap;
        this.mediumThreshold = mediumThreshold;
        this.highThreshold = highThreshold;
    }

    /**
     * Presence-only scoring for captions pulled from the connected platform.
     */
    public static WeightedScoringPolicy platform() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put(RiskSignal.POSSIBLE_LOCATION.getTag(), 40);
        weights.put(RiskSignal.CONTACT_INFO.getTag(), 25);
        weights.put(RiskSignal.SCHEDULE_TIME.getTag(), 20);
        weights.put(RiskSignal.WORKPLACE.getTag(), 15);
        return new WeightedScoringPolicy(PLATFORM, weights, 1, 20, 50);
    }

    /**
     * Occurrence-counted scoring for directly uploaded captions plus image GPS metadata.
     */
    public static WeightedScoringPolicy directUpload() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put(CaptionPiiScanner.EMAIL, 20);
        weights.put(CaptionPiiScanner.PHONE, 20);
        weights.put(CaptionPiiScanner.ADDRESS, 30);
        weights.put(CaptionRiskEngine.GPS, 40);
        return new WeightedScoringPolicy(DIRECT_UPLOAD, weights, 3, 60, 90);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PolicyScore score(Map<String, Integer> signalCounts) {
        int total = 0;
        List<String> reasons = new ArrayList<>();
        for (Map.Entry<String, Integer> weight : weights.entrySet()) {
            int count = signalCounts.getOrDefault(weight.getKey(), 0);
            if (count <= 0) {
                continue;
            }
            int added = weight.getValue() * Math.min(count, perSignalCap);
            total += added;
            reasons.add(String.format("%s detected x%d (+%d)", weight.getKey().toUpperCase(), count, added));
        }
        return new PolicyScore(total, bandFor(total), reasons);
    }

    RiskBand bandFor(int score) {
        if (score >= highThreshold) {
            return RiskBand.HIGH;
        }
        if (score >= mediumThreshold) {
            return RiskBand.MEDIUM;
        }
        return RiskBand.LOW;
    }
}
