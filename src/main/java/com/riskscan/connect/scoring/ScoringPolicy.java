package com.riskscan.connect.scoring;

import java.util.List;
import java.util.Map;

/**
 * Turns per-signal occurrence counts into a numeric risk score and a band.
 */
public interface ScoringPolicy {

    String getName();

    /**
     * @param signalCounts occurrences keyed by signal tag; unknown tags are ignored
     */
    PolicyScore score(Map<String, Integer> signalCounts);

    record PolicyScore(int score, RiskBand band, List<String> reasons) {}
}
