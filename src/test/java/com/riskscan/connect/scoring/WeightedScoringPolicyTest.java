package com.riskscan.connect.scoring;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeightedScoringPolicyTest {

    @Test
    void platformBandBoundaries() {
        WeightedScoringPolicy policy = WeightedScoringPolicy.platform();

        assertThat(policy.bandFor(0)).isEqualTo(RiskBand.LOW);
        assertThat(policy.bandFor(19)).isEqualTo(RiskBand.LOW);
        assertThat(policy.bandFor(20)).isEqualTo(RiskBand.MEDIUM);
        assertThat(policy.bandFor(49)).isEqualTo(RiskBand.MEDIUM);
        assertThat(policy.bandFor(50)).isEqualTo(RiskBand.HIGH);
    }

    @Test
    void uploadBandBoundaries() {
        WeightedScoringPolicy policy = WeightedScoringPolicy.directUpload();

        assertThat(policy.bandFor(59)).isEqualTo(RiskBand.LOW);
        assertThat(policy.bandFor(60)).isEqualTo(RiskBand.MEDIUM);
        assertThat(policy.bandFor(89)).isEqualTo(RiskBand.MEDIUM);
        assertThat(policy.bandFor(90)).isEqualTo(RiskBand.HIGH);
    }

    @Test
    void platformCountsPresenceOnly() {
        ScoringPolicy.PolicyScore score = WeightedScoringPolicy.platform()
                .score(Map.of("contact_info", 3, "workplace", 1));

        assertThat(score.score()).isEqualTo(40);
        assertThat(score.band()).isEqualTo(RiskBand.MEDIUM);
    }

    @Test
    void allPlatformSignalsSumWithoutCap() {
        ScoringPolicy.PolicyScore score = WeightedScoringPolicy.platform().score(Map.of(
                "possible_location", 1, "contact_info", 1, "schedule_time", 1, "workplace", 1));

        assertThat(score.score()).isEqualTo(100);
        assertThat(score.reasons()).hasSize(4);
    }

    @Test
    void unknownSignalsAreIgnored() {
        ScoringPolicy.PolicyScore score = WeightedScoringPolicy.platform().score(Map.of("gps", 2));

        assertThat(score.score()).isZero();
        assertThat(score.reasons()).isEmpty();
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThatThrownBy(() -> new WeightedScoringPolicy("broken", Map.of("x", 1), 1, 50, 20))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeightedScoringPolicy("broken", Map.of("x", 1), 0, 20, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
