package com.riskscan.connect.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignalDetectorTest {

    private final SignalDetector detector = new SignalDetector();

    @Test
    void detectsPlaceWorkAndRoutine() {
        assertThat(detector.detect("Working a shift at the campus coffee shop, see you tonight near UNCC!"))
                .containsExactly(RiskSignal.POSSIBLE_LOCATION, RiskSignal.SCHEDULE_TIME, RiskSignal.WORKPLACE);
    }

    @Test
    void plainCaptionHasNoSignals() {
        assertThat(detector.detect("Had a great day!")).isEmpty();
        assertThat(detector.detect("")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }

    @Test
    void locationCues() {
        assertThat(detector.detect("📍 sunset")).containsExactly(RiskSignal.POSSIBLE_LOCATION);
        assertThat(detector.detect("Meet me at 123 Main St")).containsExactly(RiskSignal.POSSIBLE_LOCATION);
        assertThat(detector.detect("brunch near Freedom Park")).containsExactly(RiskSignal.POSSIBLE_LOCATION);
        assertThat(detector.detect("art walk in NoDa")).containsExactly(RiskSignal.POSSIBLE_LOCATION);
    }

    @Test
    void neighborhoodAbbreviationsAreCaseSensitive() {
        assertThat(detector.detect("noda vibes")).isEmpty();
    }

    @Test
    void contactCues() {
        assertThat(detector.detect("follow @casey.runs")).containsExactly(RiskSignal.CONTACT_INFO);
        assertThat(detector.detect("text 704-555-0199")).containsExactly(RiskSignal.CONTACT_INFO);
        assertThat(detector.detect("write to casey@example.com")).containsExactly(RiskSignal.CONTACT_INFO);
    }

    @Test
    void weekdayNeedsAClockTime() {
        assertThat(detector.detect("Friday mood")).isEmpty();
        assertThat(detector.detect("Friday 6:30pm yoga")).containsExactly(RiskSignal.SCHEDULE_TIME);
        assertThat(detector.detect("Saturday at 9am")).containsExactly(RiskSignal.SCHEDULE_TIME);
    }

    @Test
    void workplaceVocabulary() {
        assertThat(detector.detect("about to clock in")).containsExactly(RiskSignal.WORKPLACE);
        assertThat(detector.detect("my manager said hi")).containsExactly(RiskSignal.WORKPLACE);
    }
}
