package com.riskscan.connect.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionRiskEngineTest {

    private final CaptionRiskEngine engine =
            new CaptionRiskEngine(new SignalDetector(), new CaptionPiiScanner(), new RecommendationBuilder());

    @Test
    void workplaceScheduleAndLocationScoreHigh() {
        RiskAssessment assessment =
                engine.assess("Working a shift at the campus coffee shop, see you tonight near UNCC!");

        assertThat(assessment.getPolicy()).isEqualTo(WeightedScoringPolicy.PLATFORM);
        assertThat(assessment.getScore()).isEqualTo(75);
        assertThat(assessment.getBand()).isEqualTo(RiskBand.HIGH);
        assertThat(assessment.getDetections()).containsExactly("possible_location", "schedule_time", "workplace");
        assertThat(assessment.getRecommendations()).containsExactly(
                RecommendationBuilder.GENERALIZE_PLACES_AND_TIMES,
                RecommendationBuilder.TIGHTEN_PRIVACY_SETTINGS);
        assertThat(assessment.getReasons()).containsExactly(
                "POSSIBLE_LOCATION detected x1 (+40)",
                "SCHEDULE_TIME detected x1 (+20)",
                "WORKPLACE detected x1 (+15)");
    }

    @Test
    void cleanCaptionGetsGenericAdvice() {
        RiskAssessment assessment = engine.assess("Had a great day!");

        assertThat(assessment.getScore()).isZero();
        assertThat(assessment.getBand()).isEqualTo(RiskBand.LOW);
        assertThat(assessment.getDetections()).isEmpty();
        assertThat(assessment.getRecommendations())
                .containsExactly("No issues detected. Keep captions generic and avoid contact/location details.");
        assertThat(assessment.getReasons()).isEmpty();
    }

    @Test
    void contactOnlyIsMedium() {
        RiskAssessment assessment = engine.assess("DM me @casey_runs for the playlist");

        assertThat(assessment.getScore()).isEqualTo(25);
        assertThat(assessment.getBand()).isEqualTo(RiskBand.MEDIUM);
        assertThat(assessment.getRecommendations()).containsExactly(
                RecommendationBuilder.REMOVE_CONTACT_DETAILS,
                RecommendationBuilder.TIGHTEN_PRIVACY_SETTINGS);
    }

    @Test
    void factorsCountCodePoints() {
        RiskAssessment assessment = engine.assess("📍 here");

        assertThat(assessment.getFactors())
                .containsEntry("captionLength", 6)
                .containsEntry("ocrCoverText", null);
    }

    @Test
    void nullCaptionIsScoredAsEmpty() {
        RiskAssessment assessment = engine.assess(null);

        assertThat(assessment.getScore()).isZero();
        assertThat(assessment.getFactors()).containsEntry("captionLength", 0);
    }

    @Test
    void assessmentIsDeterministic() {
        String caption = "Every Friday 6pm at 42 Oak Street, text 704-555-0199 after my shift";

        RiskAssessment first = engine.assess(caption);
        RiskAssessment second = engine.assess(caption);

        assertThat(second).isEqualTo(first);
        assertThat(first.getScore()).isEqualTo(100);
        assertThat(first.getRecommendations()).hasSizeLessThanOrEqualTo(RecommendationBuilder.MAX_RECOMMENDATIONS);
    }

    @Test
    void uploadModeCountsContactDetails() {
        RiskAssessment assessment = engine.assessUpload("Call me at 704-555-0199 or email a@b.com", null);

        assertThat(assessment.getPolicy()).isEqualTo(WeightedScoringPolicy.DIRECT_UPLOAD);
        assertThat(assessment.getScore()).isEqualTo(40);
        assertThat(assessment.getBand()).isEqualTo(RiskBand.LOW);
        assertThat(assessment.getDetections()).containsExactly("email", "phone");
        assertThat(assessment.getRecommendations()).containsExactly(RecommendationBuilder.UPLOAD_LOW);
    }

    @Test
    void uploadModeAddsGpsAndAddress() {
        RiskAssessment assessment = engine.assessUpload("Drop by 42 Oak Street, call 704-555-0199",
                new CaptionRiskEngine.GpsCoordinate(35.3076, -80.7351));

        assertThat(assessment.getScore()).isEqualTo(90);
        assertThat(assessment.getBand()).isEqualTo(RiskBand.HIGH);
        assertThat(assessment.getDetections()).containsExactlyInAnyOrder("phone", "address", "gps");
        assertThat(assessment.getRecommendations()).containsExactly(RecommendationBuilder.UPLOAD_HIGH);
    }

    @Test
    void uploadModeCapsRepeatedDetections() {
        RiskAssessment assessment = engine.assessUpload("a@b.com c@d.com e@f.com g@h.com", null);

        assertThat(assessment.getScore()).isEqualTo(60);
        assertThat(assessment.getBand()).isEqualTo(RiskBand.MEDIUM);
        assertThat(assessment.getReasons()).isEqualTo(List.of("EMAIL detected x4 (+60)"));
        assertThat(assessment.getRecommendations()).containsExactly(RecommendationBuilder.UPLOAD_MEDIUM);
    }
}
