package com.riskscan.connect.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class RecommendationBuilder {

    public static final int MAX_RECOMMENDATIONS = 4;

    static final String GENERALIZE_PLACES_AND_TIMES =
            "Generalize locations and times: mention the area instead of the exact place, and post after you have left.";
    static final String REMOVE_CONTACT_DETAILS =
            "Remove contact details such as handles, phone numbers and email addresses from the caption.";
    static final String TIGHTEN_PRIVACY_SETTINGS =
            "Tighten your account privacy settings and limit who can see and download your posts.";
    static final String NO_ISSUES =
            "No issues detected. Keep captions generic and avoid contact/location details.";

    static final String UPLOAD_LOW = "Looks safe. Double-check caption for sensitive context.";
    static final String UPLOAD_MEDIUM = "Remove contact details from caption (email/phone).";
    static final String UPLOAD_HIGH = "Strip EXIF data and remove address/contacts before posting.";

    /**
     * Priority-ordered advice for the detected signal classes, without duplicates.
     */
    public List<String> forSignals(Set<RiskSignal> signals) {
        Set<String> recommendations = new LinkedHashSet<>();
        if (signals.contains(RiskSignal.POSSIBLE_LOCATION) || signals.contains(RiskSignal.SCHEDULE_TIME)) {
            recommendations.add(GENERALIZE_PLACES_AND_TIMES);
        }
        if (signals.contains(RiskSignal.CONTACT_INFO)) {
            recommendations.add(REMOVE_CONTACT_DETAILS);
        }
        if (!signals.isEmpty()) {
            recommendations.add(TIGHTEN_PRIVACY_SETTINGS);
        } else {
            recommendations.add(NO_ISSUES);
        }
        return cap(recommendations);
    }

    public List<String> forBand(RiskBand band) {
        switch (band) {
            case HIGH:
                return List.of(UPLOAD_HIGH);
            case MEDIUM:
                return List.of(UPLOAD_MEDIUM);
            default:
                return List.of(UPLOAD_LOW);
        }
    }

    private static List<String> cap(Set<String> recommendations) {
        List<String> list = new ArrayList<>(recommendations);
        return list.size() > MAX_RECOMMENDATIONS ? list.subList(0, MAX_RECOMMENDATIONS) : list;
    }
}
