package com.riskscan.connect.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts email, phone and street-address occurrences in a directly uploaded caption.
 * Unlike {@link SignalDetector}, every occurrence is reported.
 */
@Component
public class CaptionPiiScanner {

    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String ADDRESS = "address";

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "\\b(?:\\+?1[-.\\s]?)?(?:\\(?\\d{3}\\)?[-.\\s]?)?\\d{3}[-.\\s]?\\d{4}\\b");
    private static final Pattern ADDRESS_PATTERN = Pattern.compile(
            "\\b\\d{1,5}\\s+[A-Za-z0-9.'-]+\\s+(?:St|Street|Ave|Avenue|Rd|Road|Blvd|Lane|Ln|Drive|Dr|Court|Ct)\\b",
            Pattern.CASE_INSENSITIVE);

    public record PiiDetection(String type, String value) {}

    public List<PiiDetection> scan(String caption) {
        List<PiiDetection> detections = new ArrayList<>();
        if (caption == null || caption.isEmpty()) {
            return detections;
        }
        collect(caption, EMAIL_PATTERN, EMAIL, detections);
        collect(caption, PHONE_PATTERN, PHONE, detections);
        collect(caption, ADDRESS_PATTERN, ADDRESS, detections);
        return detections;
    }

    private static void collect(String caption, Pattern pattern, String type, List<PiiDetection> into) {
        Matcher matcher = pattern.matcher(caption);
        while (matcher.find()) {
            into.add(new PiiDetection(type, matcher.group()));
        }
    }
}
