package com.riskscan.connect.scoring;

import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pattern-based detection of privacy-exposure signals in a caption.
 * Each signal class is reported at most once per caption.
 */
@Component
public class SignalDetector {

    private static final String PIN_EMOJI = "📍";

    private static final Pattern PLACE_WORDS = Pattern.compile(
            "\\b(campus|downtown|uptown|midtown|dorm|mall|neighbou?rhood|university|airport|station)\\b",
            Pattern.CASE_INSENSITIVE);
    // Case-sensitive: "NoDa" and "UNCC" are names, "noda" in running text is not
    private static final Pattern NEIGHBORHOOD_ABBREVIATIONS = Pattern.compile(
            "\\b(UNCC|UNC|NoDa|SouthEnd|CLT|NYC|ATL|DTLA|SoHo|FiDi)\\b");
    private static final Pattern NEAR_PLACE = Pattern.compile(
            "\\b(?i:near)\\s+(?:(?i:the)\\s+)?[A-Z][A-Za-z]+");
    private static final Pattern STREET_ADDRESS = Pattern.compile(
            "\\b\\d{1,5}\\s+[A-Za-z0-9.'-]+\\s+(?:St|Street|Ave|Avenue|Rd|Road|Blvd|Lane|Ln|Drive|Dr|Court|Ct)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HANDLE = Pattern.compile("(?<![\\w.@])@[A-Za-z0-9_.]{2,}");
    private static final Pattern PHONE = Pattern.compile(
            "\\b(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:mon|tues|wednes|thurs|fri|satur|sun)days?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_TIME = Pattern.compile(
            "\\b(?:(?:[01]?\\d|2[0-3]):[0-5]\\d\\s?(?:am|pm)?|(?:1[0-2]|0?[1-9])\\s?(?:am|pm))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUTINE_WORDS = Pattern.compile(
            "\\b(every|tonight)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WORKPLACE_WORDS = Pattern.compile(
            "\\b(work|works|working|shift|shifts|job|office|manager|boss|coworkers?|clock(?:ing)?\\s+in|on\\s+duty)\\b",
            Pattern.CASE_INSENSITIVE);

    public Set<RiskSignal> detect(String caption) {
        Set<RiskSignal> signals = EnumSet.noneOf(RiskSignal.class);
        if (caption == null || caption.isBlank()) {
            return signals;
        }
        if (caption.contains(PIN_EMOJI)
                || anyFind(caption, PLACE_WORDS, NEIGHBORHOOD_ABBREVIATIONS, NEAR_PLACE, STREET_ADDRESS)) {
            signals.add(RiskSignal.POSSIBLE_LOCATION);
        }
        if (anyFind(caption, HANDLE, PHONE, EMAIL)) {
            signals.add(RiskSignal.CONTACT_INFO);
        }
        if ((WEEKDAY.matcher(caption).find() && CLOCK_TIME.matcher(caption).find())
                || ROUTINE_WORDS.matcher(caption).find()) {
            signals.add(RiskSignal.SCHEDULE_TIME);
        }
        if (WORKPLACE_WORDS.matcher(caption).find()) {
            signals.add(RiskSignal.WORKPLACE);
        }
        return signals;
    }

    private static boolean anyFind(String text, Pattern... patterns) {
        for (Pattern pattern : List.of(patterns)) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
