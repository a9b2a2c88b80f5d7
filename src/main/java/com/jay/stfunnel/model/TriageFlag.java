package com.jay.stfunnel.model;

import java.util.List;
import java.util.Locale;

/**
 * A single red or green triage signal. Major flags drive the REJECT / FAST_TRACK rules.
 */
public record TriageFlag(String label, boolean major) {

    private static final List<String> MAJOR_RED_MARKERS = List.of(
        "extreme short", "very high beta", "consecutive earnings misses", "negative analyst consensus",
        "negative consensus");
    private static final List<String> MAJOR_GREEN_MARKERS = List.of(
        "strong analyst consensus", "strong consensus", "high target upside", "earnings beat");

    public static TriageFlag major(String label) { return new TriageFlag(label, true); }
    public static TriageFlag minor(String label) { return new TriageFlag(label, false); }

    /** Classifies a free-text red flag label by keyword. */
    public static TriageFlag red(String label) {
        return new TriageFlag(label, containsAny(label, MAJOR_RED_MARKERS));
    }

    /** Classifies a free-text green flag label by keyword. */
    public static TriageFlag green(String label) {
        return new TriageFlag(label, containsAny(label, MAJOR_GREEN_MARKERS));
    }

    private static boolean containsAny(String label, List<String> markers) {
        if (label == null) return false;
        String lower = label.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
