package com.jay.stfunnel.model.enums;

import java.util.Locale;

public enum TriageDecision {
    FAST_TRACK,   // strong score and at least two major positives
    PASS,         // acceptable score, no major concerns
    REJECT,       // major red flags, too many concerns, or over the finalist limit
    NEEDS_REVIEW; // unresolved: routed to a human, never defaulted to PASS/REJECT

    public boolean isFinalist() {
        return this == FAST_TRACK || this == PASS;
    }

    /** MORE_INFO from older audit rows maps onto the single unresolved state. */
    public static TriageDecision parse(String raw) {
        if (raw == null) return NEEDS_REVIEW;
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.equals("MORE_INFO")) return NEEDS_REVIEW;
        return TriageDecision.valueOf(value);
    }
}
