package com.catalog.harvester.render;

import java.util.List;
import java.util.Locale;

/**
 * Recognises interstitial bot-challenge pages by well-known markers.
 */
public final class ChallengeDetector {

    private static final List<String> MARKERS = List.of(
            "cf-browser-verification",
            "challenge-platform",
            "cf-error-details",
            "checking your browser before accessing",
            "just a moment");

    private ChallengeDetector() {
    }

    public static boolean isChallenge(final String html) {
        if (html == null) {
            return false;
        }
        String lower = html.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(lower::contains);
    }
}
