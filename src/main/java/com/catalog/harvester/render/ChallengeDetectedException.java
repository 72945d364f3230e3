package com.catalog.harvester.render;

/**
 * The renderer returned an anti-bot challenge page instead of the product.
 */
public class ChallengeDetectedException extends RenderException {

    public ChallengeDetectedException(final String url) {
        super("Bot challenge detected for " + url, true);
    }
}
