package com.catalog.harvester.ai;

/**
 * Translates product copy into the configured target language.
 */
public interface Translator {

    /**
     * @return {@code true} when translation is configured
     */
    boolean isEnabled();

    /**
     * @param text source text, may be blank
     * @return the translation, {@code null} when it could not be obtained
     */
    String translate(String text);
}
