package com.catalog.harvester.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * URL-safe slug derivation shared by the extractor and the catalog sync.
 */
public final class Slugs {

    private Slugs() {
    }

    /**
     * Lower-cases, strips accents, replaces every run of non-alphanumerics with a
     * single dash and trims leading/trailing dashes.
     *
     * @param value free text, may be {@code null}
     * @return the slug, empty for blank input
     */
    public static String slugify(final String value) {
        if (StringUtils.isBlank(value)) {
            return "";
        }
        String plain = StringUtils.stripAccents(value.trim()).toLowerCase(Locale.ROOT);
        return StringUtils.strip(plain.replaceAll("[^a-z0-9]+", "-"), "-");
    }
}
