package com.catalog.harvester.collect;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;

/**
 * Link normalisation shared by the collectors.
 */
@Slf4j
final class Links {

    private Links() {
    }

    /**
     * Resolves {@code href} against {@code baseUrl} and drops the fragment.
     *
     * @return the absolute URL, or {@code null} when it cannot be resolved
     */
    static String absolute(final String baseUrl, final String href) {
        if (StringUtils.isBlank(href)) {
            return null;
        }
        String trimmed = href.trim();
        try {
            URI resolved = StringUtils.isBlank(baseUrl)
                    ? URI.create(trimmed)
                    : URI.create(baseUrl.trim()).resolve(trimmed);
            if (!resolved.isAbsolute()) {
                return null;
            }
            String url = resolved.toString();
            int hash = url.indexOf('#');
            return hash >= 0 ? url.substring(0, hash) : url;
        } catch (IllegalArgumentException ex) {
            log.debug("Skipping unresolvable link '{}': {}", trimmed, ex.getMessage());
            return null;
        }
    }
}
