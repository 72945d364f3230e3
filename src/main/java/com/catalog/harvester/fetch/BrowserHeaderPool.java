package com.catalog.harvester.fetch;

import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of realistic browser header profiles, handed out round-robin.
 * Referer and Origin are derived from the target URL's origin.
 */
public class BrowserHeaderPool {

    private static final String ACCEPT_HTML =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";

    private static final String ACCEPT_JSON = "application/json, text/plain, */*";

    private record Profile(String userAgent, String acceptLanguage, String secChUa, String platform) {
    }

    private static final List<Profile> PROFILES = List.of(
            new Profile("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36",
                    "en-US,en;q=0.9",
                    "\"Chromium\";v=\"125\", \"Google Chrome\";v=\"125\", \"Not.A/Brand\";v=\"24\"",
                    "\"Windows\""),
            new Profile("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
                    "en-US,en;q=0.8",
                    "\"Chromium\";v=\"124\", \"Google Chrome\";v=\"124\", \"Not-A.Brand\";v=\"99\"",
                    "\"macOS\""),
            new Profile("Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
                    "en-GB,en;q=0.9",
                    "\"Chromium\";v=\"124\", \"Not-A.Brand\";v=\"99\"",
                    "\"Linux\""));

    private final AtomicInteger cursor = new AtomicInteger();

    /**
     * Writes the next profile's headers for a request to {@code url}.
     *
     * @param headers request headers to fill
     * @param url     target URL
     * @param json    whether a JSON answer is expected
     */
    public void apply(final HttpHeaders headers, final String url, final boolean json) {
        Profile p = PROFILES.get(Math.floorMod(cursor.getAndIncrement(), PROFILES.size()));
        String origin = originOf(url);

        headers.set(HttpHeaders.USER_AGENT, p.userAgent());
        headers.set(HttpHeaders.ACCEPT, json ? ACCEPT_JSON : ACCEPT_HTML);
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, p.acceptLanguage());
        headers.set("Sec-CH-UA", p.secChUa());
        headers.set("Sec-CH-UA-Mobile", "?0");
        headers.set("Sec-CH-UA-Platform", p.platform());
        if (origin != null) {
            headers.set(HttpHeaders.REFERER, origin + "/");
            headers.set(HttpHeaders.ORIGIN, origin);
        }
    }

    static String originOf(final String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
