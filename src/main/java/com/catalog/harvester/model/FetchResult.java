package com.catalog.harvester.model;

/**
 * Outcome of fetching one URL, after redirects and retries.
 *
 * @param url        the URL that was requested
 * @param finalUrl   the URL that produced the body, after following redirects
 * @param statusCode last HTTP status seen, {@code 0} when no response arrived
 * @param body       response body, {@code null} on failure
 * @param error      short failure description, {@code null} on success
 * @param attempts   number of attempts made (1 when the first try settled it)
 */
public record FetchResult(String url,
                          String finalUrl,
                          int statusCode,
                          String body,
                          String error,
                          int attempts) {

    public static FetchResult failed(final String url, final int statusCode,
                                     final String error, final int attempts) {
        return new FetchResult(url, url, statusCode, null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null && statusCode >= 200 && statusCode < 300;
    }
}
