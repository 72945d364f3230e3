package com.catalog.harvester.fetch;

import org.springframework.http.HttpMethod;

/**
 * One request handed to the {@link FetchEngine}.
 *
 * @param url      absolute URL
 * @param method   GET or POST
 * @param jsonBody request body for POST, {@code null} otherwise
 * @param json     whether the caller expects a JSON answer (drives the Accept header)
 */
public record FetchRequest(String url, HttpMethod method, String jsonBody, boolean json) {

    public static FetchRequest page(final String url) {
        return new FetchRequest(url, HttpMethod.GET, null, false);
    }

    public static FetchRequest api(final String url) {
        return new FetchRequest(url, HttpMethod.GET, null, true);
    }

    public static FetchRequest postJson(final String url, final String body) {
        return new FetchRequest(url, HttpMethod.POST, body, true);
    }
}
