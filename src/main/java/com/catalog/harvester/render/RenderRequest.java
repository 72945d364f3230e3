package com.catalog.harvester.render;

import java.time.Duration;

/**
 * Input of one render.
 *
 * @param url          page to render
 * @param waitSelector selector or text the worker waits for, may be {@code null}
 * @param timeout      render timeout handed to the worker
 * @param interactive  whether the worker must click through colour swatches
 *                     and report per-colour data on the side channel
 */
public record RenderRequest(String url, String waitSelector, Duration timeout, boolean interactive) {

    public static RenderRequest plain(final String url, final String waitSelector, final Duration timeout) {
        return new RenderRequest(url, waitSelector, timeout, false);
    }

    public static RenderRequest interactive(final String url, final Duration timeout) {
        return new RenderRequest(url, null, timeout, true);
    }
}
