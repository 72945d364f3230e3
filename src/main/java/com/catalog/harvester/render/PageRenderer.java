package com.catalog.harvester.render;

import java.time.Duration;

/**
 * Port to a headless-browser renderer.
 * <p>
 * Implementations block until the page is rendered or the attempt budget is spent.
 * A page that cannot be rendered raises a {@link RenderException}; a page that keeps
 * answering with an anti-bot challenge raises a {@link ChallengeDetectedException}.
 * </p>
 */
public interface PageRenderer {

    RenderedPage render(RenderRequest request);

    default String render(final String url, final String waitHint, final Duration timeout) {
        return render(RenderRequest.plain(url, waitHint, timeout)).html();
    }

    default RenderedPage renderWithInteractions(final String url, final Duration timeout) {
        return render(RenderRequest.interactive(url, timeout));
    }
}
