package com.catalog.harvester.render;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Output of a successful render.
 *
 * @param url         the rendered URL
 * @param html        final DOM snapshot; reflects only the last interaction state
 * @param sideChannel merged side-channel JSON, {@code null} when the worker emitted none
 * @param attempts    attempts used
 */
public record RenderedPage(String url, String html, JsonNode sideChannel, int attempts) {

    public boolean hasSideChannel() {
        return sideChannel != null && !sideChannel.isEmpty();
    }
}
