package com.catalog.harvester.render;

/**
 * Runs one headless-browser render, out of process.
 * <p>
 * Throws {@link com.catalog.harvester.exception.ConfigurationException} when the
 * worker itself cannot be started (missing executable or script).
 * </p>
 */
@FunctionalInterface
public interface RenderWorker {

    WorkerOutput execute(RenderRequest request);
}
