package com.catalog.harvester.render;

/**
 * Raw result of one render-worker process.
 *
 * @param exitCode process exit code, {@code -1} when it was killed
 * @param stdout   rendered HTML
 * @param stderr   diagnostics and side-channel blocks
 * @param timedOut whether the process outlived its timeout plus grace
 */
public record WorkerOutput(int exitCode, String stdout, String stderr, boolean timedOut) {
}
