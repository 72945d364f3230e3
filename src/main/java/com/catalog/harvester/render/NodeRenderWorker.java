package com.catalog.harvester.render;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.exception.ConfigurationException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spawns the Node.js render scripts.
 *
 * <p>Command line: {@code command script url waitSelector timeoutMillis} for plain renders
 * (an empty argument when there is no wait selector) and
 * {@code command interactiveScript url timeoutMillis} for interaction flows. The process
 * is killed when it outlives the render timeout plus the configured grace period.</p>
 */
@Slf4j
@Component
public class NodeRenderWorker implements RenderWorker {

    private static final long DRAIN_WAIT_SECONDS = 5;

    private final HarvestProperties.Render cfg;

    private final ExecutorService streamPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "render-stream");
        t.setDaemon(true);
        return t;
    });

    public NodeRenderWorker(final HarvestProperties props) {
        this.cfg = props.getRender();
    }

    @Override
    public WorkerOutput execute(final RenderRequest request) {
        Path script = Path.of(request.interactive() ? cfg.getInteractiveScript() : cfg.getScript());
        if (!Files.isRegularFile(script)) {
            throw new ConfigurationException("Render script not found: " + script.toAbsolutePath());
        }

        List<String> command = new ArrayList<>(List.of(cfg.getCommand(), script.toString(), request.url()));
        if (!request.interactive()) {
            command.add(Objects.toString(request.waitSelector(), ""));
        }
        command.add(String.valueOf(request.timeout().toMillis()));

        final Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new ConfigurationException("Cannot start render worker '" + cfg.getCommand() + "'", ex);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), streamPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), streamPool);

        long limit = request.timeout().plus(cfg.getGrace()).toMillis();
        try {
            if (!process.waitFor(limit, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Render worker for {} exceeded {} ms and was killed", request.url(), limit);
                return new WorkerOutput(-1, "", collect(stderr), true);
            }
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while rendering " + request.url(), false, ex);
        }

        return new WorkerOutput(process.exitValue(), collect(stdout), collect(stderr), false);
    }

    @PreDestroy
    void shutdown() {
        streamPool.shutdownNow();
    }

    private static String drain(final InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static String collect(final CompletableFuture<String> future) {
        try {
            return future.get(DRAIN_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while reading render output", false, ex);
        } catch (ExecutionException | TimeoutException ex) {
            log.debug("Render output stream could not be read: {}", ex.toString());
            return "";
        }
    }
}
