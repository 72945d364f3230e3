package com.catalog.harvester.service;

import com.catalog.harvester.ai.Translator;
import com.catalog.harvester.collect.LinkCollectorRegistry;
import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.config.SiteConfigFactory;
import com.catalog.harvester.exception.ConfigurationException;
import com.catalog.harvester.exception.HarvestException;
import com.catalog.harvester.fetch.FetchEngine;
import com.catalog.harvester.fetch.Pacing;
import com.catalog.harvester.media.ImageDownloader;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.FetchResult;
import com.catalog.harvester.model.ScrapeJob;
import com.catalog.harvester.model.SyncMapping;
import com.catalog.harvester.model.SyncStatus;
import com.catalog.harvester.parser.ExtractionContext;
import com.catalog.harvester.parser.ProductExtractor;
import com.catalog.harvester.render.PageRenderer;
import com.catalog.harvester.render.RenderException;
import com.catalog.harvester.render.RenderRequest;
import com.catalog.harvester.render.RenderedPage;
import com.catalog.harvester.sync.CatalogSyncService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h2>Harvest orchestrator</h2>
 *
 * <p>Runs one harvest job for one site: collect detail links, then in batches of
 * {@code harvester.orchestrator.batch-size} fetch (or render) the detail pages, extract,
 * enrich from colour pages, store images, translate, store the product and, when asked,
 * push it to the remote catalog.</p>
 *
 * <p>Failures of a single page or product are counted and logged; the batch goes on. Only a
 * {@link ConfigurationException} aborts the job, which is then marked failed and the
 * exception rethrown. Any other unexpected error also fails the job but stays inside it.</p>
 */
@Slf4j
@Service
public class HarvestOrchestrator {

    private final SiteConfigFactory sites;

    private final LinkCollectorRegistry collectors;

    private final FetchEngine fetchEngine;

    private final PageRenderer renderer;

    private final ProductExtractor extractor;

    private final ColourPageEnricher enricher;

    private final ImageDownloader images;

    private final Translator translator;

    private final ProductStore products;

    private final CatalogSyncService syncService;

    private final JobRegistry jobs;

    private final HarvestProperties props;

    private final ExecutorService jobPool;

    /** Set once the first detail response has been dumped. */
    private final AtomicBoolean dumped = new AtomicBoolean();

    public HarvestOrchestrator(final SiteConfigFactory sites,
                               final LinkCollectorRegistry collectors,
                               final FetchEngine fetchEngine,
                               final PageRenderer renderer,
                               final ProductExtractor extractor,
                               final ColourPageEnricher enricher,
                               final ImageDownloader images,
                               final Translator translator,
                               final ProductStore products,
                               final CatalogSyncService syncService,
                               final JobRegistry jobs,
                               final HarvestProperties props) {
        this.sites = sites;
        this.collectors = collectors;
        this.fetchEngine = fetchEngine;
        this.renderer = renderer;
        this.extractor = extractor;
        this.enricher = enricher;
        this.images = images;
        this.translator = translator;
        this.products = products;
        this.syncService = syncService;
        this.jobs = jobs;
        this.props = props;
        this.jobPool = Executors.newFixedThreadPool(Math.max(1, props.getOrchestrator().getJobThreads()),
                new CustomizableThreadFactory("harvest-job-"));
    }

    @PreDestroy
    void shutdown() {
        jobPool.shutdownNow();
    }

    /**
     * Registers a job and runs it in the background.
     *
     * @param maxItems per-request cap on detail URLs, {@code 0} for the configured default
     * @throws ConfigurationException when the site profile is unusable; no job is registered then
     */
    public ScrapeJob submit(final String siteId, final int maxItems, final boolean sync) {
        sites.forSite(siteId);
        ScrapeJob job = jobs.create(siteId);
        jobPool.execute(() -> {
            try {
                execute(job, maxItems, sync);
            } catch (ConfigurationException ex) {
                log.error("Job #{} for {} aborted: {}", job.getId(), siteId, ex.getMessage());
            }
        });
        log.info("Job #{} for {} submitted (maxItems={}, sync={})", job.getId(), siteId, maxItems, sync);
        return job;
    }

    /** Registers a job and runs it on the calling thread. */
    public ScrapeJob run(final String siteId, final int maxItems, final boolean sync) {
        ScrapeJob job = jobs.create(siteId);
        execute(job, maxItems, sync);
        return job;
    }

    /**
     * Runs a registered job to completion and records the outcome on it.
     *
     * @throws ConfigurationException after marking the job failed
     */
    public void execute(final ScrapeJob job, final int maxItems, final boolean sync) {
        HarvestProperties.Orchestrator cfg = props.getOrchestrator();
        Totals totals = new Totals();
        job.markRunning();
        log.info("Job #{} for {} running", job.getId(), job.getSiteId());
        try {
            SiteCfg site = sites.forSite(job.getSiteId());
            List<String> urls = new ArrayList<>(collectors.forSite(site)
                    .collect(site, site.getListing().getSeedUrl(), site.getListing().getConcurrency()));
            int cap = maxItems > 0 ? maxItems : cfg.getMaxItems();
            if (cap > 0 && urls.size() > cap) {
                urls = urls.subList(0, cap);
            }
            job.setTotalFound(urls.size());
            if (urls.isEmpty()) {
                log.warn("Job #{}: no detail links found for {}", job.getId(), job.getSiteId());
            }

            List<List<String>> batches = FetchEngine.partition(urls, Math.max(1, cfg.getBatchSize()));
            for (int i = 0; i < batches.size(); i++) {
                processBatch(job.getSiteId(), site, batches.get(i), sync, totals);
                totals.copyTo(job);
                log.info("Job #{} batch {}/{} done: created={}, updated={}, failed={}", job.getId(), i + 1,
                        batches.size(), totals.created.get(), totals.updated.get(), totals.failed.get());
                if (i < batches.size() - 1) {
                    Pacing.pause(cfg.getBatchSleep());
                }
            }
            totals.copyTo(job);
            job.markSuccess();
            log.info("Job #{} for {} finished: found={}, created={}, updated={}, failed={}", job.getId(),
                    job.getSiteId(), job.getTotalFound(), job.getTotalCreated(), job.getTotalUpdated(),
                    job.getTotalFailed());
        } catch (ConfigurationException ex) {
            totals.copyTo(job);
            job.markFailed(ex.getMessage(), cfg.getErrorMessageLimit());
            log.error("Job #{} for {} failed on configuration: {}", job.getId(), job.getSiteId(), ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            totals.copyTo(job);
            job.markFailed(Objects.toString(ex.getMessage(), ex.getClass().getName()), cfg.getErrorMessageLimit());
            log.error("Job #{} for {} failed", job.getId(), job.getSiteId(), ex);
        }
    }

    /* ---- batch -------------------------------------------------------- */

    private record DetailPage(String url, String finalUrl, String body, JsonNode sideChannel, String error) {

        boolean ok() {
            return error == null && StringUtils.isNotBlank(body);
        }
    }

    private void processBatch(final String siteId, final SiteCfg site, final List<String> batch,
                              final boolean sync, final Totals totals) {
        List<DetailPage> pages = site.isRenderDetails() ? render(site, batch) : fetch(site, batch);
        for (DetailPage page : pages) {
            if (!page.ok()) {
                totals.failed.incrementAndGet();
                log.warn("Detail {} skipped: {}", page.url(), Objects.toString(page.error(), "empty body"));
                continue;
            }
            dumpOnce(siteId, page);
            processProduct(siteId, site, page, sync, totals);
        }
    }

    private List<DetailPage> fetch(final SiteCfg site, final List<String> urls) {
        Map<String, FetchResult> results = fetchEngine.fetchBatch(urls, Math.max(1, site.getDetailConcurrency()));
        List<DetailPage> pages = new ArrayList<>();
        results.forEach((url, r) -> pages.add(r.isSuccess()
                ? new DetailPage(url, r.finalUrl(), r.body(), null, null)
                : new DetailPage(url, r.finalUrl(), null, null,
                        Objects.toString(r.error(), "HTTP " + r.statusCode()))));
        return pages;
    }

    private List<DetailPage> render(final SiteCfg site, final List<String> urls) {
        int width = Math.max(1, props.getRender().getConcurrency());
        List<DetailPage> pages = Flux.fromIterable(urls)
                .flatMapSequential(url -> Mono.fromCallable(() -> renderOne(site, url))
                        .subscribeOn(Schedulers.boundedElastic()), width)
                .collectList()
                .block();
        return pages == null ? List.of() : pages;
    }

    private DetailPage renderOne(final SiteCfg site, final String url) {
        RenderRequest request = site.isInteractiveRender()
                ? RenderRequest.interactive(url, site.getRenderTimeout())
                : RenderRequest.plain(url, site.getDetailWaitSelector(), site.getRenderTimeout());
        try {
            RenderedPage page = renderer.render(request);
            return new DetailPage(url, url, page.html(), page.sideChannel(), null);
        } catch (RenderException ex) {
            return new DetailPage(url, url, null, null, ex.getMessage());
        }
    }

    /* ---- product ------------------------------------------------------ */

    private void processProduct(final String siteId, final SiteCfg site, final DetailPage page,
                                final boolean sync, final Totals totals) {
        try {
            ExtractionContext ctx = new ExtractionContext(siteId, site, page.url(), page.finalUrl(), page.sideChannel());
            CanonicalProduct product = extractor.extract(page.body(), ctx);

            Document doc = page.body().trim().startsWith("<") ? Jsoup.parse(page.body(), ctx.pageUrl()) : null;
            product = enricher.enrich(product, doc, site);
            if (site.isDownloadImages()) {
                product = images.localise(product);
            }
            if (site.isTranslateDescription() && translator.isEnabled()) {
                product = translated(product);
            }

            boolean created = products.upsert(product);
            if (created) {
                totals.created.incrementAndGet();
            } else {
                totals.updated.incrementAndGet();
            }
            log.debug("{} {}:{} ({})", created ? "Created" : "Updated", siteId, product.getExternalId(), page.url());

            if (sync) {
                SyncMapping mapping = syncService.sync(product);
                if (mapping.getLastSyncStatus() == SyncStatus.FAILED) {
                    totals.failed.incrementAndGet();
                }
            }
        } catch (ConfigurationException ex) {
            throw ex;
        } catch (HarvestException ex) {
            totals.failed.incrementAndGet();
            log.warn("Product {} failed: {}", page.url(), ex.getMessage());
        } catch (RuntimeException ex) {
            totals.failed.incrementAndGet();
            log.warn("Product {} failed unexpectedly", page.url(), ex);
        }
    }

    private CanonicalProduct translated(final CanonicalProduct product) {
        if (StringUtils.isBlank(product.getDescription())) {
            return product;
        }
        String translation = translator.translate(product.getDescription());
        if (StringUtils.isBlank(translation)) {
            return product;
        }
        Map<String, String> meta = new LinkedHashMap<>(product.getMeta());
        meta.put("description_translated", translation);
        return product.toBuilder().meta(meta).build();
    }

    private void dumpOnce(final String siteId, final DetailPage page) {
        String dir = props.getOrchestrator().getDebugDumpDir();
        if (StringUtils.isBlank(dir) || !dumped.compareAndSet(false, true)) {
            return;
        }
        Path target = Paths.get(dir).resolve(siteId + "-first-detail.html");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, page.body());
            log.info("Dumped first detail response of {} to {}", page.url(), target);
        } catch (IOException ex) {
            log.warn("Could not dump detail response to {}: {}", target, ex.getMessage());
        }
    }

    private static final class Totals {

        private final AtomicInteger created = new AtomicInteger();

        private final AtomicInteger updated = new AtomicInteger();

        private final AtomicInteger failed = new AtomicInteger();

        void copyTo(final ScrapeJob job) {
            job.setTotalCreated(created.get());
            job.setTotalUpdated(updated.get());
            job.setTotalFailed(failed.get());
        }
    }
}
