package com.catalog.harvester.service;

import com.catalog.harvester.model.ScrapeJob;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide registry of harvest jobs. Jobs are kept for the lifetime of the process.
 */
@Component
public class JobRegistry {

    private final AtomicLong ids = new AtomicLong();

    private final Map<Long, ScrapeJob> jobs = new ConcurrentHashMap<>();

    /** Registers a new {@code PENDING} job for the site. */
    public ScrapeJob create(final String siteId) {
        ScrapeJob job = new ScrapeJob();
        job.setId(ids.incrementAndGet());
        job.setSiteId(siteId);
        jobs.put(job.getId(), job);
        return job;
    }

    public Optional<ScrapeJob> find(final long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /** All jobs, newest first. */
    public List<ScrapeJob> all() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(ScrapeJob::getId).reversed())
                .toList();
    }
}
