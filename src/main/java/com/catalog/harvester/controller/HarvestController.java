package com.catalog.harvester.controller;

import com.catalog.harvester.dto.HarvestRequest;
import com.catalog.harvester.exception.ConfigurationException;
import com.catalog.harvester.model.ScrapeJob;
import com.catalog.harvester.service.HarvestOrchestrator;
import com.catalog.harvester.service.JobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller starting harvest jobs and reporting their status.
 * <p>
 * Endpoints:
 * <ul>
 *   <li><code>POST /api/harvest</code> starts a job in the background and answers 202 with it</li>
 *   <li><code>GET /api/harvest/jobs/{id}</code> returns one job</li>
 *   <li><code>GET /api/harvest/jobs</code> returns all jobs, newest first</li>
 * </ul>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/harvest
 * Content-Type: application/json
 *
 * { "site": "lululemon", "maxItems": 50, "sync": true }
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/harvest")
@RequiredArgsConstructor
public class HarvestController {

    private final HarvestOrchestrator orchestrator;

    private final JobRegistry jobs;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScrapeJob> start(@RequestBody @Validated final HarvestRequest request) {
        ScrapeJob job = orchestrator.submit(request.site(), request.maxItemsOrDefault(), request.syncRequested());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping(value = "/jobs/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScrapeJob> job(@PathVariable("id") final long id) {
        return jobs.find(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ScrapeJob> jobs() {
        return jobs.all();
    }

    /**
     * Unknown or incomplete site profiles are a client error.
     *
     * @param ex the exception containing the error details
     * @return HTTP 400 with a JSON body {"error": "..."}
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(final ConfigurationException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getMessage()));
    }
}
