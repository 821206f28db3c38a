package com.leadintel.enricher.config;

import com.leadintel.enricher.model.CostLedgerReport;
import com.leadintel.enricher.model.Job;
import com.leadintel.enricher.model.Lead;
import com.leadintel.enricher.model.SearchRequest;
import com.leadintel.enricher.service.BatchCsvReader;
import com.leadintel.enricher.service.JobNotFoundException;
import com.leadintel.enricher.service.JobOrchestrator;
import com.leadintel.enricher.service.LeadQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LeadController {

    private final JobOrchestrator orchestrator;
    private final LeadQueryService leadQueryService;
    private final BatchCsvReader batchCsvReader;

    // ── Searches ──────────────────────────────────────────────────────────────

    /**
     * Queue a single search + enrichment job.
     *
     * POST /searches {"query": "plumbers", "location": "Austin, TX", "max_results": 50}
     */
    @PostMapping("/searches")
    public ResponseEntity<?> search(@RequestBody Map<String, Object> body) {
        try {
            SearchRequest request = new SearchRequest(
                    (String) body.get("query"),
                    (String) body.get("location"),
                    body.get("max_results") == null
                            ? SearchRequest.DEFAULT_MAX_RESULTS
                            : ((Number) body.get("max_results")).intValue());
            Job job = orchestrator.submit(request);
            return ResponseEntity.accepted().body(job);
        } catch (IllegalArgumentException | ClassCastException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Upload a CSV with columns query, location, max_results. One job per row.
     */
    @PostMapping("/searches/batch")
    public ResponseEntity<?> batch(@RequestParam("file") MultipartFile file) {
        if (file.getOriginalFilename() != null && !file.getOriginalFilename().toLowerCase().endsWith(".csv")) {
            return ResponseEntity.badRequest().body(Map.of("error", "only .csv uploads are supported"));
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            List<SearchRequest> requests = batchCsvReader.read(reader);
            if (requests.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "no valid searches in file"));
            }
            List<Job> jobs = orchestrator.submitBatch(requests);
            return ResponseEntity.accepted().body(Map.of(
                    "batch_id", jobs.get(0).getBatchId(),
                    "total_searches", jobs.size(),
                    "jobs", jobs));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.error("Batch upload failed: {}", e.getMessage(), e);
            return ResponseEntity.badRequest().body(Map.of("error", "could not read CSV: " + e.getMessage()));
        }
    }

    /**
     * GET /searches/estimate?max_results=100
     */
    @GetMapping("/searches/estimate")
    public ResponseEntity<?> estimate(@RequestParam(name = "max_results", defaultValue = "100") int maxResults) {
        try {
            return ResponseEntity.ok(leadQueryService.estimate(maxResults));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Jobs ──────────────────────────────────────────────────────────────────

    @GetMapping("/jobs")
    public List<Job> jobs(@RequestParam(defaultValue = "50") int limit,
                          @RequestParam(name = "batch_id", required = false) String batchId) {
        return batchId != null ? orchestrator.batch(batchId) : orchestrator.list(limit);
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> job(@PathVariable String jobId) {
        Job job = orchestrator.find(jobId);
        return ResponseEntity.ok(Map.of(
                "job", job,
                "progress_percent", job.progressPercent(),
                "active", orchestrator.isActive(jobId)));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        try {
            return ResponseEntity.accepted().body(orchestrator.cancel(jobId));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/jobs/{jobId}/resume")
    public ResponseEntity<?> resume(@PathVariable String jobId) {
        try {
            return ResponseEntity.accepted().body(orchestrator.resume(jobId));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/jobs/{jobId}/leads")
    public List<Lead> leads(@PathVariable String jobId) {
        return leadQueryService.leadsForJob(jobId);
    }

    @GetMapping("/leads")
    public List<Lead> recentLeads(@RequestParam(defaultValue = "100") int limit) {
        return leadQueryService.recentLeads(limit);
    }

    // ── Costs ─────────────────────────────────────────────────────────────────

    /**
     * Spend by provider. GET /costs/summary?days=30
     */
    @GetMapping("/costs/summary")
    public ResponseEntity<?> costSummary(@RequestParam(defaultValue = "30") int days) {
        try {
            return ResponseEntity.ok(leadQueryService.costSummary(days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/costs/ledger")
    public ResponseEntity<?> costLedger(@RequestParam(defaultValue = "30") int days) {
        try {
            CostLedgerReport report = leadQueryService.costLedger(days);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
