package com.leadintel.enricher.service;

import com.leadintel.enricher.budget.BudgetExhaustedException;
import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.enrichment.EnrichmentWaterfall;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EnrichmentResult;
import com.leadintel.enricher.model.Job;
import com.leadintel.enricher.model.JobKind;
import com.leadintel.enricher.model.JobStatus;
import com.leadintel.enricher.model.MapsPlace;
import com.leadintel.enricher.model.ProgressEvent;
import com.leadintel.enricher.model.SearchRequest;
import com.leadintel.enricher.store.BusinessRepository;
import com.leadintel.enricher.store.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs search + enrichment jobs.
 *
 * Lifecycle: QUEUED → RUNNING → {COMPLETED, FAILED, CANCELLED}. A job first finishes any
 * records it admitted but never processed, then pages through the search from its
 * checkpoint. Each page is mapped, upserted and passed through the Deduplicator; admitted
 * records are enriched on the shared worker pool. The checkpoint is written after every
 * page and every record, so an interrupted or cancelled job can be resumed.
 *
 * Only a provider auth failure or strict-mode budget exhaustion fails a job. Cancellation
 * is cooperative: records already started finish, no new record starts.
 */
@Service
@Slf4j
public class JobOrchestrator {

    private final JobRepository jobs;
    private final BusinessRepository businesses;
    private final Deduplicator deduplicator;
    private final PagedSearch search;
    private final BusinessRecordMapper mapper;
    private final EnrichmentWaterfall waterfall;
    private final ProgressPublisher progress;
    private final Executor jobExecutor;
    private final ExecutorService enrichmentWorkers;
    private final Clock clock;

    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();
    private final Set<String> dispatched = ConcurrentHashMap.newKeySet();

    public JobOrchestrator(JobRepository jobs,
                           BusinessRepository businesses,
                           Deduplicator deduplicator,
                           PagedSearch search,
                           BusinessRecordMapper mapper,
                           EnrichmentWaterfall waterfall,
                           ProgressPublisher progress,
                           @Qualifier("jobExecutor") Executor jobExecutor,
                           @Qualifier("enrichmentWorkers") ExecutorService enrichmentWorkers,
                           Clock clock) {
        this.jobs = jobs;
        this.businesses = businesses;
        this.deduplicator = deduplicator;
        this.search = search;
        this.mapper = mapper;
        this.waterfall = waterfall;
        this.progress = progress;
        this.jobExecutor = jobExecutor;
        this.enrichmentWorkers = enrichmentWorkers;
        this.clock = clock;
    }

    // ── Commands ─────────────────────────────────────────────────────────────

    public Job submit(SearchRequest request) {
        Job job = createJob(request, JobKind.SINGLE, null);
        log.info("Job {} queued: '{}' in '{}' (max {})",
                job.getJobId(), job.getQuery(), job.getLocation(), job.getMaxResults());
        dispatch(job.getJobId());
        return job;
    }

    /** One job per request, all sharing a batch id for progress aggregation. */
    public List<Job> submitBatch(List<SearchRequest> requests) {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("batch contains no searches");
        }
        String batchId = "batch_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        List<Job> created = new ArrayList<>();
        for (SearchRequest request : requests) {
            created.add(createJob(request, JobKind.BATCH, batchId));
        }
        log.info("Batch {} queued with {} searches", batchId, created.size());
        progress.publish(new ProgressEvent(batchId, 0, JobStatus.QUEUED,
                "Batch of " + created.size() + " searches queued", clock.instant()));
        created.forEach(j -> dispatch(j.getJobId()));
        return created;
    }

    /**
     * QUEUED jobs, and RUNNING jobs no worker is executing (left behind by a previous process),
     * are cancelled immediately. A RUNNING job in this process stops at the next record boundary.
     */
    public Job cancel(String jobId) {
        Job job = find(jobId);
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + job.getStatus());
        }
        cancelFlags.computeIfAbsent(jobId, k -> new AtomicBoolean()).set(true);

        if (job.getStatus() == JobStatus.QUEUED
                && jobs.compareAndSetStatus(jobId, JobStatus.QUEUED, JobStatus.CANCELLED)) {
            log.info("Job {} cancelled before it started", jobId);
            cancelFlags.remove(jobId);
            Job cancelled = find(jobId);
            publish(cancelled, "Cancelled");
            publishBatch(cancelled);
            return cancelled;
        }
        if (job.getStatus() == JobStatus.RUNNING && !dispatched.contains(jobId)
                && jobs.compareAndSetStatus(jobId, JobStatus.RUNNING, JobStatus.CANCELLED)) {
            log.info("Job {} cancelled, no worker was running it", jobId);
            cancelFlags.remove(jobId);
            Job cancelled = find(jobId);
            publish(cancelled, "Cancelled after " + cancelled.getProcessedRecords() + " records");
            publishBatch(cancelled);
            return cancelled;
        }
        log.info("Cancellation requested for job {}", jobId);
        return find(jobId);
    }

    /**
     * Picks up an interrupted (RUNNING/QUEUED but not executing) or CANCELLED job from its checkpoint.
     */
    public Job resume(String jobId) {
        Job job = find(jobId);
        if (dispatched.contains(jobId)) {
            throw new IllegalStateException("Job " + jobId + " is already running");
        }
        switch (job.getStatus()) {
            case COMPLETED, FAILED -> throw new IllegalStateException("Job " + jobId + " is " + job.getStatus());
            case RUNNING, CANCELLED -> {
                if (!jobs.compareAndSetStatus(jobId, job.getStatus(), JobStatus.QUEUED)) {
                    throw new IllegalStateException("Job " + jobId + " changed state, retry");
                }
            }
            case QUEUED -> { }
        }
        log.info("Resuming job {} from checkpoint (page token {}, last record {})",
                jobId, job.getNextPageToken(), job.getLastProcessedId());
        cancelFlags.remove(jobId);
        dispatch(jobId);
        return find(jobId);
    }

    /** Start-up hook: re-dispatch every job a previous process left QUEUED or RUNNING. */
    public List<Job> resumeInterrupted() {
        List<Job> resumed = new ArrayList<>();
        for (Job job : jobs.findByStatus(JobStatus.QUEUED, JobStatus.RUNNING)) {
            if (dispatched.contains(job.getJobId())) continue;
            try {
                resumed.add(resume(job.getJobId()));
            } catch (IllegalStateException e) {
                log.warn("Could not resume job {}: {}", job.getJobId(), e.getMessage());
            }
        }
        if (!resumed.isEmpty()) log.info("Resumed {} interrupted job(s)", resumed.size());
        return resumed;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public Job find(String jobId) {
        return jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<Job> list(int limit) {
        return jobs.findRecent(limit);
    }

    public List<Job> batch(String batchId) {
        return jobs.findByBatch(batchId);
    }

    public boolean isActive(String jobId) {
        return dispatched.contains(jobId);
    }

    // ── Execution ────────────────────────────────────────────────────────────

    private Job createJob(SearchRequest request, JobKind kind, String batchId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Job job = Job.builder()
                .jobId(newJobId(request, now))
                .batchId(batchId)
                .kind(kind)
                .status(JobStatus.QUEUED)
                .query(request.query())
                .location(request.location())
                .maxResults(request.maxResults())
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.insert(job);
        publish(job, "Queued");
        return job;
    }

    private void dispatch(String jobId) {
        if (!dispatched.add(jobId)) return;
        jobExecutor.execute(() -> {
            try {
                run(jobId);
            } finally {
                dispatched.remove(jobId);
                cancelFlags.remove(jobId);
            }
        });
    }

    void run(String jobId) {
        AtomicBoolean cancel = cancelFlags.computeIfAbsent(jobId, k -> new AtomicBoolean());
        if (!jobs.compareAndSetStatus(jobId, JobStatus.QUEUED, JobStatus.RUNNING)) {
            log.info("Job {} no longer queued, not starting", jobId);
            return;
        }
        Job job = find(jobId);
        publish(job, "Started");
        publishBatch(job);

        try {
            List<BusinessRecord> leftovers = businesses.findUnprocessedForJob(jobId);
            if (!leftovers.isEmpty()) {
                log.info("Job {}: finishing {} record(s) admitted before interruption", jobId, leftovers.size());
                processRecords(job, leftovers, cancel);
            }

            if (!cancel.get() && !Job.PAGES_DONE.equals(job.getNextPageToken())) {
                fetchAndProcess(job, cancel);
            }

            if (cancel.get()) {
                finish(job, JobStatus.CANCELLED, null,
                        "Cancelled after " + job.getProcessedRecords() + " records");
            } else {
                finish(job, JobStatus.COMPLETED, null,
                        "Completed: " + job.getProcessedRecords() + " records processed");
            }

        } catch (ProviderAuthException | BudgetExhaustedException e) {
            log.error("Job {} failed: {}", jobId, e.getMessage());
            finish(job, JobStatus.FAILED, e.getMessage(), "Failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
            finish(job, JobStatus.FAILED, e.getMessage(), "Failed: " + e.getMessage());
        }
    }

    private void fetchAndProcess(Job job, AtomicBoolean cancel) {
        SearchQuery query = search.prepare(job.toRequest());
        int remaining = job.getMaxResults() - job.getTotalRecords();
        PagedSearch.Cursor cursor = search.pages(query, remaining, job.getNextPageToken());

        while (!cancel.get() && cursor.hasNext()) {
            SearchPage page = cursor.next();
            List<BusinessRecord> admitted = admit(job, page);

            synchronized (job) {
                job.setTotalRecords(job.getTotalRecords() + page.places().size());
                job.setSkippedRecords(job.getSkippedRecords() + page.places().size() - admitted.size());
                job.setNextPageToken(page.hasMore() ? page.nextPageToken() : Job.PAGES_DONE);
                jobs.update(job);
            }
            log.info("Job {}: page gave {} results, {} admitted", job.getJobId(), page.places().size(), admitted.size());

            processRecords(job, admitted, cancel);
        }

        if (!cancel.get()) {
            log.info("Job {}: search finished ({})", job.getJobId(), cursor.getStopReason());
            synchronized (job) {
                job.setNextPageToken(Job.PAGES_DONE);
                jobs.update(job);
            }
        }
    }

    private List<BusinessRecord> admit(Job job, SearchPage page) {
        List<BusinessRecord> admitted = new ArrayList<>();
        for (MapsPlace raw : page.places()) {
            BusinessRecord record;
            try {
                record = mapper.map(raw, job.getJobId());
            } catch (RecordValidationException e) {
                log.warn("Job {}: skipping invalid record: {}", job.getJobId(), e.getMessage());
                continue;
            }
            businesses.upsert(record);

            if (deduplicator.admit(record.getPlaceId(), job.getJobId()) == Deduplicator.Admission.ADMITTED) {
                admitted.add(record);
            }
        }
        return admitted;
    }

    private void processRecords(Job job, List<BusinessRecord> records, AtomicBoolean cancel) {
        List<Future<?>> futures = new ArrayList<>();
        for (BusinessRecord record : records) {
            futures.add(enrichmentWorkers.submit(() -> processRecord(job, record, cancel)));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                log.error("Job {}: worker failed: {}", job.getJobId(), e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel.set(true);
                return;
            }
        }
    }

    private void processRecord(Job job, BusinessRecord record, AtomicBoolean cancel) {
        if (cancel.get()) return;
        try {
            EnrichmentResult result = waterfall.enrich(record);
            businesses.saveEnrichment(result);
            deduplicator.markProcessed(record.getPlaceId());

            Job snapshot;
            synchronized (job) {
                job.setProcessedRecords(job.getProcessedRecords() + 1);
                job.setLastProcessedId(record.getPlaceId());
                jobs.update(job);
                snapshot = job.toBuilder().build();
            }
            publish(snapshot, result.enrichmentFailed()
                    ? "No email for " + record.getName()
                    : "Enriched " + record.getName());
        } catch (RuntimeException e) {
            // left unprocessed in dedup_index; a resume picks it up again
            log.error("Job {}: processing {} ({}) failed: {}",
                    job.getJobId(), record.getPlaceId(), record.getName(), e.getMessage(), e);
        }
    }

    private void finish(Job job, JobStatus status, String error, String detail) {
        synchronized (job) {
            if (!job.getStatus().canTransitionTo(status)) {
                log.warn("Job {}: ignoring transition {} → {}", job.getJobId(), job.getStatus(), status);
                return;
            }
            job.setStatus(status);
            job.setErrorMessage(error);
            jobs.update(job);
        }
        log.info("Job {} {}: {} fetched, {} processed",
                job.getJobId(), status, job.getTotalRecords(), job.getProcessedRecords());
        publish(job, detail);
        publishBatch(job);
    }

    // ── Progress ─────────────────────────────────────────────────────────────

    private void publish(Job job, String detail) {
        progress.publish(new ProgressEvent(job.getJobId(), job.progressPercent(), job.getStatus(), detail,
                clock.instant()));
    }

    /** Batch-level event: mean job progress, RUNNING until every job in the batch is terminal. */
    private void publishBatch(Job job) {
        if (job.getBatchId() == null) return;
        List<Job> members = jobs.findByBatch(job.getBatchId());
        if (members.isEmpty()) return;

        int percent = (int) Math.round(members.stream().mapToInt(this::settledPercent).average().orElse(0));
        long done = members.stream().filter(j -> j.getStatus().isTerminal()).count();
        long failed = members.stream().filter(j -> j.getStatus() == JobStatus.FAILED).count();
        JobStatus status = done == members.size() ? JobStatus.COMPLETED : JobStatus.RUNNING;

        String detail = done + "/" + members.size() + " searches finished"
                + (failed > 0 ? ", " + failed + " failed" : "");
        progress.publish(new ProgressEvent(job.getBatchId(), percent, status, detail, clock.instant()));
    }

    private int settledPercent(Job j) {
        return j.getStatus().isTerminal() ? 100 : j.progressPercent();
    }

    private String newJobId(SearchRequest request, LocalDateTime now) {
        String seed = request.query() + "_" + (request.location() == null ? "global" : request.location())
                + "_" + now + "_" + UUID.randomUUID();
        return DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }
}
