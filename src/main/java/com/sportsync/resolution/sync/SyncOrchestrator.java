package com.sportsync.resolution.sync;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.ingest.SourceRecordRepository;
import com.sportsync.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the sync jobs and runs them on a fixed-delay schedule.
 *
 * <p>A job never overlaps itself: a tick that finds the job still running is skipped. Different
 * jobs run in parallel on the worker pool, and a failure in one job does not affect the others.</p>
 */
public class SyncOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final RecordResolver resolver;
    private final SourceRecordRepository records;
    private final SyncMetadataRepository metadataRepository;
    private final SyncOptions options;
    private final MetricsService metricsService;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Map<String, SyncJob> jobs = new ConcurrentHashMap<>();
    private final List<ScheduledFuture<?>> scheduled = new CopyOnWriteArrayList<>();
    private volatile boolean started;

    public SyncOrchestrator(RecordResolver resolver, SourceRecordRepository records,
                            SyncMetadataRepository metadataRepository, SyncOptions options,
                            MetricsService metricsService) {
        this.resolver = resolver;
        this.records = records;
        this.metadataRepository = metadataRepository;
        this.options = options;
        this.metricsService = metricsService;
        this.scheduler = Executors.newScheduledThreadPool(options.getSchedulerThreads(), namedThreads("sync-scheduler"));
        this.workers = Executors.newCachedThreadPool(namedThreads("sync-worker"));
    }

    /**
     * Registers a job. If the orchestrator is already started the job is scheduled right away.
     *
     * @throws IllegalArgumentException if the job key is taken or the adapter serves another source
     */
    public SyncJob register(SyncJobDefinition definition, SourceAdapter adapter) {
        if (!definition.source().equals(adapter.source())) {
            throw new IllegalArgumentException("Adapter for source '" + adapter.source()
                    + "' cannot serve job " + definition.jobKey());
        }
        SyncJob job = new SyncJob(definition, adapter, resolver, records, metadataRepository, options,
                metricsService, workers);
        if (jobs.putIfAbsent(definition.jobKey(), job) != null) {
            throw new IllegalArgumentException("Sync job already registered: " + definition.jobKey());
        }
        log.info("sync.job_registered job={} intervalMs={}", definition.jobKey(), definition.interval().toMillis());
        if (started) {
            schedule(job);
        }
        return job;
    }

    public synchronized void start() {
        if (started) {
            log.warn("sync.orchestrator_already_started jobs={}", jobs.size());
            return;
        }
        started = true;
        jobs.values().forEach(this::schedule);
        log.info("sync.orchestrator_started jobs={}", jobs.size());
    }

    /**
     * Schedules a periodic task on the same scheduler, first run after one interval.
     */
    public void scheduleReconciliation(Runnable task, Duration interval) {
        scheduled.add(scheduler.scheduleWithFixedDelay(() -> runGuarded("reconciliation", task),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS));
        log.info("sync.reconciliation_scheduled intervalMs={}", interval.toMillis());
    }

    /**
     * Runs a job immediately on the calling thread.
     *
     * @throws IllegalArgumentException if no such job is registered
     */
    public SyncRunResult runNow(String source, String dataType) {
        SyncJob job = jobs.get(SyncMetadata.jobKey(source, dataType));
        if (job == null) {
            throw new IllegalArgumentException("Unknown sync job: " + SyncMetadata.jobKey(source, dataType));
        }
        return job.run();
    }

    /**
     * Stores and resolves a single record outside any scheduled run.
     */
    public ResolutionResult resync(SourceRecord record) {
        SourceRecord stored = records.append(record);
        ResolutionResult result = resolver.resolve(stored);
        log.info("sync.resync source={} sourceId={} status={} canonicalId={}",
                record.source(), record.sourceId(), result.status(), result.canonicalId());
        return result;
    }

    public Optional<SyncJob> getJob(String source, String dataType) {
        return Optional.ofNullable(jobs.get(SyncMetadata.jobKey(source, dataType)));
    }

    public List<SyncJob> jobs() {
        List<SyncJob> list = new ArrayList<>(jobs.values());
        list.sort(Comparator.comparing(job -> job.getDefinition().jobKey()));
        return list;
    }

    public List<SyncMetadata> jobMetadata() {
        List<SyncMetadata> metadata = new ArrayList<>();
        for (SyncJob job : jobs()) {
            metadata.add(job.getMetadata());
        }
        return metadata;
    }

    public SyncStatusReport statusReport(long pendingReviews, long unmatchedMappings, long lowConfidenceMappings) {
        return SyncStatusReport.of(jobMetadata(), pendingReviews, unmatchedMappings, lowConfidenceMappings);
    }

    public boolean isStarted() {
        return started;
    }

    @Override
    public void close() {
        scheduled.forEach(future -> future.cancel(false));
        shutdown(scheduler);
        shutdown(workers);
        log.info("sync.orchestrator_stopped jobs={}", jobs.size());
    }

    private void schedule(SyncJob job) {
        long interval = job.getDefinition().interval().toMillis();
        scheduled.add(scheduler.scheduleWithFixedDelay(
                () -> runGuarded(job.getDefinition().jobKey(), job::run), 0, interval, TimeUnit.MILLISECONDS));
    }

    // an exception escaping a scheduled task cancels its future runs
    private static void runGuarded(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("sync.scheduled_task_failed task={} error={}", name, e.getMessage(), e);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
