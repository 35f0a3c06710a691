package com.sportsync.resolution.sync;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.core.ValidationException;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.ingest.SourceRecordRepository;
import com.sportsync.resolution.logging.LogContext;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.store.StoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One (source, data type) ingestion job: fetch with retry, store the raw records, resolve each one.
 *
 * <p>Records are resolved independently. A malformed or unresolvable record is counted as failed
 * and the run goes on; a store failure or an exhausted retry fails the whole run. A run that
 * exceeds its timeout is cancelled and fails, and the job is not triggered again until its worker
 * has stopped. Whatever was resolved before stays committed, and re-running is safe because an
 * already-mapped record is an exact-id hit.</p>
 */
public class SyncJob {
    private static final Logger log = LoggerFactory.getLogger(SyncJob.class);

    private final SyncJobDefinition definition;
    private final SourceAdapter adapter;
    private final RecordResolver resolver;
    private final SourceRecordRepository records;
    private final SyncMetadataRepository metadataRepository;
    private final MetricsService metricsService;
    private final ExecutorService workers;
    private final Duration timeout;
    private final Retry retry;
    private final Duration cancelGrace;
    private final SyncStateMachine stateMachine;
    private volatile SyncMetadata metadata;
    private volatile String metadataWriteFailure;

    public SyncJob(SyncJobDefinition definition, SourceAdapter adapter, RecordResolver resolver,
                   SourceRecordRepository records, SyncMetadataRepository metadataRepository, SyncOptions options,
                   MetricsService metricsService, ExecutorService workers) {
        this.definition = definition;
        this.adapter = adapter;
        this.resolver = resolver;
        this.records = records;
        this.metadataRepository = metadataRepository;
        this.metricsService = metricsService;
        this.workers = workers;
        this.timeout = definition.timeout() != null ? definition.timeout() : options.getDefaultTimeout();
        this.cancelGrace = options.getCancelGrace();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(options.getRetryMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(options.getInitialBackoff(),
                        options.getBackoffMultiplier()))
                .retryExceptions(TransientSourceException.class)
                .build();
        this.retry = Retry.of(definition.jobKey(), retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("sync.fetch_retry job={} attempt={} waitMs={} error={}",
                definition.jobKey(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));

        // a row left mid-run by a previous process is reset: that run is over
        SyncMetadata stored = metadataRepository.find(definition.source(), definition.dataType())
                .orElseGet(() -> SyncMetadata.initial(definition.source(), definition.dataType()));
        this.metadata = stored.state() == SyncState.IDLE ? stored : stored.withState(SyncState.IDLE);
        metadataRepository.save(metadata);

        this.stateMachine = new SyncStateMachine(definition.jobKey());
        stateMachine.addListener((from, to) -> persist(metadata.withState(to)));
    }

    public SyncJobDefinition getDefinition() {
        return definition;
    }

    public SyncState getState() {
        return stateMachine.current();
    }

    public SyncMetadata getMetadata() {
        return metadata;
    }

    /**
     * Runs once, synchronously. Returns a skipped result if the job is already running.
     *
     * <p>After a timeout the job stays FAILED until its worker has actually stopped, so a worker
     * that ignores interruption can never overlap with the next run.</p>
     */
    public SyncRunResult run() {
        if (!stateMachine.tryStart()) {
            log.info("sync.skipped job={} state={}", definition.jobKey(), stateMachine.current());
            return SyncRunResult.skipped(definition.source(), definition.dataType());
        }
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        RunGuard run = new RunGuard();
        metadataWriteFailure = null;
        try (LogContext ignored = LogContext.forSyncJob(definition.source(), definition.dataType(), runId)) {
            persist(metadata.started(startedAt));
            log.info("sync.started job={} runId={}", definition.jobKey(), runId);

            Counts counts = new Counts();
            SyncOutcome outcome;
            String error = null;
            Future<SyncOutcome> future = workers.submit(() -> {
                try {
                    return execute(counts, run);
                } finally {
                    run.exited.countDown();
                    if (run.abandoned) {
                        releaseToIdle(run);
                    }
                }
            });
            try {
                outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                SyncTimeoutException timedOut = new SyncTimeoutException(definition.jobKey(), timeout);
                error = timedOut.getMessage();
                outcome = SyncOutcome.FAILED;
                log.error("sync.timeout job={} runId={} timeoutMs={}", definition.jobKey(), runId, timeout.toMillis());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                outcome = SyncOutcome.FAILED;
                log.error("sync.failed job={} runId={} error={}", definition.jobKey(), runId, error, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                error = "interrupted";
                outcome = SyncOutcome.FAILED;
                log.error("sync.interrupted job={} runId={}", definition.jobKey(), runId);
            }
            return finish(runId, startedAt, outcome, counts, error, run);
        }
    }

    private SyncOutcome execute(Counts counts, RunGuard run) {
        List<SourceRecord> fetched = Retry.decorateSupplier(retry, () -> adapter.fetch(definition.dataType())).get();
        if (Thread.currentThread().isInterrupted() || run.abandoned
                || !stateMachine.tryTransition(SyncState.SYNCING, SyncState.MATCHING)) {
            log.warn("sync.fetch_discarded job={} records={}", definition.jobKey(),
                    fetched != null ? fetched.size() : 0);
            return SyncOutcome.FAILED;
        }
        log.info("sync.fetched job={} records={}", definition.jobKey(), fetched != null ? fetched.size() : 0);
        if (fetched == null) {
            return SyncOutcome.SUCCESS;
        }

        for (SourceRecord record : fetched) {
            if (Thread.currentThread().isInterrupted() || run.abandoned) {
                log.warn("sync.cancelled job={} processed={}", definition.jobKey(), counts.processed.get());
                return SyncOutcome.FAILED;
            }
            counts.processed.incrementAndGet();
            try {
                ResolutionResult result = resolver.resolve(records.append(record));
                switch (result.status()) {
                    case MATCHED:
                        counts.matched.incrementAndGet();
                        break;
                    case MANUAL_REVIEW:
                        counts.queued.incrementAndGet();
                        break;
                    default:
                        counts.failed.incrementAndGet();
                        break;
                }
            } catch (StoreException e) {
                throw e;
            } catch (ValidationException e) {
                counts.failed.incrementAndGet();
                log.warn("sync.record_rejected job={} sourceId={} field={} error={}",
                        definition.jobKey(), record.sourceId(), e.getField(), e.getMessage());
            } catch (RuntimeException e) {
                counts.failed.incrementAndGet();
                log.warn("sync.record_failed job={} sourceId={} error={}",
                        definition.jobKey(), record.sourceId(), e.getMessage());
            }
        }
        return counts.failed.get() == 0 && counts.queued.get() == 0 ? SyncOutcome.SUCCESS : SyncOutcome.PARTIAL;
    }

    private SyncRunResult finish(String runId, Instant startedAt, SyncOutcome outcome, Counts counts, String error,
                                 RunGuard run) {
        Instant completedAt = Instant.now();
        metadata = metadata
                .withCounts(counts.processed.get(), counts.matched.get(), counts.queued.get(), counts.failed.get())
                .finished(outcome, completedAt, error);
        switch (outcome) {
            case SUCCESS:
                stateMachine.transition(SyncState.IDLE);
                break;
            case PARTIAL:
                stateMachine.transition(SyncState.PARTIAL);
                stateMachine.transition(SyncState.IDLE);
                break;
            default:
                stateMachine.transition(SyncState.FAILED);
                awaitWorker(runId, run);
                break;
        }

        String metadataFailure = metadataWriteFailure;
        if (metadataFailure != null) {
            error = (error != null ? error + "; " : "") + "metadata not saved: " + metadataFailure;
        }

        Duration duration = Duration.between(startedAt, completedAt);
        metricsService.recordSyncRun(definition.source(), definition.dataType(), outcome, duration);
        metricsService.incrementRecords(definition.source(), definition.dataType(), "matched", counts.matched.get());
        metricsService.incrementRecords(definition.source(), definition.dataType(), "queued", counts.queued.get());
        metricsService.incrementRecords(definition.source(), definition.dataType(), "failed", counts.failed.get());
        log.info("sync.completed job={} runId={} outcome={} processed={} matched={} queued={} failed={} durationMs={}",
                definition.jobKey(), runId, outcome, counts.processed.get(), counts.matched.get(),
                counts.queued.get(), counts.failed.get(), duration.toMillis());
        return new SyncRunResult(runId, definition.source(), definition.dataType(), outcome, startedAt, duration,
                counts.processed.get(), counts.matched.get(), counts.queued.get(), counts.failed.get(), error);
    }

    /**
     * Returns the job to IDLE once the worker of a failed run has stopped. A worker still busy after
     * the grace period keeps the job FAILED and releases it itself when it finally exits.
     */
    private void awaitWorker(String runId, RunGuard run) {
        run.abandoned = true;
        boolean exited;
        try {
            exited = run.exited.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exited = run.exited.getCount() == 0;
        }
        if (exited) {
            releaseToIdle(run);
        } else {
            log.warn("sync.worker_still_running job={} runId={} graceMs={}",
                    definition.jobKey(), runId, cancelGrace.toMillis());
        }
    }

    private void releaseToIdle(RunGuard run) {
        if (run.released.compareAndSet(false, true)) {
            stateMachine.transition(SyncState.IDLE);
        }
    }

    /**
     * Writes the row. A failed write is logged and reported in the run result; the next transition rewrites it.
     */
    private void persist(SyncMetadata next) {
        metadata = next;
        try {
            metadataRepository.save(next);
        } catch (RuntimeException e) {
            metadataWriteFailure = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("sync.metadata_write_failed job={} state={} error={}",
                    definition.jobKey(), next.state(), e.getMessage());
        }
    }

    /**
     * Per-run handshake between the caller and the worker thread.
     */
    private static final class RunGuard {
        final CountDownLatch exited = new CountDownLatch(1);
        final AtomicBoolean released = new AtomicBoolean();
        volatile boolean abandoned;
    }

    private static final class Counts {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger matched = new AtomicInteger();
        final AtomicInteger queued = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
    }
}
