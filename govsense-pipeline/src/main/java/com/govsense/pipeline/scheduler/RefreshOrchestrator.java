package com.govsense.pipeline.scheduler;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.exception.AlreadyRunningException;
import com.govsense.pipeline.exception.StorageCommitException;
import com.govsense.pipeline.ingestion.DataGouvIngestionClient;
import com.govsense.pipeline.ingestion.FetchedDataset;
import com.govsense.pipeline.model.CleanRecord;
import com.govsense.pipeline.model.CleaningResult;
import com.govsense.pipeline.model.DatasetMetadata;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.DerivedRecord;
import com.govsense.pipeline.model.RefreshCompletedEvent;
import com.govsense.pipeline.model.RefreshRun;
import com.govsense.pipeline.model.RunStatus;
import com.govsense.pipeline.model.TransformResult;
import com.govsense.pipeline.processing.DatasetCleaner;
import com.govsense.pipeline.processing.RegionTransformer;
import com.govsense.pipeline.registry.DatasetCatalog;
import com.govsense.pipeline.registry.DatasetRegistry;
import com.govsense.pipeline.storage.StorageGateway;
import com.govsense.pipeline.storage.TableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the refresh pipeline: fetch and clean every dataset in parallel, wait
 * for all of them, transform whatever succeeded, commit table by table (the
 * fetched datasets, their catalogue entries, then region_stats), then tell the
 * listeners.
 *
 * At most one run is RUNNING per process. Entry is a compare-and-set on the
 * active run slot; a second trigger fails with {@link AlreadyRunningException}
 * instead of waiting.
 *
 * A dataset that cannot be fetched or cleaned only removes its own
 * contribution (degraded run). A commit failure fails the run; tables
 * committed earlier in the same run stay committed. Whatever ends a run, even
 * an {@link Error}, records it as terminal and frees the run slot.
 */
@Service
@Slf4j
public class RefreshOrchestrator {

    private final DatasetRegistry registry;
    private final DataGouvIngestionClient ingestionClient;
    private final DatasetCleaner cleaner;
    private final RegionTransformer transformer;
    private final StorageGateway storage;
    private final List<RefreshListener> listeners;
    private final Executor fetchExecutor;
    private final Executor runExecutor;
    private final Clock clock;
    private final int historySize;

    /** The RUNNING run, or null when idle */
    private final AtomicReference<RefreshRun> activeRun = new AtomicReference<>();

    /** Snapshot of the active run, republished at each phase boundary */
    private volatile RefreshRun published;

    /** Most recent terminal runs, newest first */
    private final Deque<RefreshRun> history = new ArrayDeque<>();

    public RefreshOrchestrator(DatasetRegistry registry,
                               DataGouvIngestionClient ingestionClient,
                               DatasetCleaner cleaner,
                               RegionTransformer transformer,
                               StorageGateway storage,
                               List<RefreshListener> listeners,
                               @Qualifier("fetchExecutor") Executor fetchExecutor,
                               @Qualifier("refreshTaskScheduler") Executor runExecutor,
                               Clock clock,
                               GovSenseProperties properties) {
        this.registry = registry;
        this.ingestionClient = ingestionClient;
        this.cleaner = cleaner;
        this.transformer = transformer;
        this.storage = storage;
        this.listeners = List.copyOf(listeners);
        this.fetchExecutor = fetchExecutor;
        this.runExecutor = runExecutor;
        this.clock = clock;
        this.historySize = Math.max(1, properties.getRefresh().getHistorySize());
    }

    /**
     * Run the whole pipeline on the calling thread.
     *
     * @return the run in its terminal state
     * @throws AlreadyRunningException if another run is in progress
     */
    public RefreshRun triggerNow() {
        RefreshRun run = begin();
        return execute(run);
    }

    /**
     * Claim the run slot on the calling thread, then run the pipeline on a
     * worker. {@link AlreadyRunningException} is thrown here, not lost on the worker.
     *
     * @return a snapshot of the run in RUNNING state
     */
    public RefreshRun startAsync() {
        RefreshRun run = begin();
        RefreshRun started = run.snapshot();
        try {
            runExecutor.execute(() -> execute(run));
        } catch (TaskRejectedException e) {
            activeRun.compareAndSet(run, null);
            throw e;
        }
        return started;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public Optional<RefreshRun> currentRun() {
        return isRunning() ? Optional.ofNullable(published) : Optional.empty();
    }

    public synchronized Optional<RefreshRun> lastRun() {
        return Optional.ofNullable(history.peekFirst()).map(RefreshRun::snapshot);
    }

    public synchronized List<RefreshRun> history() {
        return history.stream().map(RefreshRun::snapshot).toList();
    }

    // ── Run lifecycle ────────────────────────────────────────────────────────

    private RefreshRun begin() {
        RefreshRun run = RefreshRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now(clock))
                .status(RunStatus.RUNNING)
                .build();
        if (!activeRun.compareAndSet(null, run)) {
            RefreshRun other = activeRun.get();
            throw new AlreadyRunningException(other != null ? other.getRunId() : "unknown");
        }
        published = run.snapshot();
        log.info("Refresh {} started", run.getRunId());
        return run;
    }

    private RefreshRun execute(RefreshRun run) {
        try {
            try {
                runPipeline(run);
            } catch (StorageCommitException e) {
                fail(run, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Refresh {} aborted: {}", run.getRunId(), e.getMessage(), e);
                fail(run, "Unexpected error: " + e.getMessage());
            }
            run.setCompletedAt(LocalDateTime.now(clock));

            if (run.getStatus() == RunStatus.SUCCEEDED) {
                notifyListeners(run);
            }
        } catch (Error e) {
            log.error("Refresh {} aborted by {}", run.getRunId(), e.toString(), e);
            fail(run, "Fatal error: " + e);
            throw e;
        } finally {
            release(run);
        }
        return run.snapshot();
    }

    // Terminal bookkeeping; runs whatever escaped the pipeline
    private void release(RefreshRun run) {
        if (run.getCompletedAt() == null) {
            run.setCompletedAt(LocalDateTime.now(clock));
        }
        remember(run.snapshot());
        published = null;
        activeRun.compareAndSet(run, null);
        log.info("Refresh {} finished {}{} rows={} failedDatasets={}",
                run.getRunId(), run.getStatus(), run.isDegraded() ? " (degraded)" : "",
                run.getRowCounts(), run.getFailedDatasets().keySet());
    }

    private void runPipeline(RefreshRun run) {
        // 1. Fetch + clean, one task per dataset; the join is the synchronisation point
        List<CompletableFuture<DatasetOutcome>> futures = registry.listDatasets().stream()
                .map(spec -> CompletableFuture.supplyAsync(() -> fetchAndClean(spec), fetchExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, CleaningResult> cleaned = new LinkedHashMap<>();
        List<DatasetMetadata> catalogue = new ArrayList<>();
        for (CompletableFuture<DatasetOutcome> future : futures) {
            DatasetOutcome outcome = future.join();
            String id = outcome.spec().getId();
            if (outcome.isSuccess()) {
                cleaned.put(id, outcome.result());
                catalogue.add(outcome.metadata());
                run.getSucceededDatasets().add(id);
                run.getCleaningReports().put(id, outcome.result().report());
            } else {
                run.getFailedDatasets().put(id, outcome.error());
            }
        }

        published = run.snapshot();

        if (cleaned.isEmpty()) {
            fail(run, "No dataset could be fetched: " + run.getFailedDatasets());
            return;
        }
        if (!run.getFailedDatasets().isEmpty()) {
            log.warn("Refresh {} continues without {}", run.getRunId(), run.getFailedDatasets().keySet());
        }

        // 2. Transform over whatever succeeded
        TransformResult derived = transformer.transform(
                recordsOf(cleaned, DatasetCatalog.REGION_BUDGETS),
                recordsOf(cleaned, DatasetCatalog.COMMUNES),
                recordsOf(cleaned, DatasetCatalog.REGIONAL_EMPLOYMENT));
        run.setUnmappedCommunes(derived.unmappedCommunes());

        // 3. Commit, one atomic batch per table
        LocalDateTime refreshedAt = LocalDateTime.now(clock);
        for (Map.Entry<String, CleaningResult> entry : cleaned.entrySet()) {
            DatasetSpec spec = registry.get(entry.getKey());
            List<Map<String, Object>> rows = entry.getValue().records().stream()
                    .map(r -> withTimestamp(r.getFields(), refreshedAt))
                    .toList();
            int committed = storage.upsertBatch(spec.getTargetTable(), rows, spec.getNaturalKey());
            run.getRowCounts().put(spec.getId(), committed);
            published = run.snapshot();
        }

        List<Map<String, Object>> metadataRows = catalogue.stream().map(m -> m.toRow(refreshedAt)).toList();
        storage.upsertBatch(DatasetMetadata.TABLE, metadataRows, TableDefinition.DATASETS.naturalKey());

        List<Map<String, Object>> stats = derived.records().stream()
                .map(r -> withTimestamp(r.toRow(), refreshedAt))
                .toList();
        int committed = storage.upsertBatch(DerivedRecord.TABLE, stats, TableDefinition.REGION_STATS.naturalKey());
        run.getRowCounts().put(DerivedRecord.TABLE, committed);

        run.setStatus(RunStatus.SUCCEEDED);
    }

    private DatasetOutcome fetchAndClean(DatasetSpec spec) {
        try (FetchedDataset fetched = ingestionClient.fetch(spec)) {
            return DatasetOutcome.succeeded(spec, fetched.metadata(), cleaner.clean(spec, fetched.rows()));
        } catch (RuntimeException e) {
            log.warn("Dataset {} skipped this run: {}", spec.getId(), e.getMessage());
            return DatasetOutcome.failed(spec, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void fail(RefreshRun run, String summary) {
        log.error("Refresh {} failed: {}", run.getRunId(), summary);
        run.setStatus(RunStatus.FAILED);
        run.setErrorSummary(summary);
    }

    private void notifyListeners(RefreshRun run) {
        RefreshCompletedEvent event = new RefreshCompletedEvent(run.getRunId(),
                List.copyOf(run.getSucceededDatasets()), Set.copyOf(run.getFailedDatasets().keySet()));
        for (RefreshListener listener : listeners) {
            try {
                listener.onRefreshCompleted(event);
            } catch (RuntimeException e) {
                log.error("Refresh listener {} failed for run {}: {}",
                        listener.getClass().getSimpleName(), run.getRunId(), e.getMessage(), e);
            }
        }
    }

    private synchronized void remember(RefreshRun run) {
        history.addFirst(run);
        while (history.size() > historySize) {
            history.removeLast();
        }
    }

    private static List<CleanRecord> recordsOf(Map<String, CleaningResult> cleaned, String datasetId) {
        CleaningResult result = cleaned.get(datasetId);
        return result == null ? List.of() : result.records();
    }

    private static Map<String, Object> withTimestamp(Map<String, Object> fields, LocalDateTime refreshedAt) {
        Map<String, Object> row = new LinkedHashMap<>(fields);
        row.put("refreshed_at", refreshedAt);
        return row;
    }
}
