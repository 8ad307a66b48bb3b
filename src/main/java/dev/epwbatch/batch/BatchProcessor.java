package dev.epwbatch.batch;

import dev.epwbatch.api.CacheStore;
import dev.epwbatch.api.DataType;
import dev.epwbatch.client.CacheClient;
import dev.epwbatch.config.BatchConfig;
import dev.epwbatch.error.DataValidationException;
import dev.epwbatch.error.ErrorKind;
import dev.epwbatch.error.ProcessingException;
import dev.epwbatch.pipeline.Outcome;
import dev.epwbatch.pipeline.PipelineCollaborators;
import dev.epwbatch.pipeline.RawHandle;
import dev.epwbatch.pipeline.RetryPolicy;
import dev.epwbatch.pipeline.WeatherRecord;
import dev.epwbatch.pipeline.WeatherTable;
import dev.epwbatch.station.StationMeta;
import dev.epwbatch.stream.MemoryGovernor;
import dev.epwbatch.stream.StreamResult;
import dev.epwbatch.stream.StreamingTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the conversion pipeline for many (station, year) items, either one after another or on a
 * fixed worker pool, and reports per-item results plus aggregate statistics.
 *
 * <p>Each item first consults the batch cache ({@code batch_result_<station>_<year>}). On a miss
 * the pipeline runs: resolve station, fetch (with retries), transform, validate, write. The
 * standard path also keeps transformed tables in the processed cache
 * ({@code processed_weather_<station>_<year>}). A failing item never stops the batch.
 *
 * <p>Sequential runs report results in input order. Parallel runs report them in completion
 * order from a single aggregation thread, which is also where the progress listener is called.
 *
 * <p>Identical keys submitted concurrently are not coalesced: both may miss and run the
 * pipeline, and the last cache write wins.
 */
public class BatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    static final String BATCH_KEY_PREFIX = "batch_result_";
    static final String PROCESSED_KEY_PREFIX = "processed_weather_";
    static final int MIN_YEAR = 1950;

    private final BatchConfig config;
    private final PipelineCollaborators pipeline;
    private final CacheStore batchCache;
    private final CacheStore processedCache;
    private final StreamingTransform streaming;
    private final RetryPolicy retry;
    private final Clock clock;

    public BatchProcessor(BatchConfig config, PipelineCollaborators pipeline, CacheStore batchCache,
                          CacheStore processedCache, StreamingTransform streaming, RetryPolicy retry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
        this.batchCache = Objects.requireNonNull(batchCache, "batchCache cannot be null");
        this.processedCache = Objects.requireNonNull(processedCache, "processedCache cannot be null");
        this.streaming = Objects.requireNonNull(streaming, "streaming cannot be null");
        this.retry = Objects.requireNonNull(retry, "retry cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * Wires a processor from configuration, taking both cache regions from {@code caches}.
     */
    public static BatchProcessor create(BatchConfig config, PipelineCollaborators pipeline, CacheClient caches) {
        return new BatchProcessor(config, pipeline,
                caches.getCache(CacheClient.BATCH_REGION),
                caches.getCache(CacheClient.PROCESSED_REGION),
                new StreamingTransform(new MemoryGovernor(config.getMemoryLimitMb()), config.getReclaimEveryChunks()),
                RetryPolicy.fromConfig(config),
                null);
    }

    static String batchKey(StationYear key) {
        return BATCH_KEY_PREFIX + key.stationId() + "_" + key.year();
    }

    static String processedKey(StationYear key) {
        return PROCESSED_KEY_PREFIX + key.stationId() + "_" + key.year();
    }

    /** Output location: {@code <outputDir>/<station name>/NLD_<abbr>_EPW_YR<year>.epw}. */
    Path outputPathFor(StationMeta station, int year) {
        return Path.of(config.getOutputDir(), station.name(),
                "NLD_" + station.abbreviation() + "_EPW_YR" + year + ".epw");
    }

    /**
     * Processes every item and returns one result per item.
     */
    public BatchReport processBatch(List<WorkItem> items, BatchOptions options) {
        Objects.requireNonNull(items, "items cannot be null");
        BatchOptions opts = options != null ? options : new BatchOptions();
        RunCounters counters = new RunCounters();
        int workers = effectiveWorkers(opts, items.size());

        logger.info("Starting batch processing of {} items ({}, streaming={}, forceRefresh={})",
                items.size(), opts.isParallel() ? workers + " workers" : "sequential",
                opts.isStreaming(), opts.isForceRefresh());

        long start = System.nanoTime();
        List<WorkResult> results = opts.isParallel() && items.size() > 1
                ? runParallel(items, opts, counters, workers)
                : runSequential(items, opts, counters);
        Duration totalTime = Duration.ofNanos(System.nanoTime() - start);

        BatchStats stats = BatchStats.of(results, totalTime, counters.hits(), counters.misses());
        logSummary(stats);
        return new BatchReport(results, stats);
    }

    /** Processes a single item with its own counters. */
    public WorkResult processItem(WorkItem item, BatchOptions options) {
        return runItem(item, options != null ? options : new BatchOptions(), new RunCounters());
    }

    int effectiveWorkers(BatchOptions opts, int itemCount) {
        int max = opts.getMaxWorkers() != null ? opts.getMaxWorkers() : config.getMaxWorkers();
        return Math.max(1, Math.min(max, itemCount));
    }

    private List<WorkResult> runSequential(List<WorkItem> items, BatchOptions opts, RunCounters counters) {
        List<WorkResult> results = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            WorkResult result = runItem(item, opts, counters);
            results.add(result);
            report(opts, results.size(), items.size(), result);
        }
        return results;
    }

    private List<WorkResult> runParallel(List<WorkItem> items, BatchOptions opts, RunCounters counters,
                                         int workers) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            CompletionService<WorkResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<WorkResult>, WorkItem> submitted = new HashMap<>();
            for (WorkItem item : items) {
                submitted.put(completion.submit(() -> runItem(item, opts, counters)), item);
            }

            List<WorkResult> results = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                Future<WorkResult> done = completion.take();
                WorkResult result;
                try {
                    result = done.get();
                } catch (ExecutionException e) {
                    // runItem classifies exceptions itself; only errors reach this point
                    WorkItem item = submitted.get(done);
                    logger.error("Worker crashed on {}: {}", item.key(), e.getCause().toString(), e.getCause());
                    result = WorkResult.failure(item.key(), ErrorKind.UNEXPECTED,
                            "Worker failed for " + item.key() + ": " + e.getCause(), Duration.ZERO);
                }
                results.add(result);
                report(opts, results.size(), items.size(), result);
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new ProcessingException("Batch processing interrupted", e);
        } finally {
            pool.shutdown();
        }
    }

    private void report(BatchOptions opts, int completed, int total, WorkResult result) {
        try {
            opts.getProgressListener().onProgress(completed, total, result);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed at {}/{}: {}", completed, total, e.getMessage());
        }
    }

    private WorkResult runItem(WorkItem item, BatchOptions opts, RunCounters counters) {
        StationYear key = item.key();
        long start = System.nanoTime();
        MDC.put("stationId", key.stationId());
        MDC.put("year", String.valueOf(key.year()));
        try {
            return process(key, opts, counters, start);
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}: {}", key, e.getMessage(), e);
            return WorkResult.failure(key, ErrorKind.UNEXPECTED,
                    "Unexpected error processing " + key + ": " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    elapsedSince(start));
        } finally {
            MDC.remove("stationId");
            MDC.remove("year");
        }
    }

    private WorkResult process(StationYear key, BatchOptions opts, RunCounters counters, long start) {
        ItemState state = enter(key, ItemState.PENDING, ItemState.CACHE_CHECK);
        if (!opts.isForceRefresh()) {
            Optional<CachedOutcome> cached = batchCache.get(batchKey(key), CachedOutcome.class);
            if (cached.isPresent() && cached.get().success()) {
                counters.hit();
                enter(key, state, ItemState.CACHE_HIT);
                enter(key, ItemState.CACHE_HIT, ItemState.DONE);
                logger.debug("Using cached result for {}", key);
                return WorkResult.success(key, cached.get().outputPath(), cached.get().recordCount(),
                        elapsedSince(start), true);
            }
        }
        counters.miss();

        Outcome<StationMeta> station = checkInput(key).flatMap(k -> resolveStation(key));
        if (!station.isOk()) {
            return failed(key, state, station, start);
        }

        state = enter(key, state, ItemState.FETCHING);
        Outcome<WeatherTable> table = opts.isStreaming()
                ? streamTable(station.value(), key, opts)
                : standardTable(station.value(), key, opts);
        if (!table.isOk()) {
            return failed(key, state, table, start);
        }

        state = enter(key, ItemState.TRANSFORMING, ItemState.VALIDATING);
        Outcome<WeatherTable> valid = validate(table.value(), key);
        if (!valid.isOk()) {
            return failed(key, state, valid, start);
        }

        state = enter(key, state, ItemState.WRITING);
        Path target = outputPathFor(station.value(), key.year());
        Outcome<Path> written = Outcome.attempt("write", key.toString(), ErrorKind.GENERATION,
                () -> pipeline.writer().write(valid.value(), station.value(), key.year(), target));
        if (!written.isOk()) {
            return failed(key, state, written, start);
        }

        enter(key, state, ItemState.DONE);
        WorkResult result = WorkResult.success(key, written.value().toString(), valid.value().size(),
                elapsedSince(start), false);
        batchCache.set(batchKey(key), CachedOutcome.of(result), null, DataType.RECORD);
        logger.info("Processed {} ({} records) in {}s", key, result.recordCount(),
                String.format("%.2f", result.durationSeconds()));
        return result;
    }

    private Outcome<StationYear> checkInput(StationYear key) {
        if (!key.stationId().matches("\\d{3}")) {
            return Outcome.err(ErrorKind.VALIDATION, "Invalid station id '" + key.stationId()
                    + "' for " + key + ": expected a 3-digit string");
        }
        int maxYear = LocalDate.now(clock).getYear() + 1;
        if (key.year() < MIN_YEAR || key.year() > maxYear) {
            return Outcome.err(ErrorKind.VALIDATION, "Invalid year " + key.year() + " for " + key
                    + ": expected " + MIN_YEAR + ".." + maxYear);
        }
        return Outcome.ok(key);
    }

    private Outcome<StationMeta> resolveStation(StationYear key) {
        return pipeline.stations().find(key.stationId())
                .map(Outcome::ok)
                .orElseGet(() -> Outcome.err(ErrorKind.STATION, "Station " + key.stationId() + " not found"));
    }

    private Outcome<RawHandle> fetch(StationYear key, BatchOptions opts) {
        return Outcome.attempt("fetch", key.toString(), ErrorKind.DOWNLOAD, retry.wrap("Fetch " + key,
                () -> pipeline.fetcher().fetch(key.stationId(), key.year(), opts.isForceRefresh())));
    }

    private Outcome<WeatherTable> standardTable(StationMeta station, StationYear key, BatchOptions opts) {
        String cacheKey = processedKey(key);
        if (!opts.isForceRefresh()) {
            Optional<WeatherTable> cached = processedCache.get(cacheKey, WeatherTable.class);
            if (cached.isPresent()) {
                logger.debug("Using cached processed data for {}", key);
                return Outcome.ok(cached.get());
            }
        }
        Outcome<WeatherTable> table = fetch(key, opts).flatMap(raw -> {
            enter(key, ItemState.FETCHING, ItemState.TRANSFORMING);
            return Outcome.attempt("transform", key.toString(), ErrorKind.PROCESSING,
                    () -> pipeline.transformer().transform(raw, station, key.year()));
        });
        if (table.isOk()) {
            processedCache.set(cacheKey, table.value(), null, DataType.TABULAR);
        }
        return table;
    }

    private Outcome<WeatherTable> streamTable(StationMeta station, StationYear key, BatchOptions opts) {
        return fetch(key, opts).flatMap(raw -> {
            enter(key, ItemState.FETCHING, ItemState.TRANSFORMING);
            return Outcome.attempt("streaming transform", key.toString(), ErrorKind.PROCESSING, () -> {
                StreamResult<WeatherRecord> streamed = streaming.transform(raw.openChunks(), config.getChunkSize(),
                        lines -> pipeline.transformer().transformChunk(lines, station, key.year()),
                        WeatherRecord.BY_TIMESTAMP);
                if (streamed.isEmpty()) {
                    throw new DataValidationException("No data chunks were successfully processed",
                            "streaming_result", key.toString());
                }
                logger.debug("Streamed {} records for {} ({} chunks, {} skipped, peak {}MB)",
                        streamed.records().size(), key, streamed.chunksProcessed(), streamed.chunksFailed(),
                        String.format("%.1f", streamed.peakMb()));
                return WeatherTable.of(streamed.records());
            });
        });
    }

    private Outcome<WeatherTable> validate(WeatherTable table, StationYear key) {
        Outcome<Boolean> checked = Outcome.attempt("validate", key.toString(), ErrorKind.VALIDATION,
                () -> pipeline.validator().validate(table));
        if (!checked.isOk()) {
            return checked.propagate();
        }
        return checked.value()
                ? Outcome.ok(table)
                : Outcome.err(ErrorKind.VALIDATION, "Data validation failed for " + key);
    }

    private WorkResult failed(StationYear key, ItemState state, Outcome<?> outcome, long start) {
        enter(key, state, ItemState.FAILED);
        logger.error("Failed to process {} [{}]: {}", key, outcome.errorKind().code(), outcome.message());
        return WorkResult.failure(key, outcome.errorKind(), outcome.message(), elapsedSince(start));
    }

    private static ItemState enter(StationYear key, ItemState from, ItemState to) {
        logger.debug("{}: {} -> {}", key, from, to);
        return to;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private void logSummary(BatchStats stats) {
        logger.info("Batch processing completed: {}/{} successful ({}%)", stats.successful(), stats.total(),
                String.format("%.1f", stats.successRate()));
        logger.info("  Total time: {}s, average per item: {}s, records: {}",
                String.format("%.2f", stats.totalTime().toNanos() / 1e9),
                String.format("%.2f", stats.averageTimePerStation().toNanos() / 1e9),
                stats.totalDataRecords());
        logger.info("  Cache hits: {}, misses: {}", stats.cacheHits(), stats.cacheMisses());
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "epw-batch-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
