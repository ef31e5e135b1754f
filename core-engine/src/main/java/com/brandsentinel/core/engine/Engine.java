package com.brandsentinel.core.engine;

import com.brandsentinel.core.config.Durations;
import com.brandsentinel.core.config.SentinelConfig;
import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.Detector;
import com.brandsentinel.core.pipeline.Enforcer;
import com.brandsentinel.core.pipeline.Enricher;
import com.brandsentinel.core.pipeline.EventQueue;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.Source;
import com.brandsentinel.core.pipeline.StageException;
import com.brandsentinel.core.stats.Statistics;
import com.brandsentinel.core.stats.StatisticsReporter;
import com.brandsentinel.core.storage.Storage;
import com.brandsentinel.core.storage.StorageException;
import com.brandsentinel.core.storage.StorageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the monitoring pipeline.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   Source workers ──publish──▶ EventQueue ──▶ consumer
 *                                                │
 *     save event → enrichers → detectors → save results
 *                                                │ threat?
 *                                                ▼
 *                                 enforcers (honouring dry-run)
 * </pre>
 *
 * <h3>Threads</h3>
 * <p>
 * {@link #run(ShutdownSignal)} starts one worker per source, exactly one
 * pipeline consumer and one statistics reporter on a fixed pool. Events are
 * therefore processed strictly in queue order. Stage failures are logged and
 * isolated to the event or result they concern; they never stop the
 * pipeline.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * When the signal fires the queue is closed (events still queued are
 * abandoned), sources are asked to stop, every worker is awaited and storage
 * is closed. An engine runs once.
 * </p>
 *
 * @since 1.0.0
 */
public class Engine {

    private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

    private final Storage storage;
    private final Statistics statistics;
    private final List<Source> sources;
    private final List<Enricher> enrichers;
    private final List<Detector> detectors;
    private final List<Enforcer> enforcers;
    private final boolean dryRun;
    private final int queueCapacity;
    private final Duration statsInterval;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong localIds = new AtomicLong();

    private Engine(Builder builder) {
        this.storage = Objects.requireNonNull(builder.storage, "Storage must not be null");
        this.statistics = builder.statistics != null ? builder.statistics : new Statistics();
        this.sources = List.copyOf(builder.sources);
        this.enrichers = List.copyOf(builder.enrichers);
        this.detectors = List.copyOf(builder.detectors);
        this.enforcers = List.copyOf(builder.enforcers);
        this.dryRun = builder.dryRun;
        if (builder.queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be >= 1, got: " + builder.queueCapacity);
        }
        this.queueCapacity = builder.queueCapacity;
        this.statsInterval = Objects.requireNonNull(builder.statsInterval, "Stats interval must not be null");
    }

    /**
     * Create a new {@link Builder}.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build storage and every enabled stage from configuration.
     *
     * @param config validated configuration
     * @return a ready-to-run engine
     * @throws IllegalArgumentException if storage or a stage cannot be built
     */
    public static Engine fromConfig(SentinelConfig config) {
        Objects.requireNonNull(config, "Config must not be null");
        Storage storage = StorageFactory.create(config.getStorage().getType());
        return builder()
                .storage(storage)
                .sources(StageFactory.createSources(config))
                .enrichers(StageFactory.createEnrichers(config))
                .detectors(StageFactory.createDetectors(config))
                .enforcers(StageFactory.createEnforcers(config))
                .dryRun(config.isDryRun())
                .queueCapacity(config.getEngine().getQueueCapacity())
                .statsInterval(Durations.parse(config.getEngine().getStatsInterval()))
                .build();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Run the pipeline until {@code signal} fires, then shut down and return
     * once every worker has exited and storage is closed.
     *
     * @param signal shared cancellation signal
     * @throws IllegalStateException if the engine has already been run
     */
    public void run(ShutdownSignal signal) {
        Objects.requireNonNull(signal, "Signal must not be null");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine has already been run");
        }
        LOG.info("Starting engine: {} source(s), {} enricher(s), {} detector(s), {} enforcer(s), dry-run={}",
                sources.size(), enrichers.size(), detectors.size(), enforcers.size(), dryRun);
        if (sources.isEmpty()) {
            LOG.warn("No sources enabled; the engine will idle until shutdown");
        }

        EventQueue queue = new EventQueue(queueCapacity);
        ExecutorService executor = Executors.newFixedThreadPool(sources.size() + 2, workerThreads());
        List<Future<?>> workers = new ArrayList<>();
        for (Source source : sources) {
            workers.add(executor.submit(() -> runSource(source, signal, queue)));
        }
        workers.add(executor.submit(() -> consume(signal, queue)));
        workers.add(executor.submit(new StatisticsReporter(statistics, signal, statsInterval)));
        executor.shutdown();

        boolean interrupted = false;
        try {
            signal.await();
        } catch (InterruptedException e) {
            interrupted = true;
            signal.cancel();
        }

        LOG.info("Shutting down engine");
        List<Event> abandoned = queue.close();
        if (!abandoned.isEmpty()) {
            LOG.info("Abandoned {} queued event(s) at shutdown", abandoned.size());
        }
        for (Source source : sources) {
            try {
                source.stop();
            } catch (RuntimeException e) {
                LOG.warn("Source '{}' failed to stop: {}", source.name(), e.getMessage(), e);
            }
        }
        interrupted |= awaitAll(workers);

        try {
            storage.close();
        } catch (StorageException e) {
            LOG.warn("Failed to close storage: {}", e.getMessage(), e);
        }
        LOG.info("Engine stopped. {}", statistics.snapshot());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean awaitAll(List<Future<?>> workers) {
        boolean interrupted = false;
        for (Future<?> worker : workers) {
            while (true) {
                try {
                    worker.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    LOG.error("Worker terminated abnormally", e.getCause());
                    break;
                }
            }
        }
        return interrupted;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sentinel-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    private void runSource(Source source, ShutdownSignal signal, EventQueue queue) {
        LOG.info("Starting source '{}'", source.name());
        try {
            source.start(signal, queue);
        } catch (StageException | RuntimeException e) {
            LOG.error("Source '{}' failed: {}", source.name(), e.getMessage(), e);
        }
    }

    private void consume(ShutdownSignal signal, EventQueue queue) {
        try {
            Optional<Event> next;
            while ((next = queue.next(signal)).isPresent()) {
                process(signal, next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Pipeline consumer stopped");
    }

    // ---------------------------------------------------------------
    // Per-event processing
    // ---------------------------------------------------------------

    /**
     * Push one event through save, enrichment, detection and enforcement.
     */
    void process(ShutdownSignal signal, Event event) {
        statistics.incrementEventsProcessed();
        saveEvent(event);

        for (Enricher enricher : enrichers) {
            try {
                enricher.enrich(signal, event);
            } catch (StageException | RuntimeException e) {
                LOG.warn("Enricher '{}' failed for {}: {}", enricher.name(), event.getDomain(), e.getMessage());
            }
        }

        List<DetectionResult> results = new ArrayList<>();
        for (Detector detector : detectors) {
            try {
                List<DetectionResult> found = detector.detect(signal, event.view());
                if (found != null) {
                    results.addAll(found);
                }
            } catch (StageException | RuntimeException e) {
                LOG.warn("Detector '{}' failed for {}: {}", detector.name(), event.getDomain(), e.getMessage());
            }
        }

        for (DetectionResult result : results) {
            handleResult(signal, result);
        }
    }

    private void saveEvent(Event event) {
        try {
            String id = storage.saveEvent(event);
            if (!event.hasId()) {
                event.assignId(id);
            }
        } catch (StorageException e) {
            LOG.warn("Failed to save event for {}: {}", event.getDomain(), e.getMessage());
            if (!event.hasId()) {
                event.assignId("event_local_" + localIds.incrementAndGet() + "_" + System.nanoTime());
            }
        }
    }

    private void handleResult(ShutdownSignal signal, DetectionResult detected) {
        DetectionResult result = detected;
        try {
            String id = storage.saveDetection(detected);
            if (!detected.hasId()) {
                result = detected.withId(id);
            }
        } catch (StorageException e) {
            LOG.warn("Failed to save detection for {}: {}", result.getDomain(), e.getMessage());
        }
        if (!result.isThreat()) {
            return;
        }

        statistics.incrementThreatsFound();
        LOG.warn("THREAT DETECTED: {} (brand={}, rule={}, confidence={})",
                result.getDomain(), result.getBrand(), result.getRule(), result.getConfidence());

        for (Enforcer enforcer : enforcers) {
            try {
                enforcer.enforce(signal, result, dryRun);
                statistics.recordAction(dryRun);
            } catch (StageException | RuntimeException e) {
                LOG.warn("Enforcer '{}' failed for {}: {}", enforcer.name(), result.getDomain(), e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Statistics getStatistics() {
        return statistics;
    }

    public Storage getStorage() {
        return storage;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Fluent builder for {@link Engine}. {@code storage} is required.
     */
    public static class Builder {
        private Storage storage;
        private Statistics statistics;
        private List<Source> sources = List.of();
        private List<Enricher> enrichers = List.of();
        private List<Detector> detectors = List.of();
        private List<Enforcer> enforcers = List.of();
        private boolean dryRun;
        private int queueCapacity = EventQueue.DEFAULT_CAPACITY;
        private Duration statsInterval = StatisticsReporter.DEFAULT_INTERVAL;

        public Builder storage(Storage storage) {
            this.storage = storage;
            return this;
        }

        public Builder statistics(Statistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder sources(List<? extends Source> sources) {
            this.sources = List.copyOf(sources);
            return this;
        }

        public Builder enrichers(List<? extends Enricher> enrichers) {
            this.enrichers = List.copyOf(enrichers);
            return this;
        }

        public Builder detectors(List<? extends Detector> detectors) {
            this.detectors = List.copyOf(detectors);
            return this;
        }

        public Builder enforcers(List<? extends Enforcer> enforcers) {
            this.enforcers = List.copyOf(enforcers);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder statsInterval(Duration statsInterval) {
            this.statsInterval = statsInterval;
            return this;
        }

        public Engine build() {
            return new Engine(this);
        }
    }
}
