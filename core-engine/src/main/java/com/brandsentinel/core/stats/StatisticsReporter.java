package com.brandsentinel.core.stats;

import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Periodically logs a {@link StatisticsSnapshot} until the shutdown signal
 * fires. Has no other side effects.
 *
 * @since 1.0.0
 */
public class StatisticsReporter implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticsReporter.class);

    /** Default reporting period. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private final Statistics statistics;
    private final ShutdownSignal signal;
    private final Duration interval;
    private final Consumer<StatisticsSnapshot> sink;

    public StatisticsReporter(Statistics statistics, ShutdownSignal signal, Duration interval) {
        this(statistics, signal, interval, snapshot -> LOG.info("{}", snapshot));
    }

    /**
     * @param statistics counters to report
     * @param signal     shared cancellation signal
     * @param interval   reporting period; must be positive
     * @param sink       receiver of every snapshot
     */
    public StatisticsReporter(Statistics statistics, ShutdownSignal signal, Duration interval,
            Consumer<StatisticsSnapshot> sink) {
        this.statistics = Objects.requireNonNull(statistics, "Statistics must not be null");
        this.signal = Objects.requireNonNull(signal, "ShutdownSignal must not be null");
        this.interval = Objects.requireNonNull(interval, "Interval must not be null");
        this.sink = Objects.requireNonNull(sink, "Sink must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Reporting interval must be positive, got: " + interval);
        }
    }

    @Override
    public void run() {
        try {
            while (!signal.await(interval)) {
                sink.accept(statistics.snapshot());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Statistics reporter stopped");
    }
}
