package com.brandsentinel.core.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide pipeline counters.
 *
 * <p>
 * Written by the pipeline consumer, read by the periodic reporter and the
 * status endpoint. All access goes through one {@link ReadWriteLock}, so a
 * {@link #snapshot()} is always internally consistent.
 * </p>
 *
 * @since 1.0.0
 */
public class Statistics {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Instant startTime;

    private long eventsProcessed;
    private long threatsFound;
    private long actionsLive;
    private long actionsDryRun;

    public Statistics() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock used for start time and uptime
     */
    public Statistics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.startTime = clock.instant();
    }

    public void incrementEventsProcessed() {
        lock.writeLock().lock();
        try {
            eventsProcessed++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void incrementThreatsFound() {
        lock.writeLock().lock();
        try {
            threatsFound++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Count one successful enforcement action.
     *
     * @param dryRun whether the action was simulated
     */
    public void recordAction(boolean dryRun) {
        lock.writeLock().lock();
        try {
            if (dryRun) {
                actionsDryRun++;
            } else {
                actionsLive++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return consistent copy of all counters plus the current uptime
     */
    public StatisticsSnapshot snapshot() {
        lock.readLock().lock();
        try {
            Duration uptime = Duration.between(startTime, clock.instant());
            return new StatisticsSnapshot(startTime, uptime,
                    eventsProcessed, threatsFound, actionsLive, actionsDryRun);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getStartTime() {
        return startTime;
    }
}
