package com.brandsentinel.core.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time copy of {@link Statistics}.
 *
 * @since 1.0.0
 */
public final class StatisticsSnapshot {

    private final Instant startTime;
    private final Duration uptime;
    private final long eventsProcessed;
    private final long threatsFound;
    private final long actionsLive;
    private final long actionsDryRun;

    public StatisticsSnapshot(Instant startTime, Duration uptime, long eventsProcessed,
            long threatsFound, long actionsLive, long actionsDryRun) {
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.uptime = Objects.requireNonNull(uptime, "uptime must not be null");
        this.eventsProcessed = eventsProcessed;
        this.threatsFound = threatsFound;
        this.actionsLive = actionsLive;
        this.actionsDryRun = actionsDryRun;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getUptime() {
        return uptime;
    }

    public long getEventsProcessed() {
        return eventsProcessed;
    }

    public long getThreatsFound() {
        return threatsFound;
    }

    public long getActionsLive() {
        return actionsLive;
    }

    public long getActionsDryRun() {
        return actionsDryRun;
    }

    /**
     * @return the uptime truncated to whole seconds, e.g. {@code 1h2m3s}
     */
    public String formattedUptime() {
        long seconds = uptime.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return hours + "h" + minutes + "m" + secs + "s";
        }
        if (minutes > 0) {
            return minutes + "m" + secs + "s";
        }
        return secs + "s";
    }

    @Override
    public String toString() {
        return "Stats - Uptime: " + formattedUptime()
                + ", Certs: " + eventsProcessed
                + ", Threats: " + threatsFound
                + ", Actions: " + actionsLive + " (live) + " + actionsDryRun + " (dry-run)";
    }
}
