package com.github.dimitryivaniuta.scheduling.scheduler;

import com.github.dimitryivaniuta.scheduling.frequency.Frequency;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * One periodic task registered through {@link FrequencyScheduler#every(Frequency)}.
 *
 * <pre>
 * scheduler.every(Frequency.parse("1d"))
 *         .named("nightly-backup")
 *         .execute(backupService::run)
 *         .withLastRun(backupRepository::lastSuccessfulBackupAt);
 * </pre>
 *
 * Thread-safety: nextRun / lastRun are guarded by the entry's own monitor, so the polling thread
 * and task threads never observe a half-updated schedule. The task and provider references are volatile
 * and may be swapped at any time.
 */
public final class ScheduleEntry {

    private final Frequency frequency;
    private final Resolution resolution;
    private final AtomicInteger runningInvocations = new AtomicInteger();

    private volatile String name;
    private volatile Runnable task;
    private volatile Supplier<Instant> lastRunProvider;

    private Instant nextRun;
    private Instant lastRun = Instant.EPOCH;

    ScheduleEntry(String name, Frequency frequency, Resolution resolution) {
        this.name = name;
        this.frequency = frequency;
        this.resolution = resolution;
    }

    /** Sets (or replaces) the task invoked whenever the entry is due. */
    public ScheduleEntry execute(Runnable task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        return this;
    }

    /**
     * Makes an external timestamp (e.g. read from a database) authoritative for the last run.
     * The due time is re-derived from it on every poll. A null result counts as "never ran".
     */
    public ScheduleEntry withLastRun(Supplier<Instant> lastRunProvider) {
        this.lastRunProvider = Objects.requireNonNull(lastRunProvider, "lastRunProvider must not be null");
        return this;
    }

    public ScheduleEntry named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        return this;
    }

    public String getName() { return name; }

    public Frequency getFrequency() { return frequency; }

    public Resolution getResolution() { return resolution; }

    public synchronized Instant getNextRun() { return nextRun; }

    public synchronized Instant getLastRun() { return lastRun; }

    public int getRunningInvocations() { return runningInvocations.get(); }

    public boolean hasLastRunProvider() { return lastRunProvider != null; }

    Runnable task() { return task; }

    /**
     * Recomputes lastRun / nextRun: from the provider when one is attached, otherwise from {@code now}.
     * The provider is called outside the monitor.
     */
    void reschedule(Instant now, ZoneId zone) {
        Supplier<Instant> provider = lastRunProvider;
        Instant base = now;
        if (provider != null) {
            Instant provided = provider.get();
            base = (provided != null) ? provided : Instant.EPOCH;
        }
        Instant next = frequency.nextRun(base, zone);
        synchronized (this) {
            lastRun = base;
            nextRun = next;
        }
    }

    synchronized boolean isDue(Instant now) {
        return nextRun != null && now.isAfter(nextRun);
    }

    boolean acquire(OverlapPolicy policy) {
        if (policy == OverlapPolicy.SKIP_IF_RUNNING) {
            return runningInvocations.compareAndSet(0, 1);
        }
        runningInvocations.incrementAndGet();
        return true;
    }

    void release() {
        runningInvocations.decrementAndGet();
    }

    @Override
    public String toString() {
        return "ScheduleEntry{name=" + name + ", frequency=" + frequency + ", nextRun=" + getNextRun() + "}";
    }
}
