package com.github.dimitryivaniuta.scheduling.scheduler;

import com.github.dimitryivaniuta.scheduling.frequency.Frequency;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs {@link ScheduleEntry} tasks whenever their {@link Frequency} says they are due.
 *
 * <p>Two polling loops, each on its own single thread:
 * <ul>
 *   <li>fine loop (default every 100ms) scans entries with a sub-day frequency (s / m / h / ms)</li>
 *   <li>coarse loop (default every 5 minutes) scans day-or-larger entries (d / w / mo / y)</li>
 * </ul>
 *
 * <p>On every tick an entry with a last-run provider gets its due time re-derived from the provider;
 * then, if the clock is past the due time, the due time is recomputed and the task is handed to the
 * task executor without waiting for it. A task that throws never reaches the loop: its due time is
 * recomputed, the failure goes to the {@link TaskErrorHandler}, and the entry stays scheduled.
 *
 * <p>Guarantees and limits:
 * <ul>
 *   <li>{@code start()} and {@code stop()} are idempotent; nothing starts until {@code start()} is called</li>
 *   <li>{@code stop()} does not wait for in-flight tasks and there is no per-task timeout</li>
 *   <li>with {@link OverlapPolicy#ALLOW} two invocations of the same entry can overlap when a run takes
 *       longer than the period; use {@link OverlapPolicy#SKIP_IF_RUNNING} to serialise them</li>
 *   <li>with {@code maxConcurrentTasks = 0} the number of concurrent tasks is unbounded</li>
 * </ul>
 *
 * <p>The scheduler owns no logger. Failures are reported through {@link TaskErrorHandler} and
 * {@link SchedulerListener}; MDC keys {@value #MDC_ENTRY_KEY} and {@value #MDC_RUN_ID_KEY} are set
 * around every task invocation so the task's own logging carries them, and put back to their previous
 * values afterwards.
 */
public class FrequencyScheduler implements AutoCloseable {

    public static final String MDC_ENTRY_KEY = "scheduleEntry";
    public static final String MDC_RUN_ID_KEY = "taskRunId";

    private final Clock clock;
    private final SchedulerProperties props;
    private final Executor taskExecutor;
    private final ExecutorService ownedTaskExecutor;
    private final TaskErrorHandler errorHandler;
    private final SchedulerListener listener;

    private final ReentrantReadWriteLock entriesLock = new ReentrantReadWriteLock();
    private final List<ScheduleEntry> fineEntries = new ArrayList<>();
    private final List<ScheduleEntry> coarseEntries = new ArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();

    private final Object lifecycleMonitor = new Object();
    private ScheduledExecutorService fineLoop;
    private ScheduledExecutorService coarseLoop;
    private volatile boolean running;

    public FrequencyScheduler(Clock clock,
                              SchedulerProperties props,
                              TaskErrorHandler errorHandler,
                              SchedulerListener listener) {
        this(clock, props, newTaskExecutor(props), true, errorHandler, listener);
    }

    /**
     * Uses a caller-managed executor for task invocations; {@link #close()} leaves it running.
     * {@code maxConcurrentTasks} is ignored, the executor decides.
     */
    public FrequencyScheduler(Clock clock,
                              SchedulerProperties props,
                              Executor taskExecutor,
                              TaskErrorHandler errorHandler,
                              SchedulerListener listener) {
        this(clock, props, taskExecutor, false, errorHandler, listener);
    }

    private FrequencyScheduler(Clock clock,
                               SchedulerProperties props,
                               Executor taskExecutor,
                               boolean ownsTaskExecutor,
                               TaskErrorHandler errorHandler,
                               SchedulerListener listener) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor must not be null");
        this.ownedTaskExecutor = ownsTaskExecutor ? (ExecutorService) taskExecutor : null;
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Zero-config scheduler on the system clock with default properties. Not started.
     */
    public static FrequencyScheduler create() {
        return new FrequencyScheduler(Clock.systemDefaultZone(), new SchedulerProperties(),
                new LoggingTaskErrorHandler(), SchedulerListener.NOOP);
    }

    /**
     * Registers a new entry due one period from now and returns it so the caller can attach
     * the task ({@link ScheduleEntry#execute}) and optionally a last-run provider.
     * Entries without a task are ignored by the loops.
     */
    public ScheduleEntry every(Frequency frequency) {
        Objects.requireNonNull(frequency, "frequency must not be null");
        if (frequency.isZero()) {
            throw new IllegalArgumentException("frequency must not be zero");
        }

        Resolution resolution = frequency.isSubDay() ? Resolution.FINE : Resolution.COARSE;
        ScheduleEntry entry = new ScheduleEntry("entry-" + sequence.incrementAndGet(), frequency, resolution);
        entry.reschedule(clock.instant(), clock.getZone());

        entriesLock.writeLock().lock();
        try {
            (resolution == Resolution.FINE ? fineEntries : coarseEntries).add(entry);
        } finally {
            entriesLock.writeLock().unlock();
        }
        return entry;
    }

    /** Starts both polling loops, or does nothing if they are already running. */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) return;

            long fineMs = periodMillis(props.getFineResolution());
            long coarseMs = periodMillis(props.getCoarseResolution());

            fineLoop = newLoop("fine-");
            coarseLoop = newLoop("coarse-");
            fineLoop.scheduleWithFixedDelay(() -> runPending(Resolution.FINE), fineMs, fineMs, TimeUnit.MILLISECONDS);
            coarseLoop.scheduleWithFixedDelay(() -> runPending(Resolution.COARSE), coarseMs, coarseMs, TimeUnit.MILLISECONDS);

            running = true;
        }
    }

    /** Stops both polling loops if running. In-flight tasks are left to finish on their own. */
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) return;

            fineLoop.shutdown();
            coarseLoop.shutdown();
            fineLoop = null;
            coarseLoop = null;

            running = false;
        }
    }

    /** Stops the scheduler (if running) and forgets every entry. */
    public void clear() {
        stop();
        entriesLock.writeLock().lock();
        try {
            fineEntries.clear();
            coarseEntries.clear();
        } finally {
            entriesLock.writeLock().unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Snapshot of all entries, fine-resolution ones first. */
    public List<ScheduleEntry> entries() {
        entriesLock.readLock().lock();
        try {
            List<ScheduleEntry> all = new ArrayList<>(fineEntries.size() + coarseEntries.size());
            all.addAll(fineEntries);
            all.addAll(coarseEntries);
            return List.copyOf(all);
        } finally {
            entriesLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        stop();
        if (ownedTaskExecutor != null) {
            ownedTaskExecutor.shutdown();
        }
    }

    /**
     * One poll over the entries of the given resolution. Package-private so tests can drive ticks
     * without the loops.
     */
    void runPending(Resolution resolution) {
        List<ScheduleEntry> snapshot;
        entriesLock.readLock().lock();
        try {
            snapshot = List.copyOf(resolution == Resolution.FINE ? fineEntries : coarseEntries);
        } finally {
            entriesLock.readLock().unlock();
        }

        for (ScheduleEntry entry : snapshot) {
            if (entry.task() == null) continue;

            if (entry.hasLastRunProvider()) {
                try {
                    entry.reschedule(clock.instant(), clock.getZone());
                } catch (RuntimeException ex) {
                    // keep polling the other entries; a throwing provider must not kill the loop
                    errorHandler.handleError(entry, ex);
                    continue;
                }
            }

            if (entry.isDue(clock.instant())) {
                dispatch(entry);
            }
        }
    }

    private void dispatch(ScheduleEntry entry) {
        Runnable task = entry.task();
        if (!entry.acquire(props.getOverlapPolicy())) {
            listener.onTaskSkipped(entry);
            return;
        }

        try {
            // before the task runs, so the next poll does not fire it again
            entry.reschedule(clock.instant(), clock.getZone());
            taskExecutor.execute(() -> runTask(entry, task));
        } catch (RuntimeException ex) {
            entry.release();
            errorHandler.handleError(entry, ex instanceof RejectedExecutionException
                    ? ex
                    : new IllegalStateException("Failed to dispatch " + entry.getName(), ex));
        }
    }

    private void runTask(ScheduleEntry entry, Runnable task) {
        String outerEntry = MDC.get(MDC_ENTRY_KEY);
        String outerRunId = MDC.get(MDC_RUN_ID_KEY);
        MDC.put(MDC_ENTRY_KEY, entry.getName());
        MDC.put(MDC_RUN_ID_KEY, UUID.randomUUID().toString());
        long startNs = System.nanoTime();
        try {
            listener.onTaskStarted(entry);
            task.run();
            listener.onTaskSucceeded(entry, Duration.ofNanos(System.nanoTime() - startNs));
        } catch (Throwable ex) {
            rescheduleAfterFailure(entry, ex);
            listener.onTaskFailed(entry, ex, Duration.ofNanos(System.nanoTime() - startNs));
            errorHandler.handleError(entry, ex);
        } finally {
            entry.release();
            restoreMdc(MDC_ENTRY_KEY, outerEntry);
            restoreMdc(MDC_RUN_ID_KEY, outerRunId);
        }
    }

    // a caller-thread executor may already carry these keys
    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private void rescheduleAfterFailure(ScheduleEntry entry, Throwable taskError) {
        try {
            entry.reschedule(clock.instant(), clock.getZone());
        } catch (RuntimeException providerError) {
            taskError.addSuppressed(providerError);
        }
    }

    private ScheduledExecutorService newLoop(String suffix) {
        CustomizableThreadFactory tf = new CustomizableThreadFactory(props.getThreadNamePrefix() + suffix);
        tf.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(tf);
    }

    private static ExecutorService newTaskExecutor(SchedulerProperties props) {
        CustomizableThreadFactory tf = new CustomizableThreadFactory(props.getThreadNamePrefix() + "task-");
        tf.setDaemon(true);
        return props.getMaxConcurrentTasks() > 0
                ? Executors.newFixedThreadPool(props.getMaxConcurrentTasks(), tf)
                : Executors.newCachedThreadPool(tf);
    }

    private static long periodMillis(Duration resolution) {
        long ms = resolution.toMillis();
        if (ms <= 0) {
            throw new IllegalArgumentException("resolution must be at least 1ms: " + resolution);
        }
        return ms;
    }
}
