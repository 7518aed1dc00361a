package com.astralcore.security.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs periodic housekeeping (expired sessions, idle rate-limit windows, stale MFA codes) on a
 * single background thread.
 * <p>
 * Tasks are registered by name before {@link #start()}. A task that throws is logged and
 * keeps its schedule.
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    private ScheduledExecutorService executor;

    public synchronized MaintenanceScheduler register(String name, Duration interval, Runnable action) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (tasks.containsKey(name)) {
            throw new IllegalStateException("Maintenance task already registered: " + name);
        }
        Task task = new Task(name, interval, action);
        tasks.put(name, task);
        if (executor != null) {
            schedule(task);
        }
        return this;
    }

    /**
     * Starts the background thread. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        AtomicInteger threads = new AtomicInteger();
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "astral-maintenance-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        tasks.values().forEach(this::schedule);
        log.info("Maintenance scheduler started with tasks {}", tasks.keySet());
    }

    /**
     * Cancels all schedules and waits briefly for a running task to finish. Idempotent.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Maintenance scheduler stopped");
    }

    /**
     * Runs every registered task once on the calling thread.
     */
    public void runAllNow() {
        List<Task> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(tasks.values());
        }
        snapshot.forEach(Task::runSafely);
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public synchronized List<String> taskNames() {
        return List.copyOf(tasks.keySet());
    }

    @Override
    public void close() {
        stop();
    }

    private void schedule(Task task) {
        long millis = task.interval().toMillis();
        scheduled.add(executor.scheduleWithFixedDelay(task::runSafely, millis, millis, TimeUnit.MILLISECONDS));
    }

    private record Task(String name, Duration interval, Runnable action) {

        void runSafely() {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Maintenance task '{}' failed", name, e);
            }
        }
    }
}
