package com.example.skirmish.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic "tick" scheduler.
 * All tasks share one thread, so ticks of different subsystems never run concurrently.
 */
public class TickService {

    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skirmish-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a named task. A task that throws is logged and keeps its schedule;
     * an uncaught exception would otherwise cancel every later run.
     * Scheduling a name that already exists replaces the old task.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.warn("[TickService] Task '{}' failed: {}", name, e.getMessage(), e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        logger.debug("[TickService] Scheduled '{}' every {}ms", name, periodMs);
        return f;
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = tasks.get(name);
        return f != null && !f.isCancelled();
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public void shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdownNow();
    }
}
