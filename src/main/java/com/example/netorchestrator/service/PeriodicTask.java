package com.example.netorchestrator.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A polling loop on its own thread. Each cycle is scheduled after the previous one finished:
 * after the regular interval when it succeeded, after the backoff delay when it threw.
 * A failing cycle never ends the loop; only {@link #stop()} does. The one exception is a
 * {@link VirtualMachineError}, after which the task reports itself as no longer alive.
 */
@Slf4j
public abstract class PeriodicTask {

    private final String name;
    private final Duration interval;
    private final Duration backoff;
    private final Duration shutdownTimeout;

    private ScheduledThreadPoolExecutor scheduler;
    private volatile boolean running = false;
    private volatile boolean loopActive = false;

    protected PeriodicTask(String name, Duration interval, Duration backoff, Duration shutdownTimeout) {
        this.name = name;
        this.interval = interval;
        this.backoff = backoff;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * One pass over the store. Exceptions abort the cycle and trigger the backoff delay.
     */
    public abstract void runCycle();

    public synchronized void start() {
        if (running) {
            log.warn("{} is already running", name);
            return;
        }

        scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        running = true;
        loopActive = true;
        scheduler.execute(this::loop);

        log.info("{} started (interval={}, backoff={})", name, interval, backoff);
    }

    /**
     * Stop scheduling new cycles and wait for the in-flight one, if any.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping {}", name);
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not finish its current cycle within {}, interrupting", name, shutdownTimeout);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("{} stopped", name);
    }

    public boolean isAlive() {
        return running && loopActive && scheduler != null && !scheduler.isShutdown();
    }

    public String getName() {
        return name;
    }

    private void loop() {
        if (!running) {
            return;
        }

        Duration delay = interval;
        try {
            runCycle();
        } catch (VirtualMachineError e) {
            loopActive = false;
            log.error("{} cycle hit {}, loop terminated", name, e.getClass().getSimpleName(), e);
            throw e;
        } catch (Throwable t) {
            log.error("{} cycle failed, retrying in {}", name, backoff, t);
            delay = backoff;
        }

        if (!running) {
            return;
        }
        try {
            scheduler.schedule(this::loop, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            loopActive = false;
            log.debug("{} was stopped before its next cycle could be scheduled", name);
        }
    }
}
