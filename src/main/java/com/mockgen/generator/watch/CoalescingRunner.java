package com.mockgen.generator.watch;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task on an executor, never more than one execution at a time.
 *
 * Triggers arriving while the task runs collapse into a single pending execution, which starts
 * as soon as the current one finishes.
 */
public class CoalescingRunner {
    private static final Logger log = LoggerFactory.getLogger(CoalescingRunner.class);

    private final String name;
    private final Executor executor;
    private final Runnable task;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean pending = new AtomicBoolean();

    public CoalescingRunner(String name, Executor executor, Runnable task) {
        this.name = name;
        this.executor = executor;
        this.task = task;
    }

    public void trigger() {
        pending.set(true);
        if (running.compareAndSet(false, true)) {
            submit();
        }
    }

    public boolean isIdle() {
        return !running.get() && !pending.get();
    }

    private void submit() {
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.warn("Run for {} rejected; the watcher is shutting down", name);
        }
    }

    private void drain() {
        do {
            while (pending.getAndSet(false)) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Run for {} failed", name, e);
                }
            }
            running.set(false);
        } while (pending.get() && running.compareAndSet(false, true));
    }
}
