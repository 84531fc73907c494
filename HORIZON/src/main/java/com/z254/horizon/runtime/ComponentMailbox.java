package com.z254.horizon.runtime;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Serialized execution context owned by one component.
 * <p>
 * Every request, notification, tick and timer submitted here runs on a single
 * thread, one at a time, so the owning component can keep plain mutable state.
 * <ul>
 *     <li>{@link #request} - caller receives the reply as a {@link Mono}</li>
 *     <li>{@link #tell} - fire-and-forget, queued behind pending work</li>
 *     <li>{@link #every} / {@link #after} - self-scheduled ticks</li>
 * </ul>
 * Failures inside notifications and ticks are caught at the task boundary and
 * logged; the component keeps its last state.
 */
@Slf4j
public class ComponentMailbox {

    private final String name;
    private final ScheduledExecutorService executor;
    private final Scheduler scheduler;

    public ComponentMailbox(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-mailbox");
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = Schedulers.fromExecutorService(executor, name);
    }

    public String getName() {
        return name;
    }

    /**
     * Run work on the mailbox and reply with its result.
     */
    public <T> Mono<T> request(String operation, Callable<T> work) {
        return Mono.fromCallable(work)
                .subscribeOn(scheduler)
                .doOnError(e -> log.debug("{} request {} failed: {}", name, operation, e.getMessage()));
    }

    /**
     * Queue work without waiting for it.
     */
    public void tell(String operation, Runnable work) {
        try {
            executor.execute(() -> guarded(operation, work));
        } catch (RejectedExecutionException e) {
            log.warn("{} dropped notification {}: mailbox is shut down", name, operation);
        }
    }

    /**
     * Run work repeatedly with a fixed delay between runs.
     */
    public ScheduledFuture<?> every(String operation, Duration interval, Runnable work) {
        long millis = interval.toMillis();
        return executor.scheduleWithFixedDelay(() -> guarded(operation, work), millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Run work once after a delay.
     */
    public ScheduledFuture<?> after(String operation, Duration delay, Runnable work) {
        try {
            return executor.schedule(() -> guarded(operation, work), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("{} dropped timer {}: mailbox is shut down", name, operation);
            return null;
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public void shutdown() {
        log.info("Shutting down {} mailbox", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler.dispose();
    }

    // ========== Private Helper Methods ==========

    private void guarded(String operation, Runnable work) {
        try {
            work.run();
        } catch (Exception e) {
            // an escaped exception would also cancel a periodic task
            log.error("{} {} failed, continuing with last state: {}", name, operation, e.getMessage(), e);
        }
    }
}
