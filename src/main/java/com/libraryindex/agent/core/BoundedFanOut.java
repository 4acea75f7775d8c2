package com.libraryindex.agent.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a round of independent units on at most {@code maxWorkers} threads and
 * waits for all of them.
 *
 * Each unit has its own timeout, counted from the moment a worker starts it,
 * so units queued behind a busy pool are not charged for the wait. A unit that
 * times out is interrupted and reported as failed; its siblings are unaffected. {@link #runAll} returns only
 * after every unit has settled, with outcomes in input order.
 *
 * One instance serves one session and is closed with it.
 */
@Slf4j
public class BoundedFanOut implements AutoCloseable {

    private final ThreadPoolTaskExecutor executor;
    private final Duration unitTimeout;

    public BoundedFanOut(String name, int maxWorkers, Duration unitTimeout) {
        this.unitTimeout = unitTimeout;
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, maxWorkers));
        executor.setMaxPoolSize(Math.max(1, maxWorkers));
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(name + "-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
    }

    public <T, R> List<Outcome<R>> runAll(List<T> units, Function<T, R> work) {
        List<CompletableFuture<R>> futures = new ArrayList<>(units.size());
        for (T unit : units) {
            futures.add(submit(unit, work));
        }

        // barrier: handle() never completes exceptionally, so join() cannot throw
        CompletableFuture.allOf(futures.stream()
                .map(f -> f.handle((r, ex) -> null))
                .toArray(CompletableFuture[]::new)).join();

        List<Outcome<R>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<R> f : futures) {
            outcomes.add(toOutcome(f));
        }
        return outcomes;
    }

    private <T, R> CompletableFuture<R> submit(T unit, Function<T, R> work) {
        CompletableFuture<R> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            if (result.isDone()) {
                return;
            }
            // the clock starts when a worker picks the unit up, not while it waits in the queue
            result.orTimeout(unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(work.apply(unit));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.whenComplete((r, ex) -> {
            if (ex instanceof TimeoutException) {
                log.warn("Unit timed out after {}ms: {}", unitTimeout.toMillis(), unit);
                task.cancel(true);
            }
        });
        return result;
    }

    private static <R> Outcome<R> toOutcome(CompletableFuture<R> future) {
        try {
            return Outcome.success(future.get());
        } catch (ExecutionException | CompletionException e) {
            return Outcome.failure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    /**
     * Settled result of one unit: either a value or the failure that ended it.
     */
    public record Outcome<R>(R value, Throwable error) {

        static <R> Outcome<R> success(R value) {
            return new Outcome<>(value, null);
        }

        static <R> Outcome<R> failure(Throwable error) {
            return new Outcome<>(null, error);
        }

        public boolean succeeded() {
            return error == null;
        }

        public boolean timedOut() {
            return error instanceof TimeoutException;
        }
    }
}
