package com.indicationscout.evidence.infrastructure.adapter;

import com.indicationscout.evidence.domain.exception.DataSourceException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs independent calls concurrently and joins them at one barrier.
 * The first failure fails the barrier and is rethrown as the caller would
 * have seen it from a sequential call.
 *
 * <pre>
 * FanOut fanOut = new FanOut(executor, "clinical_trials", "whitespace");
 * CompletableFuture&lt;Integer&gt; count = fanOut.submit(() -&gt; countTrials(...));
 * fanOut.awaitAll();
 * int total = count.join();
 * </pre>
 */
public final class FanOut {

    private final Executor executor;
    private final String source;
    private final String operation;
    private final List<CompletableFuture<?>> submitted = new ArrayList<>();

    public FanOut(Executor executor, String source, String operation) {
        this.executor = executor;
        this.source = source;
        this.operation = operation;
    }

    /**
     * Schedules one call. If the executor refuses it, every call already
     * scheduled in this batch is cancelled and the refusal is reported
     * against the batch's source and operation.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> call) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            cancelAll();
            throw new DataSourceException(source, operation,
                    "Concurrent call rejected after " + submitted.size() + " scheduled: " + e.getMessage(), e);
        }
        submitted.add(future);
        return future;
    }

    /**
     * Blocks until every submitted call has completed, or until the first
     * one fails. Once this returns, {@code join()} on any submitted future
     * returns immediately.
     */
    public void awaitAll() {
        CompletableFuture<Void> barrier = CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0]));
        submitted.forEach(future -> future.whenComplete((value, error) -> {
            if (error != null) {
                barrier.completeExceptionally(error);
            }
        }));

        try {
            barrier.join();
        } catch (CompletionException e) {
            cancelAll();
            throw unwrap(e);
        }
    }

    public static <T> List<T> joinAll(List<Supplier<T>> calls, Executor executor,
                                      String source, String operation) {
        FanOut fanOut = new FanOut(executor, source, operation);
        List<CompletableFuture<T>> futures = new ArrayList<>(calls.size());
        for (Supplier<T> call : calls) {
            futures.add(fanOut.submit(call));
        }
        fanOut.awaitAll();

        List<T> results = new ArrayList<>(futures.size());
        futures.forEach(future -> results.add(future.join()));
        return results;
    }

    private void cancelAll() {
        submitted.forEach(future -> future.cancel(true));
    }

    private RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new DataSourceException(source, operation, "Concurrent call failed: " + cause.getMessage(), cause);
    }
}
