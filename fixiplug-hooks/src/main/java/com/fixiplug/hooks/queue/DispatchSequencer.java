package com.fixiplug.hooks.queue;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs tasks sharing a key one after another.
 * <p>
 * Each key has a tail future; a submitted task starts once the previous
 * task for the same key has completed, normally or not. Tasks for different
 * keys never wait for each other.
 */
public class DispatchSequencer {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, done);

        Runnable start = () -> {
            CompletableFuture<T> run;
            try {
                run = task.get();
            } catch (RuntimeException e) {
                run = CompletableFuture.failedFuture(e);
            }
            run.whenComplete((value, error) -> {
                tails.remove(key, done);
                done.complete(null);
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            });
        };

        if (previous == null) {
            start.run();
        } else {
            previous.whenComplete((ignored, error) -> start.run());
        }
        return result;
    }

    /**
     * @return true if a task for {@code key} is running or waiting
     */
    public boolean isBusy(String key) {
        return tails.containsKey(key);
    }
}
