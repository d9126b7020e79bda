package com.fixiplug.hooks.scheduler;

/**
 * Runs deferred work (error delivery, emit drains) after the current
 * dispatch has returned control to its caller.
 * <p>
 * Implementations must run tasks one at a time, in submission order.
 */
@FunctionalInterface
public interface HookScheduler {

    void schedule(Runnable task);
}
