package com.fixiplug.hooks.queue;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects a hook dispatching itself through its own handler chain.
 * <p>
 * Each dispatch carries the set of hook names already running in its call
 * chain. The set is bound to the current thread only while one of the chain's
 * handlers executes, so a nested dispatch started from that handler sees its
 * ancestors, while unrelated callers on other threads (or later scheduler
 * turns) start with an empty chain.
 */
public class ReentranceGuard {

    private final ThreadLocal<Set<String>> current = new ThreadLocal<>();
    private final Map<String, Integer> inFlight = new ConcurrentHashMap<>();

    /**
     * @return true if {@code hookName} is already part of the calling chain
     */
    public boolean isRecursive(String hookName) {
        return currentChain().contains(hookName);
    }

    public Set<String> currentChain() {
        Set<String> chain = current.get();
        return chain != null ? chain : Set.of();
    }

    /**
     * Chain for a new dispatch of {@code hookName} started by the caller.
     */
    public Set<String> extend(String hookName) {
        Set<String> chain = new HashSet<>(currentChain());
        chain.add(hookName);
        return Collections.unmodifiableSet(chain);
    }

    /**
     * Run {@code action} with {@code chain} bound to the current thread,
     * restoring the previous binding afterwards.
     */
    public <T> T callWithin(Set<String> chain, Callable<T> action) throws Exception {
        Set<String> previous = current.get();
        current.set(chain);
        try {
            return action.call();
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }

    public void enter(String hookName) {
        inFlight.merge(hookName, 1, Integer::sum);
    }

    public void exit(String hookName) {
        inFlight.computeIfPresent(hookName, (name, count) -> count > 1 ? count - 1 : null);
    }

    /**
     * @return true while at least one dispatch of {@code hookName} is running
     */
    public boolean isActive(String hookName) {
        return inFlight.containsKey(hookName);
    }

    public Set<String> activeHooks() {
        return Set.copyOf(inFlight.keySet());
    }
}
