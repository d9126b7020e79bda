package com.fixiplug.hooks.queue;

import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FIFO of fire-and-forget emissions, drained in batches.
 * <p>
 * A drain cycle runs from the first batch after the queue became non-empty
 * until the queue is empty again. Per-hook emission counters and the
 * once-per-cycle warning markers reset when a cycle ends.
 */
@Slf4j
public class DeferredEventQueue {

    private final HookSettings settings;
    private final Deque<DeferredEntry> queue = new ArrayDeque<>();
    private final Map<String, Integer> emitCounts = new HashMap<>();
    private final Set<String> warned = new HashSet<>();
    private boolean draining;
    private long droppedCount;

    public DeferredEventQueue(HookSettings settings) {
        this.settings = settings;
    }

    /**
     * Append an emission unless the queue is full or the hook crossed its
     * per-cycle drop threshold.
     *
     * @return true if the entry was queued
     */
    public synchronized boolean offer(String hookName, HookEvent event) {
        if (queue.size() >= settings.maxQueueSize()) {
            droppedCount++;
            warnOnce("overflow:" + hookName,
                    "Deferred event queue full ({} entries), dropping emission of '{}'. Possible infinite event loop",
                    queue.size(), hookName);
            return false;
        }
        int count = emitCounts.merge(hookName, 1, Integer::sum);
        if (count > settings.emitDropThreshold()) {
            droppedCount++;
            warnOnce("drop:" + hookName,
                    "Hook '{}' emitted more than {} times in one drain cycle, dropping further emissions",
                    hookName, settings.emitDropThreshold());
            return false;
        }
        if (count > settings.emitWarnThreshold()) {
            warnOnce("warn:" + hookName,
                    "Hook '{}' emitted more than {} times in one drain cycle. Possible event loop",
                    hookName, settings.emitWarnThreshold());
        }
        queue.addLast(new DeferredEntry(hookName, event));
        return true;
    }

    private void warnOnce(String key, String format, Object... args) {
        if (warned.add(key)) {
            log.warn(format, args);
        } else {
            log.debug(format, args);
        }
    }

    // =========================================================================
    // Drain control
    // =========================================================================

    /**
     * Start a drain cycle if there is work and none is running.
     *
     * @return true if the caller must schedule the drain
     */
    public synchronized boolean beginDrain() {
        if (draining || queue.isEmpty()) {
            return false;
        }
        draining = true;
        return true;
    }

    /**
     * Remove up to {@code batchSize} entries, oldest first.
     */
    public synchronized List<DeferredEntry> pollBatch() {
        int n = Math.min(settings.batchSize(), queue.size());
        List<DeferredEntry> batch = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            batch.add(queue.pollFirst());
        }
        return batch;
    }

    /**
     * Called after a batch completes. Ends the cycle when nothing is left.
     *
     * @return true if another batch must be scheduled
     */
    public synchronized boolean finishBatch() {
        if (!queue.isEmpty()) {
            return true;
        }
        emitCounts.clear();
        warned.clear();
        draining = false;
        return false;
    }

    // =========================================================================
    // State
    // =========================================================================

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized boolean isDraining() {
        return draining;
    }

    public synchronized int getEmitCount(String hookName) {
        return emitCounts.getOrDefault(hookName, 0);
    }

    public synchronized long getDroppedCount() {
        return droppedCount;
    }

    /**
     * Discard pending entries and end the current cycle.
     *
     * @return number of entries discarded
     */
    public synchronized int clear() {
        int discarded = queue.size();
        queue.clear();
        emitCounts.clear();
        warned.clear();
        draining = false;
        return discarded;
    }
}
