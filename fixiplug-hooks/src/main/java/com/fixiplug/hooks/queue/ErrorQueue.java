package com.fixiplug.hooks.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handler failures collected during dispatch, delivered later in one batch.
 */
public class ErrorQueue {

    private final Queue<ErrorEntry> entries = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean deliveryScheduled = new AtomicBoolean();

    public void push(ErrorEntry entry) {
        entries.add(entry);
    }

    /**
     * Remove and return everything queued so far, oldest first.
     */
    public List<ErrorEntry> drainAll() {
        List<ErrorEntry> drained = new ArrayList<>();
        ErrorEntry entry;
        while ((entry = entries.poll()) != null) {
            drained.add(entry);
        }
        return drained;
    }

    /**
     * @return true if the caller won the right to schedule delivery
     */
    public boolean markDeliveryScheduled() {
        return deliveryScheduled.compareAndSet(false, true);
    }

    public void clearDeliveryScheduled() {
        deliveryScheduled.set(false);
    }

    public boolean isDeliveryScheduled() {
        return deliveryScheduled.get();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
