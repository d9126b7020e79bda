package com.fixiplug.hooks.queue;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ReentranceGuardTest {

    @Test
    void chainVisibleOnlyInsideCallWithin() throws Exception {
        var guard = new ReentranceGuard();
        var chain = guard.extend("a");
        assertEquals(Set.of("a"), chain);
        assertFalse(guard.isRecursive("a"));

        boolean inside = guard.callWithin(chain, () -> guard.isRecursive("a"));
        assertTrue(inside);
        assertFalse(guard.isRecursive("a"));
    }

    @Test
    void nestedExtend_keepsAncestors() throws Exception {
        var guard = new ReentranceGuard();
        Set<String> nested = guard.callWithin(guard.extend("outer"), () -> guard.extend("inner"));
        assertEquals(Set.of("outer", "inner"), nested);

        boolean insideOther = guard.callWithin(nested,
                () -> guard.callWithin(Set.of("other"), () -> guard.isRecursive("outer")));
        assertFalse(insideOther);

        boolean restored = guard.callWithin(nested, () -> {
            guard.callWithin(Set.of("other"), () -> null);
            return guard.isRecursive("inner");
        });
        assertTrue(restored);
    }

    @Test
    void chainNotSeenByOtherThreads() throws Exception {
        var guard = new ReentranceGuard();
        Boolean seenElsewhere = guard.callWithin(guard.extend("h"),
                () -> CompletableFuture.supplyAsync(() -> guard.isRecursive("h")).get());
        assertFalse(seenElsewhere);
    }

    @Test
    void inFlightCounts() {
        var guard = new ReentranceGuard();
        guard.enter("h");
        guard.enter("h");
        guard.enter("other");
        assertTrue(guard.isActive("h"));
        assertEquals(Set.of("h", "other"), guard.activeHooks());

        guard.exit("h");
        assertTrue(guard.isActive("h"));
        guard.exit("h");
        assertFalse(guard.isActive("h"));
    }
}
