package com.fixiplug.hooks.queue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class DispatchSequencerTest {

    @Test
    void sameKey_waitsForPrevious() {
        var sequencer = new DispatchSequencer();
        List<String> started = new ArrayList<>();
        var gate = new CompletableFuture<String>();

        var first = sequencer.submit("h", () -> {
            started.add("first");
            return gate;
        });
        var second = sequencer.submit("h", () -> {
            started.add("second");
            return CompletableFuture.completedFuture("two");
        });

        assertEquals(List.of("first"), started);
        assertFalse(second.isDone());
        assertTrue(sequencer.isBusy("h"));

        gate.complete("one");
        assertEquals("one", first.join());
        assertEquals("two", second.join());
        assertEquals(List.of("first", "second"), started);
        assertFalse(sequencer.isBusy("h"));
    }

    @Test
    void differentKeys_doNotWait() {
        var sequencer = new DispatchSequencer();
        sequencer.submit("a", CompletableFuture::new);

        var other = sequencer.submit("b", () -> CompletableFuture.completedFuture(1));
        assertEquals(Integer.valueOf(1), other.join());
    }

    @Test
    void failedTask_releasesKey() {
        var sequencer = new DispatchSequencer();
        var failed = sequencer.<String>submit("h", () -> {
            throw new IllegalStateException("boom");
        });
        assertTrue(failed.isCompletedExceptionally());

        assertEquals("ok", sequencer.submit("h", () -> CompletableFuture.completedFuture("ok")).join());
    }
}
