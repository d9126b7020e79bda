package com.fixiplug.common.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_usesMessage() {
        assertEquals("boom", ErrorUtils.formatErrorMessage(new RuntimeException("boom")));
    }

    @Test
    void formatErrorMessage_noMessage_usesSimpleClassName() {
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
    }

    @Test
    void formatErrorMessage_null_returnsGeneric() {
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void unwrap_stripsNestedAsyncWrappers() {
        IllegalArgumentException root = new IllegalArgumentException("bad");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, ErrorUtils.unwrap(wrapped));
        assertEquals("bad", ErrorUtils.formatErrorMessage(wrapped));
    }

    @Test
    void unwrap_wrapperWithoutCause_returnedAsIs() {
        CompletionException bare = new CompletionException("bare", null);
        assertSame(bare, ErrorUtils.unwrap(bare));
    }
}
