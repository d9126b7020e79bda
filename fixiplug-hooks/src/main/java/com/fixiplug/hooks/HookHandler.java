package com.fixiplug.hooks;

import java.util.Optional;

/**
 * Synchronous hook handler.
 * <p>
 * Returning a present value replaces the event seen by the next handler;
 * returning {@link Optional#empty()} keeps the current one (in-place mutations
 * still carry over).
 */
@FunctionalInterface
public interface HookHandler {

    Optional<HookEvent> handle(HookEvent event, String hookName) throws Exception;
}
