package com.fixiplug.hooks;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Hook handler that completes later. The next handler in the chain starts only
 * after the returned stage completes.
 */
@FunctionalInterface
public interface AsyncHookHandler {

    CompletionStage<Optional<HookEvent>> handle(HookEvent event, String hookName) throws Exception;
}
