package com.fixiplug.hooks.registry;

import com.fixiplug.hooks.AsyncHookHandler;
import com.fixiplug.hooks.HookHandler;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One handler attached to one hook name.
 *
 * @param pluginId owning plugin
 * @param handler  the handler reference as registered (used for {@code off})
 * @param invoker  uniform async view of the handler
 * @param priority higher runs first
 * @param sequence registration order, breaks priority ties
 */
public record HandlerBinding(
        String pluginId,
        Object handler,
        AsyncHookHandler invoker,
        int priority,
        long sequence) {

    public static HandlerBinding sync(String pluginId, HookHandler handler, int priority, long sequence) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(pluginId, handler,
                (event, hookName) -> CompletableFuture.completedFuture(handler.handle(event, hookName)),
                priority, sequence);
    }

    public static HandlerBinding async(String pluginId, AsyncHookHandler handler, int priority, long sequence) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerBinding(pluginId, handler, handler, priority, sequence);
    }

    public boolean ownedBy(String id) {
        return Objects.equals(pluginId, id);
    }

    public boolean wraps(Object candidate) {
        return handler == candidate;
    }
}
