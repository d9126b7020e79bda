package com.fixiplug.hooks.queue;

import com.fixiplug.common.infra.ErrorUtils;
import com.fixiplug.hooks.HookEvent;

import java.time.Instant;

/**
 * A handler failure awaiting delivery to {@code pluginError} subscribers.
 *
 * @param eventSnapshot copy of the event as the failing handler received it
 */
public record ErrorEntry(
        String pluginId,
        String hookName,
        Throwable error,
        HookEvent eventSnapshot,
        Instant timestamp) {

    /**
     * Build the payload delivered on {@code pluginError}. Each call returns a
     * fresh event so subscribers cannot see each other's mutations.
     */
    public HookEvent toEvent() {
        return new HookEvent()
                .put("pluginId", pluginId)
                .put("hookName", hookName)
                .put("error", error)
                .put("errorMessage", ErrorUtils.formatErrorMessage(error))
                .put("event", eventSnapshot != null ? eventSnapshot.snapshot() : HookEvent.empty())
                .put("timestamp", timestamp.toEpochMilli());
    }
}
