package com.fixiplug.hooks.queue;

import com.fixiplug.hooks.HookEvent;

public record DeferredEntry(String hookName, HookEvent event) {
}
