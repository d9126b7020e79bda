package com.fixiplug.hooks;

import com.fixiplug.hooks.queue.DeferredEventQueue;
import com.fixiplug.hooks.queue.DispatchSequencer;
import com.fixiplug.hooks.queue.ErrorQueue;
import com.fixiplug.hooks.queue.ReentranceGuard;
import com.fixiplug.hooks.registry.HookTable;
import com.fixiplug.hooks.registry.PluginRegistry;
import com.fixiplug.hooks.skills.SkillRegistry;
import lombok.Getter;

/**
 * All mutable state of one dispatcher instance. Nothing here is static, so
 * independent dispatchers never share handlers, plugins or queues.
 */
@Getter
public class DispatcherState {

    private final HookSettings settings;
    private final HookTable hooks = new HookTable();
    private final SkillRegistry skills = new SkillRegistry();
    private final PluginRegistry plugins = new PluginRegistry(hooks, skills);
    private final ReentranceGuard guard = new ReentranceGuard();
    private final DispatchSequencer sequencer = new DispatchSequencer();
    private final ErrorQueue errors = new ErrorQueue();
    private final DeferredEventQueue deferred;

    public DispatcherState(HookSettings settings) {
        this.settings = settings != null ? settings : HookSettings.defaults();
        this.deferred = new DeferredEventQueue(this.settings);
    }
}
