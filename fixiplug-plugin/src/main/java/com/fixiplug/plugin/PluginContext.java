package com.fixiplug.plugin;

import com.fixiplug.common.logging.SubsystemLogger;
import com.fixiplug.hooks.AsyncHookHandler;
import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookHandler;
import com.fixiplug.hooks.HookPriority;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handle given to a plugin during setup. Every handler registered through it
 * is owned by the plugin, so {@link Fixiplug#unuse(String)} removes it.
 */
public class PluginContext {

    /**
     * Cleanup callback run when the plugin is removed.
     */
    @FunctionalInterface
    public interface Cleanup {
        void run() throws Exception;
    }

    private final String pluginName;
    private final Fixiplug fixiplug;
    private final SubsystemLogger logger;
    private final Map<String, Object> storage = new ConcurrentHashMap<>();
    private final List<Cleanup> cleanups = new CopyOnWriteArrayList<>();

    PluginContext(String pluginName, Fixiplug fixiplug) {
        this.pluginName = pluginName;
        this.fixiplug = fixiplug;
        this.logger = SubsystemLogger.create("plugin/" + pluginName);
    }

    // --- Hooks ---

    public PluginContext on(String hookName, HookHandler handler) {
        return on(hookName, handler, HookPriority.NORMAL);
    }

    public PluginContext on(String hookName, HookHandler handler, int priority) {
        fixiplug.getDispatcher().on(hookName, handler, pluginName, priority);
        return this;
    }

    public PluginContext onAsync(String hookName, AsyncHookHandler handler) {
        return onAsync(hookName, handler, HookPriority.NORMAL);
    }

    public PluginContext onAsync(String hookName, AsyncHookHandler handler, int priority) {
        fixiplug.getDispatcher().onAsync(hookName, handler, pluginName, priority);
        return this;
    }

    /**
     * Remove one of this plugin's handlers. Handlers of other plugins are
     * never touched, even if they are the same object.
     */
    public PluginContext off(String hookName, Object handler) {
        fixiplug.getDispatcher().getHooks().off(hookName, handler, pluginName);
        return this;
    }

    /**
     * Queue a deferred dispatch; see {@link Fixiplug#emit(String, HookEvent)}.
     */
    public PluginContext emit(String hookName, HookEvent event) {
        fixiplug.emit(hookName, event);
        return this;
    }

    public PluginContext registerCleanup(Cleanup cleanup) {
        cleanups.add(cleanup);
        return this;
    }

    // --- Accessors ---

    public String getPluginName() {
        return pluginName;
    }

    /** Plugin-private key/value storage, discarded with the plugin. */
    public Map<String, Object> getStorage() {
        return storage;
    }

    /** True when the TESTING feature is enabled. */
    public boolean isDebug() {
        return fixiplug.hasFeature(FixiplugFeature.TESTING);
    }

    public SubsystemLogger getLogger() {
        return logger;
    }

    public Fixiplug getFixiplug() {
        return fixiplug;
    }

    List<Cleanup> getCleanups() {
        return List.copyOf(cleanups);
    }
}
