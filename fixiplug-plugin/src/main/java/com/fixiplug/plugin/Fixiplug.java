package com.fixiplug.plugin;

import com.fixiplug.common.logging.LogLevel;
import com.fixiplug.common.logging.SubsystemLogger;
import com.fixiplug.hooks.HookDispatcher;
import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.registry.HookTable;
import com.fixiplug.hooks.skills.SkillManifest;
import com.fixiplug.hooks.skills.SkillManifestOptions;
import com.fixiplug.hooks.skills.SkillRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Plugin manager on top of a {@link HookDispatcher}.
 * <p>
 * Tracks the plugins added through {@link #use(FixiPlugin)} together with
 * their contexts and cleanups. Create instances through
 * {@link FixiplugFactory}.
 */
@Slf4j
public class Fixiplug implements AutoCloseable {

    public static final String VERSION = "0.1.0";

    private final HookDispatcher dispatcher;
    private final Set<FixiplugFeature> features;
    private final AutoCloseable ownedResource;
    private final SubsystemLogger logger = SubsystemLogger.create("fixiplug");
    private final Map<String, PluginEntry> plugins = new LinkedHashMap<>();

    private record PluginEntry(FixiPlugin plugin, PluginContext context) {
    }

    public Fixiplug(HookDispatcher dispatcher, Set<FixiplugFeature> features) {
        this(dispatcher, features, null);
    }

    /**
     * @param ownedResource closed by {@link #close()}, typically the scheduler
     *                      created for this instance; may be null
     */
    Fixiplug(HookDispatcher dispatcher, Set<FixiplugFeature> features, AutoCloseable ownedResource) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.features = features == null || features.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(FixiplugFeature.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(features));
        this.ownedResource = ownedResource;
    }

    // =========================================================================
    // Plugin lifecycle
    // =========================================================================

    /**
     * Register a plugin and run its setup. A plugin whose setup throws is
     * removed again; the failure is logged, not rethrown. Using a name that
     * is already registered replaces the previous plugin.
     */
    public Fixiplug use(FixiPlugin plugin) {
        if (plugin == null || plugin.getName() == null || plugin.getName().isBlank()) {
            logger.error("Invalid plugin: missing name");
            return this;
        }
        String name = plugin.getName();
        if (isRegistered(name)) {
            logger.warn("Plugin " + name + " is already registered, replacing it");
            unuse(name);
        }
        lifecycle("Registering plugin: " + name);

        PluginContext context = new PluginContext(name, this);
        synchronized (plugins) {
            plugins.put(name, new PluginEntry(plugin, context));
        }
        dispatcher.registerPlugin(name);

        try {
            plugin.setup(context);
            Optional<SkillRecord> skill = plugin.getSkill();
            if (skill.isPresent()) {
                lifecycle("Registering skill for plugin: " + name);
                dispatcher.registerSkill(name, skill.get());
            }
        } catch (Exception e) {
            logger.error("Error initializing plugin " + name + ": " + e.getMessage(), e);
            unuse(name);
        }
        return this;
    }

    /**
     * Run the plugin's cleanups (most recent first), then drop its handlers and
     * skill. Unknown names only clear leftover handlers.
     */
    public Fixiplug unuse(String name) {
        lifecycle("Removing plugin: " + name);
        PluginEntry entry;
        synchronized (plugins) {
            entry = plugins.remove(name);
        }
        if (entry != null) {
            runCleanups(name, entry.context());
        }
        dispatcher.unregisterPlugin(name);
        return this;
    }

    private void runCleanups(String name, PluginContext context) {
        List<PluginContext.Cleanup> cleanups = new ArrayList<>(context.getCleanups());
        Collections.reverse(cleanups);
        for (PluginContext.Cleanup cleanup : cleanups) {
            try {
                cleanup.run();
            } catch (Exception e) {
                logger.error("Error during plugin cleanup for " + name + ": " + e.getMessage(), e);
            }
        }
    }

    public Fixiplug swap(String oldName, FixiPlugin replacement) {
        lifecycle("Swapping plugin: " + oldName + " with "
                + (replacement != null ? replacement.getName() : "null"));
        unuse(oldName);
        return use(replacement);
    }

    public Fixiplug enable(String name) {
        lifecycle("Enabling plugin: " + name);
        if (!isRegistered(name)) {
            logger.error("Cannot enable plugin \"" + name + "\": plugin not found");
            return this;
        }
        dispatcher.enablePlugin(name);
        return this;
    }

    /**
     * Skip the plugin's handlers until re-enabled; the plugin stays registered.
     */
    public Fixiplug disable(String name) {
        lifecycle("Disabling plugin: " + name);
        if (!isRegistered(name)) {
            logger.error("Cannot disable plugin \"" + name + "\": plugin not found");
            return this;
        }
        dispatcher.disablePlugin(name);
        return this;
    }

    private void lifecycle(String message) {
        logger.log(hasFeature(FixiplugFeature.LOGGING) ? LogLevel.INFO : LogLevel.DEBUG, message);
    }

    // =========================================================================
    // Hooks
    // =========================================================================

    public CompletableFuture<HookEvent> dispatch(String hookName) {
        return dispatch(hookName, HookEvent.empty());
    }

    public CompletableFuture<HookEvent> dispatch(String hookName, HookEvent event) {
        log.debug("Dispatching hook: {}", hookName);
        return dispatcher.dispatch(hookName, event);
    }

    /**
     * Fire-and-forget dispatch, run after the current work settles.
     */
    public Fixiplug emit(String hookName, HookEvent event) {
        dispatcher.emit(hookName, event);
        return this;
    }

    /**
     * Remove one handler registration, whichever plugin owns it.
     */
    public Fixiplug off(String hookName, Object handler) {
        log.debug("Removing handler for hook: {}", hookName);
        dispatcher.off(hookName, handler);
        return this;
    }

    public Map<String, List<HookTable.BindingInfo>> getHooks() {
        return dispatcher.getHooks().snapshot();
    }

    // =========================================================================
    // Plugin queries
    // =========================================================================

    public boolean isRegistered(String name) {
        synchronized (plugins) {
            return name != null && plugins.containsKey(name);
        }
    }

    /** Plugin names in registration order. */
    public List<String> getPlugins() {
        synchronized (plugins) {
            return List.copyOf(plugins.keySet());
        }
    }

    public Optional<FixiPlugin> getPlugin(String name) {
        synchronized (plugins) {
            PluginEntry entry = name != null ? plugins.get(name) : null;
            return Optional.ofNullable(entry).map(PluginEntry::plugin);
        }
    }

    public List<PluginInfo> getPluginsInfo() {
        return getPlugins().stream().map(this::toInfo).toList();
    }

    public Optional<PluginInfo> getPluginInfo(String name) {
        return isRegistered(name) ? Optional.of(toInfo(name)) : Optional.empty();
    }

    private PluginInfo toInfo(String name) {
        SkillRecord skill = dispatcher.getState().getSkills().getSkillForPlugin(name).orElse(null);
        return new PluginInfo(name, dispatcher.isPluginDisabled(name), skill != null, skill);
    }

    public boolean hasFeature(FixiplugFeature feature) {
        return features.contains(feature);
    }

    public Set<FixiplugFeature> getFeatures() {
        return features;
    }

    // =========================================================================
    // Skills
    // =========================================================================

    public List<SkillRecord> getSkills() {
        return dispatcher.getAllSkills();
    }

    public Optional<SkillRecord> getSkill(String name) {
        return dispatcher.getSkill(name);
    }

    public boolean hasSkill(String name) {
        return dispatcher.getState().getSkills().hasSkill(name);
    }

    public List<SkillRecord> getSkillsByTag(String tag) {
        return dispatcher.getState().getSkills().getSkillsByTag(tag);
    }

    public List<SkillRecord> getSkillsByLevel(String level) {
        return dispatcher.getState().getSkills().getSkillsByLevel(level);
    }

    public Optional<String> getSkillInstructions(String name) {
        return dispatcher.getState().getSkills().getSkillInstructions(name);
    }

    public SkillManifest getSkillsManifest() {
        return getSkillsManifest(SkillManifestOptions.defaults());
    }

    public SkillManifest getSkillsManifest(SkillManifestOptions options) {
        return dispatcher.getSkillsManifest(options);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public HookDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Remove every plugin (most recent first) and release the scheduler this
     * instance created, if any.
     */
    @Override
    public void close() {
        List<String> names = new ArrayList<>(getPlugins());
        Collections.reverse(names);
        names.forEach(this::unuse);
        if (ownedResource != null) {
            try {
                ownedResource.close();
            } catch (Exception e) {
                log.warn("Failed to close fixiplug resources: {}", e.getMessage());
            }
        }
    }
}
