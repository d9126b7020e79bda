package com.fixiplug.hooks.registry;

import com.fixiplug.hooks.skills.SkillRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known plugin ids and their enabled state.
 * <p>
 * Unregistering a plugin cascades to its handlers and its skill. Disabling
 * only marks the id; handlers stay registered and are skipped at dispatch.
 */
@Slf4j
public class PluginRegistry {

    private final Map<String, PluginRecord> plugins = new LinkedHashMap<>();
    private final HookTable hooks;
    private final SkillRegistry skills;

    public PluginRegistry(HookTable hooks, SkillRegistry skills) {
        this.hooks = hooks;
        this.skills = skills;
    }

    /**
     * Register {@code pluginId} if not yet known.
     *
     * @return true if the id was newly added
     */
    public synchronized boolean register(String pluginId) {
        requireId(pluginId);
        if (plugins.containsKey(pluginId)) {
            return false;
        }
        plugins.put(pluginId, PluginRecord.builder()
                .id(pluginId)
                .registeredAt(Instant.now())
                .build());
        log.debug("Registered plugin: {}", pluginId);
        return true;
    }

    /**
     * Drop the plugin, every handler it owns and its skill.
     *
     * @return true if the id was registered
     */
    public boolean unregister(String pluginId) {
        boolean known;
        synchronized (this) {
            known = plugins.remove(pluginId) != null;
        }
        int removed = hooks.removePluginHooks(pluginId);
        skills.remove(pluginId);
        if (known) {
            log.debug("Unregistered plugin: {} ({} handler(s) removed)", pluginId, removed);
        }
        return known;
    }

    /**
     * @return false if the plugin is unknown
     */
    public synchronized boolean disable(String pluginId) {
        return setDisabled(pluginId, true);
    }

    /**
     * @return false if the plugin is unknown
     */
    public synchronized boolean enable(String pluginId) {
        return setDisabled(pluginId, false);
    }

    private boolean setDisabled(String pluginId, boolean disabled) {
        PluginRecord record = pluginId != null ? plugins.get(pluginId) : null;
        if (record == null) {
            log.warn("Cannot {} unknown plugin: {}", disabled ? "disable" : "enable", pluginId);
            return false;
        }
        record.setDisabled(disabled);
        log.debug("Plugin {} {}", pluginId, disabled ? "disabled" : "enabled");
        return true;
    }

    public synchronized boolean isDisabled(String pluginId) {
        PluginRecord record = pluginId != null ? plugins.get(pluginId) : null;
        return record != null && record.isDisabled();
    }

    public synchronized boolean isRegistered(String pluginId) {
        return pluginId != null && plugins.containsKey(pluginId);
    }

    public synchronized Optional<PluginRecord> getPlugin(String pluginId) {
        PluginRecord record = pluginId != null ? plugins.get(pluginId) : null;
        return Optional.ofNullable(record).map(r -> r.toBuilder().build());
    }

    /**
     * Copies of all records in registration order.
     */
    public synchronized List<PluginRecord> getPlugins() {
        return plugins.values().stream()
                .map(r -> r.toBuilder().build())
                .toList();
    }

    public synchronized Set<String> getDisabledPlugins() {
        Set<String> disabled = new LinkedHashSet<>();
        plugins.values().forEach(r -> {
            if (r.isDisabled()) {
                disabled.add(r.getId());
            }
        });
        return disabled;
    }

    private static void requireId(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("Plugin id must not be blank");
        }
    }
}
