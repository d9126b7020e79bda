package com.fixiplug.plugin.bundled;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookNames;
import com.fixiplug.hooks.registry.HookTable;
import com.fixiplug.hooks.registry.PluginRecord;
import com.fixiplug.hooks.skills.SkillManifest;
import com.fixiplug.hooks.skills.SkillManifestOptions;
import com.fixiplug.hooks.skills.SkillRecord;
import com.fixiplug.plugin.FixiPlugin;
import com.fixiplug.plugin.Fixiplug;
import com.fixiplug.plugin.PluginContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exposes the plugin/hook/skill registries through {@code api:*} hooks so
 * that callers holding only a dispatcher can discover capabilities.
 */
public class IntrospectionPlugin implements FixiPlugin {

    public static final String NAME = "introspection";

    // =========================================================================
    // Payload types
    // =========================================================================

    public record PluginHook(String hookName, int priority, int handlerCount) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PluginMetadata(String name, String version, String description, String author) {
    }

    public record PluginCapability(String name, boolean enabled, List<PluginHook> hooks, PluginMetadata metadata) {
    }

    public record HookSchema(String type, String returns, String description, boolean inferred) {
    }

    public record HookDescriptor(String name, int handlerCount, List<String> plugins, List<Integer> priorities,
            HookSchema schema) {
    }

    public record MethodDescriptor(String name, String description) {
    }

    public record PluginSkill(String name, boolean hasSkill, SkillRecord skill) {
    }

    private record SchemaPattern(String pattern, String type, String returns, String description) {
        boolean matchesPrefix(String hookName) {
            return pattern.endsWith("*") && hookName.startsWith(pattern.substring(0, pattern.length() - 1));
        }
    }

    private static final List<SchemaPattern> HOOK_PATTERNS = List.of(
            new SchemaPattern("api:*", "query", "data", "API query hook that returns data"),
            new SchemaPattern("agent:*", "command", "result", "Agent command that performs an action"),
            new SchemaPattern("state:*", "event", "state", "State transition event"),
            new SchemaPattern("internal:*", "system", "data", "Internal system hook"),
            new SchemaPattern(HookNames.PLUGIN_ERROR, "error", "void",
                    "Fired when a plugin handler fails"));

    private static final List<MethodDescriptor> METHODS = List.of(
            new MethodDescriptor("use", "Register a plugin"),
            new MethodDescriptor("unuse", "Remove a plugin and its handlers"),
            new MethodDescriptor("swap", "Replace one plugin with another"),
            new MethodDescriptor("enable", "Re-enable a disabled plugin"),
            new MethodDescriptor("disable", "Skip a plugin's handlers without removing them"),
            new MethodDescriptor("dispatch", "Run a hook's handler chain and return the final event"),
            new MethodDescriptor("emit", "Queue a hook for deferred dispatch"),
            new MethodDescriptor("off", "Remove a single handler"));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Plugin, hook and skill discovery";
    }

    @Override
    public void setup(PluginContext context) {
        Fixiplug fixiplug = context.getFixiplug();

        context.on("api:introspect", (event, hookName) -> {
            List<PluginCapability> plugins = getPluginCapabilities(fixiplug);
            Map<String, HookDescriptor> hooks = getAvailableHooks(fixiplug);
            SkillManifest skills = fixiplug.getSkillsManifest();

            Map<String, Object> capabilities = new LinkedHashMap<>();
            capabilities.put("plugins", plugins);
            capabilities.put("hooks", hooks);
            capabilities.put("skills", skills.skills());
            capabilities.put("methods", METHODS);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("timestamp", Instant.now().toString());
            metadata.put("pluginCount", plugins.size());
            metadata.put("hookCount", hooks.size());
            metadata.put("skillCount", skills.count());

            Map<String, Object> root = new LinkedHashMap<>();
            root.put("version", Fixiplug.VERSION);
            root.put("capabilities", capabilities);
            root.put("metadata", metadata);
            return Optional.of(HookEvent.of("fixiplug", root));
        });

        context.on("api:getPluginCapabilities", (event, hookName) ->
                Optional.of(HookEvent.of("capabilities", getPluginCapabilities(fixiplug))));

        context.on("api:getAvailableHooks", (event, hookName) ->
                Optional.of(HookEvent.of("hooks", getAvailableHooks(fixiplug))));

        context.on("api:getPluginDetails", (event, hookName) -> {
            String pluginName = event.getString("pluginName");
            if (pluginName == null || pluginName.isBlank()) {
                return Optional.of(HookEvent.of("error", "pluginName parameter required"));
            }
            Optional<PluginRecord> record = fixiplug.getDispatcher().getState().getPlugins().getPlugin(pluginName);
            if (record.isEmpty()) {
                return Optional.of(HookEvent.of("error", "Plugin '" + pluginName + "' not found"));
            }
            return Optional.of(new HookEvent()
                    .put("name", pluginName)
                    .put("enabled", !record.get().isDisabled())
                    .put("hooks", getPluginHooks(fixiplug, pluginName))
                    .put("metadata", metadataOf(fixiplug, pluginName))
                    .put("skill", skillOf(fixiplug, pluginName)));
        });

        context.on("api:getHookSchema", (event, hookName) -> {
            String target = event.getString("hookName");
            if (target == null || target.isBlank()) {
                return Optional.of(HookEvent.of("error", "hookName parameter required"));
            }
            List<HookTable.BindingInfo> bindings = fixiplug.getHooks().getOrDefault(target, List.of());
            return Optional.of(new HookEvent()
                    .put("hookName", target)
                    .put("exists", !bindings.isEmpty())
                    .put("handlerCount", bindings.size())
                    .put("schema", inferSchema(target))
                    .put("plugins", bindings.stream().map(HookTable.BindingInfo::pluginId).toList()));
        });

        context.on("api:getSkillsManifest", (event, hookName) -> {
            SkillManifestOptions options = SkillManifestOptions.builder()
                    .includeInstructions(Boolean.TRUE.equals(event.get("includeInstructions")))
                    .build();
            SkillManifest manifest = fixiplug.getSkillsManifest(options);
            return Optional.of(new HookEvent()
                    .put("skills", manifest.skills())
                    .put("skillCount", manifest.count()));
        });

        context.on("api:getPluginSkills", (event, hookName) -> {
            String pluginName = event.getString("pluginName");
            if (pluginName != null && !pluginName.isBlank()) {
                SkillRecord skill = skillOf(fixiplug, pluginName);
                return Optional.of(new HookEvent()
                        .put("name", pluginName)
                        .put("hasSkill", skill != null)
                        .put("skill", skill));
            }
            List<PluginSkill> plugins = new ArrayList<>();
            for (PluginRecord record : fixiplug.getDispatcher().getState().getPlugins().getPlugins()) {
                SkillRecord skill = skillOf(fixiplug, record.getId());
                plugins.add(new PluginSkill(record.getId(), skill != null, skill));
            }
            return Optional.of(HookEvent.of("plugins", plugins));
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static List<PluginCapability> getPluginCapabilities(Fixiplug fixiplug) {
        return fixiplug.getDispatcher().getState().getPlugins().getPlugins().stream()
                .map(record -> new PluginCapability(
                        record.getId(),
                        !record.isDisabled(),
                        getPluginHooks(fixiplug, record.getId()),
                        metadataOf(fixiplug, record.getId())))
                .toList();
    }

    static Map<String, HookDescriptor> getAvailableHooks(Fixiplug fixiplug) {
        Map<String, HookDescriptor> hooks = new LinkedHashMap<>();
        fixiplug.getHooks().forEach((name, bindings) -> hooks.put(name, new HookDescriptor(
                name,
                bindings.size(),
                bindings.stream().map(HookTable.BindingInfo::pluginId).toList(),
                bindings.stream().map(HookTable.BindingInfo::priority).toList(),
                inferSchema(name))));
        return hooks;
    }

    static List<PluginHook> getPluginHooks(Fixiplug fixiplug, String pluginName) {
        List<PluginHook> result = new ArrayList<>();
        fixiplug.getHooks().forEach((name, bindings) -> {
            List<HookTable.BindingInfo> own = bindings.stream()
                    .filter(b -> pluginName.equals(b.pluginId()))
                    .toList();
            if (!own.isEmpty()) {
                result.add(new PluginHook(name, own.get(0).priority(), own.size()));
            }
        });
        return result;
    }

    static HookSchema inferSchema(String hookName) {
        for (SchemaPattern pattern : HOOK_PATTERNS) {
            if (pattern.pattern().equals(hookName)) {
                return new HookSchema(pattern.type(), pattern.returns(), pattern.description(), false);
            }
        }
        for (SchemaPattern pattern : HOOK_PATTERNS) {
            if (pattern.matchesPrefix(hookName)) {
                return new HookSchema(pattern.type(), pattern.returns(), pattern.description(), true);
            }
        }
        return new HookSchema("custom", "unknown", "Custom hook with no predefined schema", true);
    }

    private static PluginMetadata metadataOf(Fixiplug fixiplug, String pluginName) {
        return fixiplug.getPlugin(pluginName)
                .map(p -> new PluginMetadata(p.getName(), p.getVersion(), p.getDescription(), p.getAuthor()))
                .orElseGet(() -> new PluginMetadata(pluginName, null, null, null));
    }

    private static SkillRecord skillOf(Fixiplug fixiplug, String pluginName) {
        return fixiplug.getDispatcher().getState().getSkills().getSkillForPlugin(pluginName).orElse(null);
    }
}
