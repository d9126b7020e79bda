package com.fixiplug.plugin.skills;

import com.fixiplug.hooks.HookDispatcher;
import com.fixiplug.hooks.HookEvent;
import com.fixiplug.plugin.FixiPlugin;
import com.fixiplug.plugin.PluginContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers every SKILL.md found by a {@link SkillMarkdownLoader} as the skill
 * of a virtual plugin {@code skillMd:<name>}.
 * <p>
 * Hooks:
 * <ul>
 * <li>{@code api:reloadSkillMd} rescans the directories and replaces the
 * previously registered skills</li>
 * <li>{@code api:getSkillMdStats} reports what the last scan found</li>
 * </ul>
 */
public class SkillMarkdownPlugin implements FixiPlugin {

    public static final String NAME = "skillMdLoader";
    public static final String VIRTUAL_PLUGIN_PREFIX = "skillMd:";

    private final SkillMarkdownLoader loader;
    private final List<String> registeredIds = new ArrayList<>();
    private volatile SkillMarkdownLoader.LoadResult lastResult = new SkillMarkdownLoader.LoadResult(List.of(), List.of());

    public SkillMarkdownPlugin(SkillMarkdownLoader loader) {
        this.loader = loader;
    }

    public static String virtualPluginId(String skillName) {
        return VIRTUAL_PLUGIN_PREFIX + skillName;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Loads skills from SKILL.md files";
    }

    @Override
    public void setup(PluginContext context) {
        HookDispatcher dispatcher = context.getFixiplug().getDispatcher();
        reload(dispatcher);

        if (!lastResult.skills().isEmpty()) {
            context.getLogger().info("Registered " + lastResult.skills().size() + " SKILL.md file(s)");
            for (SkillMarkdownLoader.LoadedSkill loaded : lastResult.skills()) {
                context.getLogger().debug("  - " + loaded.skill().getName() + " (" + loaded.source() + ")");
            }
        }
        if (!lastResult.errors().isEmpty() && context.isDebug()) {
            context.getLogger().warn("SKILL.md warnings: " + lastResult.errors());
        }

        context.on("api:reloadSkillMd", (event, hookName) -> {
            reload(dispatcher);
            return Optional.of(new HookEvent()
                    .put("success", true)
                    .put("reloaded", lastResult.skills().size())
                    .put("skills", skillNames())
                    .put("errors", lastResult.errors()));
        });

        context.on("api:getSkillMdStats", (event, hookName) -> Optional.of(new HookEvent()
                .put("loaded", lastResult.skills().size())
                .put("skills", lastResult.skills().stream()
                        .map(s -> Map.of(
                                "name", s.skill().getName(),
                                "source", s.source().toString(),
                                "path", s.path().toString()))
                        .toList())
                .put("locations", loader.getDirectories().stream().map(Path::toString).toList())
                .put("errors", lastResult.errors())));

        context.registerCleanup(() -> unregisterAll(dispatcher));
    }

    private synchronized void reload(HookDispatcher dispatcher) {
        unregisterAll(dispatcher);
        lastResult = loader.load();
        for (SkillMarkdownLoader.LoadedSkill loaded : lastResult.skills()) {
            String id = virtualPluginId(loaded.skill().getName());
            dispatcher.registerSkill(id, loaded.skill());
            registeredIds.add(id);
        }
    }

    private synchronized void unregisterAll(HookDispatcher dispatcher) {
        registeredIds.forEach(dispatcher::unregisterSkill);
        registeredIds.clear();
    }

    private synchronized List<String> skillNames() {
        return lastResult.skills().stream().map(s -> s.skill().getName()).toList();
    }

    public synchronized SkillMarkdownLoader.LoadResult getLastResult() {
        return lastResult;
    }
}
