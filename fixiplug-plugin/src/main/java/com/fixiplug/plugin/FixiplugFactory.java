package com.fixiplug.plugin;

import com.fixiplug.common.config.FixiplugConfig;
import com.fixiplug.common.config.ConfigService;
import com.fixiplug.hooks.HookDispatcher;
import com.fixiplug.hooks.HookSettings;
import com.fixiplug.hooks.scheduler.ExecutorHookScheduler;
import com.fixiplug.hooks.scheduler.HookScheduler;
import com.fixiplug.plugin.bundled.HookRecorderPlugin;
import com.fixiplug.plugin.skills.SkillMarkdownLoader;
import com.fixiplug.plugin.skills.SkillMarkdownPlugin;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds {@link Fixiplug} instances.
 */
@Slf4j
public final class FixiplugFactory {

    private FixiplugFactory() {
    }

    public static Fixiplug create() {
        return create(FixiplugOptions.builder().build());
    }

    public static Fixiplug create(Set<FixiplugFeature> features) {
        return create(FixiplugOptions.builder().features(features != null ? features : Set.of()).build());
    }

    public static Fixiplug create(FixiplugOptions options) {
        HookSettings settings = options.getSettings() != null ? options.getSettings() : HookSettings.defaults();
        HookScheduler scheduler = options.getScheduler();
        AutoCloseable owned = null;
        if (scheduler == null) {
            ExecutorHookScheduler executor = new ExecutorHookScheduler();
            scheduler = executor;
            owned = executor;
        }

        Fixiplug fixiplug = new Fixiplug(new HookDispatcher(settings, scheduler), options.getFeatures(), owned);

        if (fixiplug.hasFeature(FixiplugFeature.TESTING)) {
            fixiplug.use(new HookRecorderPlugin());
        }
        List<Path> skillDirectories = options.getSkillDirectories();
        if (skillDirectories != null && !skillDirectories.isEmpty()) {
            fixiplug.use(new SkillMarkdownPlugin(new SkillMarkdownLoader(skillDirectories)));
        }
        log.debug("Created fixiplug instance (features: {}, plugins: {})",
                fixiplug.getFeatures(), fixiplug.getPlugins());
        return fixiplug;
    }

    /**
     * Build from a loaded configuration. Unknown feature names are logged and
     * ignored.
     */
    public static Fixiplug create(FixiplugConfig config, HookScheduler scheduler) {
        Set<FixiplugFeature> features = EnumSet.noneOf(FixiplugFeature.class);
        if (config.getFeatures() != null) {
            for (String name : config.getFeatures()) {
                Optional<FixiplugFeature> feature = FixiplugFeature.fromId(name);
                if (feature.isPresent()) {
                    features.add(feature.get());
                } else {
                    log.warn("Ignoring unknown feature: {}", name);
                }
            }
        }

        FixiplugOptions.FixiplugOptionsBuilder builder = FixiplugOptions.builder()
                .features(features)
                .settings(HookSettings.from(config))
                .scheduler(scheduler);
        if (config.getSkills() != null && config.getSkills().getDirectories() != null) {
            config.getSkills().getDirectories().stream()
                    .map(dir -> Path.of(ConfigService.expandHome(dir)))
                    .forEach(builder::skillDirectory);
        }
        return create(builder.build());
    }

    public static Fixiplug create(FixiplugConfig config) {
        return create(config, null);
    }
}
