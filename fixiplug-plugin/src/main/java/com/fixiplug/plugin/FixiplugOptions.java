package com.fixiplug.plugin;

import com.fixiplug.hooks.HookSettings;
import com.fixiplug.hooks.scheduler.HookScheduler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Inputs for {@link FixiplugFactory#create(FixiplugOptions)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FixiplugOptions {
    @Singular
    private Set<FixiplugFeature> features;
    /** Queue limits; defaults when null. */
    private HookSettings settings;
    /**
     * Scheduler for deferred work. When null a single-thread executor is
     * created and closed with the instance.
     */
    private HookScheduler scheduler;
    /** Directories scanned for {@code <skill>/SKILL.md}. */
    @Singular
    private List<Path> skillDirectories;
}
