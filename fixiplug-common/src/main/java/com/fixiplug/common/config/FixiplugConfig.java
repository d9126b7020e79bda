package com.fixiplug.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for a Fixiplug instance.
 */
@Data
public class FixiplugConfig {

    /** Enabled feature flags (e.g. "logging", "testing"). */
    private List<String> features;

    /** Dispatcher limits. */
    private HooksConfig hooks;

    /** SKILL.md discovery settings. */
    private SkillsConfig skills;

    // --- Nested config types ---

    @Data
    public static class HooksConfig {
        /** Maximum number of pending deferred events. */
        private Integer maxQueueSize;
        /** Deferred events dispatched per drain tick. */
        private Integer batchSize;
        /** Per-hook emission count above which a warning is logged. */
        private Integer emitWarnThreshold;
        /** Per-hook emission count above which emissions are dropped. */
        private Integer emitDropThreshold;
    }

    @Data
    public static class SkillsConfig {
        /** Directories scanned for {@code <skill>/SKILL.md} files. */
        private List<String> directories = new ArrayList<>();
    }
}
