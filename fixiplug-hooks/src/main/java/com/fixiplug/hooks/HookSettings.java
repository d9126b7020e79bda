package com.fixiplug.hooks;

import com.fixiplug.common.config.ConfigService;
import com.fixiplug.common.config.FixiplugConfig;

/**
 * Limits applied by the deferred event queue.
 *
 * @param maxQueueSize      pending entries above which {@code emit} drops
 * @param batchSize         entries dispatched per drain tick
 * @param emitWarnThreshold per-hook emissions (per drain cycle) above which a
 *                          warning is logged
 * @param emitDropThreshold per-hook emissions (per drain cycle) above which
 *                          entries are dropped
 */
public record HookSettings(
        int maxQueueSize,
        int batchSize,
        int emitWarnThreshold,
        int emitDropThreshold) {

    public HookSettings {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (emitWarnThreshold < 0 || emitDropThreshold < 0) {
            throw new IllegalArgumentException("emit thresholds must not be negative");
        }
    }

    public static HookSettings defaults() {
        return new HookSettings(
                ConfigService.DEFAULT_MAX_QUEUE_SIZE,
                ConfigService.DEFAULT_BATCH_SIZE,
                ConfigService.DEFAULT_EMIT_WARN_THRESHOLD,
                ConfigService.DEFAULT_EMIT_DROP_THRESHOLD);
    }

    /**
     * Read limits from the {@code hooks} section; unset values use defaults.
     */
    public static HookSettings from(FixiplugConfig config) {
        FixiplugConfig.HooksConfig hooks = config != null ? config.getHooks() : null;
        if (hooks == null) {
            return defaults();
        }
        HookSettings fallback = defaults();
        return new HookSettings(
                orDefault(hooks.getMaxQueueSize(), fallback.maxQueueSize()),
                orDefault(hooks.getBatchSize(), fallback.batchSize()),
                orDefault(hooks.getEmitWarnThreshold(), fallback.emitWarnThreshold()),
                orDefault(hooks.getEmitDropThreshold(), fallback.emitDropThreshold()));
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
