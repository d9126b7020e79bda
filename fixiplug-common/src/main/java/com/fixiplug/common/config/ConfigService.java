package com.fixiplug.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches Fixiplug configuration from a JSON file.
 */
@Slf4j
public class ConfigService {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int DEFAULT_EMIT_WARN_THRESHOLD = 100;
    public static final int DEFAULT_EMIT_DROP_THRESHOLD = 500;

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, FixiplugConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this.configPath = Path.of(expandHome(configPath.toString()));
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public FixiplugConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public FixiplugConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static String expandHome(String path) {
        if (path != null && path.startsWith("~")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private FixiplugConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new FixiplugConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            FixiplugConfig config = applyDefaults(objectMapper.readValue(raw, FixiplugConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new FixiplugConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    static FixiplugConfig applyDefaults(FixiplugConfig config) {
        if (config.getFeatures() == null) {
            config.setFeatures(new ArrayList<>());
        }
        if (config.getHooks() == null) {
            config.setHooks(new FixiplugConfig.HooksConfig());
        }
        FixiplugConfig.HooksConfig hooks = config.getHooks();
        if (hooks.getMaxQueueSize() == null || hooks.getMaxQueueSize() <= 0) {
            hooks.setMaxQueueSize(DEFAULT_MAX_QUEUE_SIZE);
        }
        if (hooks.getBatchSize() == null || hooks.getBatchSize() <= 0) {
            hooks.setBatchSize(DEFAULT_BATCH_SIZE);
        }
        if (hooks.getEmitWarnThreshold() == null || hooks.getEmitWarnThreshold() < 0) {
            hooks.setEmitWarnThreshold(DEFAULT_EMIT_WARN_THRESHOLD);
        }
        if (hooks.getEmitDropThreshold() == null || hooks.getEmitDropThreshold() < 0) {
            hooks.setEmitDropThreshold(DEFAULT_EMIT_DROP_THRESHOLD);
        }
        if (config.getSkills() == null) {
            config.setSkills(new FixiplugConfig.SkillsConfig());
        }
        if (config.getSkills().getDirectories() == null) {
            config.getSkills().setDirectories(new ArrayList<>());
        }
        return config;
    }

    /**
     * Defaults-only config, used when no file is involved.
     */
    public static FixiplugConfig defaults() {
        return applyDefaults(new FixiplugConfig());
    }
}
