package com.fixiplug.plugin;

import java.util.Locale;
import java.util.Optional;

/**
 * Optional behaviours switched on per instance.
 */
public enum FixiplugFeature {
    /** Lifecycle messages at info level instead of debug. */
    LOGGING("logging"),
    /** Installs the hook recorder plugin and sets {@link PluginContext#isDebug()}. */
    TESTING("testing");

    private final String id;

    FixiplugFeature(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<FixiplugFeature> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FixiplugFeature feature : values()) {
            if (feature.id.equals(normalized)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }
}
