package com.fixiplug.plugin;

import com.fixiplug.hooks.skills.SkillRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * A fixiplug extension.
 *
 * <p>
 * {@link #setup(PluginContext)} runs once when the plugin is passed to
 * {@link Fixiplug#use(FixiPlugin)} and registers the plugin's handlers
 * through the context. A plugin that throws from setup is removed again.
 * </p>
 */
public interface FixiPlugin {

    /** Unique plugin name; also the plugin id used by the dispatcher. */
    String getName();

    /** Plugin version (SemVer). */
    default String getVersion() {
        return null;
    }

    default String getDescription() {
        return null;
    }

    default String getAuthor() {
        return null;
    }

    void setup(PluginContext context) throws Exception;

    /**
     * Skill metadata to register for this plugin after a successful setup.
     */
    default Optional<SkillRecord> getSkill() {
        return Optional.empty();
    }

    @FunctionalInterface
    interface Setup {
        void setup(PluginContext context) throws Exception;
    }

    static FixiPlugin of(String name, Setup setup) {
        return of(name, null, setup);
    }

    static FixiPlugin of(String name, SkillRecord skill, Setup setup) {
        Objects.requireNonNull(setup, "setup");
        return new FixiPlugin() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public void setup(PluginContext context) throws Exception {
                setup.setup(context);
            }

            @Override
            public Optional<SkillRecord> getSkill() {
                return Optional.ofNullable(skill);
            }

            @Override
            public String toString() {
                return "FixiPlugin[" + name + "]";
            }
        };
    }
}
