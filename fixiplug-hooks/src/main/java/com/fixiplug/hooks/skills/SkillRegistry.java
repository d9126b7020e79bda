package com.fixiplug.hooks.skills;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Skill metadata keyed by owning plugin id, at most one per plugin.
 * <p>
 * Lookup by skill name scans in registration order and returns the first
 * match. Every accessor returns copies; the stored records never leave the
 * registry.
 */
@Slf4j
public class SkillRegistry {

    public static final String DEFAULT_LEVEL = "intermediate";
    public static final String DEFAULT_VERSION = "1.0.0";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, SkillRecord> skills = new LinkedHashMap<>();

    /**
     * Attach {@code skill} to {@code pluginId}, replacing any previous one.
     * A missing name falls back to the plugin id; missing version and level
     * get their defaults.
     */
    public synchronized SkillRecord register(String pluginId, SkillRecord skill) {
        Objects.requireNonNull(skill, "skill");
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("Plugin id must not be blank");
        }
        SkillRecord stored = skill.toBuilder()
                .pluginId(pluginId)
                .name(isBlank(skill.getName()) ? pluginId : skill.getName())
                .version(isBlank(skill.getVersion()) ? DEFAULT_VERSION : skill.getVersion())
                .level(isBlank(skill.getLevel()) ? DEFAULT_LEVEL : skill.getLevel())
                .build();
        if (stored.getTags() == null) {
            stored.setTags(Set.of());
        }
        if (stored.getReferences() == null) {
            stored.setReferences(List.of());
        }
        SkillRecord previous = skills.put(pluginId, stored);
        if (previous != null) {
            log.debug("Replaced skill '{}' of plugin {}", previous.getName(), pluginId);
        } else {
            log.debug("Registered skill '{}' for plugin {}", stored.getName(), pluginId);
        }
        return copy(stored);
    }

    public synchronized Optional<SkillRecord> remove(String pluginId) {
        return Optional.ofNullable(pluginId != null ? skills.remove(pluginId) : null).map(SkillRegistry::copy);
    }

    public synchronized void clear() {
        skills.clear();
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    public synchronized Optional<SkillRecord> getSkillForPlugin(String pluginId) {
        return Optional.ofNullable(pluginId != null ? skills.get(pluginId) : null).map(SkillRegistry::copy);
    }

    public synchronized Optional<SkillRecord> getSkill(String name) {
        return skills.values().stream()
                .filter(s -> Objects.equals(s.getName(), name))
                .findFirst()
                .map(SkillRegistry::copy);
    }

    public boolean hasSkill(String name) {
        return getSkill(name).isPresent();
    }

    public synchronized List<SkillRecord> getAllSkills() {
        return skills.values().stream().map(SkillRegistry::copy).toList();
    }

    public synchronized List<SkillRecord> getSkillsByTag(String tag) {
        return skills.values().stream()
                .filter(s -> s.getTags().contains(tag))
                .map(SkillRegistry::copy)
                .toList();
    }

    public synchronized List<SkillRecord> getSkillsByLevel(String level) {
        return skills.values().stream()
                .filter(s -> Objects.equals(s.getLevel(), level))
                .map(SkillRegistry::copy)
                .toList();
    }

    public Optional<String> getSkillInstructions(String name) {
        return getSkill(name).map(SkillRecord::getInstructions);
    }

    public synchronized int size() {
        return skills.size();
    }

    // =========================================================================
    // Manifest
    // =========================================================================

    public SkillManifest getManifest(SkillManifestOptions options) {
        SkillManifestOptions opts = options != null ? options : SkillManifestOptions.defaults();
        List<SkillManifest.Entry> entries = new ArrayList<>();
        for (SkillRecord skill : getAllSkills()) {
            if (!opts.getOnlySkills().isEmpty() && !opts.getOnlySkills().contains(skill.getName())) {
                continue;
            }
            if (opts.getExcludedSkills().contains(skill.getName())) {
                continue;
            }
            if (!opts.getTags().isEmpty() && opts.getTags().stream().noneMatch(skill.getTags()::contains)) {
                continue;
            }
            if (opts.getLevel() != null && !opts.getLevel().equals(skill.getLevel())) {
                continue;
            }
            entries.add(new SkillManifest.Entry(
                    skill.getName(),
                    skill.getPluginId(),
                    skill.getDescription(),
                    List.copyOf(new LinkedHashSet<>(skill.getTags())),
                    skill.getLevel(),
                    skill.getVersion(),
                    skill.getAuthor(),
                    skill.getReferences().isEmpty() ? null : List.copyOf(skill.getReferences()),
                    opts.isIncludeInstructions() ? skill.getInstructions() : null));
        }
        return new SkillManifest(entries.size(), List.copyOf(entries));
    }

    public String getManifestJson(SkillManifestOptions options) {
        try {
            return MAPPER.writeValueAsString(getManifest(options));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize skill manifest", e);
        }
    }

    private static SkillRecord copy(SkillRecord skill) {
        return skill.toBuilder().build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
