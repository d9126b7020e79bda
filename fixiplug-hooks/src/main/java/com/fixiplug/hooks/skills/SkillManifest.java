package com.fixiplug.hooks.skills;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Serializable listing of registered skills.
 */
public record SkillManifest(int count, List<Entry> skills) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String name,
            String pluginId,
            String description,
            List<String> tags,
            String level,
            String version,
            String author,
            List<String> references,
            String instructions) {
    }
}
