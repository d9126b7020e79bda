package com.fixiplug.hooks.skills;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * Skill metadata attached to a plugin.
 * <p>
 * {@code instructions} is free-form text (usually markdown) meant for an LLM
 * consumer; it is left out of manifests unless requested.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SkillRecord {
    private String pluginId;
    private String name;
    private String description;
    private String instructions;
    @Singular
    private Set<String> tags;
    private String version;
    /** beginner / intermediate / advanced */
    private String level;
    private String author;
    @Singular
    private List<String> references;
}
