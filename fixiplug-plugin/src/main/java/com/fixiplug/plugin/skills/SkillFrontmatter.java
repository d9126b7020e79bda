package com.fixiplug.plugin.skills;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * YAML header of a SKILL.md file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SkillFrontmatter {
    private String name;
    private String description;
    private List<String> tags;
    private String version;
    private String level;
    private String author;
    private List<String> references;
    @JsonProperty("allowed-tools")
    private List<String> allowedTools;
}
