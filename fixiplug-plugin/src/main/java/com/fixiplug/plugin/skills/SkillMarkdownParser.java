package com.fixiplug.plugin.skills;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fixiplug.hooks.skills.SkillRecord;
import com.fixiplug.hooks.skills.SkillRegistry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses SKILL.md documents: a {@code ---} delimited YAML header followed by
 * markdown instructions.
 */
public final class SkillMarkdownParser {

    private SkillMarkdownParser() {
    }

    public static final int MAX_NAME_LENGTH = 64;
    public static final int MAX_DESCRIPTION_LENGTH = 1024;

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "\\A---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n(.*))?\\z", Pattern.DOTALL);
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9-]+$");

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    /**
     * @param content file content
     * @param path    used in error messages only
     */
    public static SkillRecord parse(String content, Path path) throws SkillMarkdownException {
        String normalized = content == null ? "" : content.replace("\r\n", "\n");
        Matcher m = FRONTMATTER_PATTERN.matcher(normalized);
        if (!m.matches()) {
            throw new SkillMarkdownException("Invalid SKILL.md format (missing frontmatter): " + path, path);
        }

        SkillFrontmatter frontmatter;
        try {
            frontmatter = YAML.readValue(m.group(1), SkillFrontmatter.class);
        } catch (IOException e) {
            throw new SkillMarkdownException(
                    "Invalid YAML frontmatter in " + path + ": " + e.getMessage(), path, e);
        }
        if (frontmatter == null) {
            throw new SkillMarkdownException("Empty frontmatter in " + path, path);
        }
        validate(frontmatter, path);

        return SkillRecord.builder()
                .name(frontmatter.getName())
                .description(frontmatter.getDescription())
                .instructions(m.group(2) != null ? m.group(2).trim() : "")
                .tags(orEmpty(frontmatter.getTags()))
                .version(orDefault(frontmatter.getVersion(), SkillRegistry.DEFAULT_VERSION))
                .level(orDefault(frontmatter.getLevel(), SkillRegistry.DEFAULT_LEVEL))
                .author(frontmatter.getAuthor())
                .references(orEmpty(frontmatter.getReferences()))
                .build();
    }

    private static void validate(SkillFrontmatter frontmatter, Path path) throws SkillMarkdownException {
        String name = frontmatter.getName();
        if (name == null || name.isBlank()) {
            throw new SkillMarkdownException("Missing required field 'name' in " + path, path);
        }
        if (frontmatter.getDescription() == null || frontmatter.getDescription().isBlank()) {
            throw new SkillMarkdownException("Missing required field 'description' in " + path, path);
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new SkillMarkdownException("Invalid skill name '" + name + "' in " + path
                    + ". Must use lowercase letters, numbers, and hyphens only.", path);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new SkillMarkdownException(
                    "Skill name '" + name + "' exceeds " + MAX_NAME_LENGTH + " characters in " + path, path);
        }
        if (frontmatter.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new SkillMarkdownException(
                    "Skill description exceeds " + MAX_DESCRIPTION_LENGTH + " characters in " + path, path);
        }
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
