package com.fixiplug.plugin.skills;

import java.nio.file.Path;

/**
 * A SKILL.md file that cannot be turned into a skill.
 */
public class SkillMarkdownException extends Exception {

    private final Path path;

    public SkillMarkdownException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public SkillMarkdownException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
