package com.fixiplug.plugin.skills;

import com.fixiplug.hooks.skills.SkillRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Discovers {@code <dir>/<skill>/SKILL.md} files under a list of directories.
 * Missing directories are skipped; unreadable or invalid files are reported
 * as errors without stopping the scan.
 */
@Slf4j
public class SkillMarkdownLoader {

    public static final String SKILL_FILE = "SKILL.md";

    private final List<Path> directories;

    public record LoadedSkill(SkillRecord skill, Path source, Path path) {
    }

    public record LoadError(Path location, Path path, String error) {
    }

    public record LoadResult(List<LoadedSkill> skills, List<LoadError> errors) {
    }

    public SkillMarkdownLoader(List<Path> directories) {
        this.directories = List.copyOf(directories);
    }

    public List<Path> getDirectories() {
        return directories;
    }

    public LoadResult load() {
        List<LoadedSkill> skills = new ArrayList<>();
        List<LoadError> errors = new ArrayList<>();
        for (Path dir : directories) {
            loadDirectory(dir, skills, errors);
        }
        log.debug("Loaded {} SKILL.md file(s) from {} location(s), {} error(s)",
                skills.size(), directories.size(), errors.size());
        return new LoadResult(List.copyOf(skills), List.copyOf(errors));
    }

    private void loadDirectory(Path dir, List<LoadedSkill> skills, List<LoadError> errors) {
        if (!Files.isDirectory(dir)) {
            log.debug("Skills directory does not exist: {}", dir);
            return;
        }

        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (Files.isDirectory(child)) {
                    children.add(child);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan skills directory {}: {}", dir, e.getMessage());
            errors.add(new LoadError(dir, dir, e.getMessage()));
            return;
        }
        children.sort(Comparator.comparing(p -> p.getFileName().toString()));

        for (Path child : children) {
            Path skillFile = child.resolve(SKILL_FILE);
            if (!Files.isRegularFile(skillFile)) {
                continue;
            }
            try {
                String content = Files.readString(skillFile, StandardCharsets.UTF_8);
                skills.add(new LoadedSkill(SkillMarkdownParser.parse(content, skillFile), dir, skillFile));
            } catch (IOException e) {
                log.warn("Failed to read skill file {}: {}", skillFile, e.getMessage());
                errors.add(new LoadError(dir, skillFile, e.getMessage()));
            } catch (SkillMarkdownException e) {
                log.warn("Skipping {}: {}", skillFile, e.getMessage());
                errors.add(new LoadError(dir, skillFile, e.getMessage()));
            }
        }
    }
}
