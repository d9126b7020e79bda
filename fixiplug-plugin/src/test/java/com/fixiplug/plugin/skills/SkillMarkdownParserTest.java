package com.fixiplug.plugin.skills;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillMarkdownParserTest {

    private static final Path FILE = Path.of("skills/demo/SKILL.md");

    @Test
    void fullFrontmatter() throws Exception {
        var skill = SkillMarkdownParser.parse("""
                ---
                name: reactive-ui
                description: "Build reactive UIs"
                tags: [ui, state]
                version: 2.0.0
                level: advanced
                author: Jane
                references:
                  - docs/ui.md
                allowed-tools: [Read]
                ---
                # Reactive UI

                Use api:setState.
                """, FILE);

        assertEquals("reactive-ui", skill.getName());
        assertEquals("Build reactive UIs", skill.getDescription());
        assertEquals(List.of("ui", "state"), List.copyOf(skill.getTags()));
        assertEquals("2.0.0", skill.getVersion());
        assertEquals("advanced", skill.getLevel());
        assertEquals("Jane", skill.getAuthor());
        assertEquals(List.of("docs/ui.md"), skill.getReferences());
        assertEquals("# Reactive UI\n\nUse api:setState.", skill.getInstructions());
    }

    @Test
    void defaultsApplied() throws Exception {
        var skill = SkillMarkdownParser.parse("---\nname: x\ndescription: d\n---\nbody", FILE);
        assertEquals("1.0.0", skill.getVersion());
        assertEquals("intermediate", skill.getLevel());
        assertTrue(skill.getTags().isEmpty());
    }

    @Test
    void singleTagString_acceptedAsList() throws Exception {
        var skill = SkillMarkdownParser.parse("---\nname: x\ndescription: d\ntags: solo\n---\n", FILE);
        assertEquals(List.of("solo"), List.copyOf(skill.getTags()));
        assertEquals("", skill.getInstructions());
    }

    @Test
    void windowsLineEndings() throws Exception {
        var skill = SkillMarkdownParser.parse("---\r\nname: x\r\ndescription: d\r\n---\r\nbody\r\n", FILE);
        assertEquals("body", skill.getInstructions());
    }

    @Nested
    class Invalid {
        private void assertRejected(String content, String fragment) {
            var e = assertThrows(SkillMarkdownException.class, () -> SkillMarkdownParser.parse(content, FILE));
            assertTrue(e.getMessage().contains(fragment), e.getMessage());
            assertEquals(FILE, e.getPath());
        }

        @Test
        void missingFrontmatter() {
            assertRejected("# just markdown", "missing frontmatter");
        }

        @Test
        void missingName() {
            assertRejected("---\ndescription: d\n---\nbody", "'name'");
        }

        @Test
        void missingDescription() {
            assertRejected("---\nname: x\n---\nbody", "'description'");
        }

        @Test
        void badNameCharacters() {
            assertRejected("---\nname: Bad_Name\ndescription: d\n---\nbody", "lowercase");
        }

        @Test
        void nameTooLong() {
            assertRejected("---\nname: " + "a".repeat(65) + "\ndescription: d\n---\nbody", "exceeds 64");
        }

        @Test
        void descriptionTooLong() {
            assertRejected("---\nname: x\ndescription: " + "d".repeat(1025) + "\n---\nbody", "exceeds 1024");
        }

        @Test
        void malformedYaml() {
            assertRejected("---\nname: [unclosed\n---\nbody", "Invalid YAML");
        }
    }
}
