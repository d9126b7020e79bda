package com.fixiplug.hooks.skills;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SkillRegistryTest {

    private SkillRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SkillRegistry();
        registry.register("tables", SkillRecord.builder()
                .name("table-editing")
                .description("Edit tables")
                .instructions("# Tables\nUse api:table")
                .tag("ui").tag("data")
                .level("advanced")
                .build());
        registry.register("forms", SkillRecord.builder()
                .name("form-filling")
                .description("Fill forms")
                .instructions("# Forms")
                .tag("ui")
                .build());
    }

    @Test
    void register_appliesDefaults() {
        var forms = registry.getSkill("form-filling").orElseThrow();
        assertEquals("forms", forms.getPluginId());
        assertEquals(SkillRegistry.DEFAULT_LEVEL, forms.getLevel());
        assertEquals(SkillRegistry.DEFAULT_VERSION, forms.getVersion());
    }

    @Test
    void register_missingName_usesPluginId() {
        registry.register("bare", SkillRecord.builder().description("x").build());
        assertTrue(registry.hasSkill("bare"));
    }

    @Test
    void register_replacesPerPlugin() {
        registry.register("forms", SkillRecord.builder().name("forms-v2").description("d").build());
        assertFalse(registry.hasSkill("form-filling"));
        assertTrue(registry.hasSkill("forms-v2"));
        assertEquals(2, registry.size());
    }

    @Test
    void lookups() {
        assertEquals(2, registry.getSkillsByTag("ui").size());
        assertEquals(1, registry.getSkillsByTag("data").size());
        assertEquals(1, registry.getSkillsByLevel("advanced").size());
        assertEquals("# Forms", registry.getSkillInstructions("form-filling").orElseThrow());
        assertTrue(registry.getSkillInstructions("nope").isEmpty());
        assertTrue(registry.getSkillForPlugin("tables").isPresent());
    }

    @Test
    void remove() {
        assertTrue(registry.remove("tables").isPresent());
        assertFalse(registry.hasSkill("table-editing"));
        assertTrue(registry.remove("tables").isEmpty());
    }

    @Test
    void returnedRecords_areCopies() {
        var returned = registry.getSkill("table-editing").orElseThrow();
        returned.setName(null);
        returned.setLevel(null);
        registry.getAllSkills().forEach(s -> s.setDescription("changed"));
        registry.getSkillForPlugin("forms").orElseThrow().setName("hijacked");

        assertTrue(registry.getSkill("other").isEmpty());
        assertTrue(registry.hasSkill("table-editing"));
        assertTrue(registry.hasSkill("form-filling"));
        assertFalse(registry.hasSkill("hijacked"));
        assertEquals("Edit tables", registry.getSkill("table-editing").orElseThrow().getDescription());
        assertEquals(1, registry.getSkillsByLevel("advanced").size());
    }

    @Test
    void registerReturnValue_isDetached() {
        var stored = registry.register("p", SkillRecord.builder().name("s").description("d").build());
        stored.setName(null);

        assertTrue(registry.hasSkill("s"));
        assertTrue(registry.getSkill("unknown").isEmpty());
    }

    @Nested
    class Manifest {
        @Test
        void defaults_omitInstructions() {
            var manifest = registry.getManifest(SkillManifestOptions.defaults());
            assertEquals(2, manifest.count());
            assertNull(manifest.skills().get(0).instructions());
            assertEquals("table-editing", manifest.skills().get(0).name());
        }

        @Test
        void includeInstructions() {
            var manifest = registry.getManifest(SkillManifestOptions.builder()
                    .includeInstructions(true).build());
            assertEquals("# Tables\nUse api:table", manifest.skills().get(0).instructions());
        }

        @Test
        void filters() {
            assertEquals(1, registry.getManifest(SkillManifestOptions.builder()
                    .onlySkill("form-filling").build()).count());
            assertEquals(1, registry.getManifest(SkillManifestOptions.builder()
                    .excludedSkill("form-filling").build()).count());
            assertEquals(1, registry.getManifest(SkillManifestOptions.builder()
                    .tag("data").build()).count());
            assertEquals(1, registry.getManifest(SkillManifestOptions.builder()
                    .level("intermediate").build()).count());
        }

        @Test
        void json_omitsNullFields() throws Exception {
            String json = registry.getManifestJson(null);
            var tree = new ObjectMapper().readTree(json);
            assertEquals(2, tree.get("count").asInt());
            assertFalse(tree.get("skills").get(0).has("instructions"));
            assertEquals("ui", tree.get("skills").get(0).get("tags").get(0).asText());
        }
    }
}
