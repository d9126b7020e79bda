package com.fixiplug.hooks.skills;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Filters for {@link SkillRegistry#getManifest(SkillManifestOptions)}.
 * Empty sets mean "no filter".
 */
@Value
@Builder
public class SkillManifestOptions {
    boolean includeInstructions;
    /** Keep only these skill names. */
    @Singular
    Set<String> onlySkills;
    @Singular
    Set<String> excludedSkills;
    /** Keep skills carrying at least one of these tags. */
    @Singular
    Set<String> tags;
    String level;

    public static SkillManifestOptions defaults() {
        return builder().build();
    }
}
