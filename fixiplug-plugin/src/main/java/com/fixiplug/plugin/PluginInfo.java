package com.fixiplug.plugin;

import com.fixiplug.hooks.skills.SkillRecord;

/**
 * Summary of one plugin registered through {@link Fixiplug#use(FixiPlugin)}.
 */
public record PluginInfo(String name, boolean disabled, boolean hasSkill, SkillRecord skill) {
}
