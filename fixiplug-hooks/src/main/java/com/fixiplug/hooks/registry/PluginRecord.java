package com.fixiplug.hooks.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registration entry for one plugin id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PluginRecord {
    private String id;
    private boolean disabled;
    private Instant registeredAt;
}
