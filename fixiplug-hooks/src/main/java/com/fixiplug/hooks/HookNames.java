package com.fixiplug.hooks;

/**
 * Reserved hook names.
 */
public final class HookNames {

    private HookNames() {
    }

    /** Handlers on this name run after the specific handlers of every dispatch. */
    public static final String WILDCARD = "*";

    /** Receives one event per captured handler failure. */
    public static final String PLUGIN_ERROR = "pluginError";

    public static String requireValid(String hookName) {
        if (hookName == null || hookName.isBlank()) {
            throw new IllegalArgumentException("hookName must not be blank");
        }
        return hookName;
    }
}
