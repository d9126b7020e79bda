package com.fixiplug.hooks;

/**
 * Conventional handler priorities. Higher runs first.
 */
public final class HookPriority {

    private HookPriority() {
    }

    public static final int HIGH = 100;
    public static final int NORMAL = 0;
    public static final int LOW = -100;
}
