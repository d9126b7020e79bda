package com.fixiplug.plugin.bundled;

import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookNames;
import com.fixiplug.plugin.FixiPlugin;
import com.fixiplug.plugin.PluginContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every dispatched hook for assertions in tests. Installed by the
 * TESTING feature.
 * <p>
 * The recorder is a wildcard handler at very low priority, so it sees each
 * event after all other handlers of the hook have run.
 */
public class HookRecorderPlugin implements FixiPlugin {

    public static final String NAME = "testing";
    public static final int PRIORITY = -999;

    static final String CALLS_KEY = "hookCalls";

    public record HookCall(long timestamp, HookEvent event) {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Records hook calls for tests";
    }

    @Override
    public void setup(PluginContext context) {
        Map<String, List<HookCall>> calls = new ConcurrentHashMap<>();
        context.getStorage().put(CALLS_KEY, calls);

        context.on(HookNames.WILDCARD, (event, hookName) -> {
            calls.computeIfAbsent(hookName, k -> new CopyOnWriteArrayList<>())
                    .add(new HookCall(System.currentTimeMillis(), event.snapshot()));
            return Optional.empty();
        }, PRIORITY);

        context.on("api:testing:resetTracking", (event, hookName) -> {
            calls.clear();
            return Optional.of(HookEvent.of("success", true));
        });

        context.on("api:testing:getHookCalls", (event, hookName) -> {
            String target = event.getString("hookName");
            if (target != null) {
                return Optional.of(HookEvent.of("calls", List.copyOf(calls.getOrDefault(target, List.of()))));
            }
            Map<String, List<HookCall>> all = new LinkedHashMap<>();
            calls.forEach((name, list) -> all.put(name, List.copyOf(list)));
            return Optional.of(HookEvent.of("calls", all));
        });

        if (context.isDebug()) {
            context.getLogger().debug("Hook recorder active");
        }
    }
}
