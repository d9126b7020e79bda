package com.fixiplug.plugin.bundled;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookNames;
import com.fixiplug.plugin.FixiPlugin;
import com.fixiplug.plugin.PluginContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects {@code pluginError} deliveries in memory and exposes them through
 * {@code api:getErrors}.
 */
public class ErrorReporterPlugin implements FixiPlugin {

    public static final String NAME = "errorReporter";

    private final List<ErrorReport> errors = new CopyOnWriteArrayList<>();

    /**
     * One captured handler failure.
     *
     * @param timestamp epoch millis at which the failure was captured
     */
    public record ErrorReport(
            long timestamp,
            String pluginId,
            String hookName,
            String errorMessage,
            @JsonIgnore Throwable error,
            Map<String, Object> event) {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Captures plugin handler failures";
    }

    @Override
    public void setup(PluginContext context) {
        context.on(HookNames.PLUGIN_ERROR, (event, hookName) -> {
            ErrorReport report = new ErrorReport(
                    event.get("timestamp", Long.class).orElseGet(System::currentTimeMillis),
                    event.getString("pluginId"),
                    event.getString("hookName"),
                    event.getString("errorMessage"),
                    event.get("error", Throwable.class).orElse(null),
                    event.get("event", HookEvent.class).map(HookEvent::toUnmodifiableMap).orElse(Map.of()));
            errors.add(report);
            context.getLogger().warn("pluginError plugin=" + report.pluginId()
                    + " hook=" + report.hookName() + ": " + report.errorMessage());
            return Optional.empty();
        });

        context.on("api:getErrors", (event, hookName) -> Optional.of(new HookEvent()
                .put("errors", List.copyOf(errors))
                .put("count", errors.size())));

        context.on("api:clearErrors", (event, hookName) -> {
            int cleared = errors.size();
            errors.clear();
            return Optional.of(new HookEvent().put("success", true).put("cleared", cleared));
        });
    }

    public List<ErrorReport> getErrors() {
        return List.copyOf(errors);
    }
}
