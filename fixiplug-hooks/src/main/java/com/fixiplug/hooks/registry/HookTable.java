package com.fixiplug.hooks.registry;

import com.fixiplug.hooks.AsyncHookHandler;
import com.fixiplug.hooks.HookHandler;
import com.fixiplug.hooks.HookNames;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Per-hook handler lists, each kept sorted by descending priority.
 * <p>
 * Lists are immutable snapshots replaced on every change, so a dispatch
 * iterates the bindings that existed when it started even if handlers are
 * added or removed mid-chain.
 */
@Slf4j
public class HookTable {

    /** Descending priority; {@link List#sort} is stable so ties keep insertion order. */
    private static final Comparator<HandlerBinding> BY_PRIORITY = Comparator
            .comparingInt(HandlerBinding::priority).reversed();

    private final Map<String, List<HandlerBinding>> hooks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Summary of a binding without the handler reference.
     */
    public record BindingInfo(String hookName, String pluginId, int priority) {
    }

    // =========================================================================
    // Registration
    // =========================================================================

    public HandlerBinding on(String hookName, HookHandler handler, String pluginId, int priority) {
        return add(hookName, HandlerBinding.sync(pluginId, handler, priority, sequence.incrementAndGet()));
    }

    public HandlerBinding onAsync(String hookName, AsyncHookHandler handler, String pluginId, int priority) {
        return add(hookName, HandlerBinding.async(pluginId, handler, priority, sequence.incrementAndGet()));
    }

    private HandlerBinding add(String hookName, HandlerBinding binding) {
        HookNames.requireValid(hookName);
        hooks.compute(hookName, (name, current) -> {
            List<HandlerBinding> next = current != null ? new ArrayList<>(current) : new ArrayList<>();
            next.add(binding);
            next.sort(BY_PRIORITY);
            return List.copyOf(next);
        });
        log.debug("Registered handler on '{}' (plugin: {}, priority: {})",
                hookName, binding.pluginId(), binding.priority());
        return binding;
    }

    /**
     * Remove the first binding on {@code hookName} whose handler is
     * {@code handler}.
     *
     * @return true if a binding was removed
     */
    public boolean off(String hookName, Object handler) {
        return removeFirst(hookName, b -> b.wraps(handler));
    }

    /**
     * Like {@link #off(String, Object)} but only touches bindings of one plugin.
     */
    public boolean off(String hookName, Object handler, String pluginId) {
        return removeFirst(hookName, b -> b.wraps(handler) && b.ownedBy(pluginId));
    }

    private boolean removeFirst(String hookName, Predicate<HandlerBinding> match) {
        if (hookName == null) {
            return false;
        }
        boolean[] removed = { false };
        hooks.computeIfPresent(hookName, (name, current) -> {
            List<HandlerBinding> next = new ArrayList<>(current);
            for (int i = 0; i < next.size(); i++) {
                if (match.test(next.get(i))) {
                    next.remove(i);
                    removed[0] = true;
                    break;
                }
            }
            return next.isEmpty() ? null : List.copyOf(next);
        });
        return removed[0];
    }

    /**
     * Remove every binding owned by {@code pluginId}, across all hook names.
     *
     * @return number of bindings removed
     */
    public int removePluginHooks(String pluginId) {
        AtomicInteger removed = new AtomicInteger();
        for (String hookName : Set.copyOf(hooks.keySet())) {
            hooks.computeIfPresent(hookName, (name, current) -> {
                List<HandlerBinding> kept = current.stream()
                        .filter(b -> !b.ownedBy(pluginId))
                        .toList();
                removed.addAndGet(current.size() - kept.size());
                return kept.isEmpty() ? null : kept;
            });
        }
        if (removed.get() > 0) {
            log.debug("Removed {} handler(s) of plugin {}", removed.get(), pluginId);
        }
        return removed.get();
    }

    public void clear() {
        hooks.clear();
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public List<HandlerBinding> getHandlers(String hookName) {
        return hookName != null ? hooks.getOrDefault(hookName, List.of()) : List.of();
    }

    /**
     * Bindings for {@code hookName} followed by the wildcard bindings.
     */
    public List<HandlerBinding> resolve(String hookName) {
        List<HandlerBinding> specific = getHandlers(hookName);
        if (HookNames.WILDCARD.equals(hookName)) {
            return specific;
        }
        List<HandlerBinding> wildcard = getHandlers(HookNames.WILDCARD);
        if (wildcard.isEmpty()) {
            return specific;
        }
        List<HandlerBinding> combined = new ArrayList<>(specific.size() + wildcard.size());
        combined.addAll(specific);
        combined.addAll(wildcard);
        return combined;
    }

    public Set<String> getHookNames() {
        return Set.copyOf(hooks.keySet());
    }

    public int getHandlerCount(String hookName) {
        return getHandlers(hookName).size();
    }

    /**
     * Hook name → bindings (sorted by name), without handler references.
     */
    public Map<String, List<BindingInfo>> snapshot() {
        Map<String, List<BindingInfo>> result = new TreeMap<>();
        hooks.forEach((name, bindings) -> result.put(name, bindings.stream()
                .map(b -> new BindingInfo(name, b.pluginId(), b.priority()))
                .toList()));
        return result;
    }

    /**
     * Every binding owned by {@code pluginId}, ordered by hook name.
     */
    public List<BindingInfo> getBindingsForPlugin(String pluginId) {
        return snapshot().values().stream()
                .flatMap(List::stream)
                .filter(info -> info.pluginId() != null && info.pluginId().equals(pluginId))
                .toList();
    }
}
