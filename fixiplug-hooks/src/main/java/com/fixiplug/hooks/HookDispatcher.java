package com.fixiplug.hooks;

import com.fixiplug.common.infra.ErrorUtils;
import com.fixiplug.hooks.queue.DeferredEntry;
import com.fixiplug.hooks.queue.DeferredEventQueue;
import com.fixiplug.hooks.queue.ErrorEntry;
import com.fixiplug.hooks.queue.ErrorQueue;
import com.fixiplug.hooks.queue.ReentranceGuard;
import com.fixiplug.hooks.registry.HandlerBinding;
import com.fixiplug.hooks.registry.HookTable;
import com.fixiplug.hooks.scheduler.HookScheduler;
import com.fixiplug.hooks.skills.SkillManifest;
import com.fixiplug.hooks.skills.SkillManifestOptions;
import com.fixiplug.hooks.skills.SkillRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Hook dispatcher: named hooks, prioritized handler chains, plugin
 * enable/disable, deferred emission and out-of-band error reporting.
 * <p>
 * Dispatch semantics:
 * <ul>
 * <li>Handlers for a hook run sequentially, highest priority first, then the
 * wildcard ({@code "*"}) handlers. Each receives the previous handler's
 * returned event, or the previous input when it returned nothing.</li>
 * <li>A failing handler never aborts the chain or the returned future. The
 * failure is queued and delivered to {@code pluginError} subscribers after
 * the dispatch completes.</li>
 * <li>A dispatch of a hook from within its own handler chain is rejected and
 * completes with its input unchanged.</li>
 * <li>Independent dispatches of the same hook that overlap run one after
 * another, in call order.</li>
 * </ul>
 * Deferred work (error delivery, {@link #emit} drains) runs on the
 * {@link HookScheduler}.
 */
@Slf4j
public class HookDispatcher {

    private final DispatcherState state;
    private final HookScheduler scheduler;

    public HookDispatcher(HookScheduler scheduler) {
        this(HookSettings.defaults(), scheduler);
    }

    public HookDispatcher(HookSettings settings, HookScheduler scheduler) {
        this(new DispatcherState(settings), scheduler);
    }

    public HookDispatcher(DispatcherState state, HookScheduler scheduler) {
        this.state = Objects.requireNonNull(state, "state");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    // =========================================================================
    // Handler registration
    // =========================================================================

    public HandlerBinding on(String hookName, HookHandler handler, String pluginId) {
        return on(hookName, handler, pluginId, HookPriority.NORMAL);
    }

    /**
     * Register a synchronous handler. The owning plugin id is registered
     * implicitly if unknown.
     */
    public HandlerBinding on(String hookName, HookHandler handler, String pluginId, int priority) {
        state.getPlugins().register(pluginId);
        return state.getHooks().on(hookName, handler, pluginId, priority);
    }

    public HandlerBinding onAsync(String hookName, AsyncHookHandler handler, String pluginId) {
        return onAsync(hookName, handler, pluginId, HookPriority.NORMAL);
    }

    public HandlerBinding onAsync(String hookName, AsyncHookHandler handler, String pluginId, int priority) {
        state.getPlugins().register(pluginId);
        return state.getHooks().onAsync(hookName, handler, pluginId, priority);
    }

    /**
     * Remove the first registration of {@code handler} on {@code hookName}.
     */
    public boolean off(String hookName, Object handler) {
        return state.getHooks().off(hookName, handler);
    }

    public int removePluginHooks(String pluginId) {
        return state.getHooks().removePluginHooks(pluginId);
    }

    // =========================================================================
    // Plugin state
    // =========================================================================

    public boolean registerPlugin(String pluginId) {
        return state.getPlugins().register(pluginId);
    }

    public boolean unregisterPlugin(String pluginId) {
        return state.getPlugins().unregister(pluginId);
    }

    public boolean enablePlugin(String pluginId) {
        return state.getPlugins().enable(pluginId);
    }

    public boolean disablePlugin(String pluginId) {
        return state.getPlugins().disable(pluginId);
    }

    public boolean isPluginDisabled(String pluginId) {
        return state.getPlugins().isDisabled(pluginId);
    }

    // =========================================================================
    // Skills
    // =========================================================================

    public SkillRecord registerSkill(String pluginId, SkillRecord skill) {
        return state.getSkills().register(pluginId, skill);
    }

    public Optional<SkillRecord> unregisterSkill(String pluginId) {
        return state.getSkills().remove(pluginId);
    }

    public Optional<SkillRecord> getSkill(String name) {
        return state.getSkills().getSkill(name);
    }

    public List<SkillRecord> getAllSkills() {
        return state.getSkills().getAllSkills();
    }

    public SkillManifest getSkillsManifest(SkillManifestOptions options) {
        return state.getSkills().getManifest(options);
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    public CompletableFuture<HookEvent> dispatch(String hookName) {
        return dispatch(hookName, HookEvent.empty());
    }

    /**
     * Run the handler chain for {@code hookName}.
     *
     * @return future completing with the final event; completes exceptionally
     *         only if the dispatcher's own bookkeeping fails
     */
    public CompletableFuture<HookEvent> dispatch(String hookName, HookEvent event) {
        HookNames.requireValid(hookName);
        HookEvent input = event != null ? event : HookEvent.empty();
        ReentranceGuard guard = state.getGuard();

        if (guard.isRecursive(hookName)) {
            log.warn("Recursive dispatch of '{}' rejected, returning event unchanged", hookName);
            return CompletableFuture.completedFuture(input);
        }

        Set<String> chain = guard.extend(hookName);
        return state.getSequencer()
                .submit(hookName, () -> run(hookName, input, chain))
                .whenComplete((result, error) -> {
                    scheduleErrorDelivery();
                    scheduleDeferredDrain();
                });
    }

    /**
     * Queue {@code hookName} for dispatch after the current work settles.
     * Fire-and-forget: the result is discarded and overflow drops silently
     * apart from a log line.
     */
    public void emit(String hookName, HookEvent event) {
        HookNames.requireValid(hookName);
        if (state.getDeferred().offer(hookName, event != null ? event : HookEvent.empty())) {
            scheduleDeferredDrain();
        }
    }

    private CompletableFuture<HookEvent> run(String hookName, HookEvent input, Set<String> chain) {
        ReentranceGuard guard = state.getGuard();
        guard.enter(hookName);
        CompletableFuture<HookEvent> result;
        try {
            List<HandlerBinding> bindings = state.getHooks().resolve(hookName);
            log.debug("Dispatching '{}' to {} handler(s)", hookName, bindings.size());
            result = runChain(hookName, chain, bindings, 0, input);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((ignored, error) -> guard.exit(hookName));
    }

    /**
     * Continues synchronously while handler stages are already complete and
     * suspends on the first pending one.
     */
    private CompletableFuture<HookEvent> runChain(String hookName, Set<String> chain,
            List<HandlerBinding> bindings, int start, HookEvent event) {
        HookEvent current = event;
        for (int i = start; i < bindings.size(); i++) {
            HandlerBinding binding = bindings.get(i);
            if (state.getPlugins().isDisabled(binding.pluginId())) {
                continue;
            }
            HookEvent before = current;
            CompletableFuture<HookEvent> settled = invoke(binding, before, hookName, chain)
                    .handle((result, error) -> settle(binding, hookName, before, result, error));
            if (settled.isDone()) {
                current = settled.join();
                continue;
            }
            int next = i + 1;
            return settled.thenCompose(updated -> runChain(hookName, chain, bindings, next, updated));
        }
        return CompletableFuture.completedFuture(current);
    }

    private CompletableFuture<Optional<HookEvent>> invoke(HandlerBinding binding, HookEvent event,
            String hookName, Set<String> chain) {
        try {
            CompletionStage<Optional<HookEvent>> stage = state.getGuard()
                    .callWithin(chain, () -> binding.invoker().handle(event, hookName));
            return stage != null
                    ? stage.toCompletableFuture()
                    : CompletableFuture.completedFuture(Optional.empty());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private HookEvent settle(HandlerBinding binding, String hookName, HookEvent input,
            Optional<HookEvent> result, Throwable error) {
        if (error != null) {
            recordFailure(binding, hookName, input, error);
            return input;
        }
        if (result != null && result.isPresent()) {
            return result.get();
        }
        return input;
    }

    private void recordFailure(HandlerBinding binding, String hookName, HookEvent input, Throwable error) {
        Throwable cause = ErrorUtils.unwrap(error);
        log.error("Handler of plugin '{}' failed on hook '{}': {}",
                binding.pluginId(), hookName, ErrorUtils.formatErrorMessage(cause));
        log.debug("Handler failure on '{}'", hookName, cause);
        state.getErrors().push(new ErrorEntry(
                binding.pluginId(), hookName, cause, input.snapshot(), Instant.now()));
    }

    // =========================================================================
    // Deferred work
    // =========================================================================

    private void scheduleErrorDelivery() {
        ErrorQueue errors = state.getErrors();
        if (!errors.isEmpty() && errors.markDeliveryScheduled()) {
            scheduler.schedule(this::deliverErrors);
        }
    }

    /**
     * Invokes {@code pluginError} subscribers directly, not through
     * {@link #dispatch}, so a failing subscriber cannot enqueue new errors.
     * Subscribers run one at a time, each waiting for the previous one.
     */
    private void deliverErrors() {
        ErrorQueue errors = state.getErrors();
        errors.clearDeliveryScheduled();
        List<ErrorEntry> entries = errors.drainAll();
        if (entries.isEmpty()) {
            return;
        }
        List<HandlerBinding> subscribers = state.getHooks().getHandlers(HookNames.PLUGIN_ERROR);
        if (subscribers.isEmpty()) {
            log.debug("{} plugin error(s) had no {} subscriber", entries.size(), HookNames.PLUGIN_ERROR);
            return;
        }
        Set<String> chain = Set.of(HookNames.PLUGIN_ERROR);
        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        for (ErrorEntry entry : entries) {
            for (HandlerBinding subscriber : subscribers) {
                done = done.thenCompose(ignored -> deliverError(subscriber, entry, chain));
            }
        }
    }

    private CompletableFuture<Void> deliverError(HandlerBinding subscriber, ErrorEntry entry, Set<String> chain) {
        if (state.getPlugins().isDisabled(subscriber.pluginId())) {
            return CompletableFuture.completedFuture(null);
        }
        return invoke(subscriber, entry.toEvent(), HookNames.PLUGIN_ERROR, chain).handle((result, error) -> {
            if (error != null) {
                log.warn("{} handler of plugin '{}' failed: {}", HookNames.PLUGIN_ERROR,
                        subscriber.pluginId(), ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(error)));
            }
            return null;
        });
    }

    private void scheduleDeferredDrain() {
        if (state.getDeferred().beginDrain()) {
            scheduler.schedule(this::drainDeferred);
        }
    }

    /**
     * Dispatch one batch sequentially, then schedule the next batch if
     * entries remain.
     */
    private void drainDeferred() {
        DeferredEventQueue deferred = state.getDeferred();
        List<DeferredEntry> batch = deferred.pollBatch();
        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        for (DeferredEntry entry : batch) {
            done = done.thenCompose(ignored -> dispatch(entry.hookName(), entry.event())
                    .handle((result, error) -> {
                        if (error != null) {
                            log.error("Deferred dispatch of '{}' failed: {}", entry.hookName(),
                                    ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(error)));
                        }
                        return null;
                    }));
        }
        done.whenComplete((ignored, error) -> {
            if (deferred.finishBatch()) {
                scheduler.schedule(this::drainDeferred);
            }
        });
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public HookTable getHooks() {
        return state.getHooks();
    }

    public DispatcherState getState() {
        return state;
    }

    public HookScheduler getScheduler() {
        return scheduler;
    }

    public int getPendingEventCount() {
        return state.getDeferred().size();
    }
}
