package com.fixiplug.plugin;

import com.fixiplug.hooks.HookEvent;
import com.fixiplug.hooks.HookHandler;
import com.fixiplug.hooks.HookNames;
import com.fixiplug.hooks.HookPriority;
import com.fixiplug.hooks.scheduler.TaskQueueScheduler;
import com.fixiplug.hooks.skills.SkillRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FixiplugTest {

    private TaskQueueScheduler scheduler;
    private Fixiplug fixiplug;

    @BeforeEach
    void setUp() {
        scheduler = new TaskQueueScheduler();
        fixiplug = FixiplugFactory.create(FixiplugOptions.builder().scheduler(scheduler).build());
    }

    @AfterEach
    void tearDown() {
        fixiplug.close();
    }

    private static FixiPlugin greeter(String name, int priority, String suffix) {
        return FixiPlugin.of(name, ctx -> ctx.on("greet", (event, hookName) -> Optional.of(
                HookEvent.of("msg", event.getString("msg") + suffix)), priority));
    }

    @Nested
    class Lifecycle {
        @Test
        void greetScenario_priorityChain() {
            fixiplug.use(greeter("exclaim", HookPriority.LOW, "!"));
            fixiplug.use(greeter("name", HookPriority.HIGH, " world"));

            var result = fixiplug.dispatch("greet", HookEvent.of("msg", "hello")).join();
            assertEquals("hello world!", result.getString("msg"));
        }

        @Test
        void greetScenario_literalValues() {
            fixiplug.use(FixiPlugin.of("setGreeting", ctx -> ctx.on("greet",
                    (event, hookName) -> Optional.of(HookEvent.of(event.asMap()).put("greeting", "hi")), 10)));
            fixiplug.use(FixiPlugin.of("exclaim", ctx -> ctx.on("greet",
                    (event, hookName) -> Optional.of(HookEvent.of(event.asMap())
                            .put("greeting", event.getString("greeting") + "!")), 0)));

            var result = fixiplug.dispatch("greet", HookEvent.empty()).join();
            assertEquals(HookEvent.of("greeting", "hi!"), result);
        }

        @Test
        void use_registersSkillFromPlugin() {
            var skill = SkillRecord.builder().name("greeting").description("Says hello").tag("demo").build();
            fixiplug.use(FixiPlugin.of("greeter", skill, ctx -> { }));

            assertTrue(fixiplug.hasSkill("greeting"));
            var info = fixiplug.getPluginInfo("greeter").orElseThrow();
            assertTrue(info.hasSkill());
            assertFalse(info.disabled());
            assertEquals("greeter", info.skill().getPluginId());
        }

        @Test
        void failingSetup_removesPlugin() {
            fixiplug.use(FixiPlugin.of("broken", ctx -> {
                ctx.on("h", (e, n) -> Optional.of(HookEvent.of("reached", true)));
                throw new IllegalStateException("setup failed");
            }));

            assertFalse(fixiplug.isRegistered("broken"));
            assertNull(fixiplug.dispatch("h").join().get("reached"));
        }

        @Test
        void unuseScenario_removesHandlersAndRunsCleanupsInReverse() {
            List<String> order = new ArrayList<>();
            fixiplug.use(FixiPlugin.of("p", ctx -> {
                ctx.on("h", (e, n) -> Optional.of(HookEvent.of("handled", true)));
                ctx.registerCleanup(() -> order.add("first"));
                ctx.registerCleanup(() -> {
                    throw new IllegalStateException("cleanup failed");
                });
                ctx.registerCleanup(() -> order.add("last"));
            }));

            fixiplug.unuse("p");

            assertEquals(List.of("last", "first"), order);
            var input = HookEvent.of("x", 1);
            assertSame(input, fixiplug.dispatch("h", input).join());
            assertFalse(fixiplug.getPlugins().contains("p"));
        }

        @Test
        void swap_replacesPlugin() {
            fixiplug.use(greeter("old", 0, "-old"));
            fixiplug.swap("old", greeter("new", 0, "-new"));

            assertEquals(List.of("new"), fixiplug.getPlugins());
            assertEquals("hi-new", fixiplug.dispatch("greet", HookEvent.of("msg", "hi")).join().getString("msg"));
        }

        @Test
        void reusingName_replacesPrevious() {
            fixiplug.use(greeter("g", 0, "1"));
            fixiplug.use(greeter("g", 0, "2"));
            assertEquals("x2", fixiplug.dispatch("greet", HookEvent.of("msg", "x")).join().getString("msg"));
        }

        @Test
        void invalidPlugin_ignored() {
            fixiplug.use(FixiPlugin.of(" ", ctx -> fail("must not run")));
            fixiplug.use(null);
            assertTrue(fixiplug.getPlugins().isEmpty());
        }
    }

    @Nested
    class EnableDisable {
        @Test
        void disableSkipsHandlers_enableRestores() {
            fixiplug.use(greeter("a", 0, "a"));
            fixiplug.disable("a");
            assertEquals("-", fixiplug.dispatch("greet", HookEvent.of("msg", "-")).join().getString("msg"));
            assertTrue(fixiplug.getPluginInfo("a").orElseThrow().disabled());

            fixiplug.enable("a");
            assertEquals("-a", fixiplug.dispatch("greet", HookEvent.of("msg", "-")).join().getString("msg"));
        }

        @Test
        void unknownPlugin_noEffect() {
            fixiplug.disable("ghost").enable("ghost");
            assertTrue(fixiplug.getPluginInfo("ghost").isEmpty());
            assertFalse(fixiplug.getDispatcher().isPluginDisabled("ghost"));
        }
    }

    @Nested
    class Context {
        @Test
        void off_onlyRemovesOwnHandler() {
            AtomicInteger calls = new AtomicInteger();
            HookHandler shared = (e, n) -> {
                calls.incrementAndGet();
                return Optional.empty();
            };
            fixiplug.use(FixiPlugin.of("a", ctx -> ctx.on("h", shared)));
            fixiplug.use(FixiPlugin.of("b", ctx -> {
                ctx.on("h", shared);
                ctx.off("h", shared);
                ctx.off("h", shared);
            }));

            fixiplug.dispatch("h").join();
            assertEquals(1, calls.get());
        }

        @Test
        void facadeOff_removesAnyOwner() {
            HookHandler handler = (e, n) -> Optional.of(HookEvent.of("hit", true));
            fixiplug.use(FixiPlugin.of("a", ctx -> ctx.on("h", handler)));
            fixiplug.off("h", handler);
            assertNull(fixiplug.dispatch("h").join().get("hit"));
        }

        @Test
        void emitIsDeferred() {
            List<String> seen = new ArrayList<>();
            fixiplug.use(FixiPlugin.of("p", ctx -> {
                ctx.on("start", (e, n) -> {
                    ctx.emit("later", HookEvent.of("from", "start"));
                    seen.add("start");
                    return Optional.empty();
                });
                ctx.on("later", (e, n) -> {
                    seen.add("later:" + e.getString("from"));
                    return Optional.empty();
                });
            }));

            fixiplug.dispatch("start").join();
            assertEquals(List.of("start"), seen);
            scheduler.runPending();
            assertEquals(List.of("start", "later:start"), seen);
        }

        @Test
        void storageAndLoggerArePerPlugin() {
            List<PluginContext> contexts = new ArrayList<>();
            fixiplug.use(FixiPlugin.of("one", contexts::add));
            fixiplug.use(FixiPlugin.of("two", contexts::add));

            contexts.get(0).getStorage().put("k", "v");
            assertFalse(contexts.get(1).getStorage().containsKey("k"));
            assertEquals("plugin/one", contexts.get(0).getLogger().getSubsystem());
            assertFalse(contexts.get(0).isDebug());
            assertSame(fixiplug, contexts.get(0).getFixiplug());
        }
    }

    @Test
    void boomScenario_errorReachesPluginErrorSubscriber() {
        List<HookEvent> reports = new ArrayList<>();
        fixiplug.use(FixiPlugin.of("watcher", ctx -> ctx.on(HookNames.PLUGIN_ERROR, (e, n) -> {
            reports.add(e);
            return Optional.empty();
        })));
        fixiplug.use(FixiPlugin.of("bomb", ctx -> ctx.on("boom", (e, n) -> {
            throw new IllegalStateException("boom");
        })));

        var result = fixiplug.dispatch("boom", HookEvent.of("k", "v")).join();
        assertEquals("v", result.getString("k"));
        scheduler.runPending();

        assertEquals(1, reports.size());
        assertEquals("bomb", reports.get(0).getString("pluginId"));
    }

    @Test
    void getHooksAndPluginsInfo() {
        fixiplug.use(greeter("a", 7, "a"));
        fixiplug.use(FixiPlugin.of("b", ctx -> { }));

        assertEquals(7, fixiplug.getHooks().get("greet").get(0).priority());
        assertEquals(List.of("a", "b"), fixiplug.getPluginsInfo().stream().map(PluginInfo::name).toList());
    }

    @Test
    void close_removesAllPlugins() {
        AtomicInteger cleaned = new AtomicInteger();
        fixiplug.use(FixiPlugin.of("a", ctx -> ctx.registerCleanup(cleaned::incrementAndGet)));
        fixiplug.use(FixiPlugin.of("b", ctx -> ctx.registerCleanup(cleaned::incrementAndGet)));

        fixiplug.close();
        assertEquals(2, cleaned.get());
        assertTrue(fixiplug.getPlugins().isEmpty());
    }
}
