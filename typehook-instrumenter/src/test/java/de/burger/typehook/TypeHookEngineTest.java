package de.burger.typehook;

import static de.burger.typehook.tree.Nodes.arg;
import static de.burger.typehook.tree.Nodes.constant;
import static de.burger.typehook.tree.Nodes.name;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.burger.typehook.TypeHookEngine.InstrumentedModule;
import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.strategy.InstrumentationStrategies;
import de.burger.typehook.strategy.PreambleInserter;
import de.burger.typehook.tree.Arg;
import de.burger.typehook.tree.Arguments;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.FunctionDef;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Nodes;
import de.burger.typehook.tree.SourceModule;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.SourcePrinter;
import de.burger.typehook.tree.Stmt;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class TypeHookEngineTest {

    private final ConfigRegistry registry = new ConfigRegistry();
    private final TypeHookEngine engine = new TypeHookEngine(RuntimeSymbols.defaults(), registry);

    private static SourceModule sample() {
        return Nodes.module(
            Nodes.docstring("Inventory service.", 1),
            Nodes.futureImport("annotations", 2),
            Nodes.importModule("json", 3),
            Nodes.classDef("Inventory", 5,
                Nodes.function("add", new Arguments(List.of(), List.of(Arg.of("self"), arg("sku", "str")), null,
                    List.of(), null), name("None"), 6, Nodes.pass(7))),
            Nodes.function("load", Arguments.of(arg("path", "str")), name("Inventory"), 9,
                Nodes.annAssign("raw", name("str"), constant(""), 10),
                Nodes.returns(new Call(name("Inventory"), List.of(), List.of(),
                    SourcePosition.UNKNOWN), 11)),
            Nodes.untypedFunction("main", 13, Nodes.pass(14)));
    }

    @Test
    void instrumentsAWholeModule() {
        InstrumentationConfig config = InstrumentationConfig.builder().label("service").build();

        String printed = SourcePrinter.print(engine.instrument("inventory", sample(), config));

        assertThat(printed).isEqualTo("""
            'Inventory service.'
            from __future__ import annotations
            from typehook.claw.runtime import *
            import json
            @__typehook_decorate__(conf=__typehook_conf__[0])
            class Inventory:
                def add(self, sku: str) -> None:
                    pass
            @__typehook_decorate__(conf=__typehook_conf__[0])
            def load(path: str) -> Inventory:
                raw: str = ''
                __typehook_check__(raw, str, conf=__typehook_conf__[0])
                return Inventory()
            def main():
                pass
            """);
        assertThat(registry.lookup(0)).containsSame(config);
    }

    @Test
    void summaryDescribesTheRun() {
        InstrumentedModule result = engine.instrumentWithSummary("inventory", sample(), InstrumentationConfig.defaults());

        assertThat(result.summary().moduleName()).isEqualTo("inventory");
        assertThat(result.summary().preambleInserted()).isTrue();
        assertThat(result.summary().classesDecorated()).isEqualTo(1);
        assertThat(result.summary().functionsDecorated()).isEqualTo(1);
        assertThat(result.summary().methodsSkipped()).isEqualTo(1);
        assertThat(result.summary().untypedFunctionsSkipped()).isEqualTo(1);
        assertThat(result.summary().assignmentChecks()).isEqualTo(1);
    }

    @Test
    void customRuntimeNamesAreEmitted() {
        TypeHookEngine custom = new TypeHookEngine(
            new RuntimeSymbols("acme.checks", "acme_hook", "ACME_CONF", "acme_check"), new ConfigRegistry());
        SourceModule module = Nodes.module(Nodes.function("f", Arguments.of(arg("x", "int")), null, 1, Nodes.pass(2)));

        String printed = SourcePrinter.print(custom.instrument("m", module, InstrumentationConfig.defaults()));

        assertThat(printed).startsWith("from acme.checks import *\n@acme_hook(conf=ACME_CONF[0])\ndef f(x: int):");
    }

    @Test
    void strategiesCanBeReplaced() {
        InstrumentationStrategies defaults = InstrumentationStrategies.defaults(RuntimeSymbols.defaults(), registry);
        PreambleInserter noPreamble = new PreambleInserter() {
            @Override
            public SourceModule insertPreamble(SourceModule module) {
                return module;
            }

            @Override
            public int insertionIndex(List<Stmt> body) {
                return 0;
            }

            @Override
            public boolean isPreamble(Stmt stmt) {
                return false;
            }
        };
        TypeHookEngine custom = new TypeHookEngine(new InstrumentationStrategies(
            defaults.typedSignatures(), defaults.decorations(), noPreamble, defaults.assignmentChecks(),
            defaults.typeAliasHooks()));

        InstrumentedModule result = custom.instrumentWithSummary("m", sample(), InstrumentationConfig.defaults());

        assertThat(result.summary().preambleInserted()).isFalse();
        assertThat(result.module().body()).hasSize(sample().body().size());
        assertThat(custom.strategies().preamble()).isSameAs(noPreamble);
    }

    @Test
    void failuresPropagateToTheCaller() {
        SourceModule broken = Nodes.module(Nodes.untypedFunction("ok", 1, Nodes.classDef("", 2)));

        assertThatThrownBy(() -> engine.instrument("broken", broken, InstrumentationConfig.defaults()))
            .isInstanceOf(MalformedNodeException.class)
            .hasMessageContaining("line 2");
    }

    @Test
    void failureIsLoggedWithItsStackTrace() {
        SourceModule broken = Nodes.module(Nodes.classDef("", 7));
        PrintStream originalErr = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertThatThrownBy(() -> engine.instrument("broken", broken, InstrumentationConfig.defaults()))
                .isInstanceOf(MalformedNodeException.class);
        } finally {
            System.setErr(originalErr);
        }

        String log = captured.toString(StandardCharsets.UTF_8);
        assertThat(log).contains("Instrumentation of module broken failed");
        assertThat(log).contains(MalformedNodeException.class.getName());
        assertThat(log).contains("\tat de.burger.typehook.");
    }

    @Test
    void debugConfigStillReturnsTheModule() {
        InstrumentationConfig debug = InstrumentationConfig.builder().debug(true).build();

        InstrumentedModule result = engine.instrumentWithSummary("inventory", sample(), debug);

        assertThat(result.summary().changed()).isTrue();
    }

    @Test
    void modulesCanBeInstrumentedConcurrently() throws Exception {
        InstrumentationConfig config = InstrumentationConfig.defaults();
        String expected = SourcePrinter.print(engine.instrument("inventory", sample(), config));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> SourcePrinter.print(engine.instrument("inventory", sample(), config)));
            }
            for (Future<String> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void decoratedFunctionsKeepTheirOwnDecoratorsFirst() {
        FunctionDef cached = Nodes.function("get", Arguments.of(arg("key", "str")), null, 2, Nodes.pass(3))
            .withDecorators(List.of(name("cache")));

        SourceModule result = engine.instrument("m", Nodes.module(cached), InstrumentationConfig.defaults());

        assertThat(SourcePrinter.print(result)).contains("@cache\n@__typehook_decorate__(conf=__typehook_conf__[0])\ndef get(");
    }
}
