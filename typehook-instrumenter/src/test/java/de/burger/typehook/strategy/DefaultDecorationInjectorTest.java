package de.burger.typehook.strategy;

import static de.burger.typehook.tree.Nodes.name;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.Arguments;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.ClassDef;
import de.burger.typehook.tree.Expr;
import de.burger.typehook.tree.FunctionDef;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Nodes;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.SourcePrinter;
import de.burger.typehook.tree.Subscript;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultDecorationInjectorTest {

    private final ConfigRegistry registry = new ConfigRegistry();
    private final DecorationInjector injector = new DefaultDecorationInjector(RuntimeSymbols.defaults(), registry);
    private final InstrumentationConfig config = InstrumentationConfig.builder().label("test").build();

    @Test
    void classGetsHookReferencingRegisteredConfig() {
        ClassDef decorated = injector.decorate(Nodes.classDef("Service", 3, Nodes.pass(4)), config);

        assertThat(decorated.decorators()).hasSize(1);
        assertThat(SourcePrinter.expression(decorated.decorators().get(0)))
            .isEqualTo("__typehook_decorate__(conf=__typehook_conf__[0])");
        assertThat(registry.lookup(0)).containsSame(config);
        assertThat(injector.isDecorated(decorated)).isTrue();
    }

    @Test
    void hookIsAppendedAfterUserDecorators() {
        FunctionDef function = Nodes.function("f", Arguments.empty(), name("int"), 1)
            .withDecorators(List.of(name("staticmethod")));

        FunctionDef decorated = injector.decorate(function, config);

        assertThat(decorated.decorators()).hasSize(2);
        assertThat(decorated.decorators().get(0)).isSameAs(function.decorators().get(0));
        assertThat(injector.isHook(decorated.decorators().get(1))).isTrue();
        assertThat(function.decorators()).hasSize(1);
    }

    @Test
    void everyHookNodeCarriesTheDeclarationPosition() {
        SourcePosition position = new SourcePosition(7, 4, 9, 12);
        ClassDef classDef = new ClassDef("A", List.of(), List.of(), List.of(Nodes.pass(8)), List.of(), position);

        Call hook = (Call) injector.decorate(classDef, config).decorators().get(0);
        Subscript configRef = (Subscript) hook.keywords().get(0).value();

        assertThat(hook.position()).isEqualTo(position);
        assertThat(hook.func().position()).isEqualTo(position);
        assertThat(configRef.position()).isEqualTo(position);
        assertThat(configRef.value().position()).isEqualTo(position);
        assertThat(configRef.slice().position()).isEqualTo(position);
    }

    @Test
    void eachDeclarationGetsItsOwnHook() {
        Expr first = injector.decorate(Nodes.function("f", Arguments.empty(), name("int"), 1), config).decorators().get(0);
        Expr second = injector.decorate(Nodes.function("g", Arguments.empty(), name("int"), 5), config).decorators().get(0);

        assertThat(first).isNotSameAs(second);
        assertThat(first.position().line()).isEqualTo(1);
        assertThat(second.position().line()).isEqualTo(5);
    }

    @Test
    void alreadyHookedDeclarationIsReturnedAsIs() {
        FunctionDef once = injector.decorate(Nodes.function("f", Arguments.empty(), name("int"), 1), config);

        assertThat(injector.decorate(once, config)).isSameAs(once);
        assertThat(once.decorators()).hasSize(1);
    }

    @Test
    void configsAreReferencedByIdentity() {
        InstrumentationConfig other = InstrumentationConfig.builder().label("test").build();

        Expr a = injector.decorate(Nodes.classDef("A", 1), config).decorators().get(0);
        Expr b = injector.decorate(Nodes.classDef("B", 2), other).decorators().get(0);
        Expr c = injector.decorate(Nodes.classDef("C", 3), config).decorators().get(0);

        assertThat(SourcePrinter.expression(a)).endsWith("[0])");
        assertThat(SourcePrinter.expression(b)).endsWith("[1])");
        assertThat(SourcePrinter.expression(c)).endsWith("[0])");
    }

    @Test
    void declarationWithoutNameIsAContractViolation() {
        assertThatThrownBy(() -> injector.decorate(Nodes.classDef("", 12), config))
            .isInstanceOf(MalformedNodeException.class)
            .hasMessageContaining("line 12");
    }

    @Test
    void customSymbolsChangeEmittedNames() {
        RuntimeSymbols symbols = new RuntimeSymbols("rt", "check_types", "CONFIGS", "check_value");
        DecorationInjector custom = new DefaultDecorationInjector(symbols, registry);

        FunctionDef decorated = custom.decorate(Nodes.function("f", Arguments.empty(), name("int"), 1), config);

        assertThat(SourcePrinter.expression(decorated.decorators().get(0))).isEqualTo("check_types(conf=CONFIGS[0])");
        assertThat(injector.isDecorated(decorated)).isFalse();
    }
}
