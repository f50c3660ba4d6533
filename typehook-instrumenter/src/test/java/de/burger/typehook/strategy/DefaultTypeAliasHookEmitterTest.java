package de.burger.typehook.strategy;

import static de.burger.typehook.tree.Nodes.name;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.BinOp;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.ExprStmt;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Name;
import de.burger.typehook.tree.Nodes;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.SourcePrinter;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.tree.TypeAlias;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultTypeAliasHookEmitterTest {

    private final ConfigRegistry registry = new ConfigRegistry();
    private final TypeAliasHookEmitter emitter = new DefaultTypeAliasHookEmitter(RuntimeSymbols.defaults(), registry);
    private final InstrumentationConfig config = InstrumentationConfig.defaults();

    @Test
    void hookNamesTheAliasAndTheConfig() {
        // Forward reference: Node is only defined further down the module.
        TypeAlias alias = Nodes.typeAlias("Tree", new BinOp(name("Node"), "|", name("None"), SourcePosition.UNKNOWN), 4);

        Stmt hook = emitter.hookFor(alias, config);

        assertThat(SourcePrinter.print(hook)).isEqualTo("__typehook_alias__(Tree, conf=__typehook_conf__[0])\n");
        assertThat(registry.lookup(0)).containsSame(config);
        assertThat(emitter.isHookFor(alias, hook)).isTrue();
    }

    @Test
    void hookCarriesTheAliasPosition() {
        SourcePosition position = new SourcePosition(12, 4, 12, 30);
        TypeAlias alias = new TypeAlias(new Name("Id", position), List.of(), name("int"), position);

        Call call = (Call) ((ExprStmt) emitter.hookFor(alias, config)).value();

        assertThat(call.position()).isEqualTo(position);
        assertThat(call.func().position()).isEqualTo(position);
        assertThat(call.args()).allSatisfy(a -> assertThat(a.position()).isEqualTo(position));
        assertThat(call.keywords().get(0).value().position()).isEqualTo(position);
    }

    @Test
    void hookForAnotherAliasIsNotRecognized() {
        Stmt hookOfA = emitter.hookFor(Nodes.typeAlias("A", name("int"), 1), config);

        assertThat(emitter.isHookFor(Nodes.typeAlias("B", name("int"), 2), hookOfA)).isFalse();
        assertThat(emitter.isHookFor(Nodes.typeAlias("A", name("int"), 2), Nodes.pass(3))).isFalse();
    }

    @Test
    void aliasWithoutNameIsAContractViolation() {
        assertThatThrownBy(() -> emitter.hookFor(Nodes.typeAlias(" ", name("int"), 9), config))
            .isInstanceOf(MalformedNodeException.class)
            .hasMessageContaining("line 9");
    }
}
