package de.burger.typehook.strategy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.Constant;
import de.burger.typehook.tree.Expr;
import de.burger.typehook.tree.Keyword;
import de.burger.typehook.tree.Name;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.Subscript;
import de.burger.typehook.util.NodeMetadata;
import java.util.List;
import java.util.Objects;

/** Builds the synthetic calls into the runtime facility shared by the emitting strategies. */
final class HookExpressions {
    static final String CONF_KEYWORD = "conf";

    private final RuntimeSymbols symbols;
    private final ConfigRegistry registry;

    HookExpressions(RuntimeSymbols symbols, ConfigRegistry registry) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    RuntimeSymbols symbols() {
        return symbols;
    }

    /** {@code <configTable>[<id>]}. */
    Expr configReference(InstrumentationConfig config) {
        int id = registry.register(config);
        return new Subscript(
            new Name(symbols.configTableName(), SourcePosition.UNKNOWN),
            new Constant(id, SourcePosition.UNKNOWN),
            SourcePosition.UNKNOWN);
    }

    /** {@code <name>(args..., conf=<configTable>[<id>])}, every node placed at {@code position}. */
    Expr hookCall(String name, List<Expr> args, InstrumentationConfig config, SourcePosition position) {
        Call call = new Call(
            new Name(name, SourcePosition.UNKNOWN),
            args,
            List.of(new Keyword(CONF_KEYWORD, configReference(config))),
            SourcePosition.UNKNOWN);
        return NodeMetadata.withPosition(call, position);
    }

    static boolean isCallTo(Expr expr, String name) {
        return expr instanceof Call call && call.func() instanceof Name func && func.id().equals(name);
    }
}
