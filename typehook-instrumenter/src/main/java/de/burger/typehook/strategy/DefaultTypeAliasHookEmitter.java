package de.burger.typehook.strategy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.ExprStmt;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Name;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.tree.TypeAlias;
import java.util.List;

/** {@code type X = value} is followed by {@code <typeAliasHook>(X, conf=<configTable>[<id>])}. */
public final class DefaultTypeAliasHookEmitter implements TypeAliasHookEmitter {

    private final HookExpressions hooks;

    public DefaultTypeAliasHookEmitter(RuntimeSymbols symbols, ConfigRegistry registry) {
        this.hooks = new HookExpressions(symbols, registry);
    }

    @Override
    public Stmt hookFor(TypeAlias alias, InstrumentationConfig config) {
        if (alias.name().id().isBlank()) {
            throw new MalformedNodeException("Type alias without a name", alias);
        }
        var call = hooks.hookCall(
            hooks.symbols().typeAliasHookName(),
            List.of(new Name(alias.name().id(), alias.position())),
            config,
            alias.position());
        return new ExprStmt(call, alias.position());
    }

    @Override
    public boolean isHookFor(TypeAlias alias, Stmt candidate) {
        if (!(candidate instanceof ExprStmt exprStmt)
            || !HookExpressions.isCallTo(exprStmt.value(), hooks.symbols().typeAliasHookName())) {
            return false;
        }
        Call call = (Call) exprStmt.value();
        return !call.args().isEmpty() && call.args().get(0) instanceof Name hooked && hooked.id().equals(alias.name().id());
    }
}
