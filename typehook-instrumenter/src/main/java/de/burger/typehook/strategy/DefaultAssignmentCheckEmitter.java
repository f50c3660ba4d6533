package de.burger.typehook.strategy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.AnnAssign;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.ExprStmt;
import de.burger.typehook.tree.Name;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.Stmt;
import java.util.List;
import java.util.Optional;

/**
 * {@code x: T = value} is followed by {@code <check>(x, T, conf=<configTable>[<id>])}.
 * Only simple name targets with a value qualify: a bare {@code x: T} binds nothing, and
 * attribute or subscript targets may run user code when read back.
 */
public final class DefaultAssignmentCheckEmitter implements AssignmentCheckEmitter {

    private final HookExpressions hooks;

    public DefaultAssignmentCheckEmitter(RuntimeSymbols symbols, ConfigRegistry registry) {
        this.hooks = new HookExpressions(symbols, registry);
    }

    @Override
    public Optional<Stmt> checkFor(AnnAssign assignment, InstrumentationConfig config) {
        if (assignment.value() == null || !assignment.simple() || !(assignment.target() instanceof Name target)) {
            return Optional.empty();
        }
        SourcePosition position = assignment.position();
        var call = hooks.hookCall(
            hooks.symbols().assignmentCheckName(),
            List.of(new Name(target.id(), position), assignment.annotation()),
            config,
            position);
        return Optional.of(new ExprStmt(call, position));
    }

    @Override
    public boolean isCheckFor(AnnAssign assignment, Stmt candidate) {
        if (!(assignment.target() instanceof Name target) || !(candidate instanceof ExprStmt exprStmt)) {
            return false;
        }
        if (!HookExpressions.isCallTo(exprStmt.value(), hooks.symbols().assignmentCheckName())) {
            return false;
        }
        Call call = (Call) exprStmt.value();
        return !call.args().isEmpty() && call.args().get(0) instanceof Name checked && checked.id().equals(target.id());
    }
}
