package de.burger.typehook.transform;

import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.scope.ScopeKind;
import de.burger.typehook.scope.ScopeTracker;
import de.burger.typehook.strategy.InstrumentationStrategies;
import de.burger.typehook.tree.AnnAssign;
import de.burger.typehook.tree.Assign;
import de.burger.typehook.tree.ClassDef;
import de.burger.typehook.tree.ExceptHandler;
import de.burger.typehook.tree.ExprStmt;
import de.burger.typehook.tree.For;
import de.burger.typehook.tree.FunctionDef;
import de.burger.typehook.tree.If;
import de.burger.typehook.tree.Import;
import de.burger.typehook.tree.ImportFrom;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Pass;
import de.burger.typehook.tree.Return;
import de.burger.typehook.tree.SourceModule;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.tree.Try;
import de.burger.typehook.tree.TypeAlias;
import de.burger.typehook.tree.While;
import de.burger.typehook.tree.With;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites one module in a single depth-first pass.
 *
 * <ul>
 *   <li>The module gets the preamble import once, before anything else is visited.</li>
 *   <li>Every class is hooked, whatever its members look like; the runtime facility decides per
 *       member. Its methods are therefore never hooked on their own.</li>
 *   <li>Any other function is hooked only if it declares a type hint.</li>
 *   <li>Bodies of classes and functions are always visited, so nested declarations are judged
 *       independently of their parent.</li>
 *   <li>Annotated assignments outside class bodies, and {@code type} aliases anywhere, are
 *       followed by a runtime hook statement.</li>
 * </ul>
 *
 * A transformer owns its scope stack and is used for exactly one module.
 */
public final class ModuleTransformer {
    private static final Logger log = LoggerFactory.getLogger(ModuleTransformer.class);

    private final InstrumentationConfig config;
    private final InstrumentationStrategies strategies;
    private final ScopeTracker scopes;

    private boolean used;
    private boolean preambleInserted;
    private int classesDecorated;
    private int functionsDecorated;
    private int methodsSkipped;
    private int untypedFunctionsSkipped;
    private int assignmentChecks;
    private int typeAliasHooks;

    public ModuleTransformer(String moduleName, InstrumentationConfig config, InstrumentationStrategies strategies) {
        this(config, strategies, new ScopeTracker(moduleName));
    }

    ModuleTransformer(InstrumentationConfig config, InstrumentationStrategies strategies, ScopeTracker scopes) {
        this.config = Objects.requireNonNull(config, "config");
        this.strategies = Objects.requireNonNull(strategies, "strategies");
        this.scopes = Objects.requireNonNull(scopes, "scopes");
    }

    public SourceModule transform(SourceModule module) {
        Objects.requireNonNull(module, "module");
        if (used) {
            throw new IllegalStateException("Transformer for " + scopes.moduleName() + " already used");
        }
        used = true;
        if (!scopes.isEmpty()) {
            throw new IllegalStateException("Scope stack not empty before transforming " + scopes.moduleName());
        }

        SourceModule withPreamble = strategies.preamble().insertPreamble(module);
        preambleInserted = withPreamble != module;
        SourceModule result = withPreamble.withBody(visitBody(withPreamble.body()));

        if (!scopes.isEmpty()) {
            throw new IllegalStateException("Unbalanced scopes after transforming " + scopes.moduleName()
                + ": depth " + scopes.depth());
        }
        return result;
    }

    public TransformSummary summary() {
        return new TransformSummary(scopes.moduleName(), preambleInserted, classesDecorated, functionsDecorated,
            methodsSkipped, untypedFunctionsSkipped, assignmentChecks, typeAliasHooks);
    }

    private List<Stmt> visitBody(List<Stmt> body) {
        var out = new ArrayList<Stmt>(body.size());
        for (int i = 0; i < body.size(); i++) {
            Stmt stmt = body.get(i);
            if (stmt instanceof AnnAssign assignment) {
                out.add(assignment);
                Stmt next = i + 1 < body.size() ? body.get(i + 1) : null;
                assignmentCheck(assignment, next).ifPresent(out::add);
            } else if (stmt instanceof TypeAlias alias) {
                out.add(alias);
                Stmt next = i + 1 < body.size() ? body.get(i + 1) : null;
                typeAliasHook(alias, next).ifPresent(out::add);
            } else {
                out.add(visitStatement(stmt));
            }
        }
        return out;
    }

    private Stmt visitStatement(Stmt stmt) {
        if (stmt instanceof ClassDef classDef) {
            return visitClass(classDef);
        }
        if (stmt instanceof FunctionDef function) {
            return visitFunction(function);
        }
        if (stmt instanceof If ifStmt) {
            return ifStmt.withBodies(visitBody(ifStmt.body()), visitBody(ifStmt.orElse()));
        }
        if (stmt instanceof For forStmt) {
            return forStmt.withBodies(visitBody(forStmt.body()), visitBody(forStmt.orElse()));
        }
        if (stmt instanceof While whileStmt) {
            return whileStmt.withBodies(visitBody(whileStmt.body()), visitBody(whileStmt.orElse()));
        }
        if (stmt instanceof With with) {
            return with.withBody(visitBody(with.body()));
        }
        if (stmt instanceof Try tryStmt) {
            List<ExceptHandler> handlers = tryStmt.handlers().stream()
                .map(h -> h.withBody(visitBody(h.body())))
                .toList();
            return tryStmt.withBodies(visitBody(tryStmt.body()), handlers, visitBody(tryStmt.orElse()),
                visitBody(tryStmt.finalBody()));
        }
        if (stmt instanceof Import || stmt instanceof ImportFrom || stmt instanceof ExprStmt
            || stmt instanceof Assign || stmt instanceof AnnAssign || stmt instanceof TypeAlias
            || stmt instanceof Return || stmt instanceof Pass) {
            return stmt;
        }
        throw new MalformedNodeException("Unhandled statement kind", stmt);
    }

    private ClassDef visitClass(ClassDef classDef) {
        requireNamed(classDef.name(), classDef);
        ClassDef decorated = strategies.decorations().decorate(classDef, config);
        if (decorated != classDef) {
            classesDecorated++;
            log.trace("Hooked class {}.{}", scopes.qualifiedName(), classDef.name());
        }
        try (ScopeTracker.Entered ignored = scopes.enter(ScopeKind.CLASS, classDef.name())) {
            return decorated.withBody(visitBody(decorated.body()));
        }
    }

    private FunctionDef visitFunction(FunctionDef function) {
        requireNamed(function.name(), function);
        FunctionDef current = function;
        if (scopes.isDirectlyInsideClass()) {
            methodsSkipped++;
            log.trace("Skipped method {}.{}: covered by its class", scopes.qualifiedName(), function.name());
        } else if (strategies.typedSignatures().isTyped(function)) {
            current = strategies.decorations().decorate(function, config);
            if (current != function) {
                functionsDecorated++;
                log.trace("Hooked function {}.{}", scopes.qualifiedName(), function.name());
            }
        } else {
            untypedFunctionsSkipped++;
            log.trace("Skipped untyped function {}.{}", scopes.qualifiedName(), function.name());
        }
        try (ScopeTracker.Entered ignored = scopes.enter(ScopeKind.FUNCTION, function.name())) {
            return current.withBody(visitBody(current.body()));
        }
    }

    private Optional<Stmt> assignmentCheck(AnnAssign assignment, Stmt next) {
        if (!config.checkAnnotatedAssignments() || scopes.isDirectlyInsideClass()) {
            return Optional.empty();
        }
        if (next != null && strategies.assignmentChecks().isCheckFor(assignment, next)) {
            return Optional.empty();
        }
        Optional<Stmt> check = strategies.assignmentChecks().checkFor(assignment, config);
        if (check.isPresent()) {
            assignmentChecks++;
            log.trace("Checked annotated assignment in {} at line {}", scopes.qualifiedName(), assignment.position().line());
        }
        return check;
    }

    // Every scope, class bodies included.
    private Optional<Stmt> typeAliasHook(TypeAlias alias, Stmt next) {
        if (!config.checkTypeAliases()) {
            return Optional.empty();
        }
        if (next != null && strategies.typeAliasHooks().isHookFor(alias, next)) {
            return Optional.empty();
        }
        Stmt hook = strategies.typeAliasHooks().hookFor(alias, config);
        typeAliasHooks++;
        log.trace("Hooked type alias {}.{}", scopes.qualifiedName(), alias.name().id());
        return Optional.of(hook);
    }

    private static void requireNamed(String name, Stmt declaration) {
        if (name.isBlank()) {
            throw new MalformedNodeException("Declaration without a name", declaration);
        }
    }
}
