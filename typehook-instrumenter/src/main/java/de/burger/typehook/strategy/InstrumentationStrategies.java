package de.burger.typehook.strategy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.RuntimeSymbols;
import java.util.Objects;

/** The per-concern strategies a module transformer delegates to. */
public record InstrumentationStrategies(
    TypedSignatureDetector typedSignatures,
    DecorationInjector decorations,
    PreambleInserter preamble,
    AssignmentCheckEmitter assignmentChecks,
    TypeAliasHookEmitter typeAliasHooks
) {

    public InstrumentationStrategies {
        Objects.requireNonNull(typedSignatures, "typedSignatures");
        Objects.requireNonNull(decorations, "decorations");
        Objects.requireNonNull(preamble, "preamble");
        Objects.requireNonNull(assignmentChecks, "assignmentChecks");
        Objects.requireNonNull(typeAliasHooks, "typeAliasHooks");
    }

    public static InstrumentationStrategies defaults(RuntimeSymbols symbols, ConfigRegistry registry) {
        return new InstrumentationStrategies(
            new DefaultTypedSignatureDetector(),
            new DefaultDecorationInjector(symbols, registry),
            new DefaultPreambleInserter(symbols),
            new DefaultAssignmentCheckEmitter(symbols, registry),
            new DefaultTypeAliasHookEmitter(symbols, registry));
    }
}
