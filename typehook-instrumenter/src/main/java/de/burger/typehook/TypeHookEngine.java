package de.burger.typehook;

import de.burger.it.infrastructure.logging.SuppressLogging;
import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.strategy.InstrumentationStrategies;
import de.burger.typehook.transform.ModuleTransformer;
import de.burger.typehook.transform.TransformSummary;
import de.burger.typehook.tree.SourceModule;
import de.burger.typehook.tree.SourcePrinter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: instruments parsed modules so typed declarations are routed through the runtime
 * type-checking hook. Thread-safe; every call gets its own {@link ModuleTransformer}, so
 * independent modules can be instrumented concurrently.
 */
public final class TypeHookEngine {
    private static final Logger log = LoggerFactory.getLogger(TypeHookEngine.class);

    private final InstrumentationStrategies strategies;

    /** Engine emitting the names configured through {@code typehook.runtime.*} system properties. */
    public TypeHookEngine() {
        this(RuntimeSymbols.fromSystemProperties(), ConfigRegistry.shared());
    }

    public TypeHookEngine(RuntimeSymbols symbols, ConfigRegistry registry) {
        this(InstrumentationStrategies.defaults(symbols, registry));
    }

    public TypeHookEngine(InstrumentationStrategies strategies) {
        this.strategies = Objects.requireNonNull(strategies, "strategies");
    }

    public SourceModule instrument(String moduleName, SourceModule module, InstrumentationConfig config) {
        return instrumentWithSummary(moduleName, module, config).module();
    }

    public InstrumentedModule instrumentWithSummary(String moduleName, SourceModule module, InstrumentationConfig config) {
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(config, "config");
        log.debug("Instrumenting module {} with config {}", moduleName, config.label());

        ModuleTransformer transformer = new ModuleTransformer(moduleName, config, strategies);
        SourceModule result;
        try {
            result = transformer.transform(module);
        } catch (RuntimeException e) {
            log.error("Instrumentation of module {} failed", moduleName, e);
            throw e;
        }

        TransformSummary summary = transformer.summary();
        log.debug("{}", summary);
        if (config.debug()) {
            log.info("Module {} instrumented to:\n{}", moduleName, SourcePrinter.print(result));
        }
        return new InstrumentedModule(result, summary);
    }

    @SuppressLogging
    public InstrumentationStrategies strategies() {
        return strategies;
    }

    /** Rewritten module together with what the run changed. */
    public record InstrumentedModule(SourceModule module, TransformSummary summary) {
    }
}
