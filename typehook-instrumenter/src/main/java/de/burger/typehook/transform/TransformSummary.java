package de.burger.typehook.transform;

/** What one {@link ModuleTransformer} run changed. */
public record TransformSummary(
    String moduleName,
    boolean preambleInserted,
    int classesDecorated,
    int functionsDecorated,
    int methodsSkipped,
    int untypedFunctionsSkipped,
    int assignmentChecks,
    int typeAliasHooks
) {

    public int hooksEmitted() {
        return classesDecorated + functionsDecorated + assignmentChecks + typeAliasHooks;
    }

    public boolean changed() {
        return preambleInserted || hooksEmitted() > 0;
    }
}
