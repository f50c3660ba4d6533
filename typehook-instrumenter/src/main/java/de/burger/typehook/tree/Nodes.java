package de.burger.typehook.tree;

import java.util.List;

/**
 * Shorthand constructors for trees built in code rather than parsed, mostly by tests and by
 * callers embedding the engine. Positions are line-only; columns start at 0.
 */
public final class Nodes {
    private Nodes() {
    }

    public static SourceModule module(Stmt... body) {
        return new SourceModule(List.of(body), SourcePosition.line(1));
    }

    public static ExprStmt docstring(String text, int line) {
        return new ExprStmt(new Constant(text, SourcePosition.line(line)), SourcePosition.line(line));
    }

    public static ImportFrom futureImport(String feature, int line) {
        return new ImportFrom(ImportFrom.FUTURE_MODULE, List.of(Alias.of(feature)), 0, SourcePosition.line(line));
    }

    public static Import importModule(String module, int line) {
        return new Import(List.of(Alias.of(module)), SourcePosition.line(line));
    }

    public static ClassDef classDef(String name, int line, Stmt... body) {
        return new ClassDef(name, List.of(), List.of(), List.of(body), List.of(), SourcePosition.line(line));
    }

    public static FunctionDef function(String name, Arguments args, Expr returns, int line, Stmt... body) {
        return new FunctionDef(name, args, returns, List.of(body), List.of(), false, SourcePosition.line(line));
    }

    public static FunctionDef untypedFunction(String name, int line, Stmt... body) {
        return function(name, Arguments.empty(), null, line, body);
    }

    public static FunctionDef method(String name, int line, Stmt... body) {
        return function(name, Arguments.of(Arg.of("self")), null, line, body);
    }

    public static AnnAssign annAssign(String target, Expr annotation, Expr value, int line) {
        return new AnnAssign(new Name(target, SourcePosition.line(line)), annotation, value, true, SourcePosition.line(line));
    }

    public static TypeAlias typeAlias(String name, Expr value, int line) {
        return new TypeAlias(new Name(name, SourcePosition.line(line)), List.of(), value, SourcePosition.line(line));
    }

    public static ExprStmt expr(Expr value, int line) {
        return new ExprStmt(value, SourcePosition.line(line));
    }

    public static Return returns(Expr value, int line) {
        return new Return(value, SourcePosition.line(line));
    }

    public static Pass pass(int line) {
        return new Pass(SourcePosition.line(line));
    }

    public static Name name(String id) {
        return new Name(id, SourcePosition.UNKNOWN);
    }

    public static Constant constant(Object value) {
        return new Constant(value, SourcePosition.UNKNOWN);
    }

    public static Arg arg(String name, String annotationName) {
        return Arg.of(name, name(annotationName));
    }
}
