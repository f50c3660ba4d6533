package de.burger.typehook.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameter list of a function or lambda, grouped the way the source declares them:
 * positional-only, regular, {@code *varArg}, keyword-only and {@code **kwArg}.
 */
public record Arguments(
    List<Arg> posOnly,
    List<Arg> args,
    Arg varArg,
    List<Arg> kwOnly,
    Arg kwArg
) {

    private static final Arguments EMPTY = new Arguments(List.of(), List.of(), null, List.of(), null);

    public Arguments {
        posOnly = List.copyOf(Objects.requireNonNull(posOnly, "posOnly"));
        args = List.copyOf(Objects.requireNonNull(args, "args"));
        kwOnly = List.copyOf(Objects.requireNonNull(kwOnly, "kwOnly"));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public static Arguments of(Arg... args) {
        return new Arguments(List.of(), List.of(args), null, List.of(), null);
    }

    /** All parameters in declaration order. */
    public List<Arg> all() {
        var out = new ArrayList<Arg>(posOnly.size() + args.size() + kwOnly.size() + 2);
        out.addAll(posOnly);
        out.addAll(args);
        if (varArg != null) {
            out.add(varArg);
        }
        out.addAll(kwOnly);
        if (kwArg != null) {
            out.add(kwArg);
        }
        return out;
    }

    public boolean isEmpty() {
        return posOnly.isEmpty() && args.isEmpty() && varArg == null && kwOnly.isEmpty() && kwArg == null;
    }
}
