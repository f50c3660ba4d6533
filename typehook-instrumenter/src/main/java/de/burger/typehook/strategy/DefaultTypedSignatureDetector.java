package de.burger.typehook.strategy;

import de.burger.typehook.tree.Arg;
import de.burger.typehook.tree.Arguments;
import de.burger.typehook.tree.FunctionDef;
import java.util.List;

/** Looks at the return annotation first, then every parameter group in declaration order. */
public final class DefaultTypedSignatureDetector implements TypedSignatureDetector {

    @Override
    public boolean isTyped(FunctionDef function) {
        if (function.returns() != null) {
            return true;
        }
        Arguments args = function.args();
        return anyAnnotated(args.posOnly())
            || anyAnnotated(args.args())
            || isAnnotated(args.varArg())
            || anyAnnotated(args.kwOnly())
            || isAnnotated(args.kwArg());
    }

    private static boolean anyAnnotated(List<Arg> group) {
        for (Arg arg : group) {
            if (arg.isAnnotated()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAnnotated(Arg arg) {
        return arg != null && arg.isAnnotated();
    }
}
