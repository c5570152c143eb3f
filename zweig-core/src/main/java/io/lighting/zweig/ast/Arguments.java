package io.lighting.zweig.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameter list of a function or lambda.
 * <p>
 * {@code defaults} line up with the last positional parameters. {@code kwDefaults} holds one
 * entry per keyword-only parameter, {@code null} where that parameter has no default.
 */
public record Arguments(
    List<Arg> args,
    Arg vararg,
    List<Arg> kwonlyargs,
    List<Expr> kwDefaults,
    Arg kwarg,
    List<Expr> defaults
) implements Node {

    public Arguments {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(kwonlyargs, "kwonlyargs");
        Objects.requireNonNull(kwDefaults, "kwDefaults");
        Objects.requireNonNull(defaults, "defaults");
        if (defaults.size() > args.size()) {
            throw new IllegalArgumentException(
                "more defaults than positional parameters: " + defaults.size() + " > " + args.size()
            );
        }
        if (kwDefaults.size() != kwonlyargs.size()) {
            throw new IllegalArgumentException(
                "kwDefaults and kwonlyargs differ in size: " + kwDefaults.size() + " != " + kwonlyargs.size()
            );
        }
        args = List.copyOf(args);
        kwonlyargs = List.copyOf(kwonlyargs);
        kwDefaults = Collections.unmodifiableList(new ArrayList<>(kwDefaults));
        defaults = List.copyOf(defaults);
    }

    public static Arguments empty() {
        return new Arguments(List.of(), null, List.of(), List.of(), null, List.of());
    }

    public boolean isEmpty() {
        return args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENTS;
    }
}
