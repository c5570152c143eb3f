package io.lighting.zweig.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code for target in iter if cond...} clause of a comprehension.
 */
public record Comprehension(Expr target, Expr iter, List<Expr> ifs) implements Node {
    public Comprehension {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iter, "iter");
        Objects.requireNonNull(ifs, "ifs");
        ifs = List.copyOf(ifs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPREHENSION;
    }
}
