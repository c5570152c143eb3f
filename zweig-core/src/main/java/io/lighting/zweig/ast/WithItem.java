package io.lighting.zweig.ast;

import java.util.Objects;

public record WithItem(Expr contextExpr, Expr optionalVars) implements Node {
    public WithItem {
        Objects.requireNonNull(contextExpr, "contextExpr");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH_ITEM;
    }
}
