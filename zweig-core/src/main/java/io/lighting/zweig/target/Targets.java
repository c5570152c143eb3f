package io.lighting.zweig.target;

import io.lighting.zweig.ast.Expr;
import io.lighting.zweig.ast.ExprContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks and rewrites expressions used on the left of an assignment.
 */
public final class Targets {
    private Targets() {
    }

    /**
     * Whether {@code expr} could appear as an assignment target. Names, attributes and
     * subscripts qualify; a tuple or list qualifies when all of its elements do, allowing one
     * starred element. A bare starred expression does not.
     */
    public static boolean isPossibleTarget(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (expr instanceof Expr.Name || expr instanceof Expr.Attribute || expr instanceof Expr.Subscript) {
            return true;
        }
        if (expr instanceof Expr.Tuple tuple) {
            return isPossibleSequenceTarget(tuple.elts());
        }
        if (expr instanceof Expr.ListExpr list) {
            return isPossibleSequenceTarget(list.elts());
        }
        return false;
    }

    /**
     * Copy of {@code expr} with every context in its target structure set to
     * {@link ExprContext#STORE}. Attribute bases and subscript values keep their contexts.
     *
     * @throws IllegalArgumentException if {@code expr} is not a possible target
     */
    public static Expr withStoreContext(Expr expr) {
        if (!isPossibleTarget(expr)) {
            throw new IllegalArgumentException("Not an assignment target: " + expr.kind().displayName());
        }
        return store(expr);
    }

    private static boolean isPossibleSequenceTarget(List<Expr> elements) {
        int starred = 0;
        for (Expr element : elements) {
            if (element instanceof Expr.Starred star) {
                starred++;
                if (starred > 1 || !isPossibleTarget(star.value())) {
                    return false;
                }
            } else if (!isPossibleTarget(element)) {
                return false;
            }
        }
        return true;
    }

    private static Expr store(Expr expr) {
        if (expr instanceof Expr.Name name) {
            return new Expr.Name(name.id(), ExprContext.STORE, name.position());
        }
        if (expr instanceof Expr.Attribute attribute) {
            return new Expr.Attribute(attribute.value(), attribute.attr(), ExprContext.STORE, attribute.position());
        }
        if (expr instanceof Expr.Subscript subscript) {
            return new Expr.Subscript(subscript.value(), subscript.slice(), ExprContext.STORE, subscript.position());
        }
        if (expr instanceof Expr.Starred starred) {
            return new Expr.Starred(store(starred.value()), ExprContext.STORE, starred.position());
        }
        if (expr instanceof Expr.Tuple tuple) {
            return new Expr.Tuple(storeAll(tuple.elts()), ExprContext.STORE, tuple.position());
        }
        if (expr instanceof Expr.ListExpr list) {
            return new Expr.ListExpr(storeAll(list.elts()), ExprContext.STORE, list.position());
        }
        throw new IllegalArgumentException("Not an assignment target: " + expr.kind().displayName());
    }

    private static List<Expr> storeAll(List<Expr> elements) {
        List<Expr> stored = new ArrayList<>(elements.size());
        for (Expr element : elements) {
            stored.add(store(element));
        }
        return stored;
    }
}
