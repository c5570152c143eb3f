package io.lighting.zweig.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.zweig.ast.Ast;
import io.lighting.zweig.ast.Expr;
import io.lighting.zweig.ast.ExprContext;
import org.junit.jupiter.api.Test;

class TargetsTest {

    @Test
    void recognisesPossibleTargets() {
        assertTrue(Targets.isPossibleTarget(Ast.name("name")));
        assertTrue(Targets.isPossibleTarget(Ast.tuple(Ast.name("foo"), Ast.name("bar"))));
        assertTrue(Targets.isPossibleTarget(Ast.list(Ast.name("foo"), Ast.name("bar"))));
        assertTrue(Targets.isPossibleTarget(Ast.subscript(Ast.name("sequence"), Ast.num(0))));
        assertTrue(Targets.isPossibleTarget(Ast.attribute(Ast.name("foo"), "bar")));
        assertTrue(Targets.isPossibleTarget(Ast.tuple(Ast.name("foo"), Ast.starred(Ast.name("bar")))));
    }

    @Test
    void rejectsImpossibleTargets() {
        assertFalse(Targets.isPossibleTarget(Ast.tuple(Ast.call(Ast.name("foo")), Ast.name("bar"))));
        assertFalse(Targets.isPossibleTarget(Ast.list(Ast.call(Ast.name("foo")), Ast.name("bar"))));
        assertFalse(Targets.isPossibleTarget(Ast.starred(Ast.name("foo"))));
        assertFalse(Targets.isPossibleTarget(Ast.tuple(Ast.name("foo"), Ast.starred(Ast.call(Ast.name("bar"))))));
        assertFalse(Targets.isPossibleTarget(
            Ast.tuple(Ast.starred(Ast.name("a")), Ast.starred(Ast.name("b")))
        ));
        assertFalse(Targets.isPossibleTarget(Ast.num(1)));
    }

    @Test
    void setsStoreContextThroughTheTargetStructure() {
        Expr.Name name = (Expr.Name) Targets.withStoreContext(Ast.name("name"));
        assertEquals(ExprContext.STORE, name.ctx());

        Expr.Attribute attribute = (Expr.Attribute) Targets.withStoreContext(Ast.attribute(Ast.name("foo"), "bar"));
        assertEquals(ExprContext.STORE, attribute.ctx());
        assertEquals(ExprContext.LOAD, ((Expr.Name) attribute.value()).ctx());

        Expr.Subscript subscript = (Expr.Subscript) Targets.withStoreContext(Ast.subscript(Ast.name("foo"), Ast.num(0)));
        assertEquals(ExprContext.STORE, subscript.ctx());

        Expr.Tuple tuple = (Expr.Tuple) Targets.withStoreContext(Ast.tuple(Ast.name("foo"), Ast.name("bar")));
        assertEquals(ExprContext.STORE, tuple.ctx());
        assertEquals(ExprContext.STORE, ((Expr.Name) tuple.elts().get(0)).ctx());
        assertEquals(ExprContext.STORE, ((Expr.Name) tuple.elts().get(1)).ctx());

        Expr.ListExpr list = (Expr.ListExpr) Targets.withStoreContext(
            Ast.list(Ast.name("foo"), Ast.starred(Ast.name("bar")))
        );
        assertEquals(ExprContext.STORE, list.ctx());
        Expr.Starred starred = (Expr.Starred) list.elts().get(1);
        assertEquals(ExprContext.STORE, starred.ctx());
        assertEquals(ExprContext.STORE, ((Expr.Name) starred.value()).ctx());
    }

    @Test
    void leavesTheInputUntouched() {
        Expr.Name original = Ast.name("x");

        Targets.withStoreContext(original);

        assertSame(ExprContext.LOAD, original.ctx());
    }

    @Test
    void rejectsRewritingNonTargets() {
        assertThrows(IllegalArgumentException.class, () -> Targets.withStoreContext(Ast.call(Ast.name("f"))));
    }
}
