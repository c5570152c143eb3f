package io.lighting.zweig.ast;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static factories for building trees without positions.
 * <p>
 * Names are loaded ({@link ExprContext#LOAD}) unless stated otherwise; use
 * {@link io.lighting.zweig.target.Targets#withStoreContext(Expr)} to turn an expression into an
 * assignment target.
 */
public final class Ast {
    private Ast() {
    }

    public static Mod.Module module(Stmt... body) {
        return new Mod.Module(List.of(body));
    }

    public static Mod.Module module(List<Stmt> body) {
        return new Mod.Module(body);
    }

    // statements

    public static Stmt.ExprStmt expr(Expr value) {
        return new Stmt.ExprStmt(value, null);
    }

    public static Stmt.Assign assign(Expr target, Expr value) {
        return new Stmt.Assign(List.of(target), value, null);
    }

    public static Stmt.Assign assign(List<Expr> targets, Expr value) {
        return new Stmt.Assign(targets, value, null);
    }

    public static Stmt.AugAssign augAssign(Expr target, BinaryOperator op, Expr value) {
        return new Stmt.AugAssign(target, op, value, null);
    }

    public static Stmt.Return returnStmt() {
        return new Stmt.Return(null, null);
    }

    public static Stmt.Return returnStmt(Expr value) {
        return new Stmt.Return(Objects.requireNonNull(value, "value"), null);
    }

    public static Stmt.Delete del(Expr... targets) {
        return new Stmt.Delete(List.of(targets), null);
    }

    public static Stmt.Pass pass() {
        return new Stmt.Pass(null);
    }

    public static Stmt.Break breakStmt() {
        return new Stmt.Break(null);
    }

    public static Stmt.Continue continueStmt() {
        return new Stmt.Continue(null);
    }

    public static Stmt.If ifStmt(Expr test, List<Stmt> body) {
        return new Stmt.If(test, body, List.of(), null);
    }

    public static Stmt.If ifStmt(Expr test, List<Stmt> body, List<Stmt> orelse) {
        return new Stmt.If(test, body, orelse, null);
    }

    public static Stmt.While whileStmt(Expr test, List<Stmt> body, List<Stmt> orelse) {
        return new Stmt.While(test, body, orelse, null);
    }

    public static Stmt.For forStmt(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) {
        return new Stmt.For(target, iter, body, orelse, null);
    }

    public static Stmt.FunctionDef functionDef(String name, Arguments args, List<Stmt> body) {
        return new Stmt.FunctionDef(name, args, body, List.of(), null, null);
    }

    public static Stmt.ClassDef classDef(String name, List<Expr> bases, List<Stmt> body) {
        return new Stmt.ClassDef(name, bases, List.of(), null, null, body, List.of(), null);
    }

    public static Stmt.Import importStmt(Alias... names) {
        return new Stmt.Import(List.of(names), null);
    }

    public static Stmt.ImportFrom importFrom(String module, int level, Alias... names) {
        return new Stmt.ImportFrom(module, List.of(names), level, null);
    }

    public static Alias alias(String name) {
        return new Alias(name, null);
    }

    public static Alias alias(String name, String asname) {
        return new Alias(name, asname);
    }

    public static Stmt.Global global(String... names) {
        return new Stmt.Global(List.of(names), null);
    }

    public static Stmt.Nonlocal nonlocal(String... names) {
        return new Stmt.Nonlocal(List.of(names), null);
    }

    public static Stmt.Raise raise() {
        return new Stmt.Raise(null, null, null);
    }

    public static Stmt.Raise raise(Expr exc) {
        return new Stmt.Raise(exc, null, null);
    }

    public static Stmt.Raise raise(Expr exc, Expr cause) {
        return new Stmt.Raise(exc, cause, null);
    }

    public static Stmt.Assert assertStmt(Expr test) {
        return new Stmt.Assert(test, null, null);
    }

    public static Stmt.Assert assertStmt(Expr test, Expr msg) {
        return new Stmt.Assert(test, msg, null);
    }

    // expressions

    public static Expr.Name name(String id) {
        return new Expr.Name(id, ExprContext.LOAD, null);
    }

    public static Expr.Name name(String id, ExprContext ctx) {
        return new Expr.Name(id, ctx, null);
    }

    public static Expr.Num num(Number n) {
        return new Expr.Num(n, null);
    }

    public static Expr.Str str(String s) {
        return new Expr.Str(s, null);
    }

    public static Expr.Bytes bytes(byte[] s) {
        return new Expr.Bytes(s, null);
    }

    public static Expr.Bytes bytes(String latin1) {
        return new Expr.Bytes(latin1.getBytes(StandardCharsets.ISO_8859_1), null);
    }

    public static Expr.NameConstant constant(Boolean value) {
        return new Expr.NameConstant(value, null);
    }

    public static Expr.NameConstant none() {
        return new Expr.NameConstant(null, null);
    }

    public static Expr.Ellipsis ellipsis() {
        return new Expr.Ellipsis(null);
    }

    public static Expr.BinOp binOp(Expr left, BinaryOperator op, Expr right) {
        return new Expr.BinOp(left, op, right, null);
    }

    public static Expr.UnaryOp unaryOp(UnaryOperator op, Expr operand) {
        return new Expr.UnaryOp(op, operand, null);
    }

    public static Expr.UnaryOp not(Expr operand) {
        return new Expr.UnaryOp(UnaryOperator.NOT, operand, null);
    }

    public static Expr.BoolOp and(Expr... values) {
        return new Expr.BoolOp(BooleanOperator.AND, List.of(values), null);
    }

    public static Expr.BoolOp or(Expr... values) {
        return new Expr.BoolOp(BooleanOperator.OR, List.of(values), null);
    }

    public static Expr.Compare compare(Expr left, ComparisonOperator op, Expr right) {
        return new Expr.Compare(left, List.of(op), List.of(right), null);
    }

    public static Expr.Compare compare(Expr left, List<ComparisonOperator> ops, List<Expr> comparators) {
        return new Expr.Compare(left, ops, comparators, null);
    }

    public static Expr.Call call(Expr func, Expr... args) {
        return new Expr.Call(func, List.of(args), List.of(), null, null, null);
    }

    public static Expr.Call call(Expr func, List<Expr> args, List<Keyword> keywords, Expr starargs, Expr kwargs) {
        return new Expr.Call(func, args, keywords, starargs, kwargs, null);
    }

    public static Keyword keyword(String arg, Expr value) {
        return new Keyword(arg, value);
    }

    public static Expr.Attribute attribute(Expr value, String attr) {
        return new Expr.Attribute(value, attr, ExprContext.LOAD, null);
    }

    public static Expr.Subscript subscript(Expr value, SliceNode slice) {
        return new Expr.Subscript(value, slice, ExprContext.LOAD, null);
    }

    public static Expr.Subscript subscript(Expr value, Expr index) {
        return new Expr.Subscript(value, new SliceNode.Index(index), ExprContext.LOAD, null);
    }

    public static SliceNode.Index index(Expr value) {
        return new SliceNode.Index(value);
    }

    public static SliceNode.Slice slice(Expr lower, Expr upper, Expr step) {
        return new SliceNode.Slice(lower, upper, step);
    }

    public static SliceNode.ExtSlice extSlice(SliceNode... dims) {
        return new SliceNode.ExtSlice(List.of(dims));
    }

    public static Expr.Starred starred(Expr value) {
        return new Expr.Starred(value, ExprContext.LOAD, null);
    }

    public static Expr.Tuple tuple(Expr... elts) {
        return new Expr.Tuple(List.of(elts), ExprContext.LOAD, null);
    }

    public static Expr.ListExpr list(Expr... elts) {
        return new Expr.ListExpr(List.of(elts), ExprContext.LOAD, null);
    }

    public static Expr.SetExpr set(Expr... elts) {
        return new Expr.SetExpr(List.of(elts), null);
    }

    public static Expr.Dict dict(List<Expr> keys, List<Expr> values) {
        return new Expr.Dict(keys, values, null);
    }

    public static Expr.Lambda lambda(Arguments args, Expr body) {
        return new Expr.Lambda(args, body, null);
    }

    public static Expr.IfExp ifExp(Expr test, Expr body, Expr orelse) {
        return new Expr.IfExp(test, body, orelse, null);
    }

    public static Expr.ListComp listComp(Expr elt, Comprehension... generators) {
        return new Expr.ListComp(elt, List.of(generators), null);
    }

    public static Expr.SetComp setComp(Expr elt, Comprehension... generators) {
        return new Expr.SetComp(elt, List.of(generators), null);
    }

    public static Expr.DictComp dictComp(Expr key, Expr value, Comprehension... generators) {
        return new Expr.DictComp(key, value, List.of(generators), null);
    }

    public static Expr.GeneratorExp generatorExp(Expr elt, Comprehension... generators) {
        return new Expr.GeneratorExp(elt, List.of(generators), null);
    }

    public static Comprehension comprehension(Expr target, Expr iter, Expr... ifs) {
        return new Comprehension(target, iter, List.of(ifs));
    }

    public static Expr.Yield yieldExpr() {
        return new Expr.Yield(null, null);
    }

    public static Expr.Yield yieldExpr(Expr value) {
        return new Expr.Yield(Objects.requireNonNull(value, "value"), null);
    }

    public static Expr.YieldFrom yieldFrom(Expr value) {
        return new Expr.YieldFrom(value, null);
    }

    // parameters

    public static Arg arg(String name) {
        return new Arg(name, null, null);
    }

    public static Arg arg(String name, Expr annotation) {
        return new Arg(name, annotation, null);
    }

    /**
     * Positional parameters without defaults or annotations.
     */
    public static Arguments params(String... names) {
        return new Arguments(
            Arrays.stream(names).map(Ast::arg).toList(),
            null,
            List.of(),
            List.of(),
            null,
            List.of()
        );
    }
}
