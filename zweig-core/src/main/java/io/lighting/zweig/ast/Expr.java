package io.lighting.zweig.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public sealed interface Expr extends Node, Located permits
    Expr.BoolOp, Expr.BinOp, Expr.UnaryOp, Expr.Lambda, Expr.IfExp,
    Expr.Dict, Expr.SetExpr, Expr.ListComp, Expr.SetComp, Expr.DictComp, Expr.GeneratorExp,
    Expr.Yield, Expr.YieldFrom, Expr.Compare, Expr.Call,
    Expr.Num, Expr.Str, Expr.Bytes, Expr.NameConstant, Expr.Ellipsis,
    Expr.Attribute, Expr.Subscript, Expr.Starred, Expr.Name, Expr.ListExpr, Expr.Tuple {

    record BoolOp(BooleanOperator op, List<Expr> values, Position position) implements Expr {
        public BoolOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(values, "values");
            if (values.size() < 2) {
                throw new IllegalArgumentException("values must hold at least two operands");
            }
            values = List.copyOf(values);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOL_OP;
        }
    }

    record BinOp(Expr left, BinaryOperator op, Expr right, Position position) implements Expr {
        public BinOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BIN_OP;
        }
    }

    record UnaryOp(UnaryOperator op, Expr operand, Position position) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_OP;
        }
    }

    record Lambda(Arguments args, Expr body, Position position) implements Expr {
        public Lambda {
            Objects.requireNonNull(args, "args");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LAMBDA;
        }
    }

    record IfExp(Expr test, Expr body, Expr orelse, Position position) implements Expr {
        public IfExp {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orelse, "orelse");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF_EXP;
        }
    }

    record Dict(List<Expr> keys, List<Expr> values, Position position) implements Expr {
        public Dict {
            Objects.requireNonNull(keys, "keys");
            Objects.requireNonNull(values, "values");
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException(
                    "keys and values differ in size: " + keys.size() + " != " + values.size()
                );
            }
            keys = List.copyOf(keys);
            values = List.copyOf(values);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DICT;
        }
    }

    /**
     * Set display (Python's {@code Set}). An empty set has no display form.
     */
    record SetExpr(List<Expr> elts, Position position) implements Expr {
        public SetExpr {
            Objects.requireNonNull(elts, "elts");
            if (elts.isEmpty()) {
                throw new IllegalArgumentException("elts must not be empty");
            }
            elts = List.copyOf(elts);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET;
        }
    }

    record ListComp(Expr elt, List<Comprehension> generators, Position position) implements Expr {
        public ListComp {
            Objects.requireNonNull(elt, "elt");
            generators = requireGenerators(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST_COMP;
        }
    }

    record SetComp(Expr elt, List<Comprehension> generators, Position position) implements Expr {
        public SetComp {
            Objects.requireNonNull(elt, "elt");
            generators = requireGenerators(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET_COMP;
        }
    }

    record DictComp(Expr key, Expr value, List<Comprehension> generators, Position position) implements Expr {
        public DictComp {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            generators = requireGenerators(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DICT_COMP;
        }
    }

    record GeneratorExp(Expr elt, List<Comprehension> generators, Position position) implements Expr {
        public GeneratorExp {
            Objects.requireNonNull(elt, "elt");
            generators = requireGenerators(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GENERATOR_EXP;
        }
    }

    record Yield(Expr value, Position position) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.YIELD;
        }
    }

    record YieldFrom(Expr value, Position position) implements Expr {
        public YieldFrom {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.YIELD_FROM;
        }
    }

    record Compare(Expr left, List<ComparisonOperator> ops, List<Expr> comparators, Position position)
        implements Expr {
        public Compare {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(ops, "ops");
            Objects.requireNonNull(comparators, "comparators");
            if (ops.isEmpty()) {
                throw new IllegalArgumentException("ops must not be empty");
            }
            if (ops.size() != comparators.size()) {
                throw new IllegalArgumentException(
                    "ops and comparators differ in size: " + ops.size() + " != " + comparators.size()
                );
            }
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPARE;
        }
    }

    record Call(
        Expr func,
        List<Expr> args,
        List<Keyword> keywords,
        Expr starargs,
        Expr kwargs,
        Position position
    ) implements Expr {
        public Call {
            Objects.requireNonNull(func, "func");
            Objects.requireNonNull(args, "args");
            Objects.requireNonNull(keywords, "keywords");
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }
    }

    /**
     * Numeric literal. Integral values are {@link Integer}, {@link Long}, {@link Short},
     * {@link Byte} or {@link BigInteger}; floating values are {@link Double} or {@link Float}.
     */
    record Num(Number n, Position position) implements Expr {
        public Num {
            Objects.requireNonNull(n, "n");
            if (!isIntegral(n) && !(n instanceof Double) && !(n instanceof Float)) {
                throw new IllegalArgumentException("Unsupported numeric literal type: " + n.getClass().getName());
            }
        }

        public static boolean isIntegral(Number n) {
            return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
        }

        public boolean isNegative() {
            if (n instanceof BigInteger big) {
                return big.signum() < 0;
            }
            if (isIntegral(n)) {
                return n.longValue() < 0;
            }
            double value = n.doubleValue();
            return value < 0 || (value == 0 && 1 / value < 0);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUM;
        }
    }

    record Str(String s, Position position) implements Expr {
        public Str {
            Objects.requireNonNull(s, "s");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STR;
        }
    }

    record Bytes(byte[] s, Position position) implements Expr {
        public Bytes {
            Objects.requireNonNull(s, "s");
            s = s.clone();
        }

        @Override
        public byte[] s() {
            return s.clone();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BYTES;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Bytes bytes
                && Arrays.equals(s, bytes.s)
                && Objects.equals(position, bytes.position);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(s) + Objects.hashCode(position);
        }

        @Override
        public String toString() {
            return "Bytes[s=" + Arrays.toString(s) + ", position=" + position + "]";
        }
    }

    /**
     * {@code True}, {@code False} or {@code None} (a {@code null} value).
     */
    record NameConstant(Boolean value, Position position) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.NAME_CONSTANT;
        }
    }

    record Ellipsis(Position position) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.ELLIPSIS;
        }
    }

    record Attribute(Expr value, String attr, ExprContext ctx, Position position) implements Expr {
        public Attribute {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(attr, "attr");
            Objects.requireNonNull(ctx, "ctx");
            if (attr.isBlank()) {
                throw new IllegalArgumentException("attr must not be blank");
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ATTRIBUTE;
        }
    }

    record Subscript(Expr value, SliceNode slice, ExprContext ctx, Position position) implements Expr {
        public Subscript {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(slice, "slice");
            Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUBSCRIPT;
        }
    }

    record Starred(Expr value, ExprContext ctx, Position position) implements Expr {
        public Starred {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STARRED;
        }
    }

    record Name(String id, ExprContext ctx, Position position) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(ctx, "ctx");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NAME;
        }
    }

    /**
     * List display (Python's {@code List}).
     */
    record ListExpr(List<Expr> elts, ExprContext ctx, Position position) implements Expr {
        public ListExpr {
            Objects.requireNonNull(elts, "elts");
            Objects.requireNonNull(ctx, "ctx");
            elts = List.copyOf(elts);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST;
        }
    }

    record Tuple(List<Expr> elts, ExprContext ctx, Position position) implements Expr {
        public Tuple {
            Objects.requireNonNull(elts, "elts");
            Objects.requireNonNull(ctx, "ctx");
            elts = List.copyOf(elts);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TUPLE;
        }
    }

    private static List<Comprehension> requireGenerators(List<Comprehension> generators) {
        Objects.requireNonNull(generators, "generators");
        if (generators.isEmpty()) {
            throw new IllegalArgumentException("generators must not be empty");
        }
        return List.copyOf(generators);
    }
}
