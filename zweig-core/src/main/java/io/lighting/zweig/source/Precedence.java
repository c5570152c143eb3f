package io.lighting.zweig.source;

import io.lighting.zweig.ast.BinaryOperator;
import io.lighting.zweig.ast.BooleanOperator;
import io.lighting.zweig.ast.ComparisonOperator;
import io.lighting.zweig.ast.Expr;
import io.lighting.zweig.ast.NodeKind;
import io.lighting.zweig.ast.UnaryOperator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Operator precedence tiers, loosest binding first.
 * <p>
 * A key is either an operator tag (for {@code BinOp}, {@code BoolOp} and {@code UnaryOp}) or a
 * {@link NodeKind}. A child needs parentheses when its tier is at or below its parent's tier.
 * Keys outside the table never need parentheses as children.
 */
public final class Precedence {
    private static final List<List<Enum<?>>> TIERS = List.of(
        tier(NodeKind.YIELD, NodeKind.YIELD_FROM),
        tier(NodeKind.LAMBDA),
        tier(NodeKind.IF_EXP),
        tier(BooleanOperator.OR),
        tier(BooleanOperator.AND),
        tier(UnaryOperator.NOT),
        tier(
            NodeKind.COMPARE,
            ComparisonOperator.IN, ComparisonOperator.NOT_IN, ComparisonOperator.IS, ComparisonOperator.IS_NOT,
            ComparisonOperator.LT, ComparisonOperator.LT_E, ComparisonOperator.GT, ComparisonOperator.GT_E,
            ComparisonOperator.NOT_EQ, ComparisonOperator.EQ
        ),
        tier(NodeKind.STARRED),
        tier(BinaryOperator.BIT_OR),
        tier(BinaryOperator.BIT_XOR),
        tier(BinaryOperator.BIT_AND),
        tier(BinaryOperator.LSHIFT, BinaryOperator.RSHIFT),
        tier(BinaryOperator.ADD, BinaryOperator.SUB),
        tier(BinaryOperator.MULT, BinaryOperator.DIV, BinaryOperator.FLOOR_DIV, BinaryOperator.MOD),
        tier(UnaryOperator.UADD, UnaryOperator.USUB, UnaryOperator.INVERT),
        tier(BinaryOperator.POW),
        tier(NodeKind.SUBSCRIPT, NodeKind.CALL, NodeKind.ATTRIBUTE),
        tier(
            NodeKind.TUPLE, NodeKind.LIST, NodeKind.DICT, NodeKind.SET,
            NodeKind.LIST_COMP, NodeKind.DICT_COMP, NodeKind.SET_COMP, NodeKind.GENERATOR_EXP,
            NodeKind.NAME, NodeKind.NUM, NodeKind.STR, NodeKind.BYTES, NodeKind.NAME_CONSTANT, NodeKind.ELLIPSIS
        )
    );

    private static final Map<Enum<?>, Integer> TIER_INDEX = buildIndex();

    private Precedence() {
    }

    /**
     * Precedence key of an expression: its operator for operator nodes, its kind otherwise.
     */
    public static Enum<?> keyOf(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (expr instanceof Expr.BinOp binOp) {
            return binOp.op();
        }
        if (expr instanceof Expr.BoolOp boolOp) {
            return boolOp.op();
        }
        if (expr instanceof Expr.UnaryOp unaryOp) {
            return unaryOp.op();
        }
        return expr.kind();
    }

    public static boolean requiresParentheses(Enum<?> parent, Enum<?> child) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        Integer parentTier = TIER_INDEX.get(parent);
        if (parentTier == null) {
            throw new IllegalArgumentException("No precedence tier for " + parent);
        }
        Integer childTier = TIER_INDEX.get(child);
        return childTier != null && childTier <= parentTier;
    }

    public static boolean requiresParentheses(Expr parent, Expr child) {
        return requiresParentheses(keyOf(parent), keyOf(child));
    }

    /**
     * Whether {@code child} sits in a strictly looser tier than {@code reference}.
     */
    public static boolean bindsLooserThan(Enum<?> child, Enum<?> reference) {
        Objects.requireNonNull(child, "child");
        Integer referenceTier = TIER_INDEX.get(Objects.requireNonNull(reference, "reference"));
        if (referenceTier == null) {
            throw new IllegalArgumentException("No precedence tier for " + reference);
        }
        Integer childTier = TIER_INDEX.get(child);
        return childTier != null && childTier < referenceTier;
    }

    public static OptionalInt tierOf(Enum<?> key) {
        Integer tier = TIER_INDEX.get(Objects.requireNonNull(key, "key"));
        return tier == null ? OptionalInt.empty() : OptionalInt.of(tier);
    }

    public static int tierCount() {
        return TIERS.size();
    }

    private static List<Enum<?>> tier(Enum<?>... keys) {
        return List.of(keys);
    }

    private static Map<Enum<?>, Integer> buildIndex() {
        Map<Enum<?>, Integer> index = new HashMap<>();
        for (int i = 0; i < TIERS.size(); i++) {
            for (Enum<?> key : TIERS.get(i)) {
                if (index.putIfAbsent(key, i) != null) {
                    throw new IllegalStateException("Precedence key listed twice: " + key);
                }
            }
        }
        return Map.copyOf(index);
    }
}
