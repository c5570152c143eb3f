package io.lighting.zweig.ast;

/**
 * Operator tag of a binary, unary, boolean or comparison expression.
 * <p>
 * Tags carry nothing beyond their kind: the source token and the Python class name.
 */
public sealed interface Operator permits BinaryOperator, UnaryOperator, BooleanOperator, ComparisonOperator {

    String token();

    String displayName();
}
