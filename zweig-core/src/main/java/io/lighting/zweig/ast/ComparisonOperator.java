package io.lighting.zweig.ast;

public enum ComparisonOperator implements Operator {
    EQ("==", "Eq"),
    NOT_EQ("!=", "NotEq"),
    LT("<", "Lt"),
    LT_E("<=", "LtE"),
    GT(">", "Gt"),
    GT_E(">=", "GtE"),
    IS("is", "Is"),
    IS_NOT("is not", "IsNot"),
    IN("in", "In"),
    NOT_IN("not in", "NotIn");

    private final String token;
    private final String displayName;

    ComparisonOperator(String token, String displayName) {
        this.token = token;
        this.displayName = displayName;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
