package io.lighting.zweig.ast;

public enum BooleanOperator implements Operator {
    AND("and", "And"),
    OR("or", "Or");

    private final String token;
    private final String displayName;

    BooleanOperator(String token, String displayName) {
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
