package io.lighting.zweig.ast;

public enum UnaryOperator implements Operator {
    INVERT("~", "Invert"),
    NOT("not ", "Not"),
    UADD("+", "UAdd"),
    USUB("-", "USub");

    private final String token;
    private final String displayName;

    UnaryOperator(String token, String displayName) {
        this.token = token;
        this.displayName = displayName;
    }

    /**
     * Prefix written before the operand, including the space that {@code not} needs.
     */
    @Override
    public String token() {
        return token;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
