package io.lighting.zweig.ast;

public enum BinaryOperator implements Operator {
    ADD("+", "Add"),
    SUB("-", "Sub"),
    MULT("*", "Mult"),
    DIV("/", "Div"),
    MOD("%", "Mod"),
    POW("**", "Pow"),
    LSHIFT("<<", "LShift"),
    RSHIFT(">>", "RShift"),
    BIT_OR("|", "BitOr"),
    BIT_XOR("^", "BitXor"),
    BIT_AND("&", "BitAnd"),
    FLOOR_DIV("//", "FloorDiv");

    private final String token;
    private final String displayName;

    BinaryOperator(String token, String displayName) {
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
