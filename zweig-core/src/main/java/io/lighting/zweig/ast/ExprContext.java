package io.lighting.zweig.ast;

/**
 * How a name, attribute, subscript or display is used: read, assigned or deleted.
 */
public enum ExprContext {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del"),
    AUG_LOAD("AugLoad"),
    AUG_STORE("AugStore"),
    PARAM("Param");

    private final String displayName;

    ExprContext(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
