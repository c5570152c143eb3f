package io.lighting.zweig.ast;

/**
 * Tag of every node kind in the catalog.
 * <p>
 * {@link #displayName()} is the class name the Python {@code ast} module uses, which is what
 * the structural dump prints.
 */
public enum NodeKind {
    MODULE("Module"),
    INTERACTIVE("Interactive"),
    EXPRESSION("Expression"),
    SUITE("Suite"),

    FUNCTION_DEF("FunctionDef"),
    CLASS_DEF("ClassDef"),
    RETURN("Return"),
    DELETE("Delete"),
    ASSIGN("Assign"),
    AUG_ASSIGN("AugAssign"),
    FOR("For"),
    WHILE("While"),
    IF("If"),
    WITH("With"),
    RAISE("Raise"),
    TRY("Try"),
    ASSERT("Assert"),
    IMPORT("Import"),
    IMPORT_FROM("ImportFrom"),
    GLOBAL("Global"),
    NONLOCAL("Nonlocal"),
    EXPR("Expr"),
    PASS("Pass"),
    BREAK("Break"),
    CONTINUE("Continue"),

    BOOL_OP("BoolOp"),
    BIN_OP("BinOp"),
    UNARY_OP("UnaryOp"),
    LAMBDA("Lambda"),
    IF_EXP("IfExp"),
    DICT("Dict"),
    SET("Set"),
    LIST_COMP("ListComp"),
    SET_COMP("SetComp"),
    DICT_COMP("DictComp"),
    GENERATOR_EXP("GeneratorExp"),
    YIELD("Yield"),
    YIELD_FROM("YieldFrom"),
    COMPARE("Compare"),
    CALL("Call"),
    NUM("Num"),
    STR("Str"),
    BYTES("Bytes"),
    NAME_CONSTANT("NameConstant"),
    ELLIPSIS("Ellipsis"),
    ATTRIBUTE("Attribute"),
    SUBSCRIPT("Subscript"),
    STARRED("Starred"),
    NAME("Name"),
    LIST("List"),
    TUPLE("Tuple"),

    SLICE("Slice"),
    EXT_SLICE("ExtSlice"),
    INDEX("Index"),

    ARGUMENTS("arguments"),
    ARG("arg"),
    KEYWORD("keyword"),
    ALIAS("alias"),
    WITH_ITEM("withitem"),
    COMPREHENSION("comprehension"),
    EXCEPT_HANDLER("ExceptHandler");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
