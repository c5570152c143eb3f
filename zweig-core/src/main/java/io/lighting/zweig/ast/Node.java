package io.lighting.zweig.ast;

/**
 * A node of the syntax tree.
 * <p>
 * The catalog is closed: module kinds ({@link Mod}), statements ({@link Stmt}), expressions
 * ({@link Expr}), subscript slices ({@link SliceNode}) and the auxiliary records. Nodes are
 * immutable and form a strict tree.
 */
public sealed interface Node permits Mod, Stmt, Expr, SliceNode,
    Arguments, Arg, Keyword, Alias, WithItem, Comprehension, ExceptHandler {

    NodeKind kind();
}
