package io.lighting.zweig.source;

import io.lighting.zweig.ast.Alias;
import io.lighting.zweig.ast.Arg;
import io.lighting.zweig.ast.Arguments;
import io.lighting.zweig.ast.BinaryOperator;
import io.lighting.zweig.ast.BooleanOperator;
import io.lighting.zweig.ast.Comprehension;
import io.lighting.zweig.ast.ExceptHandler;
import io.lighting.zweig.ast.Expr;
import io.lighting.zweig.ast.Keyword;
import io.lighting.zweig.ast.Mod;
import io.lighting.zweig.ast.Node;
import io.lighting.zweig.ast.NodeKind;
import io.lighting.zweig.ast.SliceNode;
import io.lighting.zweig.ast.Stmt;
import io.lighting.zweig.ast.WithItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rendering rules, one per node kind, writing into a single {@link SourceWriter}.
 * <p>
 * Expressions go through one of three entry points depending on the grammar slot they fill:
 * {@link #visit(Node)} parenthesizes tuples, {@link #visitTest(Expr)} additionally parenthesizes
 * yield expressions, and {@link #visitTestList(Expr)} writes a tuple bare.
 */
final class UnparseVisitor {
    private final SourceWriter writer;

    UnparseVisitor(SourceWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    void visit(Node node) {
        Objects.requireNonNull(node, "node");
        switch (node.kind()) {
            case MODULE -> visitStatements(((Mod.Module) node).body());
            case INTERACTIVE -> visitStatements(((Mod.Interactive) node).body());
            case EXPRESSION -> visitTestList(((Mod.Expression) node).body());

            case FUNCTION_DEF -> visitFunctionDef((Stmt.FunctionDef) node);
            case CLASS_DEF -> visitClassDef((Stmt.ClassDef) node);
            case RETURN -> visitReturn((Stmt.Return) node);
            case DELETE -> visitDelete((Stmt.Delete) node);
            case ASSIGN -> visitAssign((Stmt.Assign) node);
            case AUG_ASSIGN -> visitAugAssign((Stmt.AugAssign) node);
            case FOR -> visitFor((Stmt.For) node);
            case WHILE -> visitWhile((Stmt.While) node);
            case IF -> visitIf((Stmt.If) node, "if ");
            case WITH -> visitWith((Stmt.With) node);
            case RAISE -> visitRaise((Stmt.Raise) node);
            case TRY -> visitTry((Stmt.Try) node);
            case ASSERT -> visitAssert((Stmt.Assert) node);
            case IMPORT -> visitImport((Stmt.Import) node);
            case IMPORT_FROM -> visitImportFrom((Stmt.ImportFrom) node);
            case GLOBAL -> simpleStatement("global " + String.join(", ", ((Stmt.Global) node).names()));
            case NONLOCAL -> simpleStatement("nonlocal " + String.join(", ", ((Stmt.Nonlocal) node).names()));
            case EXPR -> {
                visitYieldOrTestList(((Stmt.ExprStmt) node).value());
                writer.writeNewline();
            }
            case PASS -> simpleStatement("pass");
            case BREAK -> simpleStatement("break");
            case CONTINUE -> simpleStatement("continue");

            case BOOL_OP -> visitBoolOp((Expr.BoolOp) node);
            case BIN_OP -> visitBinOp((Expr.BinOp) node);
            case UNARY_OP -> visitUnaryOp((Expr.UnaryOp) node);
            case LAMBDA -> visitLambda((Expr.Lambda) node);
            case IF_EXP -> visitIfExp((Expr.IfExp) node);
            case DICT -> visitDict((Expr.Dict) node);
            case SET -> {
                writer.write("{");
                writer.commaJoin(((Expr.SetExpr) node).elts(), this::visitTest);
                writer.write("}");
            }
            case LIST_COMP -> {
                Expr.ListComp comp = (Expr.ListComp) node;
                visitComprehension("[", comp.elt(), comp.generators(), "]");
            }
            case SET_COMP -> {
                Expr.SetComp comp = (Expr.SetComp) node;
                visitComprehension("{", comp.elt(), comp.generators(), "}");
            }
            case DICT_COMP -> visitDictComp((Expr.DictComp) node);
            case GENERATOR_EXP -> {
                Expr.GeneratorExp comp = (Expr.GeneratorExp) node;
                visitComprehension("(", comp.elt(), comp.generators(), ")");
            }
            case YIELD -> visitYield((Expr.Yield) node);
            case YIELD_FROM -> {
                writer.write("yield from ");
                visitTest(((Expr.YieldFrom) node).value());
            }
            case COMPARE -> visitCompare((Expr.Compare) node);
            case CALL -> visitCall((Expr.Call) node);
            case NUM -> writer.write(Literals.number(((Expr.Num) node).n()));
            case STR -> writer.write(Literals.string(((Expr.Str) node).s()));
            case BYTES -> writer.write(Literals.bytes(((Expr.Bytes) node).s()));
            case NAME_CONSTANT -> writer.write(Literals.nameConstant(((Expr.NameConstant) node).value()));
            case ELLIPSIS -> writer.write("...");
            case ATTRIBUTE -> visitAttribute((Expr.Attribute) node);
            case SUBSCRIPT -> visitSubscript((Expr.Subscript) node);
            case STARRED -> {
                Expr.Starred starred = (Expr.Starred) node;
                writer.write("*");
                visitOperand(NodeKind.STARRED, starred.value());
            }
            case NAME -> writer.write(((Expr.Name) node).id());
            case LIST -> {
                writer.write("[");
                writer.commaJoin(((Expr.ListExpr) node).elts(), this::visitTest);
                writer.write("]");
            }
            case TUPLE -> visitTuple((Expr.Tuple) node, false);

            case SLICE, EXT_SLICE, INDEX -> visitSlice((SliceNode) node);
            case ARGUMENTS -> visitArguments((Arguments) node);
            case ARG -> visitArg((Arg) node);
            case KEYWORD -> visitKeyword((Keyword) node);
            case ALIAS -> visitAlias((Alias) node);
            case WITH_ITEM -> visitWithItem((WithItem) node);
            case COMPREHENSION -> visitGenerator((Comprehension) node);
            case EXCEPT_HANDLER -> visitExceptHandler((ExceptHandler) node);
            default -> throw new UnsupportedNodeException(node.kind());
        }
    }

    // statements

    private void visitStatements(List<Stmt> statements) {
        for (int i = 0; i < statements.size(); i++) {
            Stmt statement = statements.get(i);
            visit(statement);
            boolean definition = statement instanceof Stmt.FunctionDef || statement instanceof Stmt.ClassDef;
            if (definition && i < statements.size() - 1) {
                writer.writeNewline();
            }
        }
    }

    private void visitBlock(List<Stmt> body) {
        try (SourceWriter.Indentation ignored = writer.indented()) {
            if (body.isEmpty()) {
                writer.writeLine("pass");
            } else {
                visitStatements(body);
            }
        }
    }

    private void visitClause(String header, List<Stmt> body) {
        writer.writeLine(header);
        visitBlock(body);
    }

    private void simpleStatement(String text) {
        writer.writeLine(text);
    }

    private void visitDecorators(List<Expr> decorators) {
        for (Expr decorator : decorators) {
            writer.write("@");
            visit(decorator);
            writer.writeNewline();
        }
    }

    private void visitFunctionDef(Stmt.FunctionDef def) {
        visitDecorators(def.decoratorList());
        writer.write("def ");
        writer.write(def.name());
        writer.write("(");
        visitArguments(def.args());
        writer.write(")");
        if (def.returns() != null) {
            writer.write(" -> ");
            visitTest(def.returns());
        }
        writer.writeLine(":");
        visitBlock(def.body());
    }

    private void visitClassDef(Stmt.ClassDef def) {
        visitDecorators(def.decoratorList());
        writer.write("class ");
        writer.write(def.name());
        List<Runnable> parts = callParts(def.bases(), def.keywords(), def.starargs(), def.kwargs());
        if (!parts.isEmpty()) {
            writer.write("(");
            writer.commaJoin(parts, Runnable::run);
            writer.write(")");
        }
        writer.writeLine(":");
        visitBlock(def.body());
    }

    private void visitReturn(Stmt.Return stmt) {
        writer.write("return");
        if (stmt.value() != null) {
            writer.write(" ");
            visitTestList(stmt.value());
        }
        writer.writeNewline();
    }

    private void visitDelete(Stmt.Delete stmt) {
        writer.write("del ");
        writer.commaJoin(stmt.targets(), this::visitTest);
        writer.writeNewline();
    }

    private void visitAssign(Stmt.Assign stmt) {
        for (Expr target : stmt.targets()) {
            visitTestList(target);
            writer.write(" = ");
        }
        visitYieldOrTestList(stmt.value());
        writer.writeNewline();
    }

    private void visitAugAssign(Stmt.AugAssign stmt) {
        visitTest(stmt.target());
        writer.write(" " + stmt.op().token() + "= ");
        visitYieldOrTestList(stmt.value());
        writer.writeNewline();
    }

    private void visitFor(Stmt.For stmt) {
        writer.write("for ");
        visitTestList(stmt.target());
        writer.write(" in ");
        visitTestList(stmt.iter());
        writer.writeLine(":");
        visitBlock(stmt.body());
        if (!stmt.orelse().isEmpty()) {
            visitClause("else:", stmt.orelse());
        }
    }

    private void visitWhile(Stmt.While stmt) {
        writer.write("while ");
        visitTest(stmt.test());
        writer.writeLine(":");
        visitBlock(stmt.body());
        if (!stmt.orelse().isEmpty()) {
            visitClause("else:", stmt.orelse());
        }
    }

    private void visitIf(Stmt.If stmt, String keyword) {
        writer.write(keyword);
        visitTest(stmt.test());
        writer.writeLine(":");
        visitBlock(stmt.body());
        List<Stmt> orelse = stmt.orelse();
        if (orelse.size() == 1 && orelse.get(0) instanceof Stmt.If elif) {
            visitIf(elif, "elif ");
        } else if (!orelse.isEmpty()) {
            visitClause("else:", orelse);
        }
    }

    private void visitWith(Stmt.With stmt) {
        writer.write("with ");
        writer.commaJoin(stmt.items(), this::visitWithItem);
        writer.writeLine(":");
        visitBlock(stmt.body());
    }

    private void visitWithItem(WithItem item) {
        visitTest(item.contextExpr());
        if (item.optionalVars() != null) {
            writer.write(" as ");
            visitTest(item.optionalVars());
        }
    }

    private void visitRaise(Stmt.Raise stmt) {
        writer.write("raise");
        if (stmt.exc() != null) {
            writer.write(" ");
            visitTest(stmt.exc());
            if (stmt.cause() != null) {
                writer.write(" from ");
                visitTest(stmt.cause());
            }
        }
        writer.writeNewline();
    }

    private void visitTry(Stmt.Try stmt) {
        visitClause("try:", stmt.body());
        for (ExceptHandler handler : stmt.handlers()) {
            visitExceptHandler(handler);
        }
        if (!stmt.orelse().isEmpty()) {
            visitClause("else:", stmt.orelse());
        }
        if (!stmt.finalbody().isEmpty()) {
            visitClause("finally:", stmt.finalbody());
        }
    }

    private void visitExceptHandler(ExceptHandler handler) {
        writer.write("except");
        if (handler.type() != null) {
            writer.write(" ");
            visitTest(handler.type());
            if (handler.name() != null) {
                writer.write(" as ");
                writer.write(handler.name());
            }
        }
        writer.writeLine(":");
        visitBlock(handler.body());
    }

    private void visitAssert(Stmt.Assert stmt) {
        writer.write("assert ");
        visitTest(stmt.test());
        if (stmt.msg() != null) {
            writer.write(", ");
            visitTest(stmt.msg());
        }
        writer.writeNewline();
    }

    private void visitImport(Stmt.Import stmt) {
        writer.write("import ");
        writer.commaJoin(stmt.names(), this::visitAlias);
        writer.writeNewline();
    }

    private void visitImportFrom(Stmt.ImportFrom stmt) {
        writer.write("from ");
        writer.write(".".repeat(stmt.level()));
        if (stmt.module() != null) {
            writer.write(stmt.module());
        }
        writer.write(" import ");
        writer.commaJoin(stmt.names(), this::visitAlias);
        writer.writeNewline();
    }

    private void visitAlias(Alias alias) {
        writer.write(alias.name());
        if (alias.asname() != null) {
            writer.write(" as ");
            writer.write(alias.asname());
        }
    }

    // expressions

    /**
     * Expression in a slot that accepts a bare tuple, such as the right side of an assignment.
     */
    private void visitTestList(Expr expr) {
        if (expr instanceof Expr.Tuple tuple) {
            visitTuple(tuple, true);
        } else {
            visitTest(expr);
        }
    }

    private void visitYieldOrTestList(Expr expr) {
        if (isYield(expr)) {
            visit(expr);
        } else {
            visitTestList(expr);
        }
    }

    private void visitTest(Expr expr) {
        visitParenthesized(expr, isYield(expr));
    }

    private void visitOperand(Enum<?> parentKey, Expr child) {
        visitParenthesized(child, Precedence.requiresParentheses(parentKey, Precedence.keyOf(child)));
    }

    private void visitParenthesized(Expr expr, boolean parenthesize) {
        if (parenthesize) {
            writer.write("(");
            visit(expr);
            writer.write(")");
        } else {
            visit(expr);
        }
    }

    private void visitTuple(Expr.Tuple tuple, boolean bare) {
        if (tuple.elts().isEmpty()) {
            writer.write("()");
            return;
        }
        if (!bare) {
            writer.write("(");
        }
        writer.commaJoin(tuple.elts(), this::visitTest);
        if (tuple.elts().size() == 1) {
            writer.write(",");
        }
        if (!bare) {
            writer.write(")");
        }
    }

    private void visitBoolOp(Expr.BoolOp boolOp) {
        List<Expr> values = boolOp.values();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(" " + boolOp.op().token() + " ");
            }
            visitOperand(boolOp.op(), values.get(i));
        }
    }

    private void visitBinOp(Expr.BinOp binOp) {
        Expr left = binOp.left();
        boolean negativeLiteral = left instanceof Expr.Num num && num.isNegative();
        visitParenthesized(left, negativeLiteral || Precedence.requiresParentheses(binOp.op(), Precedence.keyOf(left)));
        writer.write(" " + binOp.op().token() + " ");
        // '**' is right-associative: a same-tier right operand stays bare.
        Enum<?> rightParent = binOp.op() == BinaryOperator.POW ? BinaryOperator.MULT : binOp.op();
        visitOperand(rightParent, binOp.right());
    }

    private void visitUnaryOp(Expr.UnaryOp unaryOp) {
        writer.write(unaryOp.op().token());
        visitOperand(unaryOp.op(), unaryOp.operand());
    }

    private void visitLambda(Expr.Lambda lambda) {
        writer.write("lambda");
        if (!lambda.args().isEmpty()) {
            writer.write(" ");
            visitArguments(lambda.args());
        }
        writer.write(": ");
        visitTest(lambda.body());
    }

    private void visitIfExp(Expr.IfExp ifExp) {
        visitOperand(NodeKind.IF_EXP, ifExp.body());
        writer.write(" if ");
        visitOperand(NodeKind.IF_EXP, ifExp.test());
        writer.write(" else ");
        visitTest(ifExp.orelse());
    }

    private void visitDict(Expr.Dict dict) {
        writer.write("{");
        for (int i = 0; i < dict.keys().size(); i++) {
            if (i > 0) {
                writer.write(", ");
            }
            visitTest(dict.keys().get(i));
            writer.write(": ");
            visitTest(dict.values().get(i));
        }
        writer.write("}");
    }

    private void visitComprehension(String open, Expr elt, List<Comprehension> generators, String close) {
        writer.write(open);
        visitTest(elt);
        visitGenerators(generators);
        writer.write(close);
    }

    private void visitDictComp(Expr.DictComp comp) {
        writer.write("{");
        visitTest(comp.key());
        writer.write(": ");
        visitTest(comp.value());
        visitGenerators(comp.generators());
        writer.write("}");
    }

    private void visitGenerators(List<Comprehension> generators) {
        for (Comprehension generator : generators) {
            writer.write(" ");
            visitGenerator(generator);
        }
    }

    private void visitGenerator(Comprehension generator) {
        writer.write("for ");
        visitTestList(generator.target());
        writer.write(" in ");
        visitConditionOperand(generator.iter());
        for (Expr condition : generator.ifs()) {
            writer.write(" if ");
            visitConditionOperand(condition);
        }
    }

    // iterables and filters of a comprehension admit nothing looser than 'or'
    private void visitConditionOperand(Expr expr) {
        visitParenthesized(expr, Precedence.bindsLooserThan(Precedence.keyOf(expr), BooleanOperator.OR));
    }

    private void visitYield(Expr.Yield yield) {
        writer.write("yield");
        if (yield.value() != null) {
            writer.write(" ");
            visitTestList(yield.value());
        }
    }

    private void visitCompare(Expr.Compare compare) {
        visitOperand(NodeKind.COMPARE, compare.left());
        for (int i = 0; i < compare.ops().size(); i++) {
            writer.write(" " + compare.ops().get(i).token() + " ");
            visitOperand(NodeKind.COMPARE, compare.comparators().get(i));
        }
    }

    private void visitCall(Expr.Call call) {
        visitTrailerBase(NodeKind.CALL, call.func());
        writer.write("(");
        writer.commaJoin(callParts(call.args(), call.keywords(), call.starargs(), call.kwargs()), Runnable::run);
        writer.write(")");
    }

    private List<Runnable> callParts(List<Expr> args, List<Keyword> keywords, Expr starargs, Expr kwargs) {
        List<Runnable> parts = new ArrayList<>();
        for (Expr arg : args) {
            parts.add(() -> visitTest(arg));
        }
        for (Keyword keyword : keywords) {
            parts.add(() -> visitKeyword(keyword));
        }
        if (starargs != null) {
            parts.add(() -> {
                writer.write("*");
                visitTest(starargs);
            });
        }
        if (kwargs != null) {
            parts.add(() -> {
                writer.write("**");
                visitTest(kwargs);
            });
        }
        return parts;
    }

    private void visitKeyword(Keyword keyword) {
        writer.write(keyword.arg());
        writer.write("=");
        visitTest(keyword.value());
    }

    private void visitAttribute(Expr.Attribute attribute) {
        visitTrailerBase(NodeKind.ATTRIBUTE, attribute.value());
        writer.write(".");
        writer.write(attribute.attr());
    }

    private void visitSubscript(Expr.Subscript subscript) {
        visitTrailerBase(NodeKind.SUBSCRIPT, subscript.value());
        writer.write("[");
        visitSlice(subscript.slice());
        writer.write("]");
    }

    /**
     * Base of a call, attribute access or subscript. Chained trailers stay bare; a negative
     * number and an integer before {@code .} are wrapped so the tokens do not merge.
     */
    private void visitTrailerBase(NodeKind trailer, Expr base) {
        boolean parenthesize;
        if (base instanceof Expr.Num num) {
            parenthesize = num.isNegative() || (trailer == NodeKind.ATTRIBUTE && Expr.Num.isIntegral(num.n()));
        } else {
            parenthesize = !isTrailer(base) && Precedence.requiresParentheses(trailer, Precedence.keyOf(base));
        }
        visitParenthesized(base, parenthesize);
    }

    private void visitSlice(SliceNode slice) {
        if (slice instanceof SliceNode.Index index) {
            visitTestList(index.value());
        } else if (slice instanceof SliceNode.Slice range) {
            if (range.lower() != null) {
                visitTest(range.lower());
            }
            writer.write(":");
            if (range.upper() != null) {
                visitTest(range.upper());
            }
            if (range.step() != null) {
                writer.write(":");
                visitTest(range.step());
            }
        } else if (slice instanceof SliceNode.ExtSlice ext) {
            writer.commaJoin(ext.dims(), this::visitDimension);
            if (ext.dims().size() == 1) {
                writer.write(",");
            }
        } else {
            throw new UnsupportedNodeException(slice.kind());
        }
    }

    /**
     * One dimension of an extended slice. A tuple index is parenthesized so its commas do not
     * read as further dimensions.
     */
    private void visitDimension(SliceNode dim) {
        if (dim instanceof SliceNode.Index index) {
            visitTest(index.value());
        } else {
            visitSlice(dim);
        }
    }

    // parameters

    private void visitArguments(Arguments arguments) {
        List<Runnable> parts = new ArrayList<>();
        List<Arg> positional = arguments.args();
        int firstDefault = positional.size() - arguments.defaults().size();
        for (int i = 0; i < positional.size(); i++) {
            Arg arg = positional.get(i);
            Expr defaultValue = i >= firstDefault ? arguments.defaults().get(i - firstDefault) : null;
            parts.add(() -> visitParameter("", arg, defaultValue));
        }
        if (arguments.vararg() != null) {
            parts.add(() -> visitParameter("*", arguments.vararg(), null));
        } else if (!arguments.kwonlyargs().isEmpty()) {
            parts.add(() -> writer.write("*"));
        }
        for (int i = 0; i < arguments.kwonlyargs().size(); i++) {
            Arg arg = arguments.kwonlyargs().get(i);
            Expr defaultValue = arguments.kwDefaults().get(i);
            parts.add(() -> visitParameter("", arg, defaultValue));
        }
        if (arguments.kwarg() != null) {
            parts.add(() -> visitParameter("**", arguments.kwarg(), null));
        }
        writer.commaJoin(parts, Runnable::run);
    }

    private void visitParameter(String prefix, Arg arg, Expr defaultValue) {
        writer.write(prefix);
        visitArg(arg);
        if (defaultValue != null) {
            writer.write(arg.annotation() == null ? "=" : " = ");
            visitTest(defaultValue);
        }
    }

    private void visitArg(Arg arg) {
        writer.write(arg.arg());
        if (arg.annotation() != null) {
            writer.write(": ");
            visitTest(arg.annotation());
        }
    }

    private static boolean isYield(Expr expr) {
        return expr instanceof Expr.Yield || expr instanceof Expr.YieldFrom;
    }

    private static boolean isTrailer(Expr expr) {
        return expr instanceof Expr.Call || expr instanceof Expr.Attribute || expr instanceof Expr.Subscript;
    }
}
