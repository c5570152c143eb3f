package io.lighting.zweig.source;

import static io.lighting.zweig.ast.Ast.alias;
import static io.lighting.zweig.ast.Ast.and;
import static io.lighting.zweig.ast.Ast.arg;
import static io.lighting.zweig.ast.Ast.assertStmt;
import static io.lighting.zweig.ast.Ast.assign;
import static io.lighting.zweig.ast.Ast.attribute;
import static io.lighting.zweig.ast.Ast.augAssign;
import static io.lighting.zweig.ast.Ast.binOp;
import static io.lighting.zweig.ast.Ast.breakStmt;
import static io.lighting.zweig.ast.Ast.bytes;
import static io.lighting.zweig.ast.Ast.call;
import static io.lighting.zweig.ast.Ast.classDef;
import static io.lighting.zweig.ast.Ast.compare;
import static io.lighting.zweig.ast.Ast.comprehension;
import static io.lighting.zweig.ast.Ast.constant;
import static io.lighting.zweig.ast.Ast.continueStmt;
import static io.lighting.zweig.ast.Ast.del;
import static io.lighting.zweig.ast.Ast.dict;
import static io.lighting.zweig.ast.Ast.dictComp;
import static io.lighting.zweig.ast.Ast.ellipsis;
import static io.lighting.zweig.ast.Ast.expr;
import static io.lighting.zweig.ast.Ast.extSlice;
import static io.lighting.zweig.ast.Ast.forStmt;
import static io.lighting.zweig.ast.Ast.functionDef;
import static io.lighting.zweig.ast.Ast.generatorExp;
import static io.lighting.zweig.ast.Ast.global;
import static io.lighting.zweig.ast.Ast.ifExp;
import static io.lighting.zweig.ast.Ast.ifStmt;
import static io.lighting.zweig.ast.Ast.importFrom;
import static io.lighting.zweig.ast.Ast.index;
import static io.lighting.zweig.ast.Ast.importStmt;
import static io.lighting.zweig.ast.Ast.keyword;
import static io.lighting.zweig.ast.Ast.lambda;
import static io.lighting.zweig.ast.Ast.list;
import static io.lighting.zweig.ast.Ast.listComp;
import static io.lighting.zweig.ast.Ast.module;
import static io.lighting.zweig.ast.Ast.name;
import static io.lighting.zweig.ast.Ast.none;
import static io.lighting.zweig.ast.Ast.nonlocal;
import static io.lighting.zweig.ast.Ast.not;
import static io.lighting.zweig.ast.Ast.num;
import static io.lighting.zweig.ast.Ast.or;
import static io.lighting.zweig.ast.Ast.params;
import static io.lighting.zweig.ast.Ast.pass;
import static io.lighting.zweig.ast.Ast.raise;
import static io.lighting.zweig.ast.Ast.returnStmt;
import static io.lighting.zweig.ast.Ast.set;
import static io.lighting.zweig.ast.Ast.slice;
import static io.lighting.zweig.ast.Ast.starred;
import static io.lighting.zweig.ast.Ast.str;
import static io.lighting.zweig.ast.Ast.subscript;
import static io.lighting.zweig.ast.Ast.tuple;
import static io.lighting.zweig.ast.Ast.unaryOp;
import static io.lighting.zweig.ast.Ast.whileStmt;
import static io.lighting.zweig.ast.Ast.yieldExpr;
import static io.lighting.zweig.ast.Ast.yieldFrom;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.zweig.ast.Arguments;
import io.lighting.zweig.ast.BinaryOperator;
import io.lighting.zweig.ast.ComparisonOperator;
import io.lighting.zweig.ast.ExceptHandler;
import io.lighting.zweig.ast.Expr;
import io.lighting.zweig.ast.Mod;
import io.lighting.zweig.ast.NodeKind;
import io.lighting.zweig.ast.Stmt;
import io.lighting.zweig.ast.UnaryOperator;
import io.lighting.zweig.ast.WithItem;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestReporter;

class UnparserTest {

    @Test
    void rendersFunctionDefinitions() {
        Arguments withDefault = new Arguments(
            List.of(arg("foo"), arg("bar")), null, List.of(), List.of(), null, List.of(num(1))
        );
        Arguments varargs = new Arguments(List.of(), arg("args"), List.of(), List.of(), null, List.of());
        Arguments kwargs = new Arguments(List.of(), null, List.of(), List.of(), arg("kwargs"), List.of());

        assertRenders(
            """
            def argumentless():
                pass

            def single_positional(foo):
                return

            def two_positional(foo, bar):
                return None

            def defaults(foo, bar=1):
                global something
                global foo, bar

            def arbitrary_arguments(*args):
                yield

            def kwargs(**kwargs):
                yield something
            """,
            functionDef("argumentless", params(), List.of(pass())),
            functionDef("single_positional", params("foo"), List.of(returnStmt())),
            functionDef("two_positional", params("foo", "bar"), List.of(returnStmt(none()))),
            functionDef("defaults", withDefault, List.of(global("something"), global("foo", "bar"))),
            functionDef("arbitrary_arguments", varargs, List.of(expr(yieldExpr()))),
            functionDef("kwargs", kwargs, List.of(expr(yieldExpr(name("something")))))
        );
    }

    @Test
    void rendersDecoratorsAndClasses() {
        Stmt.FunctionDef decorated = new Stmt.FunctionDef(
            "multiple_decorators", params(), List.of(pass()), List.of(name("foo"), name("bar")), null, null
        );
        Stmt.ClassDef decoratedClass = new Stmt.ClassDef(
            "SingleDecorator", List.of(), List.of(), null, null, List.of(pass()), List.of(name("foo")), null
        );

        assertRenders(
            """
            @foo
            @bar
            def multiple_decorators():
                pass

            class NoBase:
                pass

            class SingleBase(object):
                pass

            class MultipleBases(Foo, Bar):
                pass

            @foo
            class SingleDecorator:
                pass
            """,
            decorated,
            classDef("NoBase", List.of(), List.of(pass())),
            classDef("SingleBase", List.of(name("object")), List.of(pass())),
            classDef("MultipleBases", List.of(name("Foo"), name("Bar")), List.of(pass())),
            decoratedClass
        );
    }

    @Test
    void rendersSimpleStatements() {
        assertRenders(
            """
            del something
            del something, another_thing
            foo = something
            foo = bar = baz
            assert something
            assert something, message
            raise
            raise value
            raise value from cause
            """,
            del(name("something")),
            del(name("something"), name("another_thing")),
            assign(name("foo"), name("something")),
            assign(List.of(name("foo"), name("bar")), name("baz")),
            assertStmt(name("something")),
            assertStmt(name("something"), name("message")),
            raise(),
            raise(name("value")),
            raise(name("value"), name("cause"))
        );
    }

    @Test
    void rendersEveryAugmentedAssignment() {
        List<Stmt> body = new ArrayList<>();
        StringBuilder expected = new StringBuilder();
        for (BinaryOperator op : BinaryOperator.values()) {
            body.add(augAssign(name("foo"), op, name("bar")));
            expected.append("foo ").append(op.token()).append("= bar\n");
        }

        assertEquals(expected.toString(), Unparser.toSource(module(body)));
        assertTrue(expected.toString().contains("foo **= bar\n"));
        assertTrue(expected.toString().contains("foo //= bar\n"));
    }

    @Test
    void rendersLoopsAndBlocks() {
        assertRenders(
            """
            for whatever in whatevers:
                if blubb:
                    continue
                else:
                    break
            for spam in spams:
                pass
            else:
                pass
            while True:
                pass
            else:
                pass
            with foo:
                pass
            with foo as bar, spam:
                pass
            """,
            forStmt(
                name("whatever"),
                name("whatevers"),
                List.of(ifStmt(name("blubb"), List.of(continueStmt()), List.of(breakStmt()))),
                List.of()
            ),
            forStmt(name("spam"), name("spams"), List.of(pass()), List.of(pass())),
            whileStmt(constant(true), List.of(pass()), List.of(pass())),
            new Stmt.With(List.of(new WithItem(name("foo"), null)), List.of(pass()), null),
            new Stmt.With(
                List.of(new WithItem(name("foo"), name("bar")), new WithItem(name("spam"), null)),
                List.of(pass()),
                null
            )
        );
    }

    @Test
    void foldsNestedElseIfIntoElif() {
        Stmt.If chain = ifStmt(
            name("a"),
            List.of(pass()),
            List.of(ifStmt(name("b"), List.of(breakStmt()), List.of(continueStmt())))
        );

        assertRenders(
            """
            if a:
                pass
            elif b:
                break
            else:
                continue
            """,
            chain
        );
    }

    @Test
    void rendersTryStatements() {
        Stmt.Try handlers = new Stmt.Try(
            List.of(pass()),
            List.of(
                new ExceptHandler(null, null, List.of(pass()), null),
                new ExceptHandler(name("Something"), null, List.of(pass()), null),
                new ExceptHandler(name("Something"), "AnotherThing", List.of(pass()), null)
            ),
            List.of(),
            List.of(),
            null
        );
        Stmt.Try withElse = new Stmt.Try(
            List.of(pass()),
            List.of(new ExceptHandler(null, null, List.of(pass()), null)),
            List.of(pass()),
            List.of(),
            null
        );
        Stmt.Try withFinally = new Stmt.Try(List.of(pass()), List.of(), List.of(), List.of(pass()), null);

        assertRenders(
            """
            try:
                pass
            except:
                pass
            except Something:
                pass
            except Something as AnotherThing:
                pass
            try:
                pass
            except:
                pass
            else:
                pass
            try:
                pass
            finally:
                pass
            """,
            handlers,
            withElse,
            withFinally
        );
    }

    @Test
    void rendersImports() {
        assertRenders(
            """
            import foo
            import foo, bar
            import spam as eggs
            from . import foo
            from foo import bar
            from foo import bar, baz
            from foo import spam as eggs
            from ..pkg import mod
            """,
            importStmt(alias("foo")),
            importStmt(alias("foo"), alias("bar")),
            importStmt(alias("spam", "eggs")),
            importFrom(null, 1, alias("foo")),
            importFrom("foo", 0, alias("bar")),
            importFrom("foo", 0, alias("bar"), alias("baz")),
            importFrom("foo", 0, alias("spam", "eggs")),
            importFrom("pkg", 2, alias("mod"))
        );
    }

    @Test
    void parenthesizesBooleanOperatorsByTier() {
        assertRenders(
            """
            foo or bar or baz
            foo and bar or baz
            foo and (bar or baz)
            foo or bar and baz
            (foo or bar) and baz
            not foo and not bar
            not (foo or bar)
            not (foo and bar)
            """,
            expr(or(name("foo"), name("bar"), name("baz"))),
            expr(or(and(name("foo"), name("bar")), name("baz"))),
            expr(and(name("foo"), or(name("bar"), name("baz")))),
            expr(or(name("foo"), and(name("bar"), name("baz")))),
            expr(and(or(name("foo"), name("bar")), name("baz"))),
            expr(and(not(name("foo")), not(name("bar")))),
            expr(not(or(name("foo"), name("bar")))),
            expr(not(and(name("foo"), name("bar"))))
        );
    }

    @Test
    void keepsLooserChildParenthesesAndDropsTighterOnes(TestReporter reporter) {
        Expr one = num(1);
        Mod.Module tree = module(
            expr(binOp(one, BinaryOperator.MULT, binOp(one, BinaryOperator.ADD, one))),
            expr(binOp(binOp(one, BinaryOperator.MULT, one), BinaryOperator.ADD, one)),
            expr(binOp(one, BinaryOperator.ADD, binOp(one, BinaryOperator.SUB, one))),
            expr(binOp(binOp(one, BinaryOperator.SUB, one), BinaryOperator.ADD, one)),
            expr(binOp(binOp(one, BinaryOperator.DIV, one), BinaryOperator.MULT, one)),
            expr(binOp(one, BinaryOperator.BIT_OR, binOp(one, BinaryOperator.BIT_AND, one)))
        );

        String source = Unparser.toSource(tree);
        reporter.publishEntry("source", source);

        assertEquals(
            """
            1 * (1 + 1)
            1 * 1 + 1
            1 + (1 - 1)
            (1 - 1) + 1
            (1 / 1) * 1
            1 | 1 & 1
            """,
            source
        );
    }

    @Test
    void rendersUnaryOperators() {
        Expr sum = binOp(num(1), BinaryOperator.ADD, num(1));

        assertRenders(
            """
            ~1
            not 1
            +1
            -1
            +(1 + 1)
            -(1 + 1)
            ~(1 + 1)
            """,
            expr(unaryOp(UnaryOperator.INVERT, num(1))),
            expr(not(num(1))),
            expr(unaryOp(UnaryOperator.UADD, num(1))),
            expr(unaryOp(UnaryOperator.USUB, num(1))),
            expr(unaryOp(UnaryOperator.UADD, sum)),
            expr(unaryOp(UnaryOperator.USUB, sum)),
            expr(unaryOp(UnaryOperator.INVERT, sum))
        );
    }

    @Test
    void treatsPowerAsRightAssociative() {
        Expr one = num(1);

        assertRenders(
            """
            1 ** 1
            -1 ** 1
            1 ** -1
            (-1) ** 1
            2 ** 3 ** 4
            (2 ** 3) ** 4
            """,
            expr(binOp(one, BinaryOperator.POW, one)),
            expr(unaryOp(UnaryOperator.USUB, binOp(one, BinaryOperator.POW, one))),
            expr(binOp(one, BinaryOperator.POW, unaryOp(UnaryOperator.USUB, one))),
            expr(binOp(unaryOp(UnaryOperator.USUB, one), BinaryOperator.POW, one)),
            expr(binOp(num(2), BinaryOperator.POW, binOp(num(3), BinaryOperator.POW, num(4)))),
            expr(binOp(binOp(num(2), BinaryOperator.POW, num(3)), BinaryOperator.POW, num(4)))
        );
    }

    @Test
    void wrapsNegativeLiteralsOnTheLeftAndBeforeTrailers() {
        assertRenders(
            """
            (-1) + 2
            2 - -1
            (-1.5).real
            (1).real
            1.5.real
            """,
            expr(binOp(num(-1), BinaryOperator.ADD, num(2))),
            expr(binOp(num(2), BinaryOperator.SUB, num(-1))),
            expr(attribute(num(-1.5), "real")),
            expr(attribute(num(1), "real")),
            expr(attribute(num(1.5), "real"))
        );
    }

    @Test
    void rendersLambdasAndConditionalExpressions() {
        Expr noneIfFalse = ifExp(constant(false), none(), str("foo"));

        assertRenders(
            """
            lambda: None
            lambda foo: None
            lambda foo, bar: None
            lambda: None if False else 'foo'
            (lambda: None) if False else 'foo'
            foo if condition else bar
            foo if condition else bar if True else baz
            spam if (bar if True else baz) else eggs
            """,
            expr(lambda(params(), none())),
            expr(lambda(params("foo"), none())),
            expr(lambda(params("foo", "bar"), none())),
            expr(lambda(params(), noneIfFalse)),
            expr(ifExp(constant(false), lambda(params(), none()), str("foo"))),
            expr(ifExp(name("condition"), name("foo"), name("bar"))),
            expr(ifExp(name("condition"), name("foo"), ifExp(constant(true), name("bar"), name("baz")))),
            expr(ifExp(ifExp(constant(true), name("bar"), name("baz")), name("spam"), name("eggs")))
        );
    }

    @Test
    void rendersDisplaysAndComprehensions() {
        assertRenders(
            """
            {}
            {key: value}
            {key: value, another_key: another_value}
            {element, another_element}
            [item for item in foo]
            [item for item in foo if something]
            [subitem for item in foo for subitem in item]
            {key: value for key, value in foo if value}
            (item for item in foo)
            [x for x in (lambda: y)]
            """,
            expr(dict(List.of(), List.of())),
            expr(dict(List.of(name("key")), List.of(name("value")))),
            expr(dict(
                List.of(name("key"), name("another_key")),
                List.of(name("value"), name("another_value"))
            )),
            expr(set(name("element"), name("another_element"))),
            expr(listComp(name("item"), comprehension(name("item"), name("foo")))),
            expr(listComp(name("item"), comprehension(name("item"), name("foo"), name("something")))),
            expr(listComp(
                name("subitem"),
                comprehension(name("item"), name("foo")),
                comprehension(name("subitem"), name("item"))
            )),
            expr(dictComp(
                name("key"),
                name("value"),
                comprehension(tuple(name("key"), name("value")), name("foo"), name("value"))
            )),
            expr(generatorExp(name("item"), comprehension(name("item"), name("foo")))),
            expr(listComp(name("x"), comprehension(name("x"), lambda(params(), name("y")))))
        );
    }

    @Test
    void rendersComparisons() {
        StringBuilder expected = new StringBuilder();
        List<Stmt> body = new ArrayList<>();
        for (ComparisonOperator op : ComparisonOperator.values()) {
            body.add(expr(compare(num(1), op, name("foo"))));
            expected.append("1 ").append(op.token()).append(" foo\n");
        }
        body.add(expr(compare(
            num(1),
            List.of(ComparisonOperator.LT, ComparisonOperator.LT_E),
            List.of(name("x"), num(3))
        )));
        expected.append("1 < x <= 3\n");
        body.add(expr(compare(compare(name("a"), ComparisonOperator.LT, name("b")), ComparisonOperator.EQ, name("c"))));
        expected.append("(a < b) == c\n");

        assertEquals(expected.toString(), Unparser.toSource(module(body)));
    }

    @Test
    void rendersCallsAttributesAndSubscripts() {
        Expr fooPlusBar = binOp(name("foo"), BinaryOperator.ADD, name("bar"));

        assertRenders(
            """
            func()
            func(foo, bar)
            func(*args)
            func(**kwargs)
            func(foo=bar)
            func(a, b=c, *args, **kwargs)
            (foo + bar)()
            foo.bar.baz
            (foo + bar).baz
            foo.bar().baz[0]
            foo[index]
            foo[:]
            foo[start:]
            foo[:stop]
            foo[start:stop]
            foo[::step]
            foo[start:stop:step]
            foo[bar][baz]
            (foo + bar)[index]
            foo[1, 2]
            foo[1:2, ::3]
            foo[1:2,]
            """,
            expr(call(name("func"))),
            expr(call(name("func"), name("foo"), name("bar"))),
            expr(call(name("func"), List.of(), List.of(), name("args"), null)),
            expr(call(name("func"), List.of(), List.of(), null, name("kwargs"))),
            expr(call(name("func"), List.of(), List.of(keyword("foo", name("bar"))), null, null)),
            expr(call(
                name("func"),
                List.of(name("a")),
                List.of(keyword("b", name("c"))),
                name("args"),
                name("kwargs")
            )),
            expr(call(fooPlusBar)),
            expr(attribute(attribute(name("foo"), "bar"), "baz")),
            expr(attribute(fooPlusBar, "baz")),
            expr(subscript(attribute(call(attribute(name("foo"), "bar")), "baz"), num(0))),
            expr(subscript(name("foo"), name("index"))),
            expr(subscript(name("foo"), slice(null, null, null))),
            expr(subscript(name("foo"), slice(name("start"), null, null))),
            expr(subscript(name("foo"), slice(null, name("stop"), null))),
            expr(subscript(name("foo"), slice(name("start"), name("stop"), null))),
            expr(subscript(name("foo"), slice(null, null, name("step")))),
            expr(subscript(name("foo"), slice(name("start"), name("stop"), name("step")))),
            expr(subscript(subscript(name("foo"), name("bar")), name("baz"))),
            expr(subscript(fooPlusBar, name("index"))),
            expr(subscript(name("foo"), tuple(num(1), num(2)))),
            expr(subscript(name("foo"), extSlice(slice(num(1), num(2), null), slice(null, null, num(3))))),
            expr(subscript(name("foo"), extSlice(slice(num(1), num(2), null))))
        );
    }

    @Test
    void parenthesizesTupleDimensionsOfExtendedSlices(TestReporter reporter) {
        Stmt tupleDimension = expr(subscript(
            name("a"), extSlice(slice(num(1), num(2), null), index(tuple(num(3), num(4))))
        ));
        reporter.publishEntry("source", Unparser.toSource(module(tupleDimension)));
        assertRenders(
            """
            a[1:2, (3, 4)]
            a[1:2, 3]
            a[(1, 2),]
            a[1, 2]
            """,
            tupleDimension,
            expr(subscript(name("a"), extSlice(slice(num(1), num(2), null), index(num(3))))),
            expr(subscript(name("a"), extSlice(index(tuple(num(1), num(2)))))),
            expr(subscript(name("a"), index(tuple(num(1), num(2)))))
        );
    }

    @Test
    void rejectsImportFromWithoutModuleOrLevel() {
        IllegalArgumentException ex = assertThrows(
            IllegalArgumentException.class, () -> importFrom(null, 0, alias("foo"))
        );
        assertEquals("module is required when level is 0", ex.getMessage());
    }

    @Test
    void rendersPython3Constructs() {
        Arguments annotated = new Arguments(
            List.of(arg("foo", name("annotation"))), null, List.of(), List.of(), null, List.of()
        );
        Arguments kwonly = new Arguments(List.of(), null, List.of(arg("foo")), nullList(1), null, List.of());
        Arguments kwonlyKwargs = new Arguments(
            List.of(), null, List.of(arg("foo")), List.of(name("bar")), arg("kwargs"), List.of()
        );
        Stmt.FunctionDef returnAnnotation = new Stmt.FunctionDef(
            "return_annotation", params(), List.of(expr(yieldFrom(name("foo")))), List.of(), name("foo"), null
        );
        Stmt.ClassDef allArgs = new Stmt.ClassDef(
            "AllArgs",
            List.of(),
            List.of(keyword("foo", name("bar"))),
            name("args"),
            name("kwargs"),
            List.of(pass()),
            List.of(),
            null
        );

        assertRenders(
            """
            def single_positional(foo: annotation):
                nonlocal foo
                nonlocal foo, bar

            def return_annotation() -> foo:
                yield from foo

            def kwonly(*, foo):
                pass

            def kwonly_kwargs(*, foo=bar, **kwargs):
                pass

            class AllArgs(foo=bar, *args, **kwargs):
                pass

            b'bytes'
            ...
            *foo = bar
            foo = []
            foo = [1, 2]
            """,
            functionDef("single_positional", annotated, List.of(nonlocal("foo"), nonlocal("foo", "bar"))),
            returnAnnotation,
            functionDef("kwonly", kwonly, List.of(pass())),
            functionDef("kwonly_kwargs", kwonlyKwargs, List.of(pass())),
            allArgs,
            expr(bytes("bytes")),
            expr(ellipsis()),
            assign(starred(name("foo")), name("bar")),
            assign(name("foo"), list()),
            assign(name("foo"), list(num(1), num(2)))
        );
    }

    @Test
    void ordersEveryParameterKind() {
        Arguments arguments = new Arguments(
            List.of(arg("a"), arg("b", name("int"))),
            arg("rest"),
            List.of(arg("c"), arg("d")),
            nullThen(num(4)),
            arg("options"),
            List.of(num(2))
        );

        assertRenders(
            "def f(a, b: int = 2, *rest, c, d=4, **options):\n    pass\n",
            functionDef("f", arguments, List.of(pass()))
        );
    }

    @Test
    void writesTuplesBareOnlyWhereTheGrammarAllows() {
        assertRenders(
            """
            x = 1, 2
            a, b = b, a
            x = 1,
            x = ()
            f((1, 2))
            for k, v in items:
                pass
            return 1, 2
            [(a, b) for a, b in pairs]
            """,
            assign(name("x"), tuple(num(1), num(2))),
            assign(tuple(name("a"), name("b")), tuple(name("b"), name("a"))),
            assign(name("x"), tuple(num(1))),
            assign(name("x"), tuple()),
            expr(call(name("f"), tuple(num(1), num(2)))),
            forStmt(tuple(name("k"), name("v")), name("items"), List.of(pass()), List.of()),
            returnStmt(tuple(num(1), num(2))),
            expr(listComp(
                tuple(name("a"), name("b")),
                comprehension(tuple(name("a"), name("b")), name("pairs"))
            ))
        );
    }

    @Test
    void parenthesizesYieldOutsideStatementPositions() {
        assertRenders(
            """
            x = yield y
            f((yield))
            x += yield
            y = (yield) + 1
            """,
            assign(name("x"), yieldExpr(name("y"))),
            expr(call(name("f"), yieldExpr())),
            augAssign(name("x"), BinaryOperator.ADD, yieldExpr()),
            assign(name("y"), binOp(yieldExpr(), BinaryOperator.ADD, num(1)))
        );
    }

    @Test
    void rendersLiterals() {
        assertRenders(
            """
            'string'
            "it's"
            1.0
            1e+16
            -7
            True
            None
            """,
            expr(str("string")),
            expr(str("it's")),
            expr(num(1.0)),
            expr(num(1e16)),
            expr(num(-7)),
            expr(constant(true)),
            expr(none())
        );
    }

    @Test
    void separatesDefinitionsWithBlankLineExceptAtBlockEnd() {
        Stmt.ClassDef outer = classDef(
            "Outer",
            List.of(),
            List.of(
                functionDef("first", params("self"), List.of(pass())),
                functionDef("second", params("self"), List.of(pass()))
            )
        );

        assertRenders(
            """
            class Outer:
                def first(self):
                    pass

                def second(self):
                    pass

            x = 1
            """,
            outer,
            assign(name("x"), num(1))
        );
    }

    @Test
    void indentsBodyOneUnitDeeperThanItsHeader() {
        Stmt.If nested = ifStmt(
            name("a"),
            List.of(whileStmt(name("b"), List.of(expr(call(name("spam")))), List.of()))
        );

        String source = new Unparser("\t").render(module(nested));

        assertEquals("if a:\n\twhile b:\n\t\tspam()\n", source);
    }

    @Test
    void rendersEmptyBlocksAsPass() {
        assertRenders(
            "def f():\n    pass\n",
            functionDef("f", params(), List.of())
        );
    }

    @Test
    void rendersEmptyModuleAsEmptyText() {
        assertEquals("", Unparser.toSource(module()));
    }

    @Test
    void rendersExpressionModesAndStandaloneExpressions() {
        assertEquals("1, 2", Unparser.toSource(new Mod.Expression(tuple(num(1), num(2)))));
        assertEquals("x = 1\n", Unparser.toSource(new Mod.Interactive(List.of(assign(name("x"), num(1))))));
        assertEquals("a.b(c)", Unparser.toSource(call(attribute(name("a"), "b"), name("c"))));
    }

    @Test
    void rejectsKindsWithoutRenderingRule() {
        Mod.Suite suite = new Mod.Suite(List.of(pass()));

        UnsupportedNodeException ex = assertThrows(UnsupportedNodeException.class, () -> Unparser.toSource(suite));

        assertEquals(NodeKind.SUITE, ex.kind());
        assertEquals("No rendering rule for node kind: Suite", ex.getMessage());
    }

    @Test
    void rejectsIndentationThatIsNotWhitespace() {
        assertThrows(IllegalArgumentException.class, () -> new Unparser(""));
        assertThrows(IllegalArgumentException.class, () -> new Unparser("--"));
    }

    private static void assertRenders(String expected, Stmt... body) {
        assertEquals(expected, Unparser.toSource(module(body)));
    }

    private static List<Expr> nullList(int size) {
        List<Expr> values = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            values.add(null);
        }
        return values;
    }

    private static List<Expr> nullThen(Expr value) {
        List<Expr> values = nullList(1);
        values.add(value);
        return values;
    }
}
