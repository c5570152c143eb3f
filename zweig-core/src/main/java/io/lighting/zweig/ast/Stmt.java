package io.lighting.zweig.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Stmt extends Node, Located permits
    Stmt.FunctionDef, Stmt.ClassDef, Stmt.Return, Stmt.Delete, Stmt.Assign, Stmt.AugAssign,
    Stmt.For, Stmt.While, Stmt.If, Stmt.With, Stmt.Raise, Stmt.Try, Stmt.Assert,
    Stmt.Import, Stmt.ImportFrom, Stmt.Global, Stmt.Nonlocal, Stmt.ExprStmt,
    Stmt.Pass, Stmt.Break, Stmt.Continue {

    record FunctionDef(
        String name,
        Arguments args,
        List<Stmt> body,
        List<Expr> decoratorList,
        Expr returns,
        Position position
    ) implements Stmt {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(args, "args");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(decoratorList, "decoratorList");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            body = List.copyOf(body);
            decoratorList = List.copyOf(decoratorList);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_DEF;
        }
    }

    record ClassDef(
        String name,
        List<Expr> bases,
        List<Keyword> keywords,
        Expr starargs,
        Expr kwargs,
        List<Stmt> body,
        List<Expr> decoratorList,
        Position position
    ) implements Stmt {
        public ClassDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(bases, "bases");
            Objects.requireNonNull(keywords, "keywords");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(decoratorList, "decoratorList");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            bases = List.copyOf(bases);
            keywords = List.copyOf(keywords);
            body = List.copyOf(body);
            decoratorList = List.copyOf(decoratorList);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CLASS_DEF;
        }
    }

    record Return(Expr value, Position position) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.RETURN;
        }
    }

    record Delete(List<Expr> targets, Position position) implements Stmt {
        public Delete {
            Objects.requireNonNull(targets, "targets");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("targets must not be empty");
            }
            targets = List.copyOf(targets);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DELETE;
        }
    }

    record Assign(List<Expr> targets, Expr value, Position position) implements Stmt {
        public Assign {
            Objects.requireNonNull(targets, "targets");
            Objects.requireNonNull(value, "value");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("targets must not be empty");
            }
            targets = List.copyOf(targets);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGN;
        }
    }

    record AugAssign(Expr target, BinaryOperator op, Expr value, Position position) implements Stmt {
        public AugAssign {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.AUG_ASSIGN;
        }
    }

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, Position position) implements Stmt {
        public For {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(iter, "iter");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orelse, "orelse");
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOR;
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orelse, Position position) implements Stmt {
        public While {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orelse, "orelse");
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WHILE;
        }
    }

    record If(Expr test, List<Stmt> body, List<Stmt> orelse, Position position) implements Stmt {
        public If {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orelse, "orelse");
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF;
        }
    }

    record With(List<WithItem> items, List<Stmt> body, Position position) implements Stmt {
        public With {
            Objects.requireNonNull(items, "items");
            Objects.requireNonNull(body, "body");
            if (items.isEmpty()) {
                throw new IllegalArgumentException("items must not be empty");
            }
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WITH;
        }
    }

    record Raise(Expr exc, Expr cause, Position position) implements Stmt {
        public Raise {
            if (exc == null && cause != null) {
                throw new IllegalArgumentException("cause requires an exception");
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RAISE;
        }
    }

    record Try(
        List<Stmt> body,
        List<ExceptHandler> handlers,
        List<Stmt> orelse,
        List<Stmt> finalbody,
        Position position
    ) implements Stmt {
        public Try {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(handlers, "handlers");
            Objects.requireNonNull(orelse, "orelse");
            Objects.requireNonNull(finalbody, "finalbody");
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orelse = List.copyOf(orelse);
            finalbody = List.copyOf(finalbody);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TRY;
        }
    }

    record Assert(Expr test, Expr msg, Position position) implements Stmt {
        public Assert {
            Objects.requireNonNull(test, "test");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ASSERT;
        }
    }

    record Import(List<Alias> names, Position position) implements Stmt {
        public Import {
            Objects.requireNonNull(names, "names");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("names must not be empty");
            }
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT;
        }
    }

    /**
     * {@code from <level dots><module> import <names>}; {@code module} is {@code null} for
     * {@code from . import x}.
     */
    record ImportFrom(String module, List<Alias> names, int level, Position position) implements Stmt {
        public ImportFrom {
            Objects.requireNonNull(names, "names");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("names must not be empty");
            }
            if (level < 0) {
                throw new IllegalArgumentException("level must be >= 0: " + level);
            }
            if (module == null && level == 0) {
                throw new IllegalArgumentException("module is required when level is 0");
            }
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT_FROM;
        }
    }

    record Global(List<String> names, Position position) implements Stmt {
        public Global {
            Objects.requireNonNull(names, "names");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("names must not be empty");
            }
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GLOBAL;
        }
    }

    record Nonlocal(List<String> names, Position position) implements Stmt {
        public Nonlocal {
            Objects.requireNonNull(names, "names");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("names must not be empty");
            }
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NONLOCAL;
        }
    }

    /**
     * Expression used as a statement (Python's {@code Expr}).
     */
    record ExprStmt(Expr value, Position position) implements Stmt {
        public ExprStmt {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR;
        }
    }

    record Pass(Position position) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.PASS;
        }
    }

    record Break(Position position) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.BREAK;
        }
    }

    record Continue(Position position) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.CONTINUE;
        }
    }
}
