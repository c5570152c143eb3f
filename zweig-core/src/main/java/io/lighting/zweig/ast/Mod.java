package io.lighting.zweig.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root kinds: what a front end produces for a whole file, an interactive line, an
 * {@code eval} expression or a suite.
 */
public sealed interface Mod extends Node permits Mod.Module, Mod.Interactive, Mod.Expression, Mod.Suite {

    record Module(List<Stmt> body) implements Mod {
        public Module {
            Objects.requireNonNull(body, "body");
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MODULE;
        }
    }

    record Interactive(List<Stmt> body) implements Mod {
        public Interactive {
            Objects.requireNonNull(body, "body");
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INTERACTIVE;
        }
    }

    record Expression(Expr body) implements Mod {
        public Expression {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION;
        }
    }

    record Suite(List<Stmt> body) implements Mod {
        public Suite {
            Objects.requireNonNull(body, "body");
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUITE;
        }
    }
}
