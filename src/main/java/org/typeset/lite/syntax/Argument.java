package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * An argument to a function call: {@code 12} or {@code draw: false}.
 */
public sealed interface Argument permits Argument.Positional, Named {

    /**
     * The argument's value expression.
     */
    Spanned<Expr> expr();

    /**
     * A positional argument: the expression alone.
     */
    record Positional(Spanned<Expr> expr) implements Argument {
        public Positional {
            Objects.requireNonNull(expr, "Expression cannot be null");
        }
    }

    static Argument pos(Expr expr) {
        return new Positional(Spanned.detached(expr));
    }

    static Argument named(String name, Expr expr) {
        return Named.of(name, expr);
    }
}
