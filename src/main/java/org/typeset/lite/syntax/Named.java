package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * A pair of a name and an expression: {@code pattern: dashed}.
 * 
 * Used both as a named call argument and as a dictionary entry.
 *
 * @param name The name: {@code pattern}
 * @param expr The right-hand side of the pair: {@code dashed}
 */
public record Named(Spanned<Ident> name, Spanned<Expr> expr) implements Argument {

    public Named {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(expr, "Expression cannot be null");
    }

    public static Named of(String name, Expr expr) {
        return new Named(Spanned.detached(new Ident(name)), Spanned.detached(expr));
    }
}
