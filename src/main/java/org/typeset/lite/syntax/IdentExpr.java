package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * Identifier expression (e.g., left, dashed)
 */
public record IdentExpr(Ident ident) implements Expr {

    public IdentExpr {
        Objects.requireNonNull(ident, "Identifier cannot be null");
    }

    public static IdentExpr of(String name) {
        return new IdentExpr(new Ident(name));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitIdent(this);
    }
}
