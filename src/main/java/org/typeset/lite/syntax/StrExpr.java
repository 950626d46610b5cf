package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * String literal (e.g., "hello!"). Holds the unescaped text.
 */
public record StrExpr(String value) implements Expr {

    public StrExpr {
        Objects.requireNonNull(value, "String value cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitStr(this);
    }
}
