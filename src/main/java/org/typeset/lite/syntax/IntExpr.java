package org.typeset.lite.syntax;

/**
 * Integer literal (e.g., 120)
 */
public record IntExpr(long value) implements Expr {

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitInt(this);
    }
}
