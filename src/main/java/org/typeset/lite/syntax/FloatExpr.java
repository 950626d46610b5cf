package org.typeset.lite.syntax;

/**
 * Floating-point literal (e.g., 1.2, 10e-4)
 */
public record FloatExpr(double value) implements Expr {

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitFloat(this);
    }
}
