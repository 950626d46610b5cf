package org.typeset.lite.syntax;

/**
 * Percent literal (e.g., 50%).
 * 
 * The value is kept as written: {@code 50%} is stored as {@code 50.0}, not
 * {@code 0.5}.
 */
public record PercentExpr(double value) implements Expr {

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitPercent(this);
    }
}
