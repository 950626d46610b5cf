package org.typeset.lite.syntax;

/**
 * Boolean literal (true, false)
 */
public record BoolExpr(boolean value) implements Expr {

    public static final BoolExpr TRUE = new BoolExpr(true);
    public static final BoolExpr FALSE = new BoolExpr(false);

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBool(this);
    }
}
