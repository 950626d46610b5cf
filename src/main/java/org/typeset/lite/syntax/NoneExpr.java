package org.typeset.lite.syntax;

/**
 * The none literal: {@code none}
 */
public record NoneExpr() implements Expr {

    public static final NoneExpr INSTANCE = new NoneExpr();

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitNone(this);
    }
}
