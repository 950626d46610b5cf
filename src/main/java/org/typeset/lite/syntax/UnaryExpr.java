package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * Unary expression: op expr (e.g., -x)
 *
 * @param op   The operator: {@code -}
 * @param expr The expression to operate on: {@code x}
 */
public record UnaryExpr(Spanned<UnaryOp> op, Spanned<Expr> expr) implements Expr {

    public UnaryExpr {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(expr, "Operand cannot be null");
    }

    public static UnaryExpr neg(Expr expr) {
        return new UnaryExpr(Spanned.detached(UnaryOp.NEG), Spanned.detached(expr));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }
}
