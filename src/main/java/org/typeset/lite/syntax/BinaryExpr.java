package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * Binary expression: lhs op rhs (e.g., a + b, a / b).
 * 
 * Grouping is encoded by the tree shape alone; there is no separate
 * parenthesis node.
 *
 * @param lhs The left operand
 * @param op  The operator
 * @param rhs The right operand
 */
public record BinaryExpr(Spanned<Expr> lhs, Spanned<BinaryOp> op, Spanned<Expr> rhs) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(lhs, "Left operand cannot be null");
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(rhs, "Right operand cannot be null");
    }

    public static BinaryExpr of(Expr lhs, BinaryOp op, Expr rhs) {
        return new BinaryExpr(Spanned.detached(lhs), Spanned.detached(op), Spanned.detached(rhs));
    }

    public static BinaryExpr add(Expr lhs, Expr rhs) {
        return of(lhs, BinaryOp.ADD, rhs);
    }

    public static BinaryExpr subtract(Expr lhs, Expr rhs) {
        return of(lhs, BinaryOp.SUB, rhs);
    }

    public static BinaryExpr multiply(Expr lhs, Expr rhs) {
        return of(lhs, BinaryOp.MUL, rhs);
    }

    public static BinaryExpr divide(Expr lhs, Expr rhs) {
        return of(lhs, BinaryOp.DIV, rhs);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }
}
