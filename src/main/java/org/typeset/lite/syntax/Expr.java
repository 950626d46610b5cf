package org.typeset.lite.syntax;

/**
 * Sealed interface representing expressions of the markup language.
 * 
 * Type hierarchy:
 * Expr
 * ├── literals: NoneExpr, IdentExpr, BoolExpr, IntExpr, FloatExpr,
 * │             LengthExpr, PercentExpr, ColorExpr, StrExpr
 * ├── CallExpr (f(x), [f x][body])
 * ├── UnaryExpr, BinaryExpr (-x, a + b)
 * ├── ArrayExpr, DictExpr ((1, 2), (key: value))
 * └── ContentExpr ({*markup*})
 */
public sealed interface Expr
        permits NoneExpr, IdentExpr, BoolExpr, IntExpr, FloatExpr, LengthExpr, PercentExpr,
        ColorExpr, StrExpr, CallExpr, UnaryExpr, BinaryExpr, ArrayExpr, DictExpr, ContentExpr {

    /**
     * Accept method for the expression visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExprVisitor<T> visitor);
}
