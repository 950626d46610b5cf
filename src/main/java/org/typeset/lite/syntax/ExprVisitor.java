package org.typeset.lite.syntax;

/**
 * Visitor interface for traversing Expr trees.
 * 
 * @param <T> The return type of the visitor methods
 */
public interface ExprVisitor<T> {

    T visitNone(NoneExpr none);

    T visitIdent(IdentExpr ident);

    T visitBool(BoolExpr bool);

    T visitInt(IntExpr integer);

    T visitFloat(FloatExpr number);

    T visitLength(LengthExpr length);

    T visitPercent(PercentExpr percent);

    T visitColor(ColorExpr color);

    T visitStr(StrExpr str);

    /**
     * Visit a function call in expression position.
     */
    T visitCall(CallExpr call);

    T visitUnary(UnaryExpr unary);

    T visitBinary(BinaryExpr binary);

    T visitArray(ArrayExpr array);

    T visitDict(DictExpr dict);

    /**
     * Visit a content block in expression position.
     */
    T visitContent(ContentExpr content);
}
