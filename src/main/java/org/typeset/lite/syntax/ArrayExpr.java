package org.typeset.lite.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Array expression: (1, "hi", 12cm)
 */
public record ArrayExpr(List<Spanned<Expr>> items) implements Expr {

    public ArrayExpr {
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }

    public static ArrayExpr of(Expr... items) {
        return new ArrayExpr(Arrays.stream(items).map(Spanned::detached).toList());
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitArray(this);
    }
}
