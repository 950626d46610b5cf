package org.typeset.lite.syntax;

import org.typeset.lite.color.RgbaColor;

import java.util.Objects;

/**
 * Color literal (e.g., #ffccee)
 */
public record ColorExpr(RgbaColor color) implements Expr {

    public ColorExpr {
        Objects.requireNonNull(color, "Color cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitColor(this);
    }
}
