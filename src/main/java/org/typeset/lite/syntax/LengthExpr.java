package org.typeset.lite.syntax;

import org.typeset.lite.geom.Unit;

import java.util.Objects;

/**
 * Length literal (e.g., 12pt, 3cm)
 */
public record LengthExpr(double value, Unit unit) implements Expr {

    public LengthExpr {
        Objects.requireNonNull(unit, "Unit cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitLength(this);
    }
}
