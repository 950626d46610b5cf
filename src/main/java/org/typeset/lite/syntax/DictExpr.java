package org.typeset.lite.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Dictionary expression: (color: #f79143, pattern: dashed)
 * 
 * Entries keep their source order. Duplicate keys are allowed here; whether
 * they are an error is up to evaluation.
 */
public record DictExpr(List<Named> entries) implements Expr {

    public DictExpr {
        Objects.requireNonNull(entries, "Entries cannot be null");
        entries = List.copyOf(entries);
    }

    public static DictExpr of(Named... entries) {
        return new DictExpr(List.of(entries));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitDict(this);
    }
}
