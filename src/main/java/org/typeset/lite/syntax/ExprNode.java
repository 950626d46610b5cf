package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * An expression embedded in markup: {@code {x + 1}} or {@code [f]}.
 */
public record ExprNode(Expr expr) implements Node {

    public ExprNode {
        Objects.requireNonNull(expr, "Expression cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitExpr(this);
    }
}
