package org.typeset.lite.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Content expression: {*Hello* there!}
 */
public record ContentExpr(List<Spanned<Node>> tree) implements Expr {

    public ContentExpr {
        Objects.requireNonNull(tree, "Tree cannot be null");
        tree = List.copyOf(tree);
    }

    public static ContentExpr of(Node... nodes) {
        return new ContentExpr(Arrays.stream(nodes).map(Spanned::detached).toList());
    }

    /**
     * Returns the call if this content consists of exactly one node and that
     * node is a call expression.
     */
    public Optional<CallExpr> singleCall() {
        if (tree.size() == 1
                && tree.get(0).value() instanceof ExprNode node
                && node.expr() instanceof CallExpr call) {
            return Optional.of(call);
        }
        return Optional.empty();
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitContent(this);
    }
}
