package org.typeset.lite.syntax;

/**
 * Strong text toggle: {@code *}.
 */
public record StrongNode() implements Node {

    public static final StrongNode INSTANCE = new StrongNode();

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitStrong(this);
    }
}
