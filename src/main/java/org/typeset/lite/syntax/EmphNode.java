package org.typeset.lite.syntax;

/**
 * Emphasized text toggle: {@code _}.
 */
public record EmphNode() implements Node {

    public static final EmphNode INSTANCE = new EmphNode();

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitEmph(this);
    }
}
