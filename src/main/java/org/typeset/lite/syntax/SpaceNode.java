package org.typeset.lite.syntax;

/**
 * Whitespace containing less than two newlines.
 */
public record SpaceNode() implements Node {

    public static final SpaceNode INSTANCE = new SpaceNode();

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitSpace(this);
    }
}
