package org.typeset.lite.syntax;

/**
 * A paragraph break: two or more newlines.
 */
public record ParbreakNode() implements Node {

    public static final ParbreakNode INSTANCE = new ParbreakNode();

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitParbreak(this);
    }
}
