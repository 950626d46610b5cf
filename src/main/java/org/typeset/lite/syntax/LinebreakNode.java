package org.typeset.lite.syntax;

/**
 * A forced line break: a single backslash.
 */
public record LinebreakNode() implements Node {

    public static final LinebreakNode INSTANCE = new LinebreakNode();

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitLinebreak(this);
    }
}
