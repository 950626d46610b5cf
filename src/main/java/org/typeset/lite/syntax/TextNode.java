package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * Plain text, stored unescaped.
 */
public record TextNode(String text) implements Node {

    public TextNode {
        Objects.requireNonNull(text, "Text cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitText(this);
    }
}
