package org.typeset.lite.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A section heading: {@code ## Introduction}.
 *
 * @param level    The section depth, 1 to {@value #MAX_LEVEL}
 * @param contents The heading's markup
 */
public record HeadingNode(int level, List<Spanned<Node>> contents) implements Node {

    public static final int MAX_LEVEL = 6;

    public HeadingNode {
        if (level < 1 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and " + MAX_LEVEL + ": " + level);
        }
        Objects.requireNonNull(contents, "Contents cannot be null");
        contents = List.copyOf(contents);
    }

    public static HeadingNode of(int level, Node... contents) {
        return new HeadingNode(level, Arrays.stream(contents).map(Spanned::detached).toList());
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitHeading(this);
    }
}
