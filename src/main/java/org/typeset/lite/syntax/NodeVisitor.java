package org.typeset.lite.syntax;

/**
 * Visitor interface for traversing markup nodes.
 * 
 * @param <T> The return type of the visitor methods
 */
public interface NodeVisitor<T> {

    T visitText(TextNode text);

    T visitSpace(SpaceNode space);

    T visitLinebreak(LinebreakNode linebreak);

    T visitParbreak(ParbreakNode parbreak);

    T visitStrong(StrongNode strong);

    T visitEmph(EmphNode emph);

    T visitHeading(HeadingNode heading);

    /**
     * Visit an expression embedded in markup.
     */
    T visitExpr(ExprNode expr);
}
