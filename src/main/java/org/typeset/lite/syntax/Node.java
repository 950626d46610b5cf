package org.typeset.lite.syntax;

/**
 * Sealed interface representing markup nodes, the elements of a content tree.
 * 
 * A content tree is a {@code List<Spanned<Node>>}: the body of a document, of
 * a content expression or of a bracketed call.
 */
public sealed interface Node
        permits TextNode, SpaceNode, LinebreakNode, ParbreakNode, StrongNode, EmphNode, HeadingNode, ExprNode {

    <T> T accept(NodeVisitor<T> visitor);

    static Node text(String text) {
        return new TextNode(text);
    }

    static Node expr(Expr expr) {
        return new ExprNode(expr);
    }
}
