package org.typeset.lite.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.typeset.lite.geom.Unit;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the syntax tree records: validation, immutability and equality.
 */
class SyntaxTreeTest {

    @Test
    @DisplayName("Identifiers accept letters, digits, underscores and hyphens")
    void testIdentValidation() {
        assertTrue(Ident.isIdent("left"));
        assertTrue(Ident.isIdent("font-size"));
        assertTrue(Ident.isIdent("_x1"));
        assertTrue(Ident.isIdent("größe"));

        assertFalse(Ident.isIdent(""));
        assertFalse(Ident.isIdent("1st"));
        assertFalse(Ident.isIdent("-x"));
        assertFalse(Ident.isIdent("a b"));
        assertFalse(Ident.isIdent(null));

        assertThrows(IllegalArgumentException.class, () -> Ident.of("a.b"));
        assertThrows(NullPointerException.class, () -> new Ident(null));
    }

    @Test
    @DisplayName("Nodes copy their child lists")
    void testChildListsAreCopied() {
        List<Spanned<Expr>> items = new ArrayList<>();
        items.add(Spanned.detached(new IntExpr(1)));
        ArrayExpr array = new ArrayExpr(items);

        items.add(Spanned.detached(new IntExpr(2)));

        assertEquals(1, array.items().size());
        assertThrows(UnsupportedOperationException.class,
                () -> array.items().add(Spanned.detached(new IntExpr(3))));
    }

    @Test
    @DisplayName("Trees compare structurally")
    void testStructuralEquality() {
        Expr a = CallExpr.of("f", Argument.pos(new LengthExpr(12, Unit.PT)), Argument.named("x", NoneExpr.INSTANCE));
        Expr b = CallExpr.of("f", Argument.pos(new LengthExpr(12, Unit.PT)), Argument.named("x", NoneExpr.INSTANCE));
        Expr c = CallExpr.of("f", Argument.named("x", NoneExpr.INSTANCE), Argument.pos(new LengthExpr(12, Unit.PT)));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    @DisplayName("singleCall finds exactly one call node")
    void testSingleCall() {
        CallExpr f = CallExpr.of("f");

        assertEquals(f, ContentExpr.of(Node.expr(f)).singleCall().orElseThrow());
        assertTrue(ContentExpr.of().singleCall().isEmpty());
        assertTrue(ContentExpr.of(Node.expr(f), SpaceNode.INSTANCE).singleCall().isEmpty());
        assertTrue(ContentExpr.of(Node.expr(new IntExpr(1))).singleCall().isEmpty());
        assertTrue(ContentExpr.of(Node.text("f")).singleCall().isEmpty());
    }

    @Test
    @DisplayName("Null children are rejected")
    void testNullChildren() {
        assertThrows(NullPointerException.class, () -> new StrExpr(null));
        assertThrows(NullPointerException.class, () -> new BinaryExpr(null, Spanned.detached(BinaryOp.ADD), null));
        assertThrows(NullPointerException.class, () -> Spanned.detached(null));
    }

    @Test
    @DisplayName("Heading levels are bounded")
    void testHeadingLevel() {
        assertEquals(3, HeadingNode.of(3, Node.text("x")).level());
        assertThrows(IllegalArgumentException.class, () -> HeadingNode.of(0));
        assertThrows(IllegalArgumentException.class, () -> HeadingNode.of(HeadingNode.MAX_LEVEL + 1));
    }

    @Test
    @DisplayName("Spans and units")
    void testSpansAndUnits() {
        assertEquals(new Span(2, 9), new Span(2, 4).join(new Span(5, 9)));
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4));
        assertEquals(new Span(3, 4), new Spanned<>(1, new Span(3, 4)).map(i -> i + 1).span());

        assertEquals(Unit.CM, Unit.fromSymbol("cm"));
        assertThrows(IllegalArgumentException.class, () -> Unit.fromSymbol("px"));
    }
}
