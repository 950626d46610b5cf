package org.typeset.lite.syntax;

import java.util.Objects;

/**
 * An identifier: {@code left}, {@code font-size}, {@code _private}.
 * 
 * Identifiers start with a Unicode identifier-start character or an underscore
 * and continue with identifier-part characters, underscores or hyphens.
 */
public record Ident(String name) {

    public Ident {
        Objects.requireNonNull(name, "Identifier cannot be null");
        if (!isIdent(name)) {
            throw new IllegalArgumentException("Invalid identifier: '" + name + "'");
        }
    }

    public static Ident of(String name) {
        return new Ident(name);
    }

    /**
     * Whether the string is a valid identifier.
     */
    public static boolean isIdent(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int first = text.codePointAt(0);
        if (!isIdentStart(first)) {
            return false;
        }
        return text.codePoints().skip(1).allMatch(Ident::isIdentContinue);
    }

    private static boolean isIdentStart(int c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentContinue(int c) {
        return c == '_' || c == '-' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }

    @Override
    public String toString() {
        return name;
    }
}
