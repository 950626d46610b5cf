package org.typeset.lite.syntax;

/**
 * A unary operator.
 */
public enum UnaryOp {
    NEG("-");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
