package org.typeset.lite.geom;

/**
 * Physical length units that may follow a number literal: {@code 12pt}, {@code 3cm}.
 */
public enum Unit {
    PT("pt"),
    MM("mm"),
    CM("cm"),
    IN("in");

    private final String symbol;

    Unit(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The suffix as written in source
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up a unit by its source suffix.
     *
     * @throws IllegalArgumentException if no unit has the given suffix
     */
    public static Unit fromSymbol(String symbol) {
        for (Unit unit : values()) {
            if (unit.symbol.equals(symbol)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown length unit: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
