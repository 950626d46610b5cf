package org.typeset.lite.color;

/**
 * An 8-bit RGBA color: {@code #ffccee}, {@code #ffccee80}.
 *
 * @param r Red component, 0-255
 * @param g Green component, 0-255
 * @param b Blue component, 0-255
 * @param a Alpha component, 0-255 (255 is opaque)
 */
public record RgbaColor(int r, int g, int b, int a) {

    public static final RgbaColor BLACK = new RgbaColor(0, 0, 0, 255);
    public static final RgbaColor WHITE = new RgbaColor(255, 255, 255, 255);

    public RgbaColor {
        checkComponent("red", r);
        checkComponent("green", g);
        checkComponent("blue", b);
        checkComponent("alpha", a);
    }

    public static RgbaColor rgb(int r, int g, int b) {
        return new RgbaColor(r, g, b, 255);
    }

    /**
     * Parses a hex color in one of the forms {@code rgb}, {@code rgba},
     * {@code rrggbb} or {@code rrggbbaa}, with or without a leading {@code #}.
     * Short forms repeat each digit, so {@code #fff} is {@code #ffffff}.
     *
     * @throws IllegalArgumentException if the text is not a hex color
     */
    public static RgbaColor parse(String text) {
        String hex = text.startsWith("#") ? text.substring(1) : text;
        boolean shortForm = hex.length() == 3 || hex.length() == 4;
        boolean longForm = hex.length() == 6 || hex.length() == 8;
        if (!shortForm && !longForm) {
            throw new IllegalArgumentException("Invalid color: " + text);
        }

        int digits = shortForm ? 1 : 2;
        int[] components = {0, 0, 0, 255};
        for (int i = 0; i * digits < hex.length(); i++) {
            int value = 0;
            for (int j = 0; j < digits; j++) {
                int digit = Character.digit(hex.charAt(i * digits + j), 16);
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid color: " + text);
                }
                value = value * 16 + digit;
            }
            components[i] = shortForm ? value * 17 : value;
        }
        return new RgbaColor(components[0], components[1], components[2], components[3]);
    }

    public boolean isOpaque() {
        return a == 255;
    }

    /**
     * The canonical hex form: {@code #rrggbb}, with an alpha pair appended
     * only when the color is not opaque.
     */
    public String toHex() {
        StringBuilder sb = new StringBuilder(9).append('#');
        appendHex(sb, r);
        appendHex(sb, g);
        appendHex(sb, b);
        if (!isOpaque()) {
            appendHex(sb, a);
        }
        return sb.toString();
    }

    private static void appendHex(StringBuilder sb, int component) {
        sb.append(Character.forDigit(component >> 4, 16));
        sb.append(Character.forDigit(component & 0xf, 16));
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color " + name + " component out of range: " + value);
        }
    }

    @Override
    public String toString() {
        return toHex();
    }
}
