package org.snrasm.compiler.frontend.lexer;

/**
 * Conversions between literal token text and values.
 * Real numbers are fixed point with three decimals: {@code 1.234} is stored as {@code 1234}.
 */
public final class Literals {

    /** The scale of fixed point reals. */
    public static final int REAL_SCALE = 1000;

    private Literals() {
    }

    /**
     * Parses an integer literal.
     * @param text The literal text, optionally prefixed with {@code 0x}, {@code 0o} or {@code 0b}.
     * @return The value.
     * @throws NumberFormatException If the text is malformed or does not fit into a long.
     */
    public static long parseInteger(String text) {
        String s = text.replace("_", "");
        int radix = 10;
        if (s.length() > 1 && s.charAt(0) == '0') {
            char p = Character.toLowerCase(s.charAt(1));
            if (p == 'x') {
                radix = 16;
            } else if (p == 'o') {
                radix = 8;
            } else if (p == 'b') {
                radix = 2;
            }
            if (radix != 10) {
                s = s.substring(2);
            }
        }
        if (s.isEmpty()) {
            throw new NumberFormatException("Empty numeric literal");
        }
        return Long.parseLong(s, radix);
    }

    /**
     * Parses a real literal into its fixed point representation.
     * @param text The literal text, {@code digits.digits}.
     * @return The value multiplied by {@link #REAL_SCALE}.
     * @throws NumberFormatException If the text is malformed or has more than three decimals.
     */
    public static long parseReal(String text) {
        String s = text.replace("_", "");
        int dot = s.indexOf('.');
        if (dot <= 0 || dot == s.length() - 1) {
            throw new NumberFormatException("Malformed real literal");
        }
        String fraction = s.substring(dot + 1);
        if (fraction.length() > 3) {
            throw new NumberFormatException("Real literal has more than 3 decimal places");
        }
        long whole = Long.parseLong(s.substring(0, dot));
        long frac = Long.parseLong((fraction + "000").substring(0, 3));
        return Math.addExact(Math.multiplyExact(whole, REAL_SCALE), frac);
    }

    /**
     * Resolves the escapes of a string literal.
     * @param text The literal text including the quotes.
     * @return The string value.
     */
    public static String unescape(String text) {
        StringBuilder sb = new StringBuilder();
        int end = text.endsWith("\"") && text.length() > 1 ? text.length() - 1 : text.length();
        for (int i = 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < end) {
                char n = text.charAt(++i);
                sb.append(n == 'n' ? '\n' : n);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Produces the literal text for a string value.
     * @param value The string value.
     * @return The quoted literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
