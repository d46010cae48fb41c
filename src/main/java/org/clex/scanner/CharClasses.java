package org.clex.scanner;

/**
 * Character predicates and escape handling shared by the recognizers.
 * All methods work on single bytes in the range 0-255; {@link Cursor#EOF} is never
 * a member of any class.
 */
public final class CharClasses {

    private CharClasses() {}

    public static boolean isNewline(int c) {
        return c == '\r' || c == '\n';
    }

    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || isNewline(c);
    }

    /**
     * Blank characters that may separate the parts of a directive on one line.
     */
    public static boolean isBlank(int c) {
        return c == ' ' || c == '\t';
    }

    public static boolean isAlpha(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isOctalDigit(int c) {
        return c >= '0' && c <= '7';
    }

    public static boolean isHexDigit(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public static boolean isUnderscore(int c) {
        return c == '_';
    }

    public static boolean isIdentifierStart(int c) {
        return isAlpha(c) || isUnderscore(c);
    }

    public static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    /**
     * Decodes the character following a backslash in a character or string literal.
     * Characters without a special meaning decode to themselves.
     *
     * @param c The character after the backslash.
     * @return The decoded character value.
     */
    public static int decodeEscape(int c) {
        return switch (c) {
            case 'a' -> 0x07;
            case 'b' -> 0x08;
            case 'e' -> 0x1B;
            case 'f' -> 0x0C;
            case 'n' -> 0x0A;
            case 'r' -> 0x0D;
            case 't' -> 0x09;
            case 'v' -> 0x0B;
            case '\\' -> 0x5C;
            case '\'' -> 0x27;
            case '"' -> 0x22;
            case '?' -> 0x3F;
            default -> c;
        };
    }

    /**
     * Returns a printable spelling of a decoded character. Control characters with a
     * named escape get that escape back, other control characters are written as
     * {@code \xHH}; everything else is returned unchanged.
     *
     * @param c The decoded character.
     * @return The printable spelling.
     */
    public static String encodeEscape(int c) {
        return switch (c) {
            case 0x07 -> "\\a";
            case 0x08 -> "\\b";
            case 0x1B -> "\\e";
            case 0x0C -> "\\f";
            case 0x0A -> "\\n";
            case 0x0D -> "\\r";
            case 0x09 -> "\\t";
            case 0x0B -> "\\v";
            default -> (c < 0x20 || c == 0x7F)
                    ? String.format("\\x%02X", c)
                    : String.valueOf((char) c);
        };
    }
}
