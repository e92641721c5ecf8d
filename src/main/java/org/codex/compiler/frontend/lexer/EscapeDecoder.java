package org.codex.compiler.frontend.lexer;

import org.codex.compiler.diagnostics.ErrorKind;

import java.util.Map;

/**
 * Decodes the value token of a symbol or variant line. Literal text is copied as is;
 * the following escapes are expanded:
 * <ul>
 *   <li><code>&#92;u{HEX}</code>: a single Unicode scalar value</li>
 *   <li>{@code \vs{1}} .. {@code \vs{16}}, {@code \vs{text}}, {@code \vs{emoji}}: a variation selector</li>
 *   <li>{@code \c{not}}: the combining long solidus overlay</li>
 * </ul>
 */
public final class EscapeDecoder {

    private static final int VARIATION_SELECTOR_BASE = 0xFE00;
    private static final int TEXT_PRESENTATION = 0xFE0E;
    private static final int EMOJI_PRESENTATION = 0xFE0F;

    private static final Map<String, Integer> COMBINING = Map.of(
            "not", 0x0338
    );

    private EscapeDecoder() {}

    /**
     * Decodes a raw value token.
     * @param text The raw token.
     * @return The decoded value.
     * @throws LexicalException if an escape is unknown, unterminated or names an invalid code point.
     */
    public static String decode(String text) throws LexicalException {
        StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\') {
                result.append(c);
                i++;
            } else if (text.startsWith("\\u{", i)) {
                int close = closingBrace(text, i, 3, "Unicode");
                result.appendCodePoint(parseCodepoint(text.substring(i + 3, close)));
                i = close + 1;
            } else if (text.startsWith("\\vs{", i)) {
                int close = closingBrace(text, i, 4, "VS");
                result.appendCodePoint(variationSelector(text.substring(i + 4, close)));
                i = close + 1;
            } else if (text.startsWith("\\c{", i)) {
                int close = closingBrace(text, i, 3, "combining character");
                String tag = text.substring(i + 3, close);
                Integer mark = COMBINING.get(tag);
                if (mark == null) {
                    throw new LexicalException(ErrorKind.INVALID_ESCAPE, "invalid combining escape: \\c{" + tag + "}");
                }
                result.appendCodePoint(mark);
                i = close + 1;
            } else {
                throw new LexicalException(ErrorKind.INVALID_ESCAPE, "invalid escape sequence: " + text.substring(i));
            }
        }
        return result.toString();
    }

    private static int closingBrace(String text, int start, int prefixLength, String what) throws LexicalException {
        int close = text.indexOf('}', start + prefixLength);
        if (close < 0) {
            throw new LexicalException(ErrorKind.UNTERMINATED_ESCAPE, "unclosed " + what + " escape: " + text.substring(start));
        }
        return close;
    }

    private static int parseCodepoint(String hex) throws LexicalException {
        if (hex.isEmpty()) {
            throw invalidCodepoint(hex);
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw invalidCodepoint(hex);
            }
        }
        // leading zeros are insignificant
        String digits = hex.replaceFirst("^0+", "");
        if (digits.length() > 6) {
            throw invalidCodepoint(hex);
        }
        int codepoint = digits.isEmpty() ? 0 : Integer.parseInt(digits, 16);
        if (codepoint > Character.MAX_CODE_POINT
                || (codepoint >= Character.MIN_SURROGATE && codepoint <= Character.MAX_SURROGATE)) {
            throw invalidCodepoint(hex);
        }
        return codepoint;
    }

    private static LexicalException invalidCodepoint(String hex) {
        return new LexicalException(ErrorKind.INVALID_CODEPOINT, "invalid Unicode escape \\u{" + hex + "}");
    }

    private static int variationSelector(String tag) throws LexicalException {
        switch (tag) {
            case "text":
                return TEXT_PRESENTATION;
            case "emoji":
                return EMOJI_PRESENTATION;
            default:
                if (!tag.isEmpty() && tag.length() <= 2 && tag.charAt(0) != '0' && tag.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
                    int n = Integer.parseInt(tag);
                    if (n >= 1 && n <= 16) {
                        return VARIATION_SELECTOR_BASE + n - 1;
                    }
                }
                throw new LexicalException(ErrorKind.INVALID_ESCAPE, "invalid VS escape: \\vs{" + tag + "}");
        }
    }
}
