package org.codex.runtime.model;

/**
 * Identifier rules shared by the notation compiler and the runtime model.
 * Names and modifiers are restricted to non-empty runs of ASCII letters.
 */
public final class Identifiers {

    private Identifiers() {}

    /**
     * Checks whether the given string is a valid identifier.
     * @param text The candidate identifier, may be null.
     * @return true if the text is non-empty and consists of ASCII letters only.
     */
    public static boolean isValid(String text) {
        if (text == null || text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                return false;
            }
        }
        return true;
    }
}
