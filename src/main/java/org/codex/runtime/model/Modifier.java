package org.codex.runtime.model;

/**
 * A single token of a {@link ModifierSet}.
 *
 * @param name     The bare modifier name, without the optional marker.
 * @param optional True if the modifier was written with a trailing {@code ?}.
 */
public record Modifier(String name, boolean optional) {

    /** Suffix marking a modifier as optional in the dotted encoding. */
    public static final char OPTIONAL_MARKER = '?';

    public Modifier {
        if (!Identifiers.isValid(name)) {
            throw new IllegalArgumentException("Invalid modifier name: '" + name + "'");
        }
    }

    /**
     * Parses one raw segment of a dotted modifier string, e.g. {@code double} or {@code stroked?}.
     * @param raw The raw segment.
     * @return The parsed modifier.
     * @throws IllegalArgumentException if the segment is not a valid modifier.
     */
    public static Modifier parse(String raw) {
        if (raw != null && !raw.isEmpty() && raw.charAt(raw.length() - 1) == OPTIONAL_MARKER) {
            return new Modifier(raw.substring(0, raw.length() - 1), true);
        }
        return new Modifier(raw, false);
    }

    @Override
    public String toString() {
        return optional ? name + OPTIONAL_MARKER : name;
    }
}
