package org.codex.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One variant of a symbol: the modifiers that select it, its value and an optional
 * deprecation message.
 *
 * @param modifiers   The modifier set selecting this variant.
 * @param value       The variant's value, one or more Unicode code points.
 * @param deprecation The deprecation message, or null if the variant is not deprecated.
 */
public record Variant(ModifierSet modifiers, String value, String deprecation) {

    public Variant {
        Objects.requireNonNull(modifiers, "modifiers");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Convenience constructor for a variant that is not deprecated.
     */
    public Variant(ModifierSet modifiers, String value) {
        this(modifiers, value, null);
    }

    public Optional<String> deprecationMessage() {
        return Optional.ofNullable(deprecation);
    }

    public boolean isDeprecated() {
        return deprecation != null;
    }

    /**
     * Returns a copy of this variant under a different modifier set.
     */
    public Variant withModifiers(ModifierSet newModifiers) {
        return new Variant(newModifiers, value, deprecation);
    }

    /**
     * Returns a copy of this variant carrying the given deprecation message.
     */
    public Variant withDeprecation(String message) {
        return new Variant(modifiers, value, message);
    }
}
