package org.codex.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A definition bound in a module, with metadata.
 *
 * @param def         The bound definition.
 * @param deprecation A deprecation message for the definition, or null if it is not deprecated.
 */
public record Binding(Def def, String deprecation) {

    public Binding {
        Objects.requireNonNull(def, "def");
    }

    /**
     * Creates a binding that is not deprecated.
     */
    public static Binding of(Def def) {
        return new Binding(def, null);
    }

    public Optional<String> deprecationMessage() {
        return Optional.ofNullable(deprecation);
    }

    public boolean isDeprecated() {
        return deprecation != null;
    }
}
