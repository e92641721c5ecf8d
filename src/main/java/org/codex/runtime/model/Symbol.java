package org.codex.runtime.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A symbol, either a leaf with one value or a set of variants selected by modifiers.
 */
public sealed interface Symbol extends Def permits Symbol.Single, Symbol.Multi {

    /**
     * Returns all variants of the symbol. A {@link Single} symbol has exactly one variant,
     * under the empty modifier set.
     */
    List<Variant> variants();

    /**
     * Resolves the variant that best matches the requested modifiers.
     * @param modifiers The requested modifiers.
     * @return The matching variant, or empty if no variant is eligible.
     */
    default Optional<Variant> get(ModifierSet modifiers) {
        return modifiers.bestMatchIn(variants(), Variant::modifiers);
    }

    /**
     * Resolves the variant for a dotted modifier string, e.g. {@code r.double}.
     * @return The matching variant, or empty if none is eligible or the string is not a valid modifier list.
     */
    default Optional<Variant> get(String dottedModifiers) {
        ModifierSet modifiers;
        try {
            modifiers = ModifierSet.fromRawDotted(dottedModifiers);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return get(modifiers);
    }

    /**
     * A symbol without modifiers.
     * @param value The symbol's value.
     */
    record Single(String value) implements Symbol {

        public Single {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<Variant> variants() {
            return List.of(new Variant(ModifierSet.EMPTY, value));
        }
    }

    /**
     * A symbol with named modifiers. Without modifiers it resolves to the variant
     * under the empty set, which the compiler places first.
     * @param variants The variants, in declaration order.
     */
    record Multi(List<Variant> variants) implements Symbol {

        public Multi {
            if (variants == null || variants.isEmpty()) {
                throw new IllegalArgumentException("A multi-variant symbol needs at least one variant");
            }
            variants = List.copyOf(variants);
        }
    }
}
