package org.codex.runtime.services;

import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Identifiers;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves dotted paths such as {@code sym.arrow.r.double} against a module tree.
 * <p>
 * Leading segments walk through nested modules until a symbol is reached; all remaining segments
 * form the modifier request passed to {@link Symbol#get(ModifierSet)}. Lookups never fail with an
 * exception: malformed paths and unknown names simply resolve to nothing.
 */
public final class SymbolLookup {

    /**
     * A successful lookup.
     *
     * @param symbolPath   The path of the symbol itself, without modifiers.
     * @param modifiers    The requested modifiers.
     * @param variant      The selected variant.
     * @param deprecations Deprecation messages met on the way, outermost first.
     */
    public record Resolution(String symbolPath, ModifierSet modifiers, Variant variant, List<String> deprecations) {

        public String value() {
            return variant.value();
        }

        public boolean isDeprecated() {
            return !deprecations.isEmpty();
        }
    }

    private SymbolLookup() {}

    /**
     * Resolves a dotted path to a symbol value.
     * @param root The module to start from.
     * @param path The dotted path.
     * @return The resolution, or empty if no symbol variant matches.
     */
    public static Optional<Resolution> resolve(Module root, String path) {
        String[] segments = split(path);
        if (segments == null) {
            return Optional.empty();
        }

        List<String> deprecations = new ArrayList<>();
        Module current = root;
        for (int i = 0; i < segments.length; i++) {
            Optional<Binding> binding = current.get(segments[i]);
            if (binding.isEmpty()) {
                return Optional.empty();
            }
            String prefix = String.join(".", List.of(segments).subList(0, i + 1));
            binding.get().deprecationMessage().ifPresent(message -> deprecations.add(prefix + ": " + message));

            if (binding.get().def() instanceof Module nested) {
                current = nested;
                continue;
            }

            Symbol symbol = (Symbol) binding.get().def();
            ModifierSet request = ModifierSet.EMPTY;
            for (int j = i + 1; j < segments.length; j++) {
                if (request.contains(segments[j])) {
                    return Optional.empty();
                }
                request = request.insertRaw(segments[j]);
            }
            ModifierSet modifiers = request;
            return symbol.get(request).map(variant -> {
                List<String> all = new ArrayList<>(deprecations);
                variant.deprecationMessage().ifPresent(message -> all.add(path + ": " + message));
                return new Resolution(prefix, modifiers, variant, List.copyOf(all));
            });
        }
        return Optional.empty();
    }

    /**
     * Finds a nested module by its dotted path. An empty path returns the root itself.
     * @param root The module to start from.
     * @param path The dotted module path.
     * @return The module, or empty if the path does not lead to a module.
     */
    public static Optional<Module> findModule(Module root, String path) {
        if (path == null || path.isEmpty()) {
            return Optional.of(root);
        }
        String[] segments = split(path);
        if (segments == null) {
            return Optional.empty();
        }
        Module current = root;
        for (String segment : segments) {
            Optional<Binding> binding = current.get(segment);
            if (binding.isEmpty() || !(binding.get().def() instanceof Module nested)) {
                return Optional.empty();
            }
            current = nested;
        }
        return Optional.of(current);
    }

    private static String[] split(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (!Identifiers.isValid(segment)) {
                return null;
            }
        }
        return segments;
    }
}
