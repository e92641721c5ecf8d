package org.codex.compiler.frontend.preprocessor;

import org.codex.runtime.model.ModifierSet;

import java.util.List;

/**
 * A non-blank source line with its preceding deprecation annotations folded in.
 * This is the parser's input.
 */
public sealed interface Declaration {

    int line();

    /**
     * @param deprecation The module's deprecation message, or null.
     */
    record ModuleStart(int line, String name, String deprecation) implements Declaration {}

    record ModuleEnd(int line) implements Declaration {}

    /**
     * @param value                The decoded default value, or null.
     * @param deprecation          The symbol's own deprecation message, or null.
     * @param modifierDeprecations Annotations for individual variants of this symbol.
     */
    record Symbol(int line, String name, String value, String deprecation,
                  List<ModifierDeprecation> modifierDeprecations) implements Declaration {}

    /**
     * @param modifierDeprecations Variant annotations written directly above this variant line.
     */
    record Variant(int line, ModifierSet modifiers, String value,
                   List<ModifierDeprecation> modifierDeprecations) implements Declaration {}

    record Alias(int line, String name, String target, List<String> path, boolean deep,
                 String deprecation, List<ModifierDeprecation> modifierDeprecations) implements Declaration {}
}
