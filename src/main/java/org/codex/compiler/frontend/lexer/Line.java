package org.codex.compiler.frontend.lexer;

import org.codex.runtime.model.ModifierSet;

import java.util.List;

/**
 * A single classified source line. Every variant carries the 1-based line number it was read from.
 */
public sealed interface Line {

    int line();

    /** An empty or comment-only line. */
    record Blank(int line) implements Line {}

    /**
     * A {@code @deprecated:} or {@code @deprecated(modifier):} annotation.
     * @param modifiers The annotated modifier set, or null for an unqualified annotation.
     * @param message   The deprecation message.
     */
    record Deprecated(int line, ModifierSet modifiers, String message) implements Line {}

    /** {@code name {} */
    record ModuleStart(int line, String name) implements Line {}

    /** A lone {@code }}. */
    record ModuleEnd(int line) implements Line {}

    /**
     * {@code name [value]}
     * @param value The decoded default value, or null if the symbol only has variants.
     */
    record Symbol(int line, String name, String value) implements Line {}

    /** {@code .modifier[.modifier...] value} */
    record Variant(int line, ModifierSet modifiers, String value) implements Line {}

    /**
     * {@code name @= target[.modifier...][.*]}
     * @param name   The alias name.
     * @param target The name of the aliased symbol.
     * @param path   The modifier path below the target, possibly empty.
     * @param deep   True if the target ended with {@code .*}.
     */
    record Alias(int line, String name, String target, List<String> path, boolean deep) implements Line {}
}
