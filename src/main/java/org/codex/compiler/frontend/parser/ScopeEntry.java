package org.codex.compiler.frontend.parser;

import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;

/**
 * A binding produced while parsing one module scope, remembering where it was declared.
 *
 * @param name    The bound name.
 * @param binding The binding.
 * @param line    The line of the declaration that produced it.
 */
public record ScopeEntry(String name, Binding binding, int line) {

    public Module.Entry toEntry() {
        return new Module.Entry(name, binding);
    }
}
