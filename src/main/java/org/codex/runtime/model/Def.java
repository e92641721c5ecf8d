package org.codex.runtime.model;

/**
 * A definition bound in a module: either a {@link Symbol} or a nested {@link Module}.
 */
public sealed interface Def permits Module, Symbol {
}
