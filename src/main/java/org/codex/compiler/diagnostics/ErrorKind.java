package org.codex.compiler.diagnostics;

/**
 * Categories of fatal compilation errors.
 */
public enum ErrorKind {
    INVALID_IDENTIFIER,
    INVALID_ESCAPE,
    UNTERMINATED_ESCAPE,
    INVALID_CODEPOINT,
    MISSING_VALUE,
    MISSING_DEPRECATION_MESSAGE,
    DANGLING_DEPRECATION,
    DUPLICATE_DEPRECATION,
    MALFORMED_MODIFIER_ANNOTATION,
    DUPLICATE_MODIFIER,
    DUPLICATE_DEFINITION,
    /** Grammar violation, e.g. a variant line without a preceding symbol. */
    UNEXPECTED_DECLARATION,
    ALIAS_TO_NONEXISTENT_SYMBOL,
    ALIAS_TO_NONEXISTENT_VARIANT,
    ALIAS_TO_ALIAS
}
