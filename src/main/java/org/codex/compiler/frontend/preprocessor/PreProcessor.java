package org.codex.compiler.frontend.preprocessor;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.compiler.frontend.lexer.Line;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs after the lexer and before the parser. It drops blank lines and attaches each run of
 * deprecation annotations to the declaration that follows it.
 * <p>
 * Unqualified annotations may precede a module, a symbol or an alias. Modifier-qualified
 * annotations may precede a symbol, an alias or a variant line. Anything else leaves the
 * annotation dangling, which is a fatal error.
 */
public class PreProcessor {

    private final String fileName;
    private final List<Line.Deprecated> pending = new ArrayList<>();

    /**
     * @param fileName The logical file name used in error messages.
     */
    public PreProcessor(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Folds the classified lines into declarations.
     * @param lines     The lexer output.
     * @param endOfFile The line number reported for errors detected at end of input.
     * @return The declarations, in source order.
     * @throws CompilationException on a dangling or duplicate annotation.
     */
    public List<Declaration> process(List<Line> lines, int endOfFile) {
        pending.clear();
        List<Declaration> declarations = new ArrayList<>();
        for (Line line : lines) {
            if (line instanceof Line.Blank) {
                continue;
            }
            if (line instanceof Line.Deprecated deprecated) {
                pending.add(deprecated);
            } else if (line instanceof Line.ModuleStart start) {
                declarations.add(new Declaration.ModuleStart(start.line(), start.name(), takeModuleDeprecation(start.line())));
            } else if (line instanceof Line.ModuleEnd end) {
                requireNoPending(end.line());
                declarations.add(new Declaration.ModuleEnd(end.line()));
            } else if (line instanceof Line.Symbol symbol) {
                String deprecation = takeUnqualified(symbol.line());
                declarations.add(new Declaration.Symbol(symbol.line(), symbol.name(), symbol.value(),
                        deprecation, takeQualified()));
            } else if (line instanceof Line.Variant variant) {
                if (pending.stream().anyMatch(d -> d.modifiers() == null)) {
                    throw error(ErrorKind.DANGLING_DEPRECATION, variant.line(),
                            "dangling `@deprecated:` before a variant, use `@deprecated(modifier):`");
                }
                declarations.add(new Declaration.Variant(variant.line(), variant.modifiers(), variant.value(), takeQualified()));
            } else if (line instanceof Line.Alias alias) {
                String deprecation = takeUnqualified(alias.line());
                declarations.add(new Declaration.Alias(alias.line(), alias.name(), alias.target(), alias.path(),
                        alias.deep(), deprecation, takeQualified()));
            }
        }
        requireNoPending(endOfFile);
        return declarations;
    }

    private String takeModuleDeprecation(int line) {
        for (Line.Deprecated deprecated : pending) {
            if (deprecated.modifiers() != null) {
                throw error(ErrorKind.MALFORMED_MODIFIER_ANNOTATION, deprecated.line(),
                        "wrong deprecation format for module: modules have no modifiers");
            }
        }
        return takeUnqualified(line);
    }

    /**
     * Removes the unqualified annotation from the pending list and returns its message.
     */
    private String takeUnqualified(int line) {
        String message = null;
        for (var it = pending.iterator(); it.hasNext(); ) {
            Line.Deprecated deprecated = it.next();
            if (deprecated.modifiers() != null) continue;
            if (message != null) {
                throw error(ErrorKind.DUPLICATE_DEPRECATION, deprecated.line(), "duplicate `@deprecated:` annotation");
            }
            message = deprecated.message();
            it.remove();
        }
        return message;
    }

    private List<ModifierDeprecation> takeQualified() {
        List<ModifierDeprecation> result = new ArrayList<>();
        for (Line.Deprecated deprecated : pending) {
            for (ModifierDeprecation existing : result) {
                if (existing.modifiers().equals(deprecated.modifiers())) {
                    throw error(ErrorKind.DUPLICATE_DEPRECATION, deprecated.line(),
                            "duplicate `@deprecated(" + deprecated.modifiers() + "):` annotation");
                }
            }
            result.add(new ModifierDeprecation(deprecated.line(), deprecated.modifiers(), deprecated.message()));
        }
        pending.clear();
        return List.copyOf(result);
    }

    private void requireNoPending(int line) {
        if (!pending.isEmpty()) {
            throw error(ErrorKind.DANGLING_DEPRECATION, line, "dangling `@deprecated:`");
        }
    }

    private CompilationException error(ErrorKind kind, int line, String reason) {
        return new CompilationException(kind, fileName, line, reason);
    }
}
