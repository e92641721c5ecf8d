package org.codex.compiler.frontend.parser;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.compiler.frontend.preprocessor.Declaration;
import org.codex.compiler.frontend.preprocessor.ModifierDeprecation;
import org.codex.compiler.frontend.semantics.AliasResolver;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser that turns the declaration stream into a {@link Module} tree.
 * <p>
 * A symbol declaration absorbs the variant declarations that directly follow it. A module start
 * recurses until the matching module end. Aliases are collected per scope and resolved once all
 * direct definitions of that scope are known, so an alias may refer to a sibling declared after it.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Declaration> declarations;
    private final String fileName;
    private final int endOfFile;
    private final AliasResolver aliasResolver;
    private int current = 0;

    /**
     * @param declarations The preprocessed declarations.
     * @param fileName     The logical file name used in error messages.
     * @param endOfFile    The line number reported for errors detected at end of input.
     */
    public Parser(List<Declaration> declarations, String fileName, int endOfFile) {
        this.declarations = declarations;
        this.fileName = fileName;
        this.endOfFile = endOfFile;
        this.aliasResolver = new AliasResolver(fileName);
    }

    /**
     * Parses the whole declaration stream as the top-level scope.
     * @return The frozen, name-sorted module.
     * @throws CompilationException on the first grammar or resolution error.
     */
    public Module parse() {
        current = 0;
        return parseScope(null);
    }

    private Module parseScope(Declaration.ModuleStart opener) {
        List<ScopeEntry> direct = new ArrayList<>();
        List<Declaration.Alias> aliases = new ArrayList<>();

        while (true) {
            if (isAtEnd()) {
                if (opener != null) {
                    throw error(ErrorKind.UNEXPECTED_DECLARATION, endOfFile,
                            "module '" + opener.name() + "' opened on line " + opener.line() + " is never closed");
                }
                break;
            }
            Declaration declaration = advance();
            if (declaration instanceof Declaration.ModuleEnd end) {
                if (opener == null) {
                    throw error(ErrorKind.UNEXPECTED_DECLARATION, end.line(), "unexpected `}` outside of a module");
                }
                break;
            } else if (declaration instanceof Declaration.ModuleStart start) {
                Module nested = parseScope(start);
                direct.add(new ScopeEntry(start.name(), new Binding(nested, start.deprecation()), start.line()));
            } else if (declaration instanceof Declaration.Symbol symbol) {
                direct.add(parseSymbol(symbol));
            } else if (declaration instanceof Declaration.Alias alias) {
                aliases.add(alias);
            } else {
                throw error(ErrorKind.UNEXPECTED_DECLARATION, declaration.line(),
                        "expected definition, found a variant without a preceding symbol");
            }
        }

        checkUniqueNames(direct, aliases);
        List<ScopeEntry> all = new ArrayList<>(direct);
        all.addAll(aliasResolver.resolve(direct, aliases));

        List<Module.Entry> entries = new ArrayList<>(all.size());
        for (ScopeEntry entry : all) {
            entries.add(entry.toEntry());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: parsed scope '{}' with {} definitions and {} aliases", fileName,
                    opener == null ? "<root>" : opener.name(), direct.size(), aliases.size());
        }
        return Module.of(entries);
    }

    private ScopeEntry parseSymbol(Declaration.Symbol declaration) {
        List<Variant> variants = new ArrayList<>();
        List<ModifierDeprecation> deprecations = new ArrayList<>(declaration.modifierDeprecations());
        while (!isAtEnd() && peek() instanceof Declaration.Variant variant) {
            advance();
            variants.add(new Variant(variant.modifiers(), variant.value()));
            deprecations.addAll(variant.modifierDeprecations());
        }

        Symbol symbol;
        if (!variants.isEmpty()) {
            if (declaration.value() != null) {
                variants.add(0, new Variant(ModifierSet.EMPTY, declaration.value()));
            }
            symbol = new Symbol.Multi(ModifierDeprecation.attachAll(variants, deprecations, fileName));
        } else {
            if (declaration.value() == null) {
                throw error(ErrorKind.MISSING_VALUE, declaration.line(),
                        "symbol '" + declaration.name() + "' needs a value or variants");
            }
            if (!deprecations.isEmpty()) {
                throw error(ErrorKind.DANGLING_DEPRECATION, deprecations.get(0).line(),
                        "dangling `@deprecated(" + deprecations.get(0).modifiers() + "):`, symbol '"
                                + declaration.name() + "' has no variants");
            }
            symbol = new Symbol.Single(declaration.value());
        }
        return new ScopeEntry(declaration.name(), new Binding(symbol, declaration.deprecation()), declaration.line());
    }

    private void checkUniqueNames(List<ScopeEntry> direct, List<Declaration.Alias> aliases) {
        record Declared(String name, int line) {}
        List<Declared> declared = new ArrayList<>();
        for (ScopeEntry entry : direct) {
            declared.add(new Declared(entry.name(), entry.line()));
        }
        for (Declaration.Alias alias : aliases) {
            declared.add(new Declared(alias.name(), alias.line()));
        }
        declared.sort(Comparator.comparingInt(Declared::line));
        Map<String, Integer> seen = new HashMap<>();
        for (Declared entry : declared) {
            Integer previous = seen.putIfAbsent(entry.name(), entry.line());
            if (previous != null) {
                throw error(ErrorKind.DUPLICATE_DEFINITION, entry.line(),
                        "'" + entry.name() + "' is already defined on line " + previous);
            }
        }
    }

    // --- Declaration stream navigation ---

    private Declaration advance() {
        return declarations.get(current++);
    }

    private Declaration peek() {
        return declarations.get(current);
    }

    private boolean isAtEnd() {
        return current >= declarations.size();
    }

    private CompilationException error(ErrorKind kind, int line, String reason) {
        return new CompilationException(kind, fileName, line, reason);
    }
}
